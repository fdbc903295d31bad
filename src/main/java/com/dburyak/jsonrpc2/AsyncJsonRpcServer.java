package com.dburyak.jsonrpc2;

import com.dburyak.jsonrpc2.err.JsonRpcErrors;
import com.dburyak.jsonrpc2.err.JsonRpcException;
import com.dburyak.jsonrpc2.err.MethodNotFoundException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Non-blocking twin of {@link JsonRpcServer}. Services are subscribed to strictly one after another, a service may
 * suspend on I/O but the next one is only tried once the previous completed empty. There is no fan-out.
 *
 * @param <C> type of the caller-supplied context
 */
@Log4j2
public class AsyncJsonRpcServer<C> implements AsyncCloseable {
    private final List<AsyncService<C>> services;
    @Getter
    private final NotificationPolicy notificationPolicy;

    public AsyncJsonRpcServer(List<? extends AsyncService<C>> services, NotificationPolicy notificationPolicy) {
        if (services == null) {
            throw new IllegalArgumentException("services must be provided");
        }
        if (notificationPolicy == null) {
            throw new IllegalArgumentException("notificationPolicy must be provided");
        }
        this.services = List.copyOf(services);
        this.notificationPolicy = notificationPolicy;
    }

    public AsyncJsonRpcServer(List<? extends AsyncService<C>> services, Config cfg) {
        this(services, cfg.getNotificationPolicy());
    }

    public AsyncJsonRpcServer(List<? extends AsyncService<C>> services) {
        this(services, NotificationPolicy.SURFACE_ERRORS);
    }

    /**
     * Runs the request through the chain. Nothing happens until subscribed.
     *
     * @return response of the first service that handled the request or a "method not found" error response, fails
     *         with the classified {@link JsonRpcException} of the service that failed
     */
    public Single<JsonRpcResponse> handle(JsonRpcRequest req, C ctx) {
        return processWithTheChain(req, ctx)
                .doOnSuccess(resp -> log.debug("handled: method={}, id={}, success={}",
                        req.getMethod(), req.getId(), resp.isSuccess()))
                .switchIfEmpty(Single.fromSupplier(() -> {
                    log.debug("no service matched: method={}, id={}", req.getMethod(), req.getId());
                    return JsonRpcResponse.failed(req, new MethodNotFoundException(req.getId(), req.getMethod()));
                }))
                .onErrorResumeNext(err -> Single.error(failed(req, err)))
                .doOnSubscribe(ignr -> log.debug("dispatching: method={}, id={}", req.getMethod(), req.getId()));
    }

    /**
     * Same as {@link #handle}, but failures become error responses and the Maybe is empty when no response is owed to
     * the caller (see {@link NotificationPolicy}).
     */
    public Maybe<JsonRpcResponse> serve(JsonRpcRequest req, C ctx) {
        return handle(req, ctx)
                .onErrorReturn(err -> JsonRpcResponse.failed(req, err))
                .filter(resp -> {
                    var respond = notificationPolicy.shouldRespond(req, resp);
                    if (!respond) {
                        log.debug("response suppressed: method={}, success={}", req.getMethod(), resp.isSuccess());
                    }
                    return respond;
                });
    }

    @Override
    public Completable closeAsync() {
        return Observable.fromIterable(services)
                .concatMapCompletable(AsyncCloseable::closeAsync)
                .doOnComplete(() -> log.debug("closed: services={}", services.size()));
    }

    private Maybe<JsonRpcResponse> processWithTheChain(JsonRpcRequest req, C ctx) {
        // defer so that each service is invoked only once the previous one completed empty, and so that anything
        // thrown from handle() itself ends up in the stream
        var result = Maybe.<JsonRpcResponse>empty();
        for (var service : services) {
            result = result.switchIfEmpty(Maybe.defer(() -> service.handle(req, ctx)));
        }
        return result;
    }

    private JsonRpcException failed(JsonRpcRequest req, Throwable err) {
        var rpcErr = JsonRpcErrors.classify(err, req.getId());
        if (err instanceof JsonRpcException) {
            log.debug("request processing failed: method={}, id={}", req.getMethod(), req.getId(), err);
        } else {
            log.error("unexpected error in service, responding with internal error: method={}, id={}",
                    req.getMethod(), req.getId(), err);
        }
        return rpcErr;
    }
}
