package com.dburyak.jsonrpc2;

import com.dburyak.jsonrpc2.err.JsonRpcErrors;
import com.dburyak.jsonrpc2.err.JsonRpcException;
import com.dburyak.jsonrpc2.err.MethodNotFoundException;
import io.reactivex.rxjava3.exceptions.Exceptions;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Optional;

/**
 * Dispatches requests through an ordered chain of blocking {@link Service}s. The first service that returns a
 * response wins and the rest are not called. If nobody handles the request, the verdict is "method not found".
 *
 * @param <C> type of the caller-supplied context
 */
@Log4j2
public class JsonRpcServer<C> {
    private final List<Service<C>> services;
    @Getter
    private final NotificationPolicy notificationPolicy;

    public JsonRpcServer(List<? extends Service<C>> services, NotificationPolicy notificationPolicy) {
        if (services == null) {
            throw new IllegalArgumentException("services must be provided");
        }
        if (notificationPolicy == null) {
            throw new IllegalArgumentException("notificationPolicy must be provided");
        }
        this.services = List.copyOf(services);
        this.notificationPolicy = notificationPolicy;
    }

    public JsonRpcServer(List<? extends Service<C>> services, Config cfg) {
        this(services, cfg.getNotificationPolicy());
    }

    public JsonRpcServer(List<? extends Service<C>> services) {
        this(services, NotificationPolicy.SURFACE_ERRORS);
    }

    /**
     * Runs the request through the chain.
     *
     * @return response of the first service that handled the request, or a "method not found" error response
     * @throws JsonRpcException classified failure of the service that failed
     */
    public JsonRpcResponse handle(JsonRpcRequest req, C ctx) {
        log.debug("dispatching: method={}, id={}", req.getMethod(), req.getId());
        for (var service : services) {
            Optional<JsonRpcResponse> resp;
            try {
                resp = service.handle(req, ctx);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw failed(req, e);
            } catch (Throwable e) {
                Exceptions.throwIfFatal(e);
                throw failed(req, e);
            }
            if (resp == null) {
                throw failed(req, new IllegalStateException("service returned null instead of empty response: "
                        + service.getClass().getName()));
            }
            if (resp.isPresent()) {
                log.debug("handled: method={}, id={}, success={}", req.getMethod(), req.getId(),
                        resp.get().isSuccess());
                return resp.get();
            }
        }
        log.debug("no service matched: method={}, id={}", req.getMethod(), req.getId());
        return JsonRpcResponse.failed(req, new MethodNotFoundException(req.getId(), req.getMethod()));
    }

    /**
     * Same as {@link #handle}, but failures become error responses and no response is returned when none is owed to
     * the caller (see {@link NotificationPolicy}).
     */
    public Optional<JsonRpcResponse> serve(JsonRpcRequest req, C ctx) {
        JsonRpcResponse resp;
        try {
            resp = handle(req, ctx);
        } catch (JsonRpcException e) {
            resp = JsonRpcResponse.failed(req, e);
        }
        if (!notificationPolicy.shouldRespond(req, resp)) {
            log.debug("response suppressed: method={}, success={}", req.getMethod(), resp.isSuccess());
            return Optional.empty();
        }
        return Optional.of(resp);
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
