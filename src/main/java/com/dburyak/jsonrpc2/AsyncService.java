package com.dburyak.jsonrpc2;

import io.reactivex.rxjava3.core.Maybe;

/**
 * Non-blocking counterpart of {@link Service}, with the same contract: empty means "not mine", a value is the
 * response and an error is a failure that gets converted into an error response. The returned Maybe may complete
 * asynchronously, the next service is not subscribed to until this one completes.
 *
 * @param <C> type of the caller-supplied context shared by all services during a dispatch
 */
@FunctionalInterface
public interface AsyncService<C> extends AsyncCloseable {

    Maybe<JsonRpcResponse> handle(JsonRpcRequest req, C ctx);

    /**
     * Adapts a blocking service. The blocking call runs on the subscribing thread.
     */
    static <C> AsyncService<C> fromBlocking(Service<C> service) {
        return (req, ctx) -> Maybe.defer(() -> Maybe.fromOptional(service.handle(req, ctx)));
    }
}
