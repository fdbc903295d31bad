package com.dburyak.jsonrpc2;

import java.util.Optional;

/**
 * Blocking request handler. Services are tried in order, the first one that returns a response wins.
 *
 * @param <C> type of the caller-supplied context shared by all services during a dispatch
 */
@FunctionalInterface
public interface Service<C> {

    /**
     * Handles the request if it is meant for this service.
     *
     * @param req request, the service may take its params
     * @param ctx shared context, must be treated as read-only
     * @return response, or empty if the request is not handled by this service
     * @throws Exception any failure, it is converted into an error response for this request
     */
    Optional<JsonRpcResponse> handle(JsonRpcRequest req, C ctx) throws Exception;
}
