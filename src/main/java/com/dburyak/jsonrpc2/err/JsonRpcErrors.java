package com.dburyak.jsonrpc2.err;

import com.dburyak.jsonrpc2.JsonRpcResponse;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The single place where failures are mapped onto the JSON-RPC error space. Every error response is built through
 * here.
 */
public final class JsonRpcErrors {

    private JsonRpcErrors() {
    }

    /**
     * Classifies any failure as one of the {@link ErrorKind}s. Never returns null. Failures that are not
     * {@link JsonRpcException}s fall into {@link ErrorKind#INTERNAL}.
     */
    public static JsonRpcException classify(Throwable err) {
        var unwrapped = unwrap(err);
        if (unwrapped instanceof JsonRpcException rpcErr) {
            return rpcErr;
        }
        return InternalErrorException.wrap(unwrapped);
    }

    /**
     * Same as {@link #classify(Throwable)}, but internal failures get the id of the request they happened in.
     */
    public static JsonRpcException classify(Throwable err, Object requestId) {
        var rpcErr = classify(err);
        if (rpcErr instanceof InternalErrorException && rpcErr.getRequestId() == null && requestId != null) {
            return new InternalErrorException(requestId, rpcErr.getMessage(), rpcErr.getCause());
        }
        return rpcErr;
    }

    public static JsonRpcResponse.Error toError(Throwable err) {
        return JsonRpcResponse.Error.of(classify(err));
    }

    private static Throwable unwrap(Throwable err) {
        var current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
