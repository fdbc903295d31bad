package com.dburyak.jsonrpc2.err;

import lombok.Getter;

/**
 * Root exception for all failures that can be converted into a JSON-RPC error response.
 * <p>
 * The exception message is the public error message that ends up in the response, so it must never contain anything
 * that is not meant for the caller. Diagnostics go to {@link #getData()}, and only for kinds that carry data.
 */
@Getter
public abstract class JsonRpcException extends RuntimeException {
    private final ErrorKind kind;
    private final Object requestId; // can be String, Number or null
    private final String data;

    protected JsonRpcException(ErrorKind kind, Object requestId, String message, String data, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.requestId = requestId;
        this.data = kind.isCarriesData() ? data : null;
    }

    public int getCode() {
        return kind.getCode();
    }
}
