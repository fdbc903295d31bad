package com.dburyak.jsonrpc2.err;

import lombok.Getter;

@Getter
public class MethodNotFoundException extends JsonRpcException {
    private final String method;

    public MethodNotFoundException(Object requestId, String method) {
        super(ErrorKind.METHOD_NOT_FOUND, requestId, ErrorKind.METHOD_NOT_FOUND.getMessage() + ": " + method,
                null, null);
        this.method = method;
    }
}
