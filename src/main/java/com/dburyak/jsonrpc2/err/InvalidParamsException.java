package com.dburyak.jsonrpc2.err;

/**
 * Request params are missing or can't be converted to the shape the service expects.
 */
public class InvalidParamsException extends JsonRpcException {
    public static final String NO_PARAMS = "No parameters given";

    public InvalidParamsException(Object requestId, String data, Throwable cause) {
        super(ErrorKind.INVALID_PARAMS, requestId, ErrorKind.INVALID_PARAMS.getMessage(), data, cause);
    }

    public InvalidParamsException(Object requestId, String data) {
        this(requestId, data, null);
    }
}
