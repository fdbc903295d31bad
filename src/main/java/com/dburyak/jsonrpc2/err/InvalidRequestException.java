package com.dburyak.jsonrpc2.err;

/**
 * Payload is well-formed JSON but is not a valid JSON-RPC 2.0 request object.
 */
public class InvalidRequestException extends JsonRpcException {

    public InvalidRequestException(String data, Throwable cause) {
        super(ErrorKind.INVALID_REQUEST, null, ErrorKind.INVALID_REQUEST.getMessage(), data, cause);
    }

    public InvalidRequestException(String data) {
        this(data, null);
    }
}
