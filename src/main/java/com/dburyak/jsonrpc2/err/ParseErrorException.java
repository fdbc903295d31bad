package com.dburyak.jsonrpc2.err;

/**
 * Payload is not well-formed JSON. Raised before any request exists, so it never carries a request id.
 */
public class ParseErrorException extends JsonRpcException {
    public ParseErrorException(String data, Throwable cause) {
        super(ErrorKind.PARSE, null, ErrorKind.PARSE.getMessage(), data, cause);
    }

    public ParseErrorException(String data) {
        this(data, null);
    }
}
