package com.dburyak.jsonrpc2.err;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of failure kinds together with their JSON-RPC 2.0 error codes and stable messages. Every failure that
 * crosses the dispatch boundary is reported as exactly one of these.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {
    PARSE(-32700, "Parsing failed, invalid JSON data", true),
    INVALID_REQUEST(-32600, "Invalid JSON-RPC request", true),
    METHOD_NOT_FOUND(-32601, "Service method not found", false),
    INVALID_PARAMS(-32602, "Message parameters are invalid", true),

    /**
     * No stable message, the message of the underlying failure is reported instead.
     */
    INTERNAL(-32603, null, false);

    private final int code;
    private final String message;
    private final boolean carriesData;
}
