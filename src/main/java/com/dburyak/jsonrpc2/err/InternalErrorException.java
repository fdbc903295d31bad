package com.dburyak.jsonrpc2.err;

/**
 * Any failure that doesn't belong to the other kinds. Only the message of the underlying failure is exposed to the
 * caller, the cause is kept for logging.
 */
public class InternalErrorException extends JsonRpcException {

    public InternalErrorException(Object requestId, String message, Throwable cause) {
        super(ErrorKind.INTERNAL, requestId, message, null, cause);
    }

    public InternalErrorException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public InternalErrorException(String message) {
        this(null, message, null);
    }

    /**
     * Boxes a foreign failure so that a service can rethrow it as-is. Handy for checked exceptions in lambdas.
     */
    public static InternalErrorException wrap(Throwable err) {
        if (err instanceof InternalErrorException internalErr) {
            return internalErr;
        }
        return new InternalErrorException(messageOf(err), err);
    }

    static String messageOf(Throwable err) {
        var msg = err.getMessage();
        return (msg != null && !msg.isEmpty()) ? msg : err.getClass().getName();
    }
}
