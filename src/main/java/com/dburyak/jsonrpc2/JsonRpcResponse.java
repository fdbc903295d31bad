package com.dburyak.jsonrpc2;

import com.dburyak.jsonrpc2.err.JsonRpcErrors;
import com.dburyak.jsonrpc2.err.JsonRpcException;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Immutable representation of a JSON-RPC response. Carries either a result or an error, never both. A successful
 * response may still have {@code null} as its result, which is encoded as JSON null.
 */
@Value
public class JsonRpcResponse {
    public static final String FIELD_VERSION = "jsonrpc";
    public static final String VERSION_2_0 = "2.0";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_ID = "id";

    Object id; // can be String, Number or null
    Object result;
    Error error;

    private JsonRpcResponse(Object id, Object result, Error error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static JsonRpcResponse success(JsonRpcRequest req, Object result) {
        return success(req.getId(), result);
    }

    public static JsonRpcResponse success(Object id, Object result) {
        return new JsonRpcResponse(id, result, null);
    }

    public static JsonRpcResponse failed(Object id, Error error) {
        if (error == null) {
            throw new IllegalArgumentException("error must be provided");
        }
        return new JsonRpcResponse(id, null, error);
    }

    /**
     * Error response to the given request. The request id is always echoed, whatever the failure.
     */
    public static JsonRpcResponse failed(JsonRpcRequest req, Throwable err) {
        return failed(req.getId(), JsonRpcErrors.toError(err));
    }

    /**
     * Error response for failures that may have happened before there was any request, e.g. parse errors. Uses the
     * request id carried by the failure, if any.
     */
    public static JsonRpcResponse failed(Throwable err) {
        var rpcErr = JsonRpcErrors.classify(err);
        return failed(rpcErr.getRequestId(), JsonRpcErrors.toError(rpcErr));
    }

    /**
     * Reads a response produced by a JSON-RPC server, e.g. the answer to a {@link JsonRpcRequest#newReply} call.
     */
    public static JsonRpcResponse fromJson(JsonObject json) {
        if (!VERSION_2_0.equals(json.getValue(FIELD_VERSION))) {
            throw new IllegalArgumentException("unsupported JSON-RPC version: " + json.getValue(FIELD_VERSION));
        }
        var hasResult = json.containsKey(FIELD_RESULT);
        var errObj = json.getValue(FIELD_ERROR);
        if (hasResult == (errObj != null)) {
            throw new IllegalArgumentException("response must have exactly one of `" + FIELD_RESULT + "` and `"
                    + FIELD_ERROR + "`");
        }
        var id = json.getValue(FIELD_ID);
        if (hasResult) {
            return success(id, json.getValue(FIELD_RESULT));
        }
        if (!(errObj instanceof JsonObject errJson)) {
            throw new IllegalArgumentException("`" + FIELD_ERROR + "` must be an object");
        }
        return failed(id, Error.fromJson(errJson));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public JsonObject toJson() {
        return toJson(false);
    }

    /**
     * @param omitNullId whether to leave out the id field when there is no id, instead of writing JSON null
     */
    public JsonObject toJson(boolean omitNullId) {
        var json = new JsonObject().put(FIELD_VERSION, VERSION_2_0);
        if (id != null || !omitNullId) {
            json.put(FIELD_ID, id);
        }
        if (error != null) {
            json.put(FIELD_ERROR, error.toJson());
        } else {
            json.put(FIELD_RESULT, result);
        }
        return json;
    }

    public String encode() {
        return toJson().encode();
    }

    public Buffer toBuffer() {
        return toJson().toBuffer();
    }

    @Value
    @RequiredArgsConstructor
    public static class Error {
        public static final String FIELD_CODE = "code";
        public static final String FIELD_MESSAGE = "message";
        public static final String FIELD_DATA = "data";

        int code;
        String message;
        String data;

        public Error(int code, String message) {
            this(code, message, null);
        }

        public static Error of(JsonRpcException err) {
            return new Error(err.getCode(), err.getMessage(), err.getData());
        }

        static Error fromJson(JsonObject json) {
            var code = json.getValue(FIELD_CODE);
            var message = json.getValue(FIELD_MESSAGE);
            if (!(code instanceof Number codeNum) || !(message instanceof String messageStr)) {
                throw new IllegalArgumentException("error must have numeric `" + FIELD_CODE + "` and string `"
                        + FIELD_MESSAGE + "`");
            }
            var data = json.getValue(FIELD_DATA);
            return new Error(codeNum.intValue(), messageStr, data != null ? data.toString() : null);
        }

        public JsonObject toJson() {
            var json = new JsonObject()
                    .put(FIELD_CODE, code)
                    .put(FIELD_MESSAGE, message);
            if (data != null) {
                json.put(FIELD_DATA, data);
            }
            return json;
        }
    }
}
