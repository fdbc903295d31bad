package com.dburyak.jsonrpc2;

import com.dburyak.jsonrpc2.err.InvalidParamsException;
import com.dburyak.jsonrpc2.err.InvalidRequestException;
import com.dburyak.jsonrpc2.err.ParseErrorException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.json.jackson.DatabindCodec;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * JSON-RPC 2.0 request. Method and id are fixed for the life of the request, while params can be taken out exactly
 * once: the first service that extracts them commits to handling the request.
 * <p>
 * Not thread-safe. A request is owned by the single dispatch that consumes it.
 */
@Getter
@ToString
public class JsonRpcRequest {
    public static final String FIELD_VERSION = "jsonrpc";
    public static final String VERSION_2_0 = "2.0";
    public static final String FIELD_METHOD = "method";
    public static final String FIELD_ID = "id";
    public static final String FIELD_PARAMS = "params";

    private static final long MAX_GENERATED_ID = 0xFFFF_FFFFL;
    private static final ObjectMapper PARAMS_MAPPER = paramsMapper();

    private final Object id; // can be String, Number, Boolean or null
    private final String method;
    @Getter(AccessLevel.NONE)
    private Object params; // any Vertx json value, null once taken

    public JsonRpcRequest(Object id, String method, Object params) {
        if (method == null || method.isEmpty()) {
            throw new IllegalArgumentException("method must be provided");
        }
        if (!isScalar(id)) {
            throw new IllegalArgumentException("id must be a JSON scalar: " + id);
        }
        this.id = id;
        this.method = method;
        this.params = params;
    }

    /**
     * Request that expects an answer. Gets a random non-zero correlation id.
     */
    public static JsonRpcRequest newReply(String method, Object params) {
        var id = ThreadLocalRandom.current().nextLong(1L, MAX_GENERATED_ID + 1);
        return new JsonRpcRequest(id, method, params);
    }

    public static JsonRpcRequest newNotification(String method, Object params) {
        return new JsonRpcRequest(null, method, params);
    }

    public static JsonRpcRequest parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ParseErrorException("empty payload");
        }
        Object json;
        try {
            json = Json.decodeValue(payload);
        } catch (DecodeException e) {
            throw new ParseErrorException(e.getMessage(), e);
        }
        return fromJson(json);
    }

    public static JsonRpcRequest parse(Buffer payload) {
        if (payload == null || payload.length() == 0) {
            throw new ParseErrorException("empty payload");
        }
        Object json;
        try {
            json = Json.decodeValue(payload);
        } catch (DecodeException e) {
            throw new ParseErrorException(e.getMessage(), e);
        }
        return fromJson(json);
    }

    public static JsonRpcRequest parse(byte[] payload) {
        return parse(payload != null ? Buffer.buffer(payload) : null);
    }

    /**
     * Reads the stream to the end and parses it. The stream is not closed.
     */
    public static JsonRpcRequest parse(InputStream in) {
        try {
            return parse(in.readAllBytes());
        } catch (IOException e) {
            throw new ParseErrorException("failed to read payload: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the reader to the end and parses it. The reader is not closed.
     */
    public static JsonRpcRequest parse(Reader reader) {
        var out = new StringWriter();
        try {
            reader.transferTo(out);
        } catch (IOException e) {
            throw new ParseErrorException("failed to read payload: " + e.getMessage(), e);
        }
        return parse(out.toString());
    }

    /**
     * Validates an already decoded JSON value against the request schema.
     */
    public static JsonRpcRequest fromJson(Object json) {
        if (!(json instanceof JsonObject jsonObj)) {
            throw new InvalidRequestException("request must be a JSON object, got: " + typeName(json));
        }
        var version = jsonObj.getValue(FIELD_VERSION);
        if (version == null) {
            throw new InvalidRequestException("missing field `" + FIELD_VERSION + "`");
        }
        if (!VERSION_2_0.equals(version)) {
            throw new InvalidRequestException("unsupported JSON-RPC version: " + version);
        }
        var method = jsonObj.getValue(FIELD_METHOD);
        if (method == null) {
            throw new InvalidRequestException("missing field `" + FIELD_METHOD + "`");
        }
        if (!(method instanceof String methodStr)) {
            throw new InvalidRequestException("field `" + FIELD_METHOD + "` must be a string, got: "
                    + typeName(method));
        }
        if (methodStr.isEmpty()) {
            throw new InvalidRequestException("field `" + FIELD_METHOD + "` must not be empty");
        }
        var id = jsonObj.getValue(FIELD_ID);
        if (!isScalar(id)) {
            throw new InvalidRequestException("field `" + FIELD_ID + "` must be a scalar, got: " + typeName(id));
        }
        return new JsonRpcRequest(id, methodStr, jsonObj.getValue(FIELD_PARAMS));
    }

    public boolean matches(String name) {
        return method.equals(name);
    }

    public boolean isNotification() {
        return id == null;
    }

    public boolean hasParams() {
        return params != null;
    }

    /**
     * Hands over the raw params, leaving none behind.
     *
     * @throws InvalidParamsException if there are no params, or they were already taken
     */
    public Object takeParams() {
        var taken = params;
        params = null;
        if (taken == null) {
            throw new InvalidParamsException(id, InvalidParamsException.NO_PARAMS);
        }
        return taken;
    }

    /**
     * Takes the params and converts them to the given type. Params are consumed even when the conversion fails.
     *
     * @throws InvalidParamsException if there are no params left or they don't fit the type
     */
    public <T> T deserialize(Class<T> type) {
        return deserialize(PARAMS_MAPPER.constructType(type));
    }

    public <T> T deserialize(TypeReference<T> type) {
        return deserialize(PARAMS_MAPPER.getTypeFactory().constructType(type));
    }

    private <T> T deserialize(JavaType type) {
        var taken = takeParams();
        try {
            return PARAMS_MAPPER.convertValue(taken, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsException(id, e.getMessage(), e);
        }
    }

    public JsonObject toJson() {
        var json = new JsonObject()
                .put(FIELD_VERSION, VERSION_2_0)
                .put(FIELD_METHOD, method);
        if (id != null) {
            json.put(FIELD_ID, id);
        }
        if (params != null) {
            json.put(FIELD_PARAMS, params);
        }
        return json;
    }

    public String encode() {
        return toJson().encode();
    }

    private static boolean isScalar(Object value) {
        return !(value instanceof JsonObject || value instanceof JsonArray);
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        } else if (value instanceof JsonObject) {
            return "object";
        } else if (value instanceof JsonArray) {
            return "array";
        } else if (value instanceof String) {
            return "string";
        } else if (value instanceof Number) {
            return "number";
        } else if (value instanceof Boolean) {
            return "boolean";
        }
        return value.getClass().getSimpleName();
    }

    private static ObjectMapper paramsMapper() {
        // Vertx mapper knows how to serialize JsonObject/JsonArray, but jackson by default happily turns `true` or `42`
        // into a String, `1.9` into 1 and "42" into 42, which would hide type errors in params
        var mapper = DatabindCodec.mapper().copy();
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return mapper;
    }
}
