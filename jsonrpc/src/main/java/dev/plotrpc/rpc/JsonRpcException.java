package dev.plotrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * A JSON-RPC error object as a Java exception. Handlers throw it to answer with a specific code;
 * callers receive it when the remote side answered a call with an error.
 */
public class JsonRpcException extends Exception {

    private final int code;
    private final transient JsonNode data;

    public JsonRpcException(JsonRpcErrorCode code, String message) {
        this(code.code(), message, null);
    }

    public JsonRpcException(int code, String message, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data == null ? NullNode.getInstance() : data;
    }

    /**
     * Build from the {@code "error"} member of a response.
     */
    static JsonRpcException fromErrorObject(JsonNode error) {
        int code = error.path("code").asInt(JsonRpcErrorCode.SERVER_ERROR.code());
        String message = error.path("message").asText("");
        return new JsonRpcException(code, message, error.get("data"));
    }

    public int getCode() {
        return code;
    }

    /**
     * @return the standard code this error carries, or {@code null} for application codes
     */
    public JsonRpcErrorCode getErrorCode() {
        return JsonRpcErrorCode.fromCode(code);
    }

    public JsonNode getData() {
        return data;
    }
}
