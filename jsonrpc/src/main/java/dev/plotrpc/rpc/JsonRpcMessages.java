package dev.plotrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builders for the four JSON-RPC 2.0 message shapes.
 */
public final class JsonRpcMessages {

    public static final String VERSION = "2.0";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonRpcMessages() {
    }

    public static ObjectNode request(String method, JsonNode params, long id) {
        ObjectNode request = notification(method, params);
        request.put("id", id);
        return request;
    }

    public static ObjectNode notification(String method, JsonNode params) {
        ObjectNode message = NODES.objectNode();
        message.put("jsonrpc", VERSION);
        message.put("method", method);
        if (params != null) {
            message.set("params", params);
        }
        return message;
    }

    public static ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode response = NODES.objectNode();
        response.put("jsonrpc", VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        response.set("result", result == null ? NullNode.getInstance() : result);
        return response;
    }

    public static ObjectNode error(JsonNode id, int code, String message, JsonNode data) {
        ObjectNode response = NODES.objectNode();
        response.put("jsonrpc", VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        ObjectNode error = NODES.objectNode();
        error.put("code", code);
        error.put("message", message);
        error.set("data", data == null ? NullNode.getInstance() : data);
        response.set("error", error);
        return response;
    }

    /**
     * A response carries {@code result} or {@code error} and never a {@code method}.
     */
    static boolean isResponse(JsonNode message) {
        return !message.has("method") && (message.has("result") || message.has("error"));
    }
}
