package dev.plotrpc.rpc;

/**
 * Standard JSON-RPC 2.0 error codes.
 */
public enum JsonRpcErrorCode {

    PARSE_ERROR(-32700),
    INVALID_REQUEST(-32600),
    METHOD_NOT_FOUND(-32601),
    INVALID_PARAMS(-32602),
    INTERNAL_ERROR(-32603),
    SERVER_ERROR(-32000);

    private final int code;

    JsonRpcErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the matching constant, or {@code null} for an application-defined code
     */
    public static JsonRpcErrorCode fromCode(int code) {
        for (JsonRpcErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }
}
