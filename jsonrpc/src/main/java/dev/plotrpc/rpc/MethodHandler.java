package dev.plotrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handles an inbound request and produces its result. Throwing {@link JsonRpcException} answers
 * with that error; any other exception becomes {@code INTERNAL_ERROR}.
 */
@FunctionalInterface
public interface MethodHandler {

    JsonNode handle(JsonNode params) throws Exception;
}
