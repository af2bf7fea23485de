package dev.plotrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface NotificationHandler {

    void handle(JsonNode params) throws Exception;
}
