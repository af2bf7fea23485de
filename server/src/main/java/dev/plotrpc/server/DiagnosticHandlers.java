package dev.plotrpc.server;

import com.fasterxml.jackson.databind.node.TextNode;
import dev.plotrpc.rpc.JsonRpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in methods a front end can use to check the channel: {@code rpc.ping} answers
 * {@code "pong"}, {@code rpc.echo} returns its params unchanged, and {@code rpc.log}
 * notifications are written to the server log.
 */
public final class DiagnosticHandlers {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticHandlers.class);

    public static final String PING = "rpc.ping";
    public static final String ECHO = "rpc.echo";
    public static final String LOG = "rpc.log";

    private DiagnosticHandlers() {
    }

    public static void register(JsonRpc rpc) {
        rpc.registerHandler(PING, params -> TextNode.valueOf("pong"));
        rpc.registerHandler(ECHO, params -> params);
        rpc.registerNotification(LOG, params -> LOGGER.info("Peer log: {}", params));
    }
}
