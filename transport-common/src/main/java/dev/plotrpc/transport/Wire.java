package dev.plotrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic in one format so that acceptor and connector logs look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String connectionId, String message) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} len={} msg={}", connectionId, message.length(), truncate(message, MAX_LOGGED_CHARS));
        }
    }

    public static void tx(String connectionId, String message) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} len={} msg={}", connectionId, message.length(), truncate(message, MAX_LOGGED_CHARS));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
