package dev.plotrpc.transport;

/**
 * Receives raw text messages delivered by a {@link MessageEndpoint}. Callbacks always run on the
 * endpoint's dispatch thread, never on the thread that reads from the network.
 */
@FunctionalInterface
public interface MessageCallback {

    void onMessage(String message);
}
