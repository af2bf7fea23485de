package dev.plotrpc.transport;

import java.time.Duration;

/**
 * One side of a persistent, message-oriented, bidirectional connection. Implementations either
 * accept inbound peers or connect to a single remote peer; both expose the same contract so the
 * layers above do not care which role they sit on.
 *
 * <p>Inbound messages are queued by the I/O path and delivered to every registered
 * {@link MessageCallback} on a dedicated dispatch thread, in arrival order per connection.</p>
 */
public interface MessageEndpoint extends AutoCloseable {

    /**
     * Send a text message to the remote side. An accepting endpoint broadcasts to all peers.
     * @param message the UTF-8 text to send
     * @return {@code false} when there was nobody to send to (or the single peer failed)
     */
    boolean send(String message);

    /**
     * Register a callback under a name. Registering the same name again replaces the previous
     * callback.
     */
    void registerCallback(String name, MessageCallback callback);

    /**
     * Remove the callback registered under {@code name}. Unknown names are ignored.
     */
    void unregisterCallback(String name);

    boolean isConnected();

    /**
     * Block until the endpoint has at least one live connection or the timeout elapses.
     * @return {@code true} if connected within the timeout
     */
    boolean waitConnection(Duration timeout);

    /**
     * Stop network I/O, then the dispatch thread. Safe to call repeatedly and from any thread.
     */
    void stop();

    String getName();

    @Override
    default void close() {
        stop();
    }
}
