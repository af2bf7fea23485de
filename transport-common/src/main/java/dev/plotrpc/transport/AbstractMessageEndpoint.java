package dev.plotrpc.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared base for accepting and connecting endpoints. Owns the callback dispatch machinery and the
 * connection-state lock that {@link #waitConnection(Duration)} blocks on. Subclasses own the
 * sockets and the I/O thread; they feed complete messages to {@link #handleMessage(String, String)}
 * and call {@link #signalStateChanged()} whenever a connection opens or closes.
 */
public abstract class AbstractMessageEndpoint implements MessageEndpoint {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractMessageEndpoint.class);

    private final String name;
    private final CallbackDispatcher dispatcher;
    private final AtomicBoolean stopped = new AtomicBoolean();

    /**
     * Guards the subclass connection state.
     */
    protected final ReentrantLock stateLock = new ReentrantLock();
    private final Condition stateChanged = stateLock.newCondition();

    protected AbstractMessageEndpoint(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.dispatcher = new CallbackDispatcher(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void registerCallback(String callbackName, MessageCallback callback) {
        dispatcher.register(callbackName, callback);
    }

    @Override
    public void unregisterCallback(String callbackName) {
        dispatcher.unregister(callbackName);
    }

    @Override
    public final boolean isConnected() {
        stateLock.lock();
        try {
            return hasConnection();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public final boolean waitConnection(Duration timeout) {
        return awaitState(this::hasConnection, timeout);
    }

    @Override
    public final void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        // I/O first so nothing is enqueued once dispatch shutdown begins.
        stopIo();
        dispatcher.stop();
        signalStateChanged();
        LOGGER.info("[{}] Stopped", name);
    }

    public final boolean isStopped() {
        return stopped.get();
    }

    /**
     * @return {@code true} when at least one connection is live; called with {@link #stateLock}
     * held
     */
    protected abstract boolean hasConnection();

    /**
     * Close the sockets and join the I/O thread(s). Called once.
     */
    protected abstract void stopIo();

    protected void startDispatcher() {
        dispatcher.start();
    }

    protected void handleMessage(String connectionId, String message) {
        Wire.rx(connectionId, message);
        dispatcher.enqueue(message);
    }

    protected void signalStateChanged() {
        stateLock.lock();
        try {
            stateChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Block until {@code condition} holds, the endpoint is stopped, or the timeout elapses. The
     * condition is evaluated with {@link #stateLock} held.
     */
    protected boolean awaitState(BooleanSupplier condition, Duration timeout) {
        long remaining = timeout.toNanos();
        stateLock.lock();
        try {
            while (!condition.getAsBoolean() && !stopped.get()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
            return condition.getAsBoolean();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            stateLock.unlock();
        }
    }
}
