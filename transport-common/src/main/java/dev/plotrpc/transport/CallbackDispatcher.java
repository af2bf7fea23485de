package dev.plotrpc.transport;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decouples "a message arrived" from "a callback ran". The I/O path only calls
 * {@link #enqueue(String)}; a single dispatch thread pops one message at a time and hands it to a
 * snapshot of the registered callbacks, so slow or failing callback code never stalls the socket.
 *
 * <p>The inbound queue and the callback registry are guarded by separate locks and neither is
 * held while user code runs. A callback may therefore register or unregister callbacks, itself
 * included; the change is visible from the next message on.</p>
 */
public final class CallbackDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CallbackDispatcher.class);

    private final String ownerName;

    private final Queue<String> inbound = new ArrayDeque<>();
    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition messageAvailable = queueLock.newCondition();

    private final Map<String, MessageCallback> callbacks = new LinkedHashMap<>();
    private final Object callbackLock = new Object();

    private volatile boolean running;
    private Thread dispatchThread;

    public CallbackDispatcher(String ownerName) {
        this.ownerName = Objects.requireNonNull(ownerName, "ownerName");
    }

    /**
     * Start the dispatch thread. Has no effect when already running.
     */
    public void start() {
        queueLock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            dispatchThread = new Thread(this::dispatchLoop, ownerName + "-dispatch");
            dispatchThread.setDaemon(true);
            dispatchThread.start();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Ask the dispatch thread to exit and wait for it. Idempotent. When invoked from a callback
     * the join is skipped, since the dispatch thread cannot wait for itself.
     */
    public void stop() {
        Thread thread;
        queueLock.lock();
        try {
            running = false;
            messageAvailable.signalAll();
            thread = dispatchThread;
            dispatchThread = null;
        } finally {
            queueLock.unlock();
        }
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Called by the I/O path for every complete inbound message.
     */
    public void enqueue(String message) {
        queueLock.lock();
        try {
            inbound.add(message);
            messageAvailable.signalAll();
        } finally {
            queueLock.unlock();
        }
    }

    public void register(String name, MessageCallback callback) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callback, "callback");
        synchronized (callbackLock) {
            callbacks.put(name, callback);
        }
    }

    public void unregister(String name) {
        synchronized (callbackLock) {
            callbacks.remove(name);
        }
    }

    public boolean isRegistered(String name) {
        synchronized (callbackLock) {
            return callbacks.containsKey(name);
        }
    }

    private void dispatchLoop() {
        while (running) {
            String message;
            queueLock.lock();
            try {
                while (running && inbound.isEmpty()) {
                    messageAvailable.await();
                }
                if (!running) {
                    break;
                }
                message = inbound.poll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                queueLock.unlock();
            }
            deliver(message);
        }
        LOGGER.debug("[{}] Dispatch thread exiting", ownerName);
    }

    private void deliver(String message) {
        Map<String, MessageCallback> snapshot;
        synchronized (callbackLock) {
            snapshot = new LinkedHashMap<>(callbacks);
        }
        for (Map.Entry<String, MessageCallback> entry : snapshot.entrySet()) {
            if (!running) {
                break;
            }
            try {
                entry.getValue().onMessage(message);
            } catch (Exception e) {
                LOGGER.error("[{}] Callback {} failed", ownerName, entry.getKey(), e);
            }
        }
    }
}
