package dev.plotrpc.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class AbstractMessageEndpointTest {

    /**
     * Endpoint whose connection state and inbound traffic are driven by the test.
     */
    private static final class ScriptedEndpoint extends AbstractMessageEndpoint {

        private boolean connected;
        private final AtomicInteger ioStops = new AtomicInteger();

        ScriptedEndpoint() {
            super("scripted");
        }

        void open() {
            startDispatcher();
            setConnected(true);
        }

        void setConnected(boolean value) {
            stateLock.lock();
            try {
                connected = value;
            } finally {
                stateLock.unlock();
            }
            signalStateChanged();
        }

        void receive(String message) {
            handleMessage("scripted-peer", message);
        }

        @Override
        public boolean send(String message) {
            return isConnected();
        }

        @Override
        protected boolean hasConnection() {
            return connected;
        }

        @Override
        protected void stopIo() {
            ioStops.incrementAndGet();
            setConnected(false);
        }
    }

    private final ScriptedEndpoint endpoint = new ScriptedEndpoint();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        endpoint.stop();
        scheduler.shutdownNow();
    }

    @Test
    void waitConnectionTimesOutWhenNothingConnects() {
        long start = System.nanoTime();
        assertFalse(endpoint.waitConnection(Duration.ofMillis(100)));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
        assertFalse(endpoint.isConnected());
    }

    @Test
    void waitConnectionWakesUpWhenConnectionOpens() {
        scheduler.schedule(endpoint::open, 50, TimeUnit.MILLISECONDS);

        assertTrue(endpoint.waitConnection(Duration.ofSeconds(2)));
        assertTrue(endpoint.isConnected());
    }

    @Test
    void inboundMessagesReachRegisteredCallbacks() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        endpoint.registerCallback("capture", received::add);
        endpoint.open();

        endpoint.receive("hello");

        assertEquals("hello", received.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void stopIsIdempotentAndReleasesWaiters() {
        endpoint.open();
        endpoint.stop();
        endpoint.stop();

        assertEquals(1, endpoint.ioStops.get());
        assertTrue(endpoint.isStopped());
        assertFalse(endpoint.isConnected());
        assertFalse(endpoint.waitConnection(Duration.ofSeconds(5)), "stopped endpoint should not block");
        assertFalse(endpoint.send("late"));
    }

    @Test
    void unregisteringUnknownCallbackIsHarmless() {
        assertDoesNotThrow(() -> endpoint.unregisterCallback("never-registered"));
    }
}
