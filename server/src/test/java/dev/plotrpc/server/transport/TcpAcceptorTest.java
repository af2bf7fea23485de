package dev.plotrpc.server.transport;

import static org.junit.jupiter.api.Assertions.*;

import dev.plotrpc.client.transport.TcpConnector;
import dev.plotrpc.transport.LengthPrefixedCodec;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class TcpAcceptorTest {

    private static final int LARGE_FRAME = 8 * 1024 * 1024;

    private TcpAcceptor acceptor;
    private final List<TcpConnector> connectors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        acceptor = new TcpAcceptor("test-acceptor", LengthPrefixedCodec.DEFAULT_MAX_FRAME_SIZE);
    }

    @AfterEach
    void tearDown() {
        connectors.forEach(TcpConnector::stop);
        acceptor.stop();
    }

    @Test
    void servesOnEphemeralPortAndBothSidesSeeTheConnection() {
        assertEquals(-1, acceptor.getPort());
        assertTrue(acceptor.serve("127.0.0.1", 0));
        assertTrue(acceptor.getPort() > 0);
        assertFalse(acceptor.isConnected());

        TcpConnector connector = connect();

        assertTrue(connector.waitConnection(Duration.ofSeconds(2)));
        assertTrue(acceptor.waitConnection(Duration.ofSeconds(2)));
        assertEquals(1, acceptor.getPeerCount());
    }

    @Test
    void sendWithoutPeersReportsFalse() {
        assertTrue(acceptor.serve("127.0.0.1", 0));

        assertFalse(acceptor.send("nobody"));
    }

    @Test
    void broadcastReachesEveryPeer() throws Exception {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        BlockingQueue<String> first = new LinkedBlockingQueue<>();
        BlockingQueue<String> second = new LinkedBlockingQueue<>();
        connect().registerCallback("capture", first::add);
        connect().registerCallback("capture", second::add);
        awaitPeers(2);

        assertTrue(acceptor.send("update"));

        assertEquals("update", first.poll(2, TimeUnit.SECONDS));
        assertEquals("update", second.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void failingPeerIsSkippedAndBroadcastStillReachesTheOthers() throws Exception {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        Socket stalled = openNonReadingPeer();
        awaitPeers(1);
        BlockingQueue<String> healthy = new LinkedBlockingQueue<>();
        connect().registerCallback("capture", healthy::add);
        awaitPeers(2);

        String payload = "x".repeat(LARGE_FRAME);
        List<Boolean> results = new CopyOnWriteArrayList<>();
        Thread broadcaster = startBroadcast(payload, 1, results);
        // Let the broadcast fill the stalled peer's buffers before resetting it.
        Thread.sleep(200);
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> assertTrue(acceptor.isConnected()));

        stalled.setSoLinger(true, 0);
        stalled.close();

        assertEquals(payload, healthy.poll(5, TimeUnit.SECONDS));
        broadcaster.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(broadcaster.isAlive());
        assertEquals(List.of(true), results);
    }

    @Test
    void stopReturnsPromptlyWhileBroadcastIsBlockedOnNonReadingPeer() throws Exception {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        BlockingQueue<String> healthy = new LinkedBlockingQueue<>();
        connect().registerCallback("capture", healthy::add);
        awaitPeers(1);
        try (Socket stalled = openNonReadingPeer()) {
            awaitPeers(2);

            String payload = "x".repeat(LARGE_FRAME);
            List<Boolean> results = new CopyOnWriteArrayList<>();
            Thread broadcaster = startBroadcast(payload, 4, results);
            assertEquals(payload, healthy.poll(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> assertTrue(acceptor.isConnected()));
            assertTimeoutPreemptively(Duration.ofSeconds(5), acceptor::stop);

            broadcaster.join(TimeUnit.SECONDS.toMillis(5));
            assertFalse(broadcaster.isAlive());
            assertTrue(results.get(0), "the first broadcast had peers and must report success");
            assertEquals(0, acceptor.getPeerCount());
        }
    }

    @Test
    void connectionThatCannotBeSetUpIsClosed() {
        AtomicBoolean closed = new AtomicBoolean();
        Socket broken = new Socket() {
            @Override
            public void setTcpNoDelay(boolean on) {
            }

            @Override
            public SocketAddress getRemoteSocketAddress() {
                return new InetSocketAddress("127.0.0.1", 9);
            }

            @Override
            public OutputStream getOutputStream() throws IOException {
                throw new IOException("no output stream");
            }

            @Override
            public synchronized void close() throws IOException {
                closed.set(true);
                super.close();
            }
        };

        assertFalse(acceptor.adopt(broken));
        assertTrue(closed.get());
        assertEquals(0, acceptor.getPeerCount());
        assertFalse(acceptor.isConnected());
    }

    @Test
    void messagesFromOneConnectionArriveInOrder() throws Exception {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        acceptor.registerCallback("capture", received::add);
        TcpConnector connector = connect();
        assertTrue(acceptor.waitConnection(Duration.ofSeconds(2)));

        int count = 200;
        for (int i = 0; i < count; i++) {
            assertTrue(connector.send("msg-" + i));
        }

        for (int i = 0; i < count; i++) {
            assertEquals("msg-" + i, received.poll(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void waitUntilNoClientReturnsOnceEveryPeerLeft() {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        TcpConnector connector = connect();
        assertTrue(acceptor.waitConnection(Duration.ofSeconds(2)));
        assertFalse(acceptor.waitUntilNoClient(Duration.ofMillis(50)));

        connector.stop();

        assertTrue(acceptor.waitUntilNoClient(Duration.ofSeconds(2)));
        assertFalse(acceptor.isConnected());
        assertEquals(0, acceptor.getPeerCount());
    }

    @Test
    void portInUseIsReportedAsFailure() {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        TcpAcceptor second = new TcpAcceptor();
        try {
            assertFalse(second.serve("127.0.0.1", acceptor.getPort()));
            assertEquals(-1, second.getPort());
        } finally {
            second.stop();
        }
    }

    @Test
    void stopIsIdempotentAndDisconnectsPeers() throws InterruptedException {
        assertTrue(acceptor.serve("127.0.0.1", 0));
        TcpConnector connector = connect();
        assertTrue(acceptor.waitConnection(Duration.ofSeconds(2)));

        acceptor.stop();
        acceptor.stop();

        assertFalse(acceptor.isConnected());
        assertFalse(acceptor.serve("127.0.0.1", 0), "a stopped acceptor cannot be restarted");
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (connector.isConnected() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(connector.isConnected());
    }

    /**
     * A raw peer with a tiny receive window that never reads, so large writes to it block.
     */
    private Socket openNonReadingPeer() throws IOException {
        Socket socket = new Socket();
        socket.setReceiveBufferSize(4096);
        socket.connect(new InetSocketAddress("127.0.0.1", acceptor.getPort()), 2000);
        return socket;
    }

    private Thread startBroadcast(String payload, int times, List<Boolean> results) {
        Thread thread = new Thread(() -> {
            for (int i = 0; i < times; i++) {
                results.add(acceptor.send(payload));
            }
        }, "test-broadcaster");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private TcpConnector connect() {
        TcpConnector connector = new TcpConnector();
        connectors.add(connector);
        assertTrue(connector.connect("127.0.0.1", acceptor.getPort()));
        return connector;
    }

    private void awaitPeers(int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (acceptor.getPeerCount() < count && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(count, acceptor.getPeerCount());
    }
}
