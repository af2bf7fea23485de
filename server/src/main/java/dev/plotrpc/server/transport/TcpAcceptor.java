package dev.plotrpc.server.transport;

import dev.plotrpc.transport.AbstractMessageEndpoint;
import dev.plotrpc.transport.LengthPrefixedCodec;
import dev.plotrpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepting endpoint. Listens on one address/port, keeps every connected peer, and broadcasts
 * outbound messages to all of them.
 *
 * <p>One accept thread owns the server socket and each peer gets a reader task on a cached pool.
 * Readers only enqueue frames; callbacks run on the dispatch thread.</p>
 */
public class TcpAcceptor extends AbstractMessageEndpoint {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpAcceptor.class);

    private final int maxFrameSize;
    private final ExecutorService readerExecutor;
    private final Set<PeerConnection> peers = new LinkedHashSet<>();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public TcpAcceptor() {
        this("tcp-acceptor", LengthPrefixedCodec.DEFAULT_MAX_FRAME_SIZE);
    }

    public TcpAcceptor(String name, int maxFrameSize) {
        super(name);
        this.maxFrameSize = maxFrameSize;
        this.readerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-peer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start listening. A blank address binds every interface; port {@code 0} asks the OS for an
     * ephemeral port, see {@link #getPort()}.
     * @return {@code false} if binding failed or the acceptor was already started or stopped
     */
    public synchronized boolean serve(String address, int port) {
        if (running || isStopped()) {
            LOGGER.warn("[{}] serve() ignored, acceptor already started or stopped", getName());
            return false;
        }
        ServerSocket socket = null;
        try {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            InetSocketAddress bindAddress = address == null || address.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(address, port);
            socket.bind(bindAddress);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("[{}] Failed to listen on {}:{}", getName(), address, port, e);
            closeQuietly(socket);
            return false;
        }
        serverSocket = socket;
        running = true;
        startDispatcher();
        acceptThread = new Thread(this::acceptLoop, getName() + "-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("[{}] Listening on {}", getName(), socket.getLocalSocketAddress());
        return true;
    }

    /**
     * @return the bound port, or {@code -1} before a successful {@link #serve(String, int)}
     */
    public synchronized int getPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public int getPeerCount() {
        stateLock.lock();
        try {
            return peers.size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Block until every peer has disconnected or the timeout elapses.
     */
    public boolean waitUntilNoClient(Duration timeout) {
        return awaitState(peers::isEmpty, timeout);
    }

    /**
     * Broadcast to every connected peer. A failing peer is logged and skipped; the result is
     * {@code false} only when there was no peer at all. Writes happen outside {@link #stateLock},
     * so a peer that stops reading blocks only the sending thread and is released by
     * {@link #stop()}.
     */
    @Override
    public boolean send(String message) {
        List<PeerConnection> snapshot;
        stateLock.lock();
        try {
            snapshot = new ArrayList<>(peers);
        } finally {
            stateLock.unlock();
        }
        if (snapshot.isEmpty()) {
            return false;
        }
        for (PeerConnection peer : snapshot) {
            try {
                peer.write(message);
            } catch (IOException e) {
                LOGGER.warn("[{}] Failed to send message to {}: {}", getName(), peer.connectionId, e.getMessage());
            }
        }
        return true;
    }

    @Override
    protected boolean hasConnection() {
        return !peers.isEmpty();
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("[{}] Error accepting connection", getName(), e);
                }
                continue;
            }
            adopt(socket);
        }
    }

    /**
     * Register an accepted socket as a peer and start its reader. The socket is closed when it
     * cannot be set up.
     */
    boolean adopt(Socket socket) {
        PeerConnection peer;
        try {
            socket.setTcpNoDelay(true);
            peer = new PeerConnection(socket);
        } catch (IOException e) {
            LOGGER.warn("[{}] Dropping connection that could not be set up: {}", getName(), e.getMessage());
            closeQuietly(socket);
            return false;
        }
        stateLock.lock();
        try {
            peers.add(peer);
        } finally {
            stateLock.unlock();
        }
        signalStateChanged();
        try {
            readerExecutor.submit(peer::readLoop);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("[{}] Reader pool rejected connection {}", getName(), peer.connectionId);
            peer.close();
            return false;
        }
        return true;
    }

    @Override
    protected void stopIo() {
        Thread accept;
        synchronized (this) {
            running = false;
            closeQuietly(serverSocket);
            accept = acceptThread;
        }
        if (accept != null && accept != Thread.currentThread()) {
            try {
                accept.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        List<PeerConnection> snapshot;
        stateLock.lock();
        try {
            snapshot = new ArrayList<>(peers);
        } finally {
            stateLock.unlock();
        }
        for (PeerConnection peer : snapshot) {
            peer.close();
        }
        readerExecutor.shutdown();
        try {
            if (!readerExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                readerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing {}", closeable, e);
        }
    }

    /**
     * One accepted peer. Closing shuts the socket first so a broadcast blocked in
     * {@link #write(String)} fails with an {@link IOException} instead of holding up the close.
     */
    private final class PeerConnection implements Closeable {

        private final Socket socket;
        private final String connectionId;
        private final OutputStream out;

        PeerConnection(Socket socket) throws IOException {
            this.socket = socket;
            this.connectionId = socket.getRemoteSocketAddress().toString();
            this.out = socket.getOutputStream();
            LOGGER.info("[{}] Accepted connection {}", getName(), connectionId);
        }

        void readLoop() {
            try (InputStream in = socket.getInputStream()) {
                while (running) {
                    String frame = LengthPrefixedCodec.readFrame(in, maxFrameSize);
                    if (frame == null) {
                        break;
                    }
                    handleMessage(connectionId, frame);
                }
            } catch (IOException e) {
                if (running && !socket.isClosed()) {
                    LOGGER.error("[{}] Connection error {}", getName(), connectionId, e);
                }
            } finally {
                close();
            }
        }

        void write(String message) throws IOException {
            Wire.tx(connectionId, message);
            synchronized (out) {
                LengthPrefixedCodec.writeFrame(out, message);
            }
        }

        @Override
        public void close() {
            closeQuietly(socket);
            boolean removed;
            stateLock.lock();
            try {
                removed = peers.remove(this);
            } finally {
                stateLock.unlock();
            }
            if (removed) {
                signalStateChanged();
                LOGGER.info("[{}] Connection {} closed", getName(), connectionId);
            }
        }
    }
}
