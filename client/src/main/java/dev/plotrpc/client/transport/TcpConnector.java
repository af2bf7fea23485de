package dev.plotrpc.client.transport;

import dev.plotrpc.transport.AbstractMessageEndpoint;
import dev.plotrpc.transport.LengthPrefixedCodec;
import dev.plotrpc.transport.Wire;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connecting endpoint. Owns at most one connection to a remote acceptor and a single reader thread
 * for it. Once the connection drops the connector stays disconnected; create a new one to retry.
 */
public class TcpConnector extends AbstractMessageEndpoint {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpConnector.class);

    public static final String SCHEME = "tcp";

    private final Duration connectTimeout;
    private final int maxFrameSize;

    private Socket socket;
    private OutputStream out;
    private String connectionId;
    private Thread readerThread;
    private boolean connected;
    private volatile boolean running;

    public TcpConnector() {
        this("tcp-connector", Duration.ofSeconds(2), LengthPrefixedCodec.DEFAULT_MAX_FRAME_SIZE);
    }

    public TcpConnector(String name, Duration connectTimeout, int maxFrameSize) {
        super(name);
        this.connectTimeout = connectTimeout;
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Connect to {@code tcp://host:port}.
     */
    public boolean connect(URI endpoint) {
        if (endpoint == null || !SCHEME.equalsIgnoreCase(endpoint.getScheme())
            || endpoint.getHost() == null || endpoint.getPort() < 0) {
            LOGGER.error("[{}] Unsupported endpoint {}, expected {}://host:port", getName(), endpoint, SCHEME);
            return false;
        }
        return connect(endpoint.getHost(), endpoint.getPort());
    }

    /**
     * Open the connection and start the reader and dispatch threads.
     * @return {@code false} if the connection could not be established, or this connector was
     * already used
     */
    public synchronized boolean connect(String host, int port) {
        if (running || isStopped()) {
            LOGGER.warn("[{}] connect() ignored, connector already started or stopped", getName());
            return false;
        }
        Socket candidate = new Socket();
        try {
            candidate.setTcpNoDelay(true);
            candidate.connect(new InetSocketAddress(host, port), Math.toIntExact(connectTimeout.toMillis()));
            out = candidate.getOutputStream();
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("[{}] Failed to connect to {}:{}", getName(), host, port, e);
            try {
                candidate.close();
            } catch (IOException closeError) {
                LOGGER.debug("[{}] Error closing failed socket", getName(), closeError);
            }
            return false;
        }
        socket = candidate;
        connectionId = host + ":" + port;
        running = true;
        setConnected(true);
        startDispatcher();
        readerThread = new Thread(this::readLoop, getName() + "-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        LOGGER.info("[{}] Connected to {}", getName(), connectionId);
        return true;
    }

    private void readLoop() {
        try (InputStream in = socket.getInputStream()) {
            while (running) {
                String frame = LengthPrefixedCodec.readFrame(in, maxFrameSize);
                if (frame == null) {
                    break;
                }
                handleMessage(connectionId, frame);
            }
        } catch (IOException e) {
            if (running) {
                LOGGER.error("[{}] Transport error on {}", getName(), connectionId, e);
            }
        } finally {
            setConnected(false);
            LOGGER.info("[{}] Connection {} closed", getName(), connectionId);
        }
    }

    @Override
    public boolean send(String message) {
        if (!isConnected()) {
            return false;
        }
        Wire.tx(connectionId, message);
        try {
            synchronized (out) {
                LengthPrefixedCodec.writeFrame(out, message);
            }
            return true;
        } catch (IOException e) {
            LOGGER.warn("[{}] Failed to send message to {}: {}", getName(), connectionId, e.getMessage());
            return false;
        }
    }

    @Override
    protected boolean hasConnection() {
        return connected;
    }

    private void setConnected(boolean value) {
        stateLock.lock();
        try {
            connected = value;
        } finally {
            stateLock.unlock();
        }
        signalStateChanged();
    }

    @Override
    protected void stopIo() {
        Thread reader;
        synchronized (this) {
            running = false;
            if (socket != null && !socket.isClosed()) {
                try {
                    socket.close();
                } catch (IOException e) {
                    LOGGER.warn("[{}] Error closing socket", getName(), e);
                }
            }
            reader = readerThread;
        }
        if (reader != null && reader != Thread.currentThread()) {
            try {
                reader.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        setConnected(false);
    }
}
