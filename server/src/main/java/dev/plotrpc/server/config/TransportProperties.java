package dev.plotrpc.server.config;

import dev.plotrpc.transport.LengthPrefixedCodec;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "plotrpc.transport")
public class TransportProperties {

    /**
     * Interface to bind. Blank listens on every interface.
     */
    private String address = "";

    /**
     * Listening port. {@code 0} picks an ephemeral port.
     */
    private int port = 7071;

    /**
     * Largest accepted inbound frame, in bytes.
     */
    private int maxFrameSize = LengthPrefixedCodec.DEFAULT_MAX_FRAME_SIZE;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public void setMaxFrameSize(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }
}
