package dev.plotrpc.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Codec that writes and reads frames that start with a four-byte big-endian length followed by
 * UTF-8 encoded text. One frame carries exactly one message.
 */
public final class LengthPrefixedCodec {

    public static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;

    private LengthPrefixedCodec() {
    }

    public static void writeFrame(OutputStream out, String message) throws IOException {
        byte[] payload = message.getBytes(StandardCharsets.UTF_8);
        byte[] header = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(header);
        out.write(payload);
        out.flush();
    }

    public static String readFrame(InputStream in) throws IOException {
        return readFrame(in, DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Read one frame, rejecting it before allocating the payload when the announced length is
     * negative or larger than {@code maxFrameSize}. Callers treat that {@link IOException} as fatal
     * for the connection since the stream can no longer be resynchronised.
     * @return the decoded frame, or {@code null} on a clean end of stream before a header
     * @throws EOFException if the stream ends inside a header or payload
     */
    public static String readFrame(InputStream in, int maxFrameSize) throws IOException {
        byte[] header = readFully(in, 4);
        if (header == null) {
            return null;
        }
        int length = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (length < 0) {
            throw new IOException("Invalid frame length: " + length);
        }
        if (length > maxFrameSize) {
            throw new IOException("Frame of " + length + " bytes exceeds limit of " + maxFrameSize);
        }
        byte[] payload = readFully(in, length);
        if (payload == null) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                if (offset == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream after reading " + offset + " bytes");
            }
            offset += read;
        }
        return buffer;
    }
}
