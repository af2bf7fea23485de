package dev.plotrpc.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

final class LengthPrefixedCodecTest {

    @Test
    void framesAreReadBackOneMessageAtATime() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LengthPrefixedCodec.writeFrame(out, "{\"jsonrpc\":\"2.0\",\"method\":\"évt\"}");
        LengthPrefixedCodec.writeFrame(out, "");
        LengthPrefixedCodec.writeFrame(out, "second");

        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());
        assertEquals("{\"jsonrpc\":\"2.0\",\"method\":\"évt\"}", LengthPrefixedCodec.readFrame(in));
        assertEquals("", LengthPrefixedCodec.readFrame(in));
        assertEquals("second", LengthPrefixedCodec.readFrame(in));
        assertNull(LengthPrefixedCodec.readFrame(in), "clean end of stream");
    }

    @Test
    void headerCarriesUtf8ByteLength() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LengthPrefixedCodec.writeFrame(out, "é");

        byte[] bytes = out.toByteArray();
        assertEquals(2, ByteBuffer.wrap(bytes, 0, 4).getInt());
        assertEquals(6, bytes.length);
    }

    @Test
    void truncatedPayloadIsAnError() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LengthPrefixedCodec.writeFrame(out, "hello world");
        byte[] truncated = Arrays.copyOf(out.toByteArray(), 8);

        assertThrows(EOFException.class,
            () -> LengthPrefixedCodec.readFrame(new ByteArrayInputStream(truncated)));
    }

    @Test
    void oversizedAndNegativeFramesAreRejected() {
        byte[] big = ByteBuffer.allocate(4).putInt(1024).array();
        IOException tooLarge = assertThrows(IOException.class,
            () -> LengthPrefixedCodec.readFrame(new ByteArrayInputStream(big), 16));
        assertTrue(tooLarge.getMessage().contains("exceeds"));

        byte[] negative = ByteBuffer.allocate(4).putInt(-1).array();
        assertThrows(IOException.class,
            () -> LengthPrefixedCodec.readFrame(new ByteArrayInputStream(negative)));
    }
}
