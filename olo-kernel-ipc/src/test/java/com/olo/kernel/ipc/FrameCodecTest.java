package com.olo.kernel.ipc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameCodecTest {

    private final FrameCodec codec = new FrameCodec(1 << 20);

    private static byte[] header(int length, int type) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(length);
        out.writeByte(type);
        return bytes.toByteArray();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 64, 65536})
    void roundTripPreservesPayload(int size) throws IOException {
        byte[] payload = new byte[size];
        for (int i = 0; i < size; i++) {
            payload[i] = (byte) (i * 31);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        codec.writeFrame(out, MessageType.RESPONSE, payload);
        byte[] wire = out.toByteArray();
        Frame frame = codec.readFrame(new ByteArrayInputStream(wire));

        assertEquals(size + 5, wire.length);
        assertEquals(size + 1, ByteBuffer.wrap(wire, 0, 4).getInt());
        assertEquals(0x02, wire[4]);
        assertEquals(MessageType.RESPONSE, frame.getType());
        assertArrayEquals(payload, frame.getPayload());
    }

    @Test
    void readsConsecutiveFramesThenCleanEnd() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.writeFrame(out, MessageType.REQUEST, "{\"id\":\"1\"}".getBytes());
        codec.writeFrame(out, MessageType.ERROR, new byte[0]);
        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());

        assertEquals("{\"id\":\"1\"}", codec.readFrame(in).payloadAsString());
        assertEquals(MessageType.ERROR, codec.readFrame(in).getType());
        assertNull(codec.readFrame(in));
    }

    @Test
    void rejectsZeroLength() throws IOException {
        FrameException e = assertThrows(FrameException.class,
                () -> codec.readFrame(new ByteArrayInputStream(new byte[]{0, 0, 0, 0})));

        assertEquals("frame too short: 0", e.getMessage());
    }

    @Test
    void rejectsOverMaxBeforeReadingBody() throws IOException {
        FrameCodec small = new FrameCodec(16);
        byte[] body = new byte[16];
        byte[] wire = header(17, 0x01);
        byte[] all = Arrays.copyOf(wire, wire.length + body.length);
        ByteArrayInputStream in = new ByteArrayInputStream(all);

        FrameException e = assertThrows(FrameException.class, () -> small.readFrame(in));

        assertTrue(e.getMessage().contains("exceeds max 16"));
        assertEquals(17, in.available());
    }

    @Test
    void highBitLengthIsOverMaxNotTooShort() throws IOException {
        byte[] wire = {(byte) 0x80, 0, 0, 0, 0x01};

        FrameException e = assertThrows(FrameException.class, () -> codec.readFrame(new ByteArrayInputStream(wire)));

        assertTrue(e.getMessage().startsWith("frame length 2147483648 exceeds max"), e.getMessage());
    }

    @Test
    void rejectsUnknownType() throws IOException {
        FrameException e = assertThrows(FrameException.class,
                () -> codec.readFrame(new ByteArrayInputStream(header(1, 0x09))));

        assertEquals("unknown frame type: 0x09", e.getMessage());
    }

    @Test
    void truncatedBodyIsEof() throws IOException {
        byte[] wire = Arrays.copyOf(header(10, 0x01), 5 + 3);

        assertThrows(EOFException.class, () -> codec.readFrame(new ByteArrayInputStream(wire)));
    }

    @Test
    void truncatedHeaderIsEof() {
        assertThrows(EOFException.class, () -> codec.readFrame(new ByteArrayInputStream(new byte[]{0, 0})));
    }

    @Test
    void writeRejectsPayloadOverMax() {
        FrameCodec small = new FrameCodec(8);

        assertThrows(FrameException.class,
                () -> small.writeFrame(new ByteArrayOutputStream(), MessageType.RESPONSE, new byte[8]));
    }
}
