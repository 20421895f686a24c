package com.olo.kernel.ipc;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Length-prefixed framing: a 4-byte big-endian length covering the type byte and payload, then the type byte,
 * then the payload. Lengths are checked against {@code maxFrameBytes} before any body byte is read.
 */
public final class FrameCodec {

    private final int maxFrameBytes;

    public FrameCodec(int maxFrameBytes) {
        if (maxFrameBytes < 1) {
            throw new IllegalArgumentException("maxFrameBytes must be positive: " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Reads one frame.
     *
     * @return null when the stream ends cleanly before a new frame starts
     * @throws FrameException on a declared length below 1 or above the max, or an unknown type byte
     * @throws EOFException   when the stream ends inside a frame
     */
    public Frame readFrame(InputStream in) throws IOException {
        int first = in.read();
        if (first < 0) {
            return null;
        }
        DataInputStream data = new DataInputStream(in);
        long length = Integer.toUnsignedLong((first << 24) | (data.readUnsignedByte() << 16)
                | (data.readUnsignedByte() << 8) | data.readUnsignedByte());
        if (length < 1) {
            throw new FrameException("frame too short: " + length);
        }
        if (length > maxFrameBytes) {
            throw new FrameException(String.format("frame length %d exceeds max %d", length, maxFrameBytes));
        }
        MessageType type = MessageType.fromCode(data.readUnsignedByte());
        byte[] payload = new byte[(int) length - 1];
        data.readFully(payload);
        return new Frame(type, payload);
    }

    /**
     * Writes and flushes one frame.
     *
     * @throws FrameException when the payload plus type byte exceeds the max
     */
    public void writeFrame(OutputStream out, MessageType type, byte[] payload) throws IOException {
        byte[] body = payload != null ? payload : new byte[0];
        if (body.length > maxFrameBytes - 1) {
            throw new FrameException(String.format("payload of %d bytes exceeds max frame %d", body.length,
                    maxFrameBytes));
        }
        DataOutputStream data = new DataOutputStream(out);
        data.writeInt(body.length + 1);
        data.writeByte(type.getCode());
        data.write(body);
        data.flush();
    }

    public void writeFrame(OutputStream out, Frame frame) throws IOException {
        writeFrame(out, frame.getType(), frame.getPayload());
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }
}
