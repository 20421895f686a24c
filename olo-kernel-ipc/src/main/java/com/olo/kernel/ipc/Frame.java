package com.olo.kernel.ipc;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** One decoded frame: a type and its payload bytes. */
public final class Frame {

    private final MessageType type;
    private final byte[] payload;

    public Frame(MessageType type, byte[] payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload != null ? payload : new byte[0];
    }

    public MessageType getType() {
        return type;
    }

    public byte[] getPayload() {
        return payload;
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Frame{type=" + type + ", bytes=" + payload.length + '}';
    }
}
