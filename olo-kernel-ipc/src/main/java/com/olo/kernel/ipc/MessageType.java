package com.olo.kernel.ipc;

/** Frame type byte. */
public enum MessageType {
    REQUEST(0x01),
    RESPONSE(0x02),
    STREAM_CHUNK(0x03),
    STREAM_END(0x04),
    ERROR(0xFF);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @throws FrameException for an unknown type byte
     */
    public static MessageType fromCode(int code) throws FrameException {
        for (MessageType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new FrameException(String.format("unknown frame type: 0x%02X", code));
    }
}
