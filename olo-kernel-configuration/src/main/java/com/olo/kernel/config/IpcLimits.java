package com.olo.kernel.config;

import java.util.Objects;

/**
 * Hard caps for the IPC transport. All values must be positive.
 */
public final class IpcLimits {

    /** Default: 50 MiB frames, 1000 concurrent connections, 30 s read timeout. */
    public static final IpcLimits DEFAULT = new IpcLimits(
            KernelConfig.DEFAULT_MAX_FRAME_BYTES,
            KernelConfig.DEFAULT_MAX_CONNECTIONS,
            KernelConfig.DEFAULT_READ_TIMEOUT_SECONDS);

    private final int maxFrameBytes;
    private final int maxConnections;
    private final int readTimeoutSeconds;

    public IpcLimits(int maxFrameBytes, int maxConnections, int readTimeoutSeconds) {
        this.maxFrameBytes = requirePositive(maxFrameBytes, "maxFrameBytes");
        this.maxConnections = requirePositive(maxConnections, "maxConnections");
        this.readTimeoutSeconds = requirePositive(readTimeoutSeconds, "readTimeoutSeconds");
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Max value of the 4-byte length prefix (type byte plus payload). */
    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    /** Connections beyond this count are refused with an UNAVAILABLE error frame. */
    public int getMaxConnections() {
        return maxConnections;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IpcLimits that = (IpcLimits) o;
        return maxFrameBytes == that.maxFrameBytes
                && maxConnections == that.maxConnections
                && readTimeoutSeconds == that.readTimeoutSeconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxFrameBytes, maxConnections, readTimeoutSeconds);
    }

    @Override
    public String toString() {
        return "IpcLimits{maxFrameBytes=" + maxFrameBytes + ", maxConnections=" + maxConnections
                + ", readTimeoutSeconds=" + readTimeoutSeconds + "}";
    }
}
