package com.olo.kernel.config;

import java.util.Objects;

/**
 * Configuration loaded from environment variables for the OLO kernel process.
 * <p>
 * Transport: OLO_KERNEL_HOST, OLO_KERNEL_PORT, OLO_KERNEL_MAX_FRAME_BYTES, OLO_KERNEL_MAX_CONNECTIONS,
 * OLO_KERNEL_READ_TIMEOUT_SECONDS.
 * <p>
 * Cleanup: OLO_KERNEL_CLEANUP_INTERVAL_SECONDS and the three retention windows (process, session, interrupt),
 * plus OLO_KERNEL_MAX_USER_USAGE_ENTRIES.
 * <p>
 * Default rate limits applied to every user: OLO_KERNEL_RATE_LIMIT_RPM, OLO_KERNEL_RATE_LIMIT_RPH,
 * OLO_KERNEL_RATE_LIMIT_BURST.
 */
public final class KernelConfig {

    private static final String ENV_HOST = "OLO_KERNEL_HOST";
    private static final String ENV_PORT = "OLO_KERNEL_PORT";
    private static final String ENV_MAX_FRAME_BYTES = "OLO_KERNEL_MAX_FRAME_BYTES";
    private static final String ENV_MAX_CONNECTIONS = "OLO_KERNEL_MAX_CONNECTIONS";
    private static final String ENV_READ_TIMEOUT_SECONDS = "OLO_KERNEL_READ_TIMEOUT_SECONDS";
    private static final String ENV_CLEANUP_INTERVAL_SECONDS = "OLO_KERNEL_CLEANUP_INTERVAL_SECONDS";
    private static final String ENV_PROCESS_RETENTION_SECONDS = "OLO_KERNEL_PROCESS_RETENTION_SECONDS";
    private static final String ENV_SESSION_RETENTION_SECONDS = "OLO_KERNEL_SESSION_RETENTION_SECONDS";
    private static final String ENV_INTERRUPT_RETENTION_SECONDS = "OLO_KERNEL_INTERRUPT_RETENTION_SECONDS";
    private static final String ENV_MAX_USER_USAGE_ENTRIES = "OLO_KERNEL_MAX_USER_USAGE_ENTRIES";
    private static final String ENV_RATE_LIMIT_RPM = "OLO_KERNEL_RATE_LIMIT_RPM";
    private static final String ENV_RATE_LIMIT_RPH = "OLO_KERNEL_RATE_LIMIT_RPH";
    private static final String ENV_RATE_LIMIT_BURST = "OLO_KERNEL_RATE_LIMIT_BURST";

    static final String DEFAULT_HOST = "127.0.0.1";
    static final int DEFAULT_PORT = 50051;
    /** 50 MiB; frames declaring more are rejected before the body is read. */
    static final int DEFAULT_MAX_FRAME_BYTES = 50 * 1024 * 1024;
    static final int DEFAULT_MAX_CONNECTIONS = 1000;
    static final int DEFAULT_READ_TIMEOUT_SECONDS = 30;
    static final long DEFAULT_CLEANUP_INTERVAL_SECONDS = 300;
    static final long DEFAULT_PROCESS_RETENTION_SECONDS = 86_400;
    static final long DEFAULT_SESSION_RETENTION_SECONDS = 3_600;
    static final long DEFAULT_INTERRUPT_RETENTION_SECONDS = 86_400;
    static final int DEFAULT_MAX_USER_USAGE_ENTRIES = 10_000;
    static final int DEFAULT_RATE_LIMIT_RPM = 60;
    static final int DEFAULT_RATE_LIMIT_RPH = 1000;
    static final int DEFAULT_RATE_LIMIT_BURST = 10;

    private final String host;
    private final int port;
    private final IpcLimits ipcLimits;
    private final long cleanupIntervalSeconds;
    private final long processRetentionSeconds;
    private final long sessionRetentionSeconds;
    private final long interruptRetentionSeconds;
    private final int maxUserUsageEntries;
    private final int rateLimitRpm;
    private final int rateLimitRph;
    private final int rateLimitBurst;

    private KernelConfig(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.ipcLimits = new IpcLimits(b.maxFrameBytes, b.maxConnections, b.readTimeoutSeconds);
        this.cleanupIntervalSeconds = b.cleanupIntervalSeconds;
        this.processRetentionSeconds = b.processRetentionSeconds;
        this.sessionRetentionSeconds = b.sessionRetentionSeconds;
        this.interruptRetentionSeconds = b.interruptRetentionSeconds;
        this.maxUserUsageEntries = b.maxUserUsageEntries;
        this.rateLimitRpm = b.rateLimitRpm;
        this.rateLimitRph = b.rateLimitRph;
        this.rateLimitBurst = b.rateLimitBurst;
    }

    /** Address the IPC server binds to. Default {@value #DEFAULT_HOST}. */
    public String getHost() {
        return host;
    }

    /** TCP port of the IPC server. Default {@value #DEFAULT_PORT}; 0 picks an ephemeral port. */
    public int getPort() {
        return port;
    }

    public IpcLimits getIpcLimits() {
        return ipcLimits;
    }

    /** Seconds between background cleanup cycles. Default 300. */
    public long getCleanupIntervalSeconds() {
        return cleanupIntervalSeconds;
    }

    /** How long terminated/zombie processes are kept for inspection. Default one day. */
    public long getProcessRetentionSeconds() {
        return processRetentionSeconds;
    }

    /** Orchestration sessions idle longer than this are dropped with their envelopes. Default one hour. */
    public long getSessionRetentionSeconds() {
        return sessionRetentionSeconds;
    }

    /** Resolved and cancelled interrupts older than this are purged. Default one day. */
    public long getInterruptRetentionSeconds() {
        return interruptRetentionSeconds;
    }

    /** Cap on per-user usage aggregates kept in memory. Default 10000. */
    public int getMaxUserUsageEntries() {
        return maxUserUsageEntries;
    }

    public int getRateLimitRpm() {
        return rateLimitRpm;
    }

    public int getRateLimitRph() {
        return rateLimitRph;
    }

    public int getRateLimitBurst() {
        return rateLimitBurst;
    }

    public static KernelConfig fromEnvironment() {
        return builder()
                .host(getEnv(ENV_HOST, DEFAULT_HOST))
                .port(parseInt(System.getenv(ENV_PORT), DEFAULT_PORT))
                .maxFrameBytes(parseInt(System.getenv(ENV_MAX_FRAME_BYTES), DEFAULT_MAX_FRAME_BYTES))
                .maxConnections(parseInt(System.getenv(ENV_MAX_CONNECTIONS), DEFAULT_MAX_CONNECTIONS))
                .readTimeoutSeconds(parseInt(System.getenv(ENV_READ_TIMEOUT_SECONDS), DEFAULT_READ_TIMEOUT_SECONDS))
                .cleanupIntervalSeconds(parseLong(System.getenv(ENV_CLEANUP_INTERVAL_SECONDS), DEFAULT_CLEANUP_INTERVAL_SECONDS))
                .processRetentionSeconds(parseLong(System.getenv(ENV_PROCESS_RETENTION_SECONDS), DEFAULT_PROCESS_RETENTION_SECONDS))
                .sessionRetentionSeconds(parseLong(System.getenv(ENV_SESSION_RETENTION_SECONDS), DEFAULT_SESSION_RETENTION_SECONDS))
                .interruptRetentionSeconds(parseLong(System.getenv(ENV_INTERRUPT_RETENTION_SECONDS), DEFAULT_INTERRUPT_RETENTION_SECONDS))
                .maxUserUsageEntries(parseInt(System.getenv(ENV_MAX_USER_USAGE_ENTRIES), DEFAULT_MAX_USER_USAGE_ENTRIES))
                .rateLimitRpm(parseInt(System.getenv(ENV_RATE_LIMIT_RPM), DEFAULT_RATE_LIMIT_RPM))
                .rateLimitRph(parseInt(System.getenv(ENV_RATE_LIMIT_RPH), DEFAULT_RATE_LIMIT_RPH))
                .rateLimitBurst(parseInt(System.getenv(ENV_RATE_LIMIT_BURST), DEFAULT_RATE_LIMIT_BURST))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int readTimeoutSeconds = DEFAULT_READ_TIMEOUT_SECONDS;
        private long cleanupIntervalSeconds = DEFAULT_CLEANUP_INTERVAL_SECONDS;
        private long processRetentionSeconds = DEFAULT_PROCESS_RETENTION_SECONDS;
        private long sessionRetentionSeconds = DEFAULT_SESSION_RETENTION_SECONDS;
        private long interruptRetentionSeconds = DEFAULT_INTERRUPT_RETENTION_SECONDS;
        private int maxUserUsageEntries = DEFAULT_MAX_USER_USAGE_ENTRIES;
        private int rateLimitRpm = DEFAULT_RATE_LIMIT_RPM;
        private int rateLimitRph = DEFAULT_RATE_LIMIT_RPH;
        private int rateLimitBurst = DEFAULT_RATE_LIMIT_BURST;

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder readTimeoutSeconds(int readTimeoutSeconds) {
            this.readTimeoutSeconds = readTimeoutSeconds;
            return this;
        }

        public Builder cleanupIntervalSeconds(long cleanupIntervalSeconds) {
            this.cleanupIntervalSeconds = cleanupIntervalSeconds;
            return this;
        }

        public Builder processRetentionSeconds(long processRetentionSeconds) {
            this.processRetentionSeconds = processRetentionSeconds;
            return this;
        }

        public Builder sessionRetentionSeconds(long sessionRetentionSeconds) {
            this.sessionRetentionSeconds = sessionRetentionSeconds;
            return this;
        }

        public Builder interruptRetentionSeconds(long interruptRetentionSeconds) {
            this.interruptRetentionSeconds = interruptRetentionSeconds;
            return this;
        }

        public Builder maxUserUsageEntries(int maxUserUsageEntries) {
            this.maxUserUsageEntries = maxUserUsageEntries;
            return this;
        }

        public Builder rateLimitRpm(int rateLimitRpm) {
            this.rateLimitRpm = rateLimitRpm;
            return this;
        }

        public Builder rateLimitRph(int rateLimitRph) {
            this.rateLimitRph = rateLimitRph;
            return this;
        }

        public Builder rateLimitBurst(int rateLimitBurst) {
            this.rateLimitBurst = rateLimitBurst;
            return this;
        }

        public KernelConfig build() {
            if (cleanupIntervalSeconds <= 0) {
                throw new IllegalArgumentException("cleanupIntervalSeconds must be positive, got: " + cleanupIntervalSeconds);
            }
            return new KernelConfig(this);
        }
    }
}
