package com.olo.kernel.cleanup;

import com.olo.kernel.config.KernelConfig;

import java.time.Duration;

/**
 * Interval and retention windows for {@link CleanupService}.
 */
public final class CleanupConfig {

    public static final CleanupConfig DEFAULT = new CleanupConfig(
            Duration.ofSeconds(300), Duration.ofSeconds(86_400), Duration.ofSeconds(3_600),
            Duration.ofSeconds(86_400), 10_000);

    private final Duration interval;
    private final Duration processRetention;
    private final Duration sessionRetention;
    private final Duration interruptRetention;
    private final int maxUserUsageEntries;

    public CleanupConfig(Duration interval, Duration processRetention, Duration sessionRetention,
                         Duration interruptRetention, int maxUserUsageEntries) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("cleanup interval must be positive");
        }
        this.interval = interval;
        this.processRetention = processRetention != null ? processRetention : DEFAULT.processRetention;
        this.sessionRetention = sessionRetention != null ? sessionRetention : DEFAULT.sessionRetention;
        this.interruptRetention = interruptRetention != null ? interruptRetention : DEFAULT.interruptRetention;
        this.maxUserUsageEntries = maxUserUsageEntries;
    }

    public static CleanupConfig from(KernelConfig config) {
        return new CleanupConfig(
                Duration.ofSeconds(config.getCleanupIntervalSeconds()),
                Duration.ofSeconds(config.getProcessRetentionSeconds()),
                Duration.ofSeconds(config.getSessionRetentionSeconds()),
                Duration.ofSeconds(config.getInterruptRetentionSeconds()),
                config.getMaxUserUsageEntries());
    }

    public Duration getInterval() {
        return interval;
    }

    /** How long a Terminated process and an orphan envelope are kept. */
    public Duration getProcessRetention() {
        return processRetention;
    }

    public Duration getSessionRetention() {
        return sessionRetention;
    }

    public Duration getInterruptRetention() {
        return interruptRetention;
    }

    public int getMaxUserUsageEntries() {
        return maxUserUsageEntries;
    }

    @Override
    public String toString() {
        return "CleanupConfig{interval=" + interval + ", processRetention=" + processRetention
                + ", sessionRetention=" + sessionRetention + ", interruptRetention=" + interruptRetention
                + ", maxUserUsageEntries=" + maxUserUsageEntries + '}';
    }
}
