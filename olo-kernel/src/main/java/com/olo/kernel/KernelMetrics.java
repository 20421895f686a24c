package com.olo.kernel;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Kernel counters on a Micrometer registry. Defaults to an in-process {@link SimpleMeterRegistry}.
 */
public final class KernelMetrics {

    public static final String PROCESSES_CREATED = "olo.kernel.processes.created";
    public static final String QUOTA_VIOLATIONS = "olo.kernel.quota.violations";
    public static final String RATE_LIMIT_REJECTIONS = "olo.kernel.ratelimit.rejections";
    public static final String PANICS = "olo.kernel.panics";
    public static final String CLEANUP_REMOVED = "olo.kernel.cleanup.removed";

    private final MeterRegistry registry;

    public KernelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public KernelMetrics() {
        this(new SimpleMeterRegistry());
    }

    void processCreated() {
        registry.counter(PROCESSES_CREATED).increment();
    }

    void quotaViolation(String dimension) {
        registry.counter(QUOTA_VIOLATIONS, "dimension", dimension).increment();
    }

    void rateLimitRejected() {
        registry.counter(RATE_LIMIT_REJECTIONS).increment();
    }

    void panic(String operation) {
        registry.counter(PANICS, "operation", operation).increment();
    }

    /** Adds {@code removed} items reclaimed by a cleanup phase. */
    public void cleanupRemoved(String phase, int removed) {
        if (removed > 0) {
            registry.counter(CLEANUP_REMOVED, "phase", phase).increment(removed);
        }
    }

    /** Sum of a counter across all tag values; 0 when never incremented. */
    public double total(String name) {
        double sum = 0;
        for (Counter counter : registry.find(name).counters()) {
            sum += counter.count();
        }
        return sum;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
