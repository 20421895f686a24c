package com.olo.kernel.cleanup;

import com.olo.kernel.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Periodically reclaims kernel state: terminated processes, orphan envelopes, idle sessions, settled interrupts,
 * idle rate windows and surplus usage aggregates. Each phase takes the kernel lock on its own, so requests are
 * served between phases.
 */
public final class CleanupService {

    private static final Logger log = LoggerFactory.getLogger(CleanupService.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final Kernel kernel;
    private final CleanupConfig config;
    private ScheduledExecutorService scheduler;
    private volatile CleanupStats lastStats;

    public CleanupService(Kernel kernel, CleanupConfig config) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.config = config != null ? config : CleanupConfig.DEFAULT;
    }

    /** Starts the periodic cycle on a daemon thread; the first cycle runs after one interval. */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "olo-kernel-cleanup");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runScheduled, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Cleanup started | interval={} processRetention={} sessionRetention={} interruptRetention={}",
                config.getInterval(), config.getProcessRetention(), config.getSessionRetention(),
                config.getInterruptRetention());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Cleanup stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void runScheduled() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Cleanup cycle failed | error={}", e.getMessage(), e);
        }
    }

    /** Runs every phase once. A failing phase is logged and counted as 0. */
    public CleanupStats runCycle() {
        int zombies = phase("zombies", () -> kernel.cleanupZombies(config.getProcessRetention()));
        int envelopes = phase("envelopes", () -> kernel.cleanupOrphanEnvelopes(config.getProcessRetention()));
        int sessions = phase("sessions", () -> kernel.cleanupStaleSessions(config.getSessionRetention()));
        int interrupts = phase("interrupts", () -> kernel.cleanupResolvedInterrupts(config.getInterruptRetention()));
        int rateWindows = phase("rate_windows", kernel::cleanupRateLimits);
        int userUsage = phase("user_usage", () -> kernel.cleanupUserUsage(config.getMaxUserUsageEntries()));
        CleanupStats stats = new CleanupStats(zombies, sessions, envelopes, interrupts, rateWindows, userUsage,
                kernel.getClock().instant());
        lastStats = stats;
        if (stats.total() > 0) {
            log.info("Cleanup cycle | {}", stats);
        } else {
            log.debug("Cleanup cycle | nothing to reclaim");
        }
        return stats;
    }

    private static int phase(String name, IntSupplier body) {
        try {
            return body.getAsInt();
        } catch (RuntimeException e) {
            log.warn("Cleanup phase failed | phase={} error={}", name, e.getMessage());
            return 0;
        }
    }

    /** Stats of the most recent cycle; null before the first one. */
    public CleanupStats getLastStats() {
        return lastStats;
    }

    public CleanupConfig getConfig() {
        return config;
    }
}
