package com.olo.kernel.cleanup;

import java.time.Instant;

/** What one cleanup cycle reclaimed. A phase that failed counts 0. */
public final class CleanupStats {

    private final int zombiesRemoved;
    private final int sessionsRemoved;
    private final int envelopesEvicted;
    private final int interruptsRemoved;
    private final int rateWindowsCleaned;
    private final int userUsageEvicted;
    private final Instant completedAt;

    CleanupStats(int zombiesRemoved, int sessionsRemoved, int envelopesEvicted, int interruptsRemoved,
                 int rateWindowsCleaned, int userUsageEvicted, Instant completedAt) {
        this.zombiesRemoved = zombiesRemoved;
        this.sessionsRemoved = sessionsRemoved;
        this.envelopesEvicted = envelopesEvicted;
        this.interruptsRemoved = interruptsRemoved;
        this.rateWindowsCleaned = rateWindowsCleaned;
        this.userUsageEvicted = userUsageEvicted;
        this.completedAt = completedAt;
    }

    public int getZombiesRemoved() {
        return zombiesRemoved;
    }

    public int getSessionsRemoved() {
        return sessionsRemoved;
    }

    public int getEnvelopesEvicted() {
        return envelopesEvicted;
    }

    public int getInterruptsRemoved() {
        return interruptsRemoved;
    }

    public int getRateWindowsCleaned() {
        return rateWindowsCleaned;
    }

    public int getUserUsageEvicted() {
        return userUsageEvicted;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public int total() {
        return zombiesRemoved + sessionsRemoved + envelopesEvicted + interruptsRemoved
                + rateWindowsCleaned + userUsageEvicted;
    }

    @Override
    public String toString() {
        return "CleanupStats{zombies=" + zombiesRemoved + ", sessions=" + sessionsRemoved
                + ", envelopes=" + envelopesEvicted + ", interrupts=" + interruptsRemoved
                + ", rateWindows=" + rateWindowsCleaned + ", userUsage=" + userUsageEvicted
                + ", completedAt=" + completedAt + '}';
    }
}
