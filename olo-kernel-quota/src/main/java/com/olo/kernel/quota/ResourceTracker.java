package com.olo.kernel.quota;

import com.olo.kernel.error.KernelException;
import com.olo.kernel.process.ProcessControlBlock;
import com.olo.kernel.process.ResourceQuota;
import com.olo.kernel.process.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Quota checks for processes and per-user usage aggregates. Not thread-safe; the kernel serializes calls.
 */
public final class ResourceTracker {

    private static final Logger log = LoggerFactory.getLogger(ResourceTracker.class);

    private final Clock clock;
    private final Map<String, UserUsage> userUsage = new HashMap<>();

    public ResourceTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ResourceTracker() {
        this(Clock.systemUTC());
    }

    /**
     * Refreshes live elapsed time, then returns the first violated dimension, if any.
     */
    public Optional<String> checkQuota(ProcessControlBlock pcb) {
        pcb.refreshElapsed(clock.instant());
        Optional<String> violation = pcb.getUsage().exceedsQuota(pcb.getQuota());
        violation.ifPresent(v -> log.info("Quota check | pid={} exceeded={}", pcb.getPid(), v));
        return violation;
    }

    /**
     * Adds usage to the user's aggregate.
     *
     * @throws KernelException VALIDATION when any delta is negative
     */
    public void recordUsage(String userId, int llmCalls, int toolCalls, long tokensIn, long tokensOut) {
        requireNonNegative(llmCalls, toolCalls, tokensIn, tokensOut);
        UserUsage entry = userUsage.computeIfAbsent(userId, k -> new UserUsage());
        entry.usage.add(llmCalls, toolCalls, tokensIn, tokensOut);
        entry.lastTouched = clock.instant();
    }

    /** Rejects negative usage deltas before anything is recorded. */
    public static void requireNonNegative(int llmCalls, int toolCalls, long tokensIn, long tokensOut) {
        if (llmCalls < 0 || toolCalls < 0 || tokensIn < 0 || tokensOut < 0) {
            throw KernelException.validation(
                    "usage deltas must be non-negative: llm_calls=%d tool_calls=%d tokens_in=%d tokens_out=%d",
                    llmCalls, toolCalls, tokensIn, tokensOut);
        }
    }

    /** Snapshot of the user's aggregate, or empty when nothing was recorded. */
    public Optional<ResourceUsage> getUserUsage(String userId) {
        UserUsage entry = userUsage.get(userId);
        return entry == null ? Optional.empty() : Optional.of(entry.usage.copy());
    }

    public int trackedUserCount() {
        return userUsage.size();
    }

    /**
     * Drops aggregates of users with no live process, then the least recently touched ones until at most
     * {@code maxEntries} remain. Returns how many were dropped.
     */
    public int cleanupStaleUsers(Collection<String> activeUserIds, int maxEntries) {
        if (userUsage.size() <= maxEntries) {
            return 0;
        }
        Set<String> active = new HashSet<>(activeUserIds);
        int before = userUsage.size();
        userUsage.keySet().removeIf(userId -> !active.contains(userId) && userUsage.size() > maxEntries);
        if (userUsage.size() > maxEntries) {
            List<Map.Entry<String, UserUsage>> byAge = new ArrayList<>(userUsage.entrySet());
            byAge.sort(Comparator.comparing(e -> e.getValue().lastTouched));
            for (int i = 0; userUsage.size() > maxEntries && i < byAge.size(); i++) {
                userUsage.remove(byAge.get(i).getKey());
            }
        }
        int removed = before - userUsage.size();
        log.info("User usage cleanup | removed={} remaining={} max={}", removed, userUsage.size(), maxEntries);
        return removed;
    }

    /** Headroom per dimension; unlimited dimensions report {@link RemainingBudget#UNLIMITED}. */
    public RemainingBudget getRemainingBudget(ProcessControlBlock pcb) {
        pcb.refreshElapsed(clock.instant());
        ResourceQuota quota = pcb.getQuota();
        ResourceUsage usage = pcb.getUsage();
        double seconds = quota.getTimeoutSeconds() > 0
                ? Math.max(0.0, quota.getTimeoutSeconds() - usage.getElapsedSeconds())
                : RemainingBudget.UNLIMITED;
        return new RemainingBudget(
                remaining(quota.getMaxLlmCalls(), usage.getLlmCalls()),
                remaining(quota.getMaxToolCalls(), usage.getToolCalls()),
                remaining(quota.getMaxAgentHops(), usage.getAgentHops()),
                remaining(quota.getMaxIterations(), usage.getIterations()),
                remaining(quota.getMaxInputTokens(), usage.getTokensIn()),
                remaining(quota.getMaxOutputTokens(), usage.getTokensOut()),
                seconds);
    }

    private static long remaining(int limit, long used) {
        return limit > 0 ? Math.max(0, limit - used) : RemainingBudget.UNLIMITED;
    }

    private static final class UserUsage {
        private final ResourceUsage usage = new ResourceUsage();
        private Instant lastTouched = Instant.EPOCH;
    }
}
