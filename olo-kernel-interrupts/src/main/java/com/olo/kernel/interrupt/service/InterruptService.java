package com.olo.kernel.interrupt.service;

import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.FlowInterrupt;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.interrupt.InterruptResponse;
import com.olo.kernel.interrupt.InterruptStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Interrupt table with request and session indexes. Not thread-safe; the kernel serializes calls.
 */
public final class InterruptService {

    private static final Logger log = LoggerFactory.getLogger(InterruptService.class);

    private final Clock clock;
    private final Map<InterruptKind, Duration> ttlOverrides;
    private final Map<String, FlowInterrupt> interrupts = new LinkedHashMap<>();
    private final Map<String, Set<String>> byRequest = new HashMap<>();
    private final Map<String, Set<String>> bySession = new HashMap<>();

    /**
     * @param ttlOverrides per-kind TTL replacing the kind's default; a zero or negative duration means no expiry
     */
    public InterruptService(Clock clock, Map<InterruptKind, Duration> ttlOverrides) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttlOverrides = ttlOverrides == null || ttlOverrides.isEmpty()
                ? new EnumMap<>(InterruptKind.class)
                : new EnumMap<>(ttlOverrides);
    }

    public InterruptService() {
        this(Clock.systemUTC(), Map.of());
    }

    public static String newInterruptId() {
        return "int_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * Creates a pending interrupt with an expiry from the kind's TTL and indexes it.
     *
     * @throws KernelException VALIDATION when kind is missing
     */
    public FlowInterrupt create(InterruptKind kind, String requestId, String userId, String sessionId,
                                String envelopeId, String question, String message, Map<String, Object> data) {
        if (kind == null) {
            throw KernelException.validation("interrupt kind is required");
        }
        Instant now = clock.instant();
        Duration ttl = ttlFor(kind);
        FlowInterrupt interrupt = new FlowInterrupt(newInterruptId(), kind, requestId, userId, sessionId, envelopeId,
                question, message, data, now, ttl != null ? now.plus(ttl) : null);
        interrupts.put(interrupt.getId(), interrupt);
        index(byRequest, requestId, interrupt.getId());
        index(bySession, sessionId, interrupt.getId());
        log.info("Interrupt create | id={} kind={} requestId={} sessionId={} expiresAt={}",
                interrupt.getId(), kind.toValue(), requestId, sessionId, interrupt.getExpiresAt());
        return interrupt;
    }

    Duration ttlFor(InterruptKind kind) {
        Duration override = ttlOverrides.get(kind);
        if (override != null) {
            return override.isZero() || override.isNegative() ? null : override;
        }
        return kind.getDefaultTtl();
    }

    private static void index(Map<String, Set<String>> index, String key, String id) {
        if (key != null) {
            index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
        }
    }

    /**
     * Resolves a pending interrupt. Returns false when it is unknown, no longer pending, past its expiry
     * (it is marked expired) or owned by a different user. A null {@code userId} skips the owner check.
     */
    public boolean resolve(String interruptId, InterruptResponse response, String userId) {
        FlowInterrupt interrupt = interrupts.get(interruptId);
        if (interrupt == null || !interrupt.isPending()) {
            log.debug("Interrupt resolve | id={} rejected=not pending", interruptId);
            return false;
        }
        Instant now = clock.instant();
        if (interrupt.isExpiredAt(now)) {
            interrupt.expire(now);
            log.info("Interrupt resolve | id={} rejected=expired", interruptId);
            return false;
        }
        if (userId != null && interrupt.getUserId() != null && !userId.equals(interrupt.getUserId())) {
            log.warn("Interrupt resolve | id={} rejected=user mismatch userId={}", interruptId, userId);
            return false;
        }
        boolean resolved = interrupt.resolve(response, now);
        log.info("Interrupt resolve | id={} kind={} resolved={}", interruptId, interrupt.getKind().toValue(), resolved);
        return resolved;
    }

    public boolean cancel(String interruptId, String reason) {
        FlowInterrupt interrupt = interrupts.get(interruptId);
        if (interrupt == null) {
            return false;
        }
        boolean cancelled = interrupt.cancel(reason, clock.instant());
        if (cancelled) {
            log.info("Interrupt cancel | id={} reason={}", interruptId, reason);
        }
        return cancelled;
    }

    public Optional<FlowInterrupt> get(String interruptId) {
        return Optional.ofNullable(interruptId != null ? interrupts.get(interruptId) : null);
    }

    /**
     * Pending, unexpired interrupts of the session in creation order.
     *
     * @param kinds null or empty for every kind
     */
    public List<FlowInterrupt> getPendingForSession(String sessionId, Collection<InterruptKind> kinds) {
        List<FlowInterrupt> pending = new ArrayList<>();
        Instant now = clock.instant();
        for (String id : bySession.getOrDefault(sessionId, Set.of())) {
            FlowInterrupt interrupt = interrupts.get(id);
            if (interrupt == null || !interrupt.isPending() || interrupt.isExpiredAt(now)) {
                continue;
            }
            if (kinds == null || kinds.isEmpty() || kinds.contains(interrupt.getKind())) {
                pending.add(interrupt);
            }
        }
        return pending;
    }

    /** Most recently created pending, unexpired interrupt of the request. */
    public Optional<FlowInterrupt> getPendingForRequest(String requestId) {
        FlowInterrupt latest = null;
        Instant now = clock.instant();
        for (String id : byRequest.getOrDefault(requestId, Set.of())) {
            FlowInterrupt interrupt = interrupts.get(id);
            if (interrupt != null && interrupt.isPending() && !interrupt.isExpiredAt(now)) {
                latest = interrupt;
            }
        }
        return Optional.ofNullable(latest);
    }

    /** Marks every pending interrupt past its expiry as expired. Returns how many changed. */
    public int expirePending() {
        Instant now = clock.instant();
        int expired = 0;
        for (FlowInterrupt interrupt : interrupts.values()) {
            if (interrupt.isPending() && interrupt.isExpiredAt(now) && interrupt.expire(now)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Interrupt expire | expired={}", expired);
        }
        return expired;
    }

    /**
     * Purges non-pending interrupts created before {@code now - retention}, with their index entries.
     * Pending interrupts are never purged by age. Returns how many were purged.
     */
    public int cleanupResolved(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        Iterator<FlowInterrupt> it = interrupts.values().iterator();
        while (it.hasNext()) {
            FlowInterrupt interrupt = it.next();
            if (!interrupt.isPending() && interrupt.getCreatedAt().isBefore(cutoff)) {
                it.remove();
                unindex(byRequest, interrupt.getRequestId(), interrupt.getId());
                unindex(bySession, interrupt.getSessionId(), interrupt.getId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Interrupt cleanup | removed={} remaining={}", removed, interrupts.size());
        }
        return removed;
    }

    private static void unindex(Map<String, Set<String>> index, String key, String id) {
        if (key == null) {
            return;
        }
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }

    public InterruptStats getStats() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (InterruptStatus status : InterruptStatus.values()) {
            byStatus.put(status.toValue(), 0);
        }
        Map<String, Integer> byKind = new LinkedHashMap<>();
        for (FlowInterrupt interrupt : interrupts.values()) {
            byStatus.merge(interrupt.getStatus().toValue(), 1, Integer::sum);
            byKind.merge(interrupt.getKind().toValue(), 1, Integer::sum);
        }
        return new InterruptStats(interrupts.size(), byStatus, byKind);
    }

    public int count() {
        return interrupts.size();
    }
}
