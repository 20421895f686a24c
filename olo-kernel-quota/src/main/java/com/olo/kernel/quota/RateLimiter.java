package com.olo.kernel.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Per-user sliding-window rate limiter with hour, minute and 10-second burst windows.
 * Not thread-safe; the kernel serializes calls.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final Duration HOUR = Duration.ofHours(1);
    static final Duration MINUTE = Duration.ofMinutes(1);
    static final Duration BURST_WINDOW = Duration.ofSeconds(10);

    private final Clock clock;
    private final Map<String, Deque<Instant>> windows = new HashMap<>();
    private final Map<String, RateLimitConfig> userConfigs = new HashMap<>();
    private RateLimitConfig defaultConfig;

    public RateLimiter(Clock clock, RateLimitConfig defaultConfig) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultConfig = defaultConfig != null ? defaultConfig : RateLimitConfig.DEFAULT;
    }

    public RateLimiter() {
        this(Clock.systemUTC(), RateLimitConfig.DEFAULT);
    }

    /**
     * Checks the user's windows and, when every check passes and {@code record} is set, counts this request.
     *
     * @throws QuotaExceededException when the hour, minute or burst limit has been reached
     */
    public void checkRateLimit(String userId, boolean record) {
        Instant now = clock.instant();
        RateLimitConfig config = configFor(userId);
        Deque<Instant> window = record ? windows.computeIfAbsent(userId, k -> new ArrayDeque<>()) : windows.get(userId);
        if (window == null) {
            window = new ArrayDeque<>();
        }
        evictBefore(window, now.minus(HOUR));

        int hourCount = window.size();
        if (config.getRequestsPerHour() > 0 && hourCount >= config.getRequestsPerHour()) {
            throw reject(userId, "requests_per_hour", hourCount, config.getRequestsPerHour(),
                    String.format("Rate limit exceeded: %d requests per hour", config.getRequestsPerHour()));
        }
        int minuteCount = countSince(window, now.minus(MINUTE));
        if (config.getRequestsPerMinute() > 0 && minuteCount >= config.getRequestsPerMinute()) {
            throw reject(userId, "requests_per_minute", minuteCount, config.getRequestsPerMinute(),
                    String.format("Rate limit exceeded: %d requests per minute", config.getRequestsPerMinute()));
        }
        int burstCount = countSince(window, now.minus(BURST_WINDOW));
        if (config.getBurstSize() > 0 && burstCount >= config.getBurstSize()) {
            throw reject(userId, "burst", burstCount, config.getBurstSize(),
                    String.format("Burst limit exceeded: %d requests per 10 seconds", config.getBurstSize()));
        }
        if (record) {
            window.addLast(now);
        }
    }

    private static QuotaExceededException reject(String userId, String dimension, long current, long limit,
                                                 String message) {
        log.warn("Rate limit | userId={} dimension={} current={} limit={}", userId, dimension, current, limit);
        return new QuotaExceededException(userId, dimension, current, limit, message);
    }

    /** Drops entries strictly older than the cutoff. */
    private static void evictBefore(Deque<Instant> window, Instant cutoff) {
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.pollFirst();
        }
    }

    /** Counts entries at or after the cutoff. */
    private static int countSince(Deque<Instant> window, Instant cutoff) {
        int n = 0;
        Iterator<Instant> it = window.descendingIterator();
        while (it.hasNext() && !it.next().isBefore(cutoff)) {
            n++;
        }
        return n;
    }

    /** Requests recorded for the user in the last minute. */
    public int getCurrentRate(String userId) {
        Deque<Instant> window = windows.get(userId);
        return window == null ? 0 : countSince(window, clock.instant().minus(MINUTE));
    }

    public void setUserConfig(String userId, RateLimitConfig config) {
        userConfigs.put(userId, Objects.requireNonNull(config, "config"));
    }

    public RateLimitConfig configFor(String userId) {
        return userConfigs.getOrDefault(userId, defaultConfig);
    }

    public RateLimitConfig getDefaultConfig() {
        return defaultConfig;
    }

    /** Replaces the default limits and clears every recorded window. */
    public void setDefaultConfig(RateLimitConfig config) {
        this.defaultConfig = Objects.requireNonNull(config, "config");
        windows.clear();
    }

    public void clearUserLimits(String userId) {
        windows.remove(userId);
        userConfigs.remove(userId);
    }

    /** Drops windows with no request in the last hour. Returns how many were dropped. */
    public int cleanupExpired() {
        Instant cutoff = clock.instant().minus(HOUR);
        int removed = 0;
        Iterator<Map.Entry<String, Deque<Instant>>> it = windows.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Instant> window = it.next().getValue();
            evictBefore(window, cutoff);
            if (window.isEmpty()) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Rate limit cleanup | windowsRemoved={} remaining={}", removed, windows.size());
        }
        return removed;
    }

    public int trackedUserCount() {
        return windows.size();
    }
}
