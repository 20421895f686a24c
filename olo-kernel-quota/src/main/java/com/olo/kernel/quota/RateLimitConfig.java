package com.olo.kernel.quota;

import com.olo.kernel.process.ResourceQuota;

import java.util.Objects;

/**
 * Sliding-window limits for one user. A limit of zero or below disables that window.
 */
public final class RateLimitConfig {

    public static final int DEFAULT_REQUESTS_PER_MINUTE = 60;
    public static final int DEFAULT_REQUESTS_PER_HOUR = 1000;
    public static final int DEFAULT_BURST_SIZE = 10;

    public static final RateLimitConfig DEFAULT =
            new RateLimitConfig(DEFAULT_REQUESTS_PER_MINUTE, DEFAULT_REQUESTS_PER_HOUR, DEFAULT_BURST_SIZE);

    private final int requestsPerMinute;
    private final int requestsPerHour;
    private final int burstSize;

    public RateLimitConfig(int requestsPerMinute, int requestsPerHour, int burstSize) {
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerHour = requestsPerHour;
        this.burstSize = burstSize;
    }

    /** Limits taken from the rate fields of a quota. */
    public static RateLimitConfig fromQuota(ResourceQuota quota) {
        return new RateLimitConfig(quota.getRateLimitRpm(), quota.getRateLimitRph(), quota.getRateLimitBurst());
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public int getRequestsPerHour() {
        return requestsPerHour;
    }

    public int getBurstSize() {
        return burstSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RateLimitConfig that = (RateLimitConfig) o;
        return requestsPerMinute == that.requestsPerMinute
                && requestsPerHour == that.requestsPerHour
                && burstSize == that.burstSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestsPerMinute, requestsPerHour, burstSize);
    }

    @Override
    public String toString() {
        return "RateLimitConfig{rpm=" + requestsPerMinute + ", rph=" + requestsPerHour + ", burst=" + burstSize + "}";
    }
}
