package com.olo.kernel.interrupt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/**
 * Reason a pipeline is paused for external input. Each kind carries a default time-to-live; {@link #CHECKPOINT}
 * never expires.
 */
public enum InterruptKind {
    /** Agent needs more information from the user. */
    CLARIFICATION("clarification", Duration.ofHours(24)),
    /** User must approve an action before it runs. */
    CONFIRMATION("confirmation", Duration.ofHours(1)),
    /** Human review of an agent's output. */
    AGENT_REVIEW("agent_review", Duration.ofMinutes(30)),
    CHECKPOINT("checkpoint", null),
    RESOURCE_EXHAUSTED("resource_exhausted", Duration.ofMinutes(5)),
    TIMEOUT("timeout", Duration.ofMinutes(5)),
    SYSTEM_ERROR("system_error", Duration.ofHours(1));

    private final String value;
    private final Duration defaultTtl;

    InterruptKind(String value, Duration defaultTtl) {
        this.value = value;
        this.defaultTtl = defaultTtl;
    }

    /** Default time-to-live, or null when interrupts of this kind never expire. */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Returns null for null, blank or unknown values. */
    @JsonCreator
    public static InterruptKind fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InterruptKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
