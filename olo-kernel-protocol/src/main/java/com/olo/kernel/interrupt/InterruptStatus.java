package com.olo.kernel.interrupt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Interrupt lifecycle: pending, then exactly one of resolved, expired or cancelled. */
public enum InterruptStatus {
    PENDING,
    RESOLVED,
    EXPIRED,
    CANCELLED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterruptStatus fromValue(String value) {
        if (value == null || value.isBlank()) return PENDING;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
