package com.olo.kernel.process;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Scheduling priority. Lower {@link #getHeapValue() heap value} runs first.
 */
public enum SchedulingPriority {
    REALTIME(0),
    HIGH(1),
    NORMAL(2),
    LOW(3),
    IDLE(4);

    private final int heapValue;

    SchedulingPriority(int heapValue) {
        this.heapValue = heapValue;
    }

    public int getHeapValue() {
        return heapValue;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null, blank or unknown values fall back to {@link #NORMAL}. */
    @JsonCreator
    public static SchedulingPriority fromValue(String value) {
        if (value == null || value.isBlank()) return NORMAL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
