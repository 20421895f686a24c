package com.olo.kernel.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a stage with several dependencies decides it is ready (DAG execution only).
 */
public enum JoinStrategy {
    /** Every required stage has completed (default). */
    ALL,
    /** At least one required stage has completed. */
    ANY;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JoinStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return ALL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ALL;
        }
    }
}
