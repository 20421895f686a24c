package com.olo.kernel.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Why an envelope stopped. Set at most once. */
public enum TerminalReason {
    COMPLETED,
    MAX_ITERATIONS_EXCEEDED,
    MAX_LLM_CALLS_EXCEEDED,
    MAX_AGENT_HOPS_EXCEEDED,
    USER_CANCELLED,
    TOOL_FAILED_FATALLY,
    LLM_FAILED_FATALLY,
    POLICY_VIOLATION;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns null for null, blank or unknown values. */
    @JsonCreator
    public static TerminalReason fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
