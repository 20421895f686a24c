package com.olo.kernel.orchestrator;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * INITIALIZED → RUNNING → WAITING | TERMINATED. WAITING goes back to RUNNING once the envelope's interrupt
 * is cleared.
 */
public enum SessionStatus {
    INITIALIZED,
    RUNNING,
    WAITING,
    TERMINATED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
