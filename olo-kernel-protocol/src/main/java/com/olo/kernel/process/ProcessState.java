package com.olo.kernel.process;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle state of a process. Allowed transitions are fixed by {@link #canTransitionTo}; everything else
 * is rejected before any mutation.
 */
public enum ProcessState {
    /** Submitted, not yet scheduled. */
    NEW,
    /** In the run queue. */
    READY,
    /** Handed to a worker. */
    RUNNING,
    /** Paused on an interrupt (human input). */
    WAITING,
    /** Paused on a resource or external condition. */
    BLOCKED,
    TERMINATED,
    /** Terminated and eligible for garbage collection. Absorbing. */
    ZOMBIE;

    public Set<ProcessState> allowedTargets() {
        switch (this) {
            case NEW:
                return EnumSet.of(READY, TERMINATED);
            case READY:
                return EnumSet.of(RUNNING, TERMINATED);
            case RUNNING:
                return EnumSet.of(READY, WAITING, BLOCKED, TERMINATED);
            case WAITING:
            case BLOCKED:
                return EnumSet.of(READY, TERMINATED);
            case TERMINATED:
                return EnumSet.of(ZOMBIE);
            default:
                return EnumSet.noneOf(ProcessState.class);
        }
    }

    public boolean canTransitionTo(ProcessState target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == TERMINATED || this == ZOMBIE;
    }

    public boolean canSchedule() {
        return this == NEW || this == READY;
    }

    public boolean isRunnable() {
        return this == READY;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses {@code "running"}, {@code "RUNNING"}, etc. Returns null for null/blank/unknown. */
    @JsonCreator
    public static ProcessState fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
