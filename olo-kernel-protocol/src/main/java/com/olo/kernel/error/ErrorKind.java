package com.olo.kernel.error;

/**
 * Category of every error surfaced by the kernel. Each kind maps to one stable code so callers
 * see the same semantics regardless of transport.
 */
public enum ErrorKind {
    /** Malformed or out-of-range caller input. */
    VALIDATION("INVALID_ARGUMENT"),
    /** Unknown process, envelope, session or interrupt id. */
    NOT_FOUND("NOT_FOUND"),
    /** Any quota or rate-limit breach. Expected and recoverable. */
    QUOTA_EXCEEDED("RESOURCE_EXHAUSTED"),
    /** Disallowed process state transition; nothing was mutated. */
    STATE_TRANSITION("FAILED_PRECONDITION"),
    /** Unexpected failure, including anything caught by the recovery wrapper. */
    INTERNAL("INTERNAL"),
    CANCELLED("CANCELLED"),
    TIMEOUT("DEADLINE_EXCEEDED");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
