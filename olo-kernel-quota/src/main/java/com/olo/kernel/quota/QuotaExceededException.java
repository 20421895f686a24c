package com.olo.kernel.quota;

import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;

/**
 * Thrown when a process quota or a per-user rate limit is breached. Always carries
 * {@link ErrorKind#QUOTA_EXCEEDED}.
 */
public final class QuotaExceededException extends KernelException {

    private final String subject;
    private final String dimension;
    private final long current;
    private final long limit;

    public QuotaExceededException(String subject, String dimension, long current, long limit, String message) {
        super(ErrorKind.QUOTA_EXCEEDED, message);
        this.subject = subject;
        this.dimension = dimension;
        this.current = current;
        this.limit = limit;
    }

    /** User id for rate limits, pid for process quotas. */
    public String getSubject() {
        return subject;
    }

    /** e.g. {@code requests_per_hour}, {@code llm_calls}. */
    public String getDimension() {
        return dimension;
    }

    public long getCurrent() {
        return current;
    }

    public long getLimit() {
        return limit;
    }
}
