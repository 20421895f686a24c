package com.olo.kernel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.olo.kernel.process.ResourceUsage;

/** Result of a process quota check with the usage it was evaluated against. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QuotaCheckResult {

    private final String exceededReason;
    private final ResourceUsage usage;

    QuotaCheckResult(String exceededReason, ResourceUsage usage) {
        this.exceededReason = exceededReason;
        this.usage = usage;
    }

    @JsonProperty("within_bounds")
    public boolean isWithinBounds() {
        return exceededReason == null;
    }

    /** First violated dimension, e.g. {@code "llm_calls 15 >= 10"}; null when within bounds. */
    @JsonProperty("exceeded_reason")
    public String getExceededReason() {
        return exceededReason;
    }

    @JsonUnwrapped
    public ResourceUsage getUsage() {
        return usage;
    }
}
