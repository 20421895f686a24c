package com.olo.kernel.process;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Static per-process ceilings. A limit of zero or below means unlimited for that dimension.
 * <p>
 * When deserialized, absent fields are 0 ("unset") so a partial quota from a caller can be laid over the
 * kernel's default with {@link #mergedOver(ResourceQuota)}.
 */
public final class ResourceQuota {

    /** Defaults used when a process is submitted without a quota. */
    public static final ResourceQuota DEFAULT = builder().build();

    private final int maxLlmCalls;
    private final int maxToolCalls;
    private final int maxAgentHops;
    private final int maxIterations;
    private final int timeoutSeconds;
    private final int softTimeoutSeconds;
    private final int maxInputTokens;
    private final int maxOutputTokens;
    private final int maxContextTokens;
    private final int rateLimitRpm;
    private final int rateLimitRph;
    private final int rateLimitBurst;
    private final int maxInferenceRequests;
    private final int maxInferenceInputChars;

    @JsonCreator
    public ResourceQuota(
            @JsonProperty("max_llm_calls") Integer maxLlmCalls,
            @JsonProperty("max_tool_calls") Integer maxToolCalls,
            @JsonProperty("max_agent_hops") Integer maxAgentHops,
            @JsonProperty("max_iterations") Integer maxIterations,
            @JsonProperty("timeout_seconds") Integer timeoutSeconds,
            @JsonProperty("soft_timeout_seconds") Integer softTimeoutSeconds,
            @JsonProperty("max_input_tokens") Integer maxInputTokens,
            @JsonProperty("max_output_tokens") Integer maxOutputTokens,
            @JsonProperty("max_context_tokens") Integer maxContextTokens,
            @JsonProperty("rate_limit_rpm") Integer rateLimitRpm,
            @JsonProperty("rate_limit_rph") Integer rateLimitRph,
            @JsonProperty("rate_limit_burst") Integer rateLimitBurst,
            @JsonProperty("max_inference_requests") Integer maxInferenceRequests,
            @JsonProperty("max_inference_input_chars") Integer maxInferenceInputChars) {
        this.maxLlmCalls = orZero(maxLlmCalls);
        this.maxToolCalls = orZero(maxToolCalls);
        this.maxAgentHops = orZero(maxAgentHops);
        this.maxIterations = orZero(maxIterations);
        this.timeoutSeconds = orZero(timeoutSeconds);
        this.softTimeoutSeconds = orZero(softTimeoutSeconds);
        this.maxInputTokens = orZero(maxInputTokens);
        this.maxOutputTokens = orZero(maxOutputTokens);
        this.maxContextTokens = orZero(maxContextTokens);
        this.rateLimitRpm = orZero(rateLimitRpm);
        this.rateLimitRph = orZero(rateLimitRph);
        this.rateLimitBurst = orZero(rateLimitBurst);
        this.maxInferenceRequests = orZero(maxInferenceRequests);
        this.maxInferenceInputChars = orZero(maxInferenceInputChars);
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    /**
     * Returns {@code base} with every non-zero field of this quota laid over it. Negative values therefore
     * override to unlimited.
     */
    public ResourceQuota mergedOver(ResourceQuota base) {
        Objects.requireNonNull(base, "base");
        return new ResourceQuota(
                pick(maxLlmCalls, base.maxLlmCalls),
                pick(maxToolCalls, base.maxToolCalls),
                pick(maxAgentHops, base.maxAgentHops),
                pick(maxIterations, base.maxIterations),
                pick(timeoutSeconds, base.timeoutSeconds),
                pick(softTimeoutSeconds, base.softTimeoutSeconds),
                pick(maxInputTokens, base.maxInputTokens),
                pick(maxOutputTokens, base.maxOutputTokens),
                pick(maxContextTokens, base.maxContextTokens),
                pick(rateLimitRpm, base.rateLimitRpm),
                pick(rateLimitRph, base.rateLimitRph),
                pick(rateLimitBurst, base.rateLimitBurst),
                pick(maxInferenceRequests, base.maxInferenceRequests),
                pick(maxInferenceInputChars, base.maxInferenceInputChars));
    }

    private static int pick(int override, int base) {
        return override != 0 ? override : base;
    }

    @JsonProperty("max_llm_calls")
    public int getMaxLlmCalls() {
        return maxLlmCalls;
    }

    @JsonProperty("max_tool_calls")
    public int getMaxToolCalls() {
        return maxToolCalls;
    }

    @JsonProperty("max_agent_hops")
    public int getMaxAgentHops() {
        return maxAgentHops;
    }

    @JsonProperty("max_iterations")
    public int getMaxIterations() {
        return maxIterations;
    }

    /** Hard wall-clock limit, in seconds, measured from the process start. */
    @JsonProperty("timeout_seconds")
    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    /** Advisory deadline; reported in the remaining budget but never enforced. */
    @JsonProperty("soft_timeout_seconds")
    public int getSoftTimeoutSeconds() {
        return softTimeoutSeconds;
    }

    @JsonProperty("max_input_tokens")
    public int getMaxInputTokens() {
        return maxInputTokens;
    }

    @JsonProperty("max_output_tokens")
    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    @JsonProperty("max_context_tokens")
    public int getMaxContextTokens() {
        return maxContextTokens;
    }

    @JsonProperty("rate_limit_rpm")
    public int getRateLimitRpm() {
        return rateLimitRpm;
    }

    @JsonProperty("rate_limit_rph")
    public int getRateLimitRph() {
        return rateLimitRph;
    }

    @JsonProperty("rate_limit_burst")
    public int getRateLimitBurst() {
        return rateLimitBurst;
    }

    @JsonProperty("max_inference_requests")
    public int getMaxInferenceRequests() {
        return maxInferenceRequests;
    }

    @JsonProperty("max_inference_input_chars")
    public int getMaxInferenceInputChars() {
        return maxInferenceInputChars;
    }

    public Builder toBuilder() {
        return new Builder()
                .maxLlmCalls(maxLlmCalls)
                .maxToolCalls(maxToolCalls)
                .maxAgentHops(maxAgentHops)
                .maxIterations(maxIterations)
                .timeoutSeconds(timeoutSeconds)
                .softTimeoutSeconds(softTimeoutSeconds)
                .maxInputTokens(maxInputTokens)
                .maxOutputTokens(maxOutputTokens)
                .maxContextTokens(maxContextTokens)
                .rateLimitRpm(rateLimitRpm)
                .rateLimitRph(rateLimitRph)
                .rateLimitBurst(rateLimitBurst)
                .maxInferenceRequests(maxInferenceRequests)
                .maxInferenceInputChars(maxInferenceInputChars);
    }

    /** Builder seeded with the default limits. */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceQuota that = (ResourceQuota) o;
        return maxLlmCalls == that.maxLlmCalls
                && maxToolCalls == that.maxToolCalls
                && maxAgentHops == that.maxAgentHops
                && maxIterations == that.maxIterations
                && timeoutSeconds == that.timeoutSeconds
                && softTimeoutSeconds == that.softTimeoutSeconds
                && maxInputTokens == that.maxInputTokens
                && maxOutputTokens == that.maxOutputTokens
                && maxContextTokens == that.maxContextTokens
                && rateLimitRpm == that.rateLimitRpm
                && rateLimitRph == that.rateLimitRph
                && rateLimitBurst == that.rateLimitBurst
                && maxInferenceRequests == that.maxInferenceRequests
                && maxInferenceInputChars == that.maxInferenceInputChars;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLlmCalls, maxToolCalls, maxAgentHops, maxIterations, timeoutSeconds,
                softTimeoutSeconds, maxInputTokens, maxOutputTokens, maxContextTokens, rateLimitRpm,
                rateLimitRph, rateLimitBurst, maxInferenceRequests, maxInferenceInputChars);
    }

    public static final class Builder {
        private int maxLlmCalls = 100;
        private int maxToolCalls = 50;
        private int maxAgentHops = 10;
        private int maxIterations = 20;
        private int timeoutSeconds = 300;
        private int softTimeoutSeconds = 240;
        private int maxInputTokens = 100_000;
        private int maxOutputTokens = 50_000;
        private int maxContextTokens = 150_000;
        private int rateLimitRpm = 60;
        private int rateLimitRph = 1000;
        private int rateLimitBurst = 10;
        private int maxInferenceRequests = 50;
        private int maxInferenceInputChars = 500_000;

        private Builder() {
        }

        public Builder maxLlmCalls(int v) {
            this.maxLlmCalls = v;
            return this;
        }

        public Builder maxToolCalls(int v) {
            this.maxToolCalls = v;
            return this;
        }

        public Builder maxAgentHops(int v) {
            this.maxAgentHops = v;
            return this;
        }

        public Builder maxIterations(int v) {
            this.maxIterations = v;
            return this;
        }

        public Builder timeoutSeconds(int v) {
            this.timeoutSeconds = v;
            return this;
        }

        public Builder softTimeoutSeconds(int v) {
            this.softTimeoutSeconds = v;
            return this;
        }

        public Builder maxInputTokens(int v) {
            this.maxInputTokens = v;
            return this;
        }

        public Builder maxOutputTokens(int v) {
            this.maxOutputTokens = v;
            return this;
        }

        public Builder maxContextTokens(int v) {
            this.maxContextTokens = v;
            return this;
        }

        public Builder rateLimitRpm(int v) {
            this.rateLimitRpm = v;
            return this;
        }

        public Builder rateLimitRph(int v) {
            this.rateLimitRph = v;
            return this;
        }

        public Builder rateLimitBurst(int v) {
            this.rateLimitBurst = v;
            return this;
        }

        public Builder maxInferenceRequests(int v) {
            this.maxInferenceRequests = v;
            return this;
        }

        public Builder maxInferenceInputChars(int v) {
            this.maxInferenceInputChars = v;
            return this;
        }

        public ResourceQuota build() {
            return new ResourceQuota(maxLlmCalls, maxToolCalls, maxAgentHops, maxIterations, timeoutSeconds,
                    softTimeoutSeconds, maxInputTokens, maxOutputTokens, maxContextTokens, rateLimitRpm,
                    rateLimitRph, rateLimitBurst, maxInferenceRequests, maxInferenceInputChars);
        }
    }
}
