package com.olo.kernel.process;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Optional;

/**
 * Live counters for one process or one user. Not thread-safe; owned by the kernel and mutated under its lock.
 */
public final class ResourceUsage {

    private int llmCalls;
    private int toolCalls;
    private int agentHops;
    private int iterations;
    private long tokensIn;
    private long tokensOut;
    private double elapsedSeconds;
    private int inferenceRequests;
    private long inferenceInputChars;

    public ResourceUsage() {
    }

    public ResourceUsage copy() {
        ResourceUsage c = new ResourceUsage();
        c.llmCalls = llmCalls;
        c.toolCalls = toolCalls;
        c.agentHops = agentHops;
        c.iterations = iterations;
        c.tokensIn = tokensIn;
        c.tokensOut = tokensOut;
        c.elapsedSeconds = elapsedSeconds;
        c.inferenceRequests = inferenceRequests;
        c.inferenceInputChars = inferenceInputChars;
        return c;
    }

    /**
     * Returns the first dimension that has reached its limit, checked in the order llm_calls, tool_calls,
     * agent_hops, iterations, tokens_in, tokens_out, elapsed_seconds, inference_requests,
     * inference_input_chars. Counters violate when they reach the limit; elapsed time when it passes the
     * timeout. Limits of zero or below are skipped.
     */
    public Optional<String> exceedsQuota(ResourceQuota quota) {
        if (reached(llmCalls, quota.getMaxLlmCalls())) return violation("llm_calls", llmCalls, quota.getMaxLlmCalls());
        if (reached(toolCalls, quota.getMaxToolCalls())) return violation("tool_calls", toolCalls, quota.getMaxToolCalls());
        if (reached(agentHops, quota.getMaxAgentHops())) return violation("agent_hops", agentHops, quota.getMaxAgentHops());
        if (reached(iterations, quota.getMaxIterations())) return violation("iterations", iterations, quota.getMaxIterations());
        if (reached(tokensIn, quota.getMaxInputTokens())) return violation("tokens_in", tokensIn, quota.getMaxInputTokens());
        if (reached(tokensOut, quota.getMaxOutputTokens())) return violation("tokens_out", tokensOut, quota.getMaxOutputTokens());
        if (quota.getTimeoutSeconds() > 0 && elapsedSeconds > quota.getTimeoutSeconds()) {
            return Optional.of(String.format(Locale.ROOT, "elapsed_seconds %.1f > %d", elapsedSeconds, quota.getTimeoutSeconds()));
        }
        if (reached(inferenceRequests, quota.getMaxInferenceRequests())) {
            return violation("inference_requests", inferenceRequests, quota.getMaxInferenceRequests());
        }
        if (reached(inferenceInputChars, quota.getMaxInferenceInputChars())) {
            return violation("inference_input_chars", inferenceInputChars, quota.getMaxInferenceInputChars());
        }
        return Optional.empty();
    }

    private static boolean reached(long value, int limit) {
        return limit > 0 && value >= limit;
    }

    private static Optional<String> violation(String dimension, long value, int limit) {
        return Optional.of(String.format("%s %d >= %d", dimension, value, limit));
    }

    /** Adds non-negative deltas. Callers validate sign at the boundary. */
    public void add(int llmCalls, int toolCalls, long tokensIn, long tokensOut) {
        this.llmCalls += llmCalls;
        this.toolCalls += toolCalls;
        this.tokensIn += tokensIn;
        this.tokensOut += tokensOut;
    }

    public void incrementAgentHops() {
        agentHops++;
    }

    public void incrementToolCalls() {
        toolCalls++;
    }

    /** Tracks the highest loop iteration reported for the process. */
    public void recordIteration(int iteration) {
        if (iteration > iterations) {
            iterations = iteration;
        }
    }

    public void addInference(int requests, long inputChars) {
        this.inferenceRequests += requests;
        this.inferenceInputChars += inputChars;
    }

    @JsonProperty("llm_calls")
    public int getLlmCalls() {
        return llmCalls;
    }

    @JsonProperty("tool_calls")
    public int getToolCalls() {
        return toolCalls;
    }

    @JsonProperty("agent_hops")
    public int getAgentHops() {
        return agentHops;
    }

    @JsonProperty("iterations")
    public int getIterations() {
        return iterations;
    }

    @JsonProperty("tokens_in")
    public long getTokensIn() {
        return tokensIn;
    }

    @JsonProperty("tokens_out")
    public long getTokensOut() {
        return tokensOut;
    }

    @JsonProperty("elapsed_seconds")
    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public void setElapsedSeconds(double elapsedSeconds) {
        this.elapsedSeconds = elapsedSeconds;
    }

    @JsonProperty("inference_requests")
    public int getInferenceRequests() {
        return inferenceRequests;
    }

    @JsonProperty("inference_input_chars")
    public long getInferenceInputChars() {
        return inferenceInputChars;
    }

    @Override
    public String toString() {
        return "ResourceUsage{llmCalls=" + llmCalls + ", toolCalls=" + toolCalls + ", agentHops=" + agentHops
                + ", iterations=" + iterations + ", tokensIn=" + tokensIn + ", tokensOut=" + tokensOut
                + ", elapsedSeconds=" + elapsedSeconds + "}";
    }
}
