package com.olo.kernel.orchestrator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.error.KernelException;

/** Usage reported by a worker for one agent run. Missing fields are zero. */
public final class AgentExecutionMetrics {

    public static final AgentExecutionMetrics NONE = new AgentExecutionMetrics(0, 0, 0L, 0L, 0L);

    private final int llmCalls;
    private final int toolCalls;
    private final long tokensIn;
    private final long tokensOut;
    private final long durationMs;

    @JsonCreator
    public AgentExecutionMetrics(
            @JsonProperty("llm_calls") Integer llmCalls,
            @JsonProperty("tool_calls") Integer toolCalls,
            @JsonProperty("tokens_in") Long tokensIn,
            @JsonProperty("tokens_out") Long tokensOut,
            @JsonProperty("duration_ms") Long durationMs) {
        this.llmCalls = llmCalls != null ? llmCalls : 0;
        this.toolCalls = toolCalls != null ? toolCalls : 0;
        this.tokensIn = tokensIn != null ? tokensIn : 0L;
        this.tokensOut = tokensOut != null ? tokensOut : 0L;
        this.durationMs = durationMs != null ? durationMs : 0L;
    }

    /**
     * @throws KernelException VALIDATION when a counter is negative
     */
    void requireNonNegative() {
        if (llmCalls < 0 || toolCalls < 0 || tokensIn < 0 || tokensOut < 0) {
            throw KernelException.validation("agent metrics must be non-negative: %s", this);
        }
    }

    @JsonProperty("llm_calls")
    public int getLlmCalls() {
        return llmCalls;
    }

    @JsonProperty("tool_calls")
    public int getToolCalls() {
        return toolCalls;
    }

    @JsonProperty("tokens_in")
    public long getTokensIn() {
        return tokensIn;
    }

    @JsonProperty("tokens_out")
    public long getTokensOut() {
        return tokensOut;
    }

    @JsonProperty("duration_ms")
    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "AgentExecutionMetrics{llmCalls=" + llmCalls + ", toolCalls=" + toolCalls + ", tokensIn=" + tokensIn
                + ", tokensOut=" + tokensOut + ", durationMs=" + durationMs + "}";
    }
}
