package com.olo.kernel.quota;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remaining headroom of one process per dimension. {@code -1} means the dimension is unlimited.
 */
public final class RemainingBudget {

    public static final long UNLIMITED = -1;

    private final long llmCalls;
    private final long toolCalls;
    private final long agentHops;
    private final long iterations;
    private final long tokensIn;
    private final long tokensOut;
    private final double seconds;

    public RemainingBudget(long llmCalls, long toolCalls, long agentHops, long iterations,
                           long tokensIn, long tokensOut, double seconds) {
        this.llmCalls = llmCalls;
        this.toolCalls = toolCalls;
        this.agentHops = agentHops;
        this.iterations = iterations;
        this.tokensIn = tokensIn;
        this.tokensOut = tokensOut;
        this.seconds = seconds;
    }

    @JsonProperty("llm_calls")
    public long getLlmCalls() {
        return llmCalls;
    }

    @JsonProperty("tool_calls")
    public long getToolCalls() {
        return toolCalls;
    }

    @JsonProperty("agent_hops")
    public long getAgentHops() {
        return agentHops;
    }

    @JsonProperty("iterations")
    public long getIterations() {
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

    @JsonProperty("seconds")
    public double getSeconds() {
        return seconds;
    }

    @Override
    public String toString() {
        return "RemainingBudget{llmCalls=" + llmCalls + ", toolCalls=" + toolCalls + ", agentHops=" + agentHops
                + ", iterations=" + iterations + ", tokensIn=" + tokensIn + ", tokensOut=" + tokensOut
                + ", seconds=" + seconds + "}";
    }
}
