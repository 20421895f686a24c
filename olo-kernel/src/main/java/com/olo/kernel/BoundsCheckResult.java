package com.olo.kernel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.TerminalReason;

/** Pipeline bound counters of one envelope and whether it may continue. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BoundsCheckResult {

    private final boolean canContinue;
    private final TerminalReason terminalReason;
    private final int llmCallsRemaining;
    private final int agentHopsRemaining;
    private final int iterationsRemaining;

    private BoundsCheckResult(boolean canContinue, TerminalReason terminalReason, int llmCallsRemaining,
                              int agentHopsRemaining, int iterationsRemaining) {
        this.canContinue = canContinue;
        this.terminalReason = terminalReason;
        this.llmCallsRemaining = llmCallsRemaining;
        this.agentHopsRemaining = agentHopsRemaining;
        this.iterationsRemaining = iterationsRemaining;
    }

    /**
     * @param exceeded bound reached, or null; a terminated envelope reports its own terminal reason
     */
    static BoundsCheckResult of(Envelope envelope, TerminalReason exceeded) {
        TerminalReason reason = envelope.isTerminated() ? envelope.getTerminalReason() : exceeded;
        return new BoundsCheckResult(reason == null, reason,
                Math.max(0, envelope.getMaxLlmCalls() - envelope.getLlmCallCount()),
                Math.max(0, envelope.getMaxAgentHops() - envelope.getAgentHopCount()),
                Math.max(0, envelope.getMaxIterations() - envelope.getIteration()));
    }

    @JsonProperty("can_continue")
    public boolean isCanContinue() {
        return canContinue;
    }

    @JsonProperty("terminal_reason")
    public TerminalReason getTerminalReason() {
        return terminalReason;
    }

    @JsonProperty("llm_calls_remaining")
    public int getLlmCallsRemaining() {
        return llmCallsRemaining;
    }

    @JsonProperty("agent_hops_remaining")
    public int getAgentHopsRemaining() {
        return agentHopsRemaining;
    }

    @JsonProperty("iterations_remaining")
    public int getIterationsRemaining() {
        return iterationsRemaining;
    }
}
