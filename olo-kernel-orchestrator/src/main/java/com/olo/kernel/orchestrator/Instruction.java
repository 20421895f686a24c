package com.olo.kernel.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.TerminalReason;
import com.olo.kernel.interrupt.FlowInterrupt;
import com.olo.kernel.pipeline.AgentConfig;

import java.util.Objects;

/**
 * Next step for a worker. The envelope is a snapshot taken when the instruction was issued.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Instruction {

    private final InstructionKind kind;
    private final String agentName;
    private final AgentConfig agentConfig;
    private final Envelope envelope;
    private final TerminalReason terminalReason;
    private final String terminationMessage;
    private final FlowInterrupt interrupt;

    private Instruction(InstructionKind kind, String agentName, AgentConfig agentConfig, Envelope envelope,
                        TerminalReason terminalReason, String terminationMessage, FlowInterrupt interrupt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.agentName = agentName;
        this.agentConfig = agentConfig;
        this.envelope = envelope;
        this.terminalReason = terminalReason;
        this.terminationMessage = terminationMessage;
        this.interrupt = interrupt;
    }

    public static Instruction runAgent(AgentConfig agent, Envelope snapshot) {
        return new Instruction(InstructionKind.RUN_AGENT, agent.getName(), agent, snapshot, null, null, null);
    }

    public static Instruction waitInterrupt(FlowInterrupt interrupt, Envelope snapshot) {
        return new Instruction(InstructionKind.WAIT_INTERRUPT, null, null, snapshot, null, null, interrupt);
    }

    public static Instruction terminate(TerminalReason reason, String message, Envelope snapshot) {
        return new Instruction(InstructionKind.TERMINATE, null, null, snapshot, reason, message, null);
    }

    @JsonProperty("kind")
    public InstructionKind getKind() {
        return kind;
    }

    @JsonProperty("agent_name")
    public String getAgentName() {
        return agentName;
    }

    @JsonProperty("agent_config")
    public AgentConfig getAgentConfig() {
        return agentConfig;
    }

    @JsonProperty("envelope")
    public Envelope getEnvelope() {
        return envelope;
    }

    @JsonProperty("terminal_reason")
    public TerminalReason getTerminalReason() {
        return terminalReason;
    }

    @JsonProperty("termination_message")
    public String getTerminationMessage() {
        return terminationMessage;
    }

    @JsonProperty("interrupt_pending")
    public boolean isInterruptPending() {
        return kind == InstructionKind.WAIT_INTERRUPT;
    }

    @JsonProperty("interrupt")
    public FlowInterrupt getInterrupt() {
        return interrupt;
    }

    @Override
    public String toString() {
        return "Instruction{kind=" + kind.toValue() + ", agentName=" + agentName + ", terminalReason="
                + (terminalReason != null ? terminalReason.toValue() : null) + "}";
    }
}
