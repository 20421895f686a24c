package com.olo.kernel.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.envelope.TerminalReason;
import com.olo.kernel.interrupt.InterruptKind;

/**
 * Outcome of one reported agent result. When {@link #getInterruptKind()} is set the caller raises an interrupt
 * of that kind and the stage cursor stays on the reporting agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RoutingDecision {

    private final String from;
    private final String target;
    private final InterruptKind interruptKind;
    private final TerminalReason terminalReason;
    private final boolean failed;

    private RoutingDecision(String from, String target, InterruptKind interruptKind,
                            TerminalReason terminalReason, boolean failed) {
        this.from = from;
        this.target = target;
        this.interruptKind = interruptKind;
        this.terminalReason = terminalReason;
        this.failed = failed;
    }

    static RoutingDecision advance(String from, String target) {
        return new RoutingDecision(from, target, null, null, false);
    }

    static RoutingDecision interrupt(String from, String target, InterruptKind kind) {
        return new RoutingDecision(from, target, kind, null, false);
    }

    static RoutingDecision terminated(String from, String target, TerminalReason reason) {
        return new RoutingDecision(from, target, null, reason, false);
    }

    /** Failure with no error route; the next instruction terminates the session. */
    static RoutingDecision failedFatally(String from) {
        return new RoutingDecision(from, null, null, null, true);
    }

    /** Result recorded for audit only because the envelope was already terminated. */
    static RoutingDecision recordedOnly(String from) {
        return new RoutingDecision(from, null, null, null, false);
    }

    @JsonProperty("from")
    public String getFrom() {
        return from;
    }

    @JsonProperty("target")
    public String getTarget() {
        return target;
    }

    @JsonProperty("interrupt_kind")
    public InterruptKind getInterruptKind() {
        return interruptKind;
    }

    public boolean requiresInterrupt() {
        return interruptKind != null;
    }

    @JsonProperty("terminal_reason")
    public TerminalReason getTerminalReason() {
        return terminalReason;
    }

    @JsonProperty("failed")
    public boolean isFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "RoutingDecision{from=" + from + ", target=" + target + ", interruptKind=" + interruptKind
                + ", terminalReason=" + terminalReason + ", failed=" + failed + "}";
    }
}
