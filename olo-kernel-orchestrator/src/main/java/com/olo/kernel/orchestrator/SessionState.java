package com.olo.kernel.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.TerminalReason;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Read-only view of one orchestration session. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SessionState {

    private final String processId;
    private final String pipelineName;
    private final SessionStatus status;
    private final String currentStage;
    private final List<String> stageOrder;
    private final List<String> readyStages;
    private final int iteration;
    private final Map<String, Integer> edgeTraversals;
    private final TerminalReason terminalReason;
    private final Instant createdAt;
    private final Instant lastActivityAt;
    private final Envelope envelope;

    SessionState(String processId, String pipelineName, SessionStatus status, String currentStage,
                 List<String> stageOrder, List<String> readyStages, int iteration,
                 Map<String, Integer> edgeTraversals, TerminalReason terminalReason,
                 Instant createdAt, Instant lastActivityAt, Envelope envelope) {
        this.processId = processId;
        this.pipelineName = pipelineName;
        this.status = status;
        this.currentStage = currentStage;
        this.stageOrder = List.copyOf(stageOrder);
        this.readyStages = readyStages != null ? List.copyOf(readyStages) : null;
        this.iteration = iteration;
        this.edgeTraversals = Map.copyOf(edgeTraversals);
        this.terminalReason = terminalReason;
        this.createdAt = createdAt;
        this.lastActivityAt = lastActivityAt;
        this.envelope = envelope;
    }

    @JsonProperty("process_id")
    public String getProcessId() {
        return processId;
    }

    @JsonProperty("pipeline_name")
    public String getPipelineName() {
        return pipelineName;
    }

    @JsonProperty("status")
    public SessionStatus getStatus() {
        return status;
    }

    @JsonProperty("current_stage")
    public String getCurrentStage() {
        return currentStage;
    }

    @JsonProperty("stage_order")
    public List<String> getStageOrder() {
        return stageOrder;
    }

    /** Stages whose dependencies are met; only present for DAG pipelines. */
    @JsonProperty("ready_stages")
    public List<String> getReadyStages() {
        return readyStages;
    }

    @JsonProperty("iteration")
    public int getIteration() {
        return iteration;
    }

    @JsonProperty("edge_traversals")
    public Map<String, Integer> getEdgeTraversals() {
        return edgeTraversals;
    }

    @JsonProperty("terminated")
    public boolean isTerminated() {
        return status == SessionStatus.TERMINATED;
    }

    @JsonProperty("terminal_reason")
    public TerminalReason getTerminalReason() {
        return terminalReason;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("last_activity_at")
    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    /** Envelope snapshot. */
    @JsonProperty("envelope")
    public Envelope getEnvelope() {
        return envelope;
    }
}
