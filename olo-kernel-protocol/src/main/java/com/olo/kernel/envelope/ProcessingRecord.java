package com.olo.kernel.envelope;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/** One agent execution in an envelope's audit trail. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class ProcessingRecord {

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_SKIPPED = "skipped";

    @JsonProperty("agent")
    private final String agent;
    @JsonProperty("stage_order")
    private final int stageOrder;
    @JsonProperty("started_at")
    private final Instant startedAt;
    @JsonProperty("completed_at")
    private Instant completedAt;
    @JsonProperty("duration_ms")
    private long durationMs;
    @JsonProperty("status")
    private String status;
    @JsonProperty("error")
    private String error;
    @JsonProperty("llm_calls")
    private int llmCalls;

    @JsonCreator
    public ProcessingRecord(
            @JsonProperty("agent") String agent,
            @JsonProperty("stage_order") int stageOrder,
            @JsonProperty("started_at") Instant startedAt) {
        this.agent = agent;
        this.stageOrder = stageOrder;
        this.startedAt = startedAt;
        this.status = STATUS_RUNNING;
    }

    void complete(String status, String error, int llmCalls, Instant now) {
        this.status = status;
        this.error = error;
        this.llmCalls = llmCalls;
        this.completedAt = now;
        this.durationMs = startedAt != null ? Duration.between(startedAt, now).toMillis() : 0;
    }

    public String getAgent() {
        return agent;
    }

    public int getStageOrder() {
        return stageOrder;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public int getLlmCalls() {
        return llmCalls;
    }
}
