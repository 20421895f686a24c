package com.olo.kernel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.process.ProcessControlBlock;
import com.olo.kernel.process.ProcessState;
import com.olo.kernel.process.ResourceQuota;
import com.olo.kernel.process.ResourceUsage;
import com.olo.kernel.process.SchedulingPriority;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Point-in-time copy of a {@link ProcessControlBlock}, safe to read outside the kernel lock. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProcessInfo {

    private final String pid;
    private final String requestId;
    private final String userId;
    private final String sessionId;
    private final ProcessState state;
    private final SchedulingPriority priority;
    private final ResourceQuota quota;
    private final ResourceUsage usage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant lastScheduledAt;
    private final String currentStage;
    private final String pendingInterrupt;
    private final Map<String, Object> interruptData;
    private final String parentPid;
    private final List<String> childPids;

    private ProcessInfo(ProcessControlBlock pcb) {
        this.pid = pcb.getPid();
        this.requestId = pcb.getRequestId();
        this.userId = pcb.getUserId();
        this.sessionId = pcb.getSessionId();
        this.state = pcb.getState();
        this.priority = pcb.getPriority();
        this.quota = pcb.getQuota();
        this.usage = pcb.getUsage().copy();
        this.createdAt = pcb.getCreatedAt();
        this.startedAt = pcb.getStartedAt();
        this.completedAt = pcb.getCompletedAt();
        this.lastScheduledAt = pcb.getLastScheduledAt();
        this.currentStage = pcb.getCurrentStage();
        this.pendingInterrupt = pcb.getPendingInterrupt() != null ? pcb.getPendingInterrupt().toValue() : null;
        this.interruptData = Map.copyOf(pcb.getInterruptData());
        this.parentPid = pcb.getParentPid();
        this.childPids = List.copyOf(pcb.getChildPids());
    }

    public static ProcessInfo of(ProcessControlBlock pcb) {
        return new ProcessInfo(pcb);
    }

    @JsonProperty("pid")
    public String getPid() {
        return pid;
    }

    @JsonProperty("request_id")
    public String getRequestId() {
        return requestId;
    }

    @JsonProperty("user_id")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("state")
    public ProcessState getState() {
        return state;
    }

    @JsonProperty("priority")
    public SchedulingPriority getPriority() {
        return priority;
    }

    @JsonProperty("quota")
    public ResourceQuota getQuota() {
        return quota;
    }

    @JsonProperty("usage")
    public ResourceUsage getUsage() {
        return usage;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("started_at")
    public Instant getStartedAt() {
        return startedAt;
    }

    @JsonProperty("completed_at")
    public Instant getCompletedAt() {
        return completedAt;
    }

    @JsonProperty("last_scheduled_at")
    public Instant getLastScheduledAt() {
        return lastScheduledAt;
    }

    @JsonProperty("current_stage")
    public String getCurrentStage() {
        return currentStage;
    }

    @JsonProperty("pending_interrupt")
    public String getPendingInterrupt() {
        return pendingInterrupt;
    }

    @JsonProperty("interrupt_data")
    public Map<String, Object> getInterruptData() {
        return interruptData;
    }

    @JsonProperty("parent_pid")
    public String getParentPid() {
        return parentPid;
    }

    @JsonProperty("child_pids")
    public List<String> getChildPids() {
        return childPids;
    }
}
