package com.olo.kernel.process;

import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.InterruptKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process Control Block: scheduling and resource metadata for one in-flight request.
 * <p>
 * Every state change goes through {@link #transitionTo}, which checks the transition matrix before touching
 * any field. Not thread-safe; the kernel lock guards it.
 */
public final class ProcessControlBlock {

    public static final String BLOCK_REASON_KEY = "block_reason";

    private final String pid;
    private final String requestId;
    private final String userId;
    private final String sessionId;
    private final SchedulingPriority priority;
    private final ResourceQuota quota;
    private final ResourceUsage usage = new ResourceUsage();
    private final Instant createdAt;
    private final Map<String, Object> interruptData = new LinkedHashMap<>();
    private final List<String> childPids = new ArrayList<>();

    private ProcessState state = ProcessState.NEW;
    private Instant startedAt;
    private Instant completedAt;
    private Instant lastScheduledAt;
    private String currentStage;
    private InterruptKind pendingInterrupt;
    private String parentPid;

    public ProcessControlBlock(String pid, String requestId, String userId, String sessionId,
                               SchedulingPriority priority, ResourceQuota quota, Instant createdAt) {
        this.pid = requireNonEmpty(pid, "pid");
        this.requestId = requireNonEmpty(requestId, "request_id");
        this.userId = requireNonEmpty(userId, "user_id");
        this.sessionId = requireNonEmpty(sessionId, "session_id");
        this.priority = priority != null ? priority : SchedulingPriority.NORMAL;
        this.quota = quota != null ? quota : ResourceQuota.DEFAULT;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Checks the identity fields a new block needs, without building one.
     *
     * @throws KernelException VALIDATION naming the first blank field
     */
    public static void validateIdentity(String pid, String requestId, String userId, String sessionId) {
        requireNonEmpty(pid, "pid");
        requireNonEmpty(requestId, "request_id");
        requireNonEmpty(userId, "user_id");
        requireNonEmpty(sessionId, "session_id");
    }

    private static String requireNonEmpty(String value, String name) {
        if (value == null || value.isBlank()) {
            throw KernelException.validation("%s is required", name);
        }
        return value;
    }

    /**
     * Moves to {@code target} if the matrix allows it.
     *
     * @throws KernelException STATE_TRANSITION, with no field changed
     */
    public void transitionTo(ProcessState target) {
        if (!state.canTransitionTo(target)) {
            throw KernelException.stateTransition("Cannot transition process %s from %s to %s",
                    pid, state.toValue(), target != null ? target.toValue() : "null");
        }
        state = target;
    }

    /** Ready → Running. Stamps {@code startedAt} on first start and {@code lastScheduledAt} every time. */
    public void start(Instant now) {
        transitionTo(ProcessState.RUNNING);
        if (startedAt == null) {
            startedAt = now;
        }
        lastScheduledAt = now;
    }

    /** → Terminated. Stamps {@code completedAt} and freezes elapsed time. */
    public void complete(Instant now) {
        transitionTo(ProcessState.TERMINATED);
        completedAt = now;
        if (startedAt != null) {
            usage.setElapsedSeconds(Duration.between(startedAt, now).toMillis() / 1000.0);
        }
    }

    public void block(String reason) {
        transitionTo(ProcessState.BLOCKED);
        if (reason != null) {
            interruptData.put(BLOCK_REASON_KEY, reason);
        }
    }

    public void waitOn(InterruptKind kind) {
        transitionTo(ProcessState.WAITING);
        pendingInterrupt = kind;
    }

    /** Waiting or Blocked → Ready; clears interrupt metadata. */
    public void resume() {
        if (state != ProcessState.WAITING && state != ProcessState.BLOCKED) {
            throw KernelException.stateTransition("Cannot resume process %s from %s", pid, state.toValue());
        }
        transitionTo(ProcessState.READY);
        pendingInterrupt = null;
        interruptData.clear();
    }

    /** Recomputes elapsed seconds while the process has started and not completed. */
    public void refreshElapsed(Instant now) {
        if (startedAt != null && completedAt == null) {
            usage.setElapsedSeconds(Duration.between(startedAt, now).toMillis() / 1000.0);
        }
    }

    public String getPid() {
        return pid;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ProcessState getState() {
        return state;
    }

    public SchedulingPriority getPriority() {
        return priority;
    }

    public ResourceQuota getQuota() {
        return quota;
    }

    /** Live counters; mutate only under the kernel lock. */
    public ResourceUsage getUsage() {
        return usage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getLastScheduledAt() {
        return lastScheduledAt;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    public InterruptKind getPendingInterrupt() {
        return pendingInterrupt;
    }

    public Map<String, Object> getInterruptData() {
        return Collections.unmodifiableMap(interruptData);
    }

    public String getParentPid() {
        return parentPid;
    }

    public void setParentPid(String parentPid) {
        this.parentPid = parentPid;
    }

    public List<String> getChildPids() {
        return Collections.unmodifiableList(childPids);
    }

    public void addChild(String childPid) {
        if (!childPids.contains(childPid)) {
            childPids.add(childPid);
        }
    }
}
