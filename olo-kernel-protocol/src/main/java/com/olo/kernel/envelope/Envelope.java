package com.olo.kernel.envelope;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.FlowInterrupt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Per-request state container: inputs, per-agent outputs, pipeline position, bounds counters and audit trail.
 * <p>
 * {@code terminated} is true exactly when {@code terminalReason} and {@code completedAt} are set. After that only
 * audit appends ({@link #recordAgentComplete}, {@link #addError}) are accepted; every other mutator throws
 * STATE_TRANSITION.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Envelope {

    public static final String DEFAULT_USER_ID = "anonymous";
    public static final String START_STAGE = "start";
    public static final String END_STAGE = "end";
    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final int DEFAULT_MAX_LLM_CALLS = 10;
    public static final int DEFAULT_MAX_AGENT_HOPS = 21;

    // Identity
    @JsonProperty("envelope_id")
    private String envelopeId;
    @JsonProperty("request_id")
    private String requestId;
    @JsonProperty("user_id")
    private String userId = DEFAULT_USER_ID;
    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("raw_input")
    private String rawInput;
    @JsonProperty("received_at")
    private Instant receivedAt;
    @JsonProperty("outputs")
    private Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();

    // Pipeline cursor
    @JsonProperty("current_stage")
    private String currentStage = START_STAGE;
    @JsonProperty("stage_order")
    private List<String> stageOrder = new ArrayList<>();
    @JsonProperty("iteration")
    private int iteration;
    @JsonProperty("max_iterations")
    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    @JsonProperty("active_stages")
    private Set<String> activeStages = new LinkedHashSet<>();
    @JsonProperty("completed_stage_set")
    private Set<String> completedStageSet = new LinkedHashSet<>();
    @JsonProperty("failed_stages")
    private Map<String, String> failedStages = new LinkedHashMap<>();
    @JsonProperty("parallel_mode")
    private boolean parallelMode;

    // Bounds
    @JsonProperty("llm_call_count")
    private int llmCallCount;
    @JsonProperty("max_llm_calls")
    private int maxLlmCalls = DEFAULT_MAX_LLM_CALLS;
    @JsonProperty("tool_call_count")
    private int toolCallCount;
    @JsonProperty("agent_hop_count")
    private int agentHopCount;
    @JsonProperty("max_agent_hops")
    private int maxAgentHops = DEFAULT_MAX_AGENT_HOPS;
    @JsonProperty("tokens_in")
    private long tokensIn;
    @JsonProperty("tokens_out")
    private long tokensOut;

    // Termination
    @JsonProperty("terminal_reason")
    private TerminalReason terminalReason;
    @JsonProperty("terminated")
    private boolean terminated;
    @JsonProperty("termination_reason")
    private String terminationReason;

    // Interrupt slot
    @JsonProperty("interrupt_pending")
    private boolean interruptPending;
    @JsonProperty("interrupt")
    private FlowInterrupt interrupt;

    // Audit
    @JsonProperty("processing_history")
    private List<ProcessingRecord> processingHistory = new ArrayList<>();
    @JsonProperty("errors")
    private List<Map<String, Object>> errors = new ArrayList<>();
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("completed_at")
    private Instant completedAt;
    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** Used by Jackson. */
    private Envelope() {
    }

    public Envelope(String envelopeId, String requestId, String userId, String sessionId, String rawInput, Instant now) {
        this.envelopeId = envelopeId != null && !envelopeId.isBlank() ? envelopeId : newEnvelopeId();
        this.requestId = requestId != null && !requestId.isBlank() ? requestId : "req_" + shortId();
        this.userId = userId != null && !userId.isBlank() ? userId : DEFAULT_USER_ID;
        this.sessionId = sessionId != null && !sessionId.isBlank() ? sessionId : "sess_" + shortId();
        this.rawInput = rawInput != null ? rawInput : "";
        this.receivedAt = now;
        this.createdAt = now;
    }

    public static String newEnvelopeId() {
        return "env_" + shortId();
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private void ensureMutable() {
        if (terminated) {
            throw KernelException.stateTransition("Envelope %s is terminated (%s)", envelopeId,
                    terminalReason != null ? terminalReason.toValue() : "unknown");
        }
    }

    // --- outputs ---

    public void setOutput(String agentName, Map<String, Object> output) {
        ensureMutable();
        outputs.put(Objects.requireNonNull(agentName, "agentName"),
                output != null ? new LinkedHashMap<>(output) : new LinkedHashMap<>());
    }

    /** Sets one key in an agent's output map, creating the map if needed. */
    public void putOutputValue(String agentName, String key, Object value) {
        ensureMutable();
        outputs.computeIfAbsent(agentName, k -> new LinkedHashMap<>()).put(key, value);
    }

    public Map<String, Object> getOutput(String agentName) {
        Map<String, Object> out = outputs.get(agentName);
        return out != null ? Collections.unmodifiableMap(out) : null;
    }

    public Map<String, Map<String, Object>> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    // --- stage bookkeeping ---

    public void startStage(String stage) {
        ensureMutable();
        activeStages.add(stage);
    }

    public void completeStage(String stage) {
        ensureMutable();
        activeStages.remove(stage);
        completedStageSet.add(stage);
    }

    public void failStage(String stage, String error) {
        ensureMutable();
        activeStages.remove(stage);
        failedStages.put(stage, error != null ? error : "");
    }

    public boolean isStageCompleted(String stage) {
        return completedStageSet.contains(stage);
    }

    public boolean isStageFailed(String stage) {
        return failedStages.containsKey(stage);
    }

    public Set<String> getActiveStages() {
        return Collections.unmodifiableSet(activeStages);
    }

    public Set<String> getCompletedStages() {
        return Collections.unmodifiableSet(completedStageSet);
    }

    public Map<String, String> getFailedStages() {
        return Collections.unmodifiableMap(failedStages);
    }

    // --- bounds ---

    /** True when the LLM-call or agent-hop counter has reached its maximum. */
    public boolean atLimit() {
        return llmCallCount >= maxLlmCalls || agentHopCount >= maxAgentHops;
    }

    public void setBounds(int maxIterations, int maxLlmCalls, int maxAgentHops) {
        ensureMutable();
        this.maxIterations = maxIterations;
        this.maxLlmCalls = maxLlmCalls;
        this.maxAgentHops = maxAgentHops;
    }

    public void incrementLlmCalls(int count) {
        ensureMutable();
        llmCallCount += count;
    }

    public void incrementToolCalls(int count) {
        ensureMutable();
        toolCallCount += count;
    }

    public void incrementAgentHops() {
        ensureMutable();
        agentHopCount++;
    }

    public void addTokens(long in, long out) {
        ensureMutable();
        tokensIn += in;
        tokensOut += out;
    }

    public void incrementIteration() {
        ensureMutable();
        iteration++;
    }

    // --- termination ---

    /**
     * Terminates the envelope. Returns false, changing nothing, when it is already terminated.
     */
    public boolean terminate(TerminalReason reason, String text, Instant now) {
        if (terminated) {
            return false;
        }
        this.terminalReason = Objects.requireNonNull(reason, "reason");
        this.terminationReason = text;
        this.completedAt = now;
        this.terminated = true;
        this.activeStages.clear();
        return true;
    }

    // --- interrupt slot ---

    public void setInterrupt(FlowInterrupt interrupt) {
        ensureMutable();
        this.interrupt = Objects.requireNonNull(interrupt, "interrupt");
        this.interruptPending = true;
    }

    public void clearInterrupt() {
        ensureMutable();
        this.interrupt = null;
        this.interruptPending = false;
    }

    // --- audit ---

    /** Appends a running history record for the agent. */
    public ProcessingRecord recordAgentStart(String agent, int stageOrder, Instant now) {
        ensureMutable();
        ProcessingRecord record = new ProcessingRecord(agent, stageOrder, now);
        processingHistory.add(record);
        return record;
    }

    /**
     * Completes the newest running record for {@code agent}, or appends a completed one when none is running.
     * Allowed after termination.
     */
    public void recordAgentComplete(String agent, int stageOrder, String status, String error, int llmCalls, Instant now) {
        ProcessingRecord target = null;
        for (int i = processingHistory.size() - 1; i >= 0; i--) {
            ProcessingRecord r = processingHistory.get(i);
            if (r.getAgent().equals(agent) && ProcessingRecord.STATUS_RUNNING.equals(r.getStatus())) {
                target = r;
                break;
            }
        }
        if (target == null) {
            target = new ProcessingRecord(agent, stageOrder, now);
            processingHistory.add(target);
        }
        target.complete(status, error, llmCalls, now);
    }

    /** Allowed after termination. */
    public void addError(String agent, String error, Instant now) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("agent", agent);
        entry.put("error", error);
        entry.put("timestamp", now.toString());
        errors.add(entry);
    }

    public void putMetadata(String key, Object value) {
        ensureMutable();
        metadata.put(key, value);
    }

    public List<ProcessingRecord> getProcessingHistory() {
        return Collections.unmodifiableList(processingHistory);
    }

    public List<Map<String, Object>> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // --- cursor ---

    public void setCurrentStage(String currentStage) {
        ensureMutable();
        this.currentStage = currentStage;
    }

    public void setStageOrder(List<String> stageOrder) {
        ensureMutable();
        this.stageOrder = new ArrayList<>(stageOrder);
    }

    public void setParallelMode(boolean parallelMode) {
        ensureMutable();
        this.parallelMode = parallelMode;
    }

    public String getEnvelopeId() {
        return envelopeId;
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

    public String getRawInput() {
        return rawInput;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public List<String> getStageOrder() {
        return Collections.unmodifiableList(stageOrder);
    }

    public int getIteration() {
        return iteration;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean isParallelMode() {
        return parallelMode;
    }

    public int getLlmCallCount() {
        return llmCallCount;
    }

    public int getMaxLlmCalls() {
        return maxLlmCalls;
    }

    public int getToolCallCount() {
        return toolCallCount;
    }

    public int getAgentHopCount() {
        return agentHopCount;
    }

    public int getMaxAgentHops() {
        return maxAgentHops;
    }

    public long getTokensIn() {
        return tokensIn;
    }

    public long getTokensOut() {
        return tokensOut;
    }

    public TerminalReason getTerminalReason() {
        return terminalReason;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    public boolean isInterruptPending() {
        return interruptPending;
    }

    public FlowInterrupt getInterrupt() {
        return interrupt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
