package com.olo.kernel;

import com.olo.kernel.config.KernelConfig;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.EnvelopeJson;
import com.olo.kernel.envelope.TerminalReason;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.FlowInterrupt;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.interrupt.InterruptResponse;
import com.olo.kernel.interrupt.service.InterruptService;
import com.olo.kernel.lifecycle.LifecycleManager;
import com.olo.kernel.orchestrator.AgentExecutionMetrics;
import com.olo.kernel.orchestrator.Instruction;
import com.olo.kernel.orchestrator.InstructionKind;
import com.olo.kernel.orchestrator.Orchestrator;
import com.olo.kernel.orchestrator.RoutingDecision;
import com.olo.kernel.orchestrator.SessionState;
import com.olo.kernel.pipeline.PipelineConfig;
import com.olo.kernel.process.ProcessControlBlock;
import com.olo.kernel.process.ProcessState;
import com.olo.kernel.process.ResourceQuota;
import com.olo.kernel.process.ResourceUsage;
import com.olo.kernel.process.SchedulingPriority;
import com.olo.kernel.quota.QuotaExceededException;
import com.olo.kernel.quota.RateLimitConfig;
import com.olo.kernel.quota.RateLimiter;
import com.olo.kernel.quota.RemainingBudget;
import com.olo.kernel.quota.ResourceTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Composition root of the control plane. Owns the process table, envelope table, rate windows, usage
 * aggregates, interrupt table and orchestration sessions, and serializes every public call on one lock.
 * <p>
 * Envelopes are keyed by process id. Every operation runs through {@link KernelRecovery}, so callers only ever
 * see {@link KernelException}.
 */
public final class Kernel {

    private static final Logger log = LoggerFactory.getLogger(Kernel.class);

    static final String LAST_INTERRUPT_RESPONSE_KEY = "last_interrupt_response";

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final LifecycleManager lifecycle;
    private final ResourceTracker resources;
    private final RateLimiter rateLimiter;
    private final InterruptService interrupts;
    private final Orchestrator orchestrator;
    private final KernelMetrics metrics;
    private final KernelRecovery recovery;
    private final Map<String, Envelope> envelopes = new LinkedHashMap<>();
    /** Interrupt id to the pid whose envelope carries it. */
    private final Map<String, String> interruptOwners = new HashMap<>();

    public Kernel(KernelConfig config, Clock clock, KernelMetrics metrics) {
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics != null ? metrics : new KernelMetrics(new SimpleMeterRegistry());
        this.recovery = new KernelRecovery(this.metrics);
        ResourceQuota defaultQuota = ResourceQuota.DEFAULT.toBuilder()
                .rateLimitRpm(config.getRateLimitRpm())
                .rateLimitRph(config.getRateLimitRph())
                .rateLimitBurst(config.getRateLimitBurst())
                .build();
        this.lifecycle = new LifecycleManager(clock, defaultQuota);
        this.resources = new ResourceTracker(clock);
        this.rateLimiter = new RateLimiter(clock, RateLimitConfig.fromQuota(defaultQuota));
        this.interrupts = new InterruptService(clock, Map.of());
        this.orchestrator = new Orchestrator(clock);
    }

    public Kernel(KernelConfig config) {
        this(config, Clock.systemUTC(), new KernelMetrics());
    }

    public Kernel() {
        this(KernelConfig.builder().build());
    }

    private <T> T locked(String operation, Supplier<T> body) {
        lock.lock();
        try {
            return recovery.call(operation, body);
        } finally {
            lock.unlock();
        }
    }

    // --- processes ---

    public ProcessInfo createProcess(String pid, String requestId, String userId, String sessionId,
                                     SchedulingPriority priority, ResourceQuota quota) {
        return createProcess(pid, requestId, userId, sessionId, priority, quota, null);
    }

    /**
     * Validates the identity fields, rate-limits the user (counting this request), then submits and schedules a
     * new process. An existing pid is returned as is. A partial quota is merged over the default: non-zero fields
     * override. A non-null {@code parentPid} links the new process as a child of that process.
     *
     * @throws KernelException VALIDATION for a blank pid, request, user or session id (nothing is counted);
     *                         NOT_FOUND for an unknown parent
     * @throws QuotaExceededException when the user is over a rate limit
     */
    public ProcessInfo createProcess(String pid, String requestId, String userId, String sessionId,
                                     SchedulingPriority priority, ResourceQuota quota, String parentPid) {
        return locked("createProcess", () -> {
            ProcessControlBlock.validateIdentity(pid, requestId, userId, sessionId);
            ProcessControlBlock parent = parentPid != null ? lifecycle.require(parentPid) : null;
            try {
                rateLimiter.checkRateLimit(userId, true);
            } catch (QuotaExceededException e) {
                metrics.rateLimitRejected();
                throw e;
            }
            Optional<ProcessControlBlock> existing = lifecycle.get(pid);
            if (existing.isPresent()) {
                return ProcessInfo.of(existing.get());
            }
            ResourceQuota effective = quota != null ? quota.mergedOver(lifecycle.getDefaultQuota()) : null;
            ProcessControlBlock pcb = lifecycle.submit(pid, requestId, userId, sessionId, priority, effective);
            if (parent != null) {
                pcb.setParentPid(parentPid);
                parent.addChild(pid);
            }
            lifecycle.schedule(pid);
            metrics.processCreated();
            return ProcessInfo.of(pcb);
        });
    }

    public ProcessInfo getProcess(String pid) {
        return locked("getProcess", () -> ProcessInfo.of(lifecycle.require(pid)));
    }

    public ProcessInfo scheduleProcess(String pid) {
        return locked("scheduleProcess", () -> {
            lifecycle.schedule(pid);
            return ProcessInfo.of(lifecycle.require(pid));
        });
    }

    /** Pops the next Ready process; its state is unchanged until {@link #startProcess}. */
    public Optional<ProcessInfo> getNextRunnable() {
        return locked("getNextRunnable", () -> lifecycle.getNextRunnable().map(ProcessInfo::of));
    }

    public ProcessInfo startProcess(String pid) {
        return locked("startProcess", () -> {
            lifecycle.start(pid);
            return ProcessInfo.of(lifecycle.require(pid));
        });
    }

    /**
     * Guarded transition. Terminating also terminates the envelope; leaving Waiting or Blocked for Ready also
     * clears the envelope's interrupt.
     */
    public ProcessInfo transitionState(String pid, ProcessState newState, String reason) {
        return locked("transitionState", () -> {
            ProcessControlBlock pcb = lifecycle.require(pid);
            ProcessState from = pcb.getState();
            if (newState == ProcessState.TERMINATED && !from.isTerminal()) {
                doTerminate(pid, TerminalReason.USER_CANCELLED, reason);
            } else if (newState == ProcessState.READY
                    && (from == ProcessState.WAITING || from == ProcessState.BLOCKED)) {
                doResume(pid, null);
            } else {
                lifecycle.transition(pid, newState, reason);
            }
            return ProcessInfo.of(pcb);
        });
    }

    /** Running → Waiting on the given interrupt, which is also placed on the process's envelope. */
    public ProcessInfo waitProcess(String pid, String interruptId) {
        return locked("waitProcess", () -> {
            FlowInterrupt interrupt = interrupts.get(interruptId)
                    .orElseThrow(() -> KernelException.notFound("interrupt", interruptId));
            lifecycle.waitOn(pid, interrupt.getKind());
            attachInterrupt(pid, interrupt);
            return ProcessInfo.of(lifecycle.require(pid));
        });
    }

    public ProcessInfo blockProcess(String pid, String reason) {
        return locked("blockProcess", () -> {
            lifecycle.block(pid, reason);
            return ProcessInfo.of(lifecycle.require(pid));
        });
    }

    /**
     * Waiting|Blocked → Ready. Clears the envelope's interrupt and, when a response is given, stores it in the
     * envelope metadata under {@code last_interrupt_response}.
     */
    public ProcessInfo resumeProcess(String pid, InterruptResponse response) {
        return locked("resumeProcess", () -> {
            doResume(pid, response);
            return ProcessInfo.of(lifecycle.require(pid));
        });
    }

    private void doResume(String pid, InterruptResponse response) {
        lifecycle.resume(pid);
        releaseEnvelopeInterrupt(pid, response);
    }

    private void releaseEnvelopeInterrupt(String pid, InterruptResponse response) {
        Envelope envelope = envelopes.get(pid);
        if (envelope == null || envelope.isTerminated()) {
            return;
        }
        if (envelope.getInterrupt() != null) {
            interruptOwners.remove(envelope.getInterrupt().getId());
        }
        envelope.clearInterrupt();
        if (response != null) {
            envelope.putMetadata(LAST_INTERRUPT_RESPONSE_KEY, responseToMap(response));
        }
    }

    private static Map<String, Object> responseToMap(InterruptResponse response) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (response.getText() != null) map.put("text", response.getText());
        if (response.getApproved() != null) map.put("approved", response.getApproved());
        if (response.getDecision() != null) map.put("decision", response.getDecision());
        if (response.getData() != null) map.put("data", new LinkedHashMap<>(response.getData()));
        if (response.getReceivedAt() != null) map.put("received_at", response.getReceivedAt().toString());
        return map;
    }

    /**
     * Terminates the process and its envelope, and cancels the envelope's pending interrupt. Idempotent.
     *
     * @param reason envelope terminal reason; {@code USER_CANCELLED} when null
     */
    public ProcessInfo terminateProcess(String pid, TerminalReason reason, String message) {
        return locked("terminateProcess", () -> {
            doTerminate(pid, reason != null ? reason : TerminalReason.USER_CANCELLED, message);
            return ProcessInfo.of(lifecycle.require(pid));
        });
    }

    private void doTerminate(String pid, TerminalReason reason, String message) {
        lifecycle.terminate(pid);
        Envelope envelope = envelopes.get(pid);
        if (envelope == null) {
            return;
        }
        if (envelope.getInterrupt() != null && envelope.getInterrupt().isPending()) {
            interrupts.cancel(envelope.getInterrupt().getId(), "process terminated");
            interruptOwners.remove(envelope.getInterrupt().getId());
        }
        envelope.terminate(reason, message != null ? message : "Process terminated", clock.instant());
    }

    /** Terminated → Zombie, then drops the PCB, its envelope and its orchestration session. */
    public void cleanupProcess(String pid) {
        locked("cleanupProcess", () -> {
            lifecycle.cleanup(pid);
            removeProcess(pid);
            return null;
        });
    }

    private void removeProcess(String pid) {
        lifecycle.remove(pid);
        envelopes.remove(pid);
        orchestrator.removeSession(pid);
        interruptOwners.values().removeIf(pid::equals);
    }

    /**
     * @param state  null for every state
     * @param userId null for every user
     */
    public List<ProcessInfo> listProcesses(ProcessState state, String userId) {
        return locked("listProcesses", () -> {
            List<ProcessInfo> result = new ArrayList<>();
            for (ProcessControlBlock pcb : lifecycle.list()) {
                if ((state == null || pcb.getState() == state) && (userId == null || userId.equals(pcb.getUserId()))) {
                    result.add(ProcessInfo.of(pcb));
                }
            }
            return result;
        });
    }

    public Map<ProcessState, Integer> getProcessCounts() {
        return locked("getProcessCounts", lifecycle::countsByState);
    }

    // --- usage and quotas ---

    public QuotaCheckResult checkQuota(String pid) {
        return locked("checkQuota", () -> {
            ProcessControlBlock pcb = lifecycle.require(pid);
            Optional<String> violation = resources.checkQuota(pcb);
            violation.ifPresent(v -> metrics.quotaViolation(v.split(" ", 2)[0]));
            return new QuotaCheckResult(violation.orElse(null), pcb.getUsage().copy());
        });
    }

    /**
     * Adds usage to the process and to its user's aggregate.
     *
     * @throws KernelException VALIDATION for negative deltas, STATE_TRANSITION for a terminal process
     */
    public ResourceUsage recordUsage(String pid, int llmCalls, int toolCalls, long tokensIn, long tokensOut) {
        return locked("recordUsage", () -> {
            ResourceTracker.requireNonNegative(llmCalls, toolCalls, tokensIn, tokensOut);
            ProcessControlBlock pcb = requireLive(pid, "record usage for");
            pcb.getUsage().add(llmCalls, toolCalls, tokensIn, tokensOut);
            resources.recordUsage(pcb.getUserId(), llmCalls, toolCalls, tokensIn, tokensOut);
            return pcb.getUsage().copy();
        });
    }

    public ResourceUsage recordToolCall(String pid) {
        return locked("recordToolCall", () -> {
            ProcessControlBlock pcb = requireLive(pid, "record a tool call for");
            pcb.getUsage().incrementToolCalls();
            resources.recordUsage(pcb.getUserId(), 0, 1, 0, 0);
            return pcb.getUsage().copy();
        });
    }

    public ResourceUsage recordAgentHop(String pid) {
        return locked("recordAgentHop", () -> {
            ProcessControlBlock pcb = requireLive(pid, "record an agent hop for");
            pcb.getUsage().incrementAgentHops();
            return pcb.getUsage().copy();
        });
    }

    /**
     * Charges inference requests and their input size to the process.
     *
     * @throws KernelException VALIDATION for negative deltas, STATE_TRANSITION for a terminal process
     */
    public ResourceUsage recordInference(String pid, int requests, long inputChars) {
        return locked("recordInference", () -> {
            if (requests < 0 || inputChars < 0) {
                throw KernelException.validation(
                        "inference deltas must be non-negative: requests=%d input_chars=%d", requests, inputChars);
            }
            ProcessControlBlock pcb = requireLive(pid, "record inference for");
            pcb.getUsage().addInference(requests, inputChars);
            return pcb.getUsage().copy();
        });
    }

    private ProcessControlBlock requireLive(String pid, String action) {
        ProcessControlBlock pcb = lifecycle.require(pid);
        if (pcb.getState().isTerminal()) {
            throw KernelException.stateTransition("Cannot %s process %s in state %s", action, pid,
                    pcb.getState().toValue());
        }
        return pcb;
    }

    /**
     * @throws QuotaExceededException when the user is over a rate limit
     */
    public void checkRateLimit(String userId, boolean record) {
        locked("checkRateLimit", () -> {
            try {
                rateLimiter.checkRateLimit(userId, record);
            } catch (QuotaExceededException e) {
                metrics.rateLimitRejected();
                throw e;
            }
            return null;
        });
    }

    /** Requests recorded for the user in the last minute. */
    public int getCurrentRate(String userId) {
        return locked("getCurrentRate", () -> rateLimiter.getCurrentRate(userId));
    }

    public RemainingBudget getRemainingBudget(String pid) {
        return locked("getRemainingBudget", () -> resources.getRemainingBudget(lifecycle.require(pid)));
    }

    public ResourceQuota getDefaultQuota() {
        return locked("getDefaultQuota", lifecycle::getDefaultQuota);
    }

    /** Merges {@code overrides} over the current default quota; non-zero fields win. */
    public ResourceQuota setDefaultQuota(ResourceQuota overrides) {
        return locked("setDefaultQuota", () -> {
            ResourceQuota merged = overrides.mergedOver(lifecycle.getDefaultQuota());
            lifecycle.setDefaultQuota(merged);
            return merged;
        });
    }

    // --- envelopes ---

    /**
     * Creates and stores an envelope. Without a pid the generated envelope id is used as the key.
     *
     * @return snapshot of the stored envelope
     */
    public Envelope createEnvelope(String pid, String requestId, String userId, String sessionId, String rawInput) {
        return locked("createEnvelope", () -> {
            Envelope envelope = new Envelope(null, requestId, userId, sessionId, rawInput, clock.instant());
            String key = pid != null && !pid.isBlank() ? pid : envelope.getEnvelopeId();
            if (envelopes.containsKey(key)) {
                throw KernelException.validation("envelope already exists for process: %s", key);
            }
            envelopes.put(key, envelope);
            log.debug("Envelope create | pid={} envelopeId={}", key, envelope.getEnvelopeId());
            return EnvelopeJson.copy(envelope);
        });
    }

    /** Stores a copy of the envelope for {@code pid}, replacing any previous one; an existing session follows it. */
    public void storeEnvelope(String pid, Envelope envelope) {
        locked("storeEnvelope", () -> {
            if (pid == null || pid.isBlank()) {
                throw KernelException.validation("pid is required");
            }
            Envelope stored = EnvelopeJson.copy(Objects.requireNonNull(envelope, "envelope"));
            envelopes.put(pid, stored);
            orchestrator.replaceEnvelope(pid, stored);
            return null;
        });
    }

    public Envelope getEnvelope(String pid) {
        return locked("getEnvelope", () -> EnvelopeJson.copy(requireEnvelope(pid)));
    }

    /**
     * Replaces a stored envelope with a caller-updated copy.
     *
     * @throws KernelException NOT_FOUND when none is stored, STATE_TRANSITION when the stored one is terminated
     */
    public Envelope updateEnvelope(String pid, Envelope updated) {
        return locked("updateEnvelope", () -> {
            Envelope current = requireEnvelope(pid);
            if (current.isTerminated()) {
                throw KernelException.stateTransition("Envelope %s is terminated (%s)", current.getEnvelopeId(),
                        current.getTerminalReason().toValue());
            }
            if (updated == null) {
                throw KernelException.validation("envelope is required");
            }
            Envelope stored = EnvelopeJson.copy(updated);
            envelopes.put(pid, stored);
            orchestrator.replaceEnvelope(pid, stored);
            return EnvelopeJson.copy(stored);
        });
    }

    public BoundsCheckResult checkBounds(String pid) {
        return locked("checkBounds", () -> {
            Envelope envelope = requireEnvelope(pid);
            return BoundsCheckResult.of(envelope, Orchestrator.checkBounds(envelope));
        });
    }

    /** Deep copy under a fresh envelope id, stored under that id. */
    public Envelope cloneEnvelope(String pid) {
        return locked("cloneEnvelope", () -> {
            Envelope clone = EnvelopeJson.copyWithId(requireEnvelope(pid), Envelope.newEnvelopeId());
            envelopes.put(clone.getEnvelopeId(), clone);
            return EnvelopeJson.copy(clone);
        });
    }

    private Envelope requireEnvelope(String pid) {
        Envelope envelope = pid != null ? envelopes.get(pid) : null;
        if (envelope == null) {
            throw KernelException.notFound("envelope", pid);
        }
        return envelope;
    }

    // --- interrupts ---

    /**
     * Creates an interrupt. With a known {@code pid}, missing request/user/session ids are taken from the
     * process, the interrupt is placed on its envelope and a Running process moves to Waiting.
     */
    public FlowInterrupt createInterrupt(String pid, InterruptKind kind, String requestId, String userId,
                                         String sessionId, String question, String message, Map<String, Object> data) {
        return locked("createInterrupt", () -> raiseInterrupt(pid, kind, requestId, userId, sessionId, question,
                message, data).copy());
    }

    private FlowInterrupt raiseInterrupt(String pid, InterruptKind kind, String requestId, String userId,
                                         String sessionId, String question, String message, Map<String, Object> data) {
        ProcessControlBlock pcb = pid != null ? lifecycle.get(pid).orElse(null) : null;
        Envelope envelope = pid != null ? envelopes.get(pid) : null;
        String req = requestId != null ? requestId : pcb != null ? pcb.getRequestId() : null;
        String user = userId != null ? userId : pcb != null ? pcb.getUserId() : null;
        String session = sessionId != null ? sessionId : pcb != null ? pcb.getSessionId() : null;
        FlowInterrupt interrupt = interrupts.create(kind, req, user, session,
                envelope != null ? envelope.getEnvelopeId() : null, question, message, data);
        if (envelope != null && !envelope.isTerminated()) {
            attachInterrupt(pid, interrupt);
        }
        if (pcb != null && pcb.getState() == ProcessState.RUNNING) {
            lifecycle.waitOn(pid, kind);
        }
        return interrupt;
    }

    private void attachInterrupt(String pid, FlowInterrupt interrupt) {
        Envelope envelope = envelopes.get(pid);
        if (envelope != null && !envelope.isTerminated()) {
            envelope.setInterrupt(interrupt);
            interruptOwners.put(interrupt.getId(), pid);
        }
    }

    /**
     * Resolves an interrupt. On success the owning process, if waiting, is resumed and the response is stored on
     * its envelope.
     *
     * @return false when the interrupt is unknown, not pending, expired or owned by another user
     */
    public boolean resolveInterrupt(String interruptId, InterruptResponse response, String userId) {
        return locked("resolveInterrupt", () -> {
            boolean resolved = interrupts.resolve(interruptId, response, userId);
            if (resolved) {
                FlowInterrupt interrupt = interrupts.get(interruptId).orElseThrow();
                release(interruptId, interrupt.getResponse());
            }
            return resolved;
        });
    }

    public boolean cancelInterrupt(String interruptId, String reason) {
        return locked("cancelInterrupt", () -> {
            boolean cancelled = interrupts.cancel(interruptId, reason);
            if (cancelled) {
                release(interruptId, null);
            }
            return cancelled;
        });
    }

    private void release(String interruptId, InterruptResponse response) {
        String pid = interruptOwners.remove(interruptId);
        if (pid == null) {
            return;
        }
        Optional<ProcessControlBlock> pcb = lifecycle.get(pid);
        if (pcb.isPresent() && pcb.get().getState() == ProcessState.WAITING) {
            lifecycle.resume(pid);
        }
        releaseEnvelopeInterrupt(pid, response);
    }

    public Optional<FlowInterrupt> getInterrupt(String interruptId) {
        return locked("getInterrupt", () -> interrupts.get(interruptId).map(FlowInterrupt::copy));
    }

    public List<FlowInterrupt> getPendingForSession(String sessionId, Collection<InterruptKind> kinds) {
        return locked("getPendingForSession", () -> interrupts.getPendingForSession(sessionId, kinds).stream()
                .map(FlowInterrupt::copy)
                .collect(Collectors.toList()));
    }

    // --- orchestration ---

    /**
     * Binds a pipeline to the process. A given envelope is stored for the pid first; otherwise the stored
     * envelope is used.
     */
    public SessionState initializeSession(String pid, PipelineConfig config, Envelope envelope, boolean force) {
        return locked("initializeSession", () -> {
            Envelope target = envelope != null ? EnvelopeJson.copy(envelope) : requireEnvelope(pid);
            SessionState state = orchestrator.initializeSession(pid, config, target, force);
            envelopes.put(pid, target);
            return state;
        });
    }

    /** Next instruction; a TERMINATE also terminates the process when it is still live. */
    public Instruction getNextInstruction(String pid) {
        return locked("getNextInstruction", () -> {
            Instruction instruction = orchestrator.getNextInstruction(pid);
            Optional<ProcessControlBlock> pcb = lifecycle.get(pid);
            if (pcb.isPresent()) {
                if (instruction.getKind() == InstructionKind.TERMINATE && !pcb.get().getState().isTerminal()) {
                    lifecycle.terminate(pid);
                } else if (instruction.getKind() == InstructionKind.RUN_AGENT) {
                    pcb.get().setCurrentStage(instruction.getAgentName());
                }
            }
            return instruction;
        });
    }

    /**
     * Folds an agent result into the session. Metrics are also charged to the process and its user. A route to
     * clarification or confirmation raises the matching interrupt, its question and message read from the output's
     * {@code question} and {@code message} keys.
     */
    public RoutingDecision reportAgentResult(String pid, String agentName, Map<String, Object> output,
                                             AgentExecutionMetrics metrics, boolean success, String error) {
        return locked("reportAgentResult", () -> {
            RoutingDecision decision = orchestrator.reportAgentResult(pid, agentName, output, metrics, success, error);
            Optional<ProcessControlBlock> pcb = lifecycle.get(pid);
            if (pcb.isPresent() && !pcb.get().getState().isTerminal()) {
                ProcessControlBlock p = pcb.get();
                if (metrics != null) {
                    p.getUsage().add(metrics.getLlmCalls(), metrics.getToolCalls(),
                            metrics.getTokensIn(), metrics.getTokensOut());
                    resources.recordUsage(p.getUserId(), metrics.getLlmCalls(), metrics.getToolCalls(),
                            metrics.getTokensIn(), metrics.getTokensOut());
                }
                p.getUsage().incrementAgentHops();
                if (orchestrator.hasSession(pid)) {
                    p.getUsage().recordIteration(orchestrator.getSessionState(pid).getIteration());
                }
                if (decision.getTerminalReason() != null) {
                    lifecycle.terminate(pid);
                }
            }
            if (decision.requiresInterrupt()) {
                raiseInterrupt(pid, decision.getInterruptKind(), null, null, null,
                        outputText(output, "question"), outputText(output, "message"), null);
            }
            return decision;
        });
    }

    private static String outputText(Map<String, Object> output, String key) {
        Object value = output != null ? output.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public SessionState getSessionState(String pid) {
        return locked("getSessionState", () -> orchestrator.getSessionState(pid));
    }

    // --- status ---

    public SystemStatus getSystemStatus() {
        return locked("getSystemStatus", () -> {
            Map<String, Integer> byState = new LinkedHashMap<>();
            lifecycle.countsByState().forEach((state, count) -> byState.put(state.toValue(), count));
            return new SystemStatus(lifecycle.count(), byState, lifecycle.queueDepth(), orchestrator.sessionCount(),
                    envelopes.size(), interrupts.getStats(), rateLimiter.trackedUserCount(),
                    resources.trackedUserCount());
        });
    }

    // --- cleanup phases, each under the lock on its own ---

    /**
     * Removes Zombie processes and Terminated ones completed before {@code now - retention}, with their envelopes
     * and sessions. Returns how many processes were removed.
     */
    public int cleanupZombies(Duration retention) {
        return locked("cleanupZombies", () -> {
            Instant cutoff = clock.instant().minus(retention);
            int removed = 0;
            for (ProcessControlBlock pcb : lifecycle.list()) {
                boolean expired = pcb.getState() == ProcessState.TERMINATED
                        && pcb.getCompletedAt() != null && pcb.getCompletedAt().isBefore(cutoff);
                if (expired) {
                    lifecycle.cleanup(pcb.getPid());
                }
                if (pcb.getState() == ProcessState.ZOMBIE) {
                    removeProcess(pcb.getPid());
                    removed++;
                }
            }
            metrics.cleanupRemoved("zombies", removed);
            return removed;
        });
    }

    /**
     * Drops envelopes with neither a process nor a session that were completed (or, if never completed,
     * created) before {@code now - retention}.
     */
    public int cleanupOrphanEnvelopes(Duration retention) {
        return locked("cleanupOrphanEnvelopes", () -> {
            Instant cutoff = clock.instant().minus(retention);
            int removed = 0;
            Iterator<Map.Entry<String, Envelope>> it = envelopes.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Envelope> entry = it.next();
                String pid = entry.getKey();
                Envelope envelope = entry.getValue();
                Instant last = envelope.getCompletedAt() != null ? envelope.getCompletedAt() : envelope.getCreatedAt();
                boolean orphan = lifecycle.get(pid).isEmpty() && !orchestrator.hasSession(pid);
                if (orphan && last != null && last.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            metrics.cleanupRemoved("envelopes", removed);
            return removed;
        });
    }

    public int cleanupStaleSessions(Duration retention) {
        return locked("cleanupStaleSessions", () -> {
            List<String> stale = orchestrator.cleanupStaleSessions(retention);
            stale.forEach(envelopes::remove);
            int removed = stale.size();
            metrics.cleanupRemoved("sessions", removed);
            return removed;
        });
    }

    /** Expires overdue interrupts, then purges non-pending ones older than {@code retention}. */
    public int cleanupResolvedInterrupts(Duration retention) {
        return locked("cleanupResolvedInterrupts", () -> {
            interrupts.expirePending();
            int removed = interrupts.cleanupResolved(retention);
            interruptOwners.keySet().removeIf(id -> interrupts.get(id).isEmpty());
            metrics.cleanupRemoved("interrupts", removed);
            return removed;
        });
    }

    /** Drops rate windows idle for an hour. */
    public int cleanupRateLimits() {
        return locked("cleanupRateLimits", () -> {
            int removed = rateLimiter.cleanupExpired();
            metrics.cleanupRemoved("rate_windows", removed);
            return removed;
        });
    }

    /** Trims usage aggregates to {@code maxEntries}, keeping users with live processes first. */
    public int cleanupUserUsage(int maxEntries) {
        return locked("cleanupUserUsage", () -> {
            Set<String> active = new HashSet<>();
            for (ProcessControlBlock pcb : lifecycle.list()) {
                if (!pcb.getState().isTerminal()) {
                    active.add(pcb.getUserId());
                }
            }
            int removed = resources.cleanupStaleUsers(active, maxEntries);
            metrics.cleanupRemoved("user_usage", removed);
            return removed;
        });
    }

    public KernelMetrics getMetrics() {
        return metrics;
    }

    public Clock getClock() {
        return clock;
    }
}
