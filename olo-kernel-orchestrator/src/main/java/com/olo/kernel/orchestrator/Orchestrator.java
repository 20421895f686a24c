package com.olo.kernel.orchestrator;

import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.EnvelopeJson;
import com.olo.kernel.envelope.ProcessingRecord;
import com.olo.kernel.envelope.TerminalReason;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.pipeline.AgentConfig;
import com.olo.kernel.pipeline.PipelineConfig;
import com.olo.kernel.pipeline.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kernel-side pipeline driver. Turns envelope state into the next {@link Instruction} and folds reported
 * agent results back into the envelope: routing, edge limits and bounds.
 * <p>
 * A session holds the same {@link Envelope} instance the kernel stores for the process, so every change made
 * here is visible through the kernel's envelope table. Not thread-safe; the kernel serializes calls.
 */
public final class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String LAST_ERROR_KEY = "last_error";

    private final Clock clock;
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    public Orchestrator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Orchestrator() {
        this(Clock.systemUTC());
    }

    /**
     * Binds a validated pipeline to the process's envelope. Bounds and stage order are copied into the envelope;
     * a cursor that does not name a stage is moved to the first one.
     *
     * @param force replace an existing session for the same pid
     * @throws KernelException VALIDATION for an existing session without force or an invalid config
     */
    public SessionState initializeSession(String pid, PipelineConfig config, Envelope envelope, boolean force) {
        if (pid == null || pid.isBlank()) {
            throw KernelException.validation("process_id is required");
        }
        if (sessions.containsKey(pid) && !force) {
            throw KernelException.validation("Session already exists for process: %s (use force=true to replace)", pid);
        }
        if (config == null) {
            throw KernelException.validation("pipeline_config is required");
        }
        if (envelope == null) {
            throw KernelException.validation("envelope is required");
        }
        config.validate();

        envelope.setBounds(config.getMaxIterations(), config.getMaxLlmCalls(), config.getMaxAgentHops());
        envelope.setStageOrder(config.getStageOrder());
        envelope.setParallelMode(config.isEnableDagExecution());
        if (!config.hasStage(envelope.getCurrentStage())) {
            envelope.setCurrentStage(config.getStageOrder().get(0));
        }

        Instant now = clock.instant();
        Session session = new Session(pid, config, envelope, now);
        Session replaced = sessions.put(pid, session);
        log.info("Orchestrator init | pid={} pipeline={} stages={} firstStage={} replaced={}",
                pid, config.getName(), config.getStageOrder().size(), envelope.getCurrentStage(), replaced != null);
        return buildState(session);
    }

    /**
     * Decides what the worker does next. Checked in order: already terminated, pending failure, end of pipeline,
     * pending interrupt, bounds (LLM calls, iterations, agent hops), unknown stage; otherwise run the current
     * stage's agent.
     *
     * @throws KernelException NOT_FOUND for an unknown session
     */
    public Instruction getNextInstruction(String pid) {
        Session session = require(pid);
        Instant now = clock.instant();
        session.lastActivityAt = now;
        Envelope envelope = session.envelope;

        if (envelope.isTerminated()) {
            return Instruction.terminate(envelope.getTerminalReason(), envelope.getTerminationReason(),
                    EnvelopeJson.copy(envelope));
        }
        if (session.pendingFailure != null) {
            return terminate(session, TerminalReason.TOOL_FAILED_FATALLY,
                    "Agent failed without error route: " + session.pendingFailure, now);
        }
        if (Envelope.END_STAGE.equals(envelope.getCurrentStage())) {
            return terminate(session, TerminalReason.COMPLETED, "Pipeline completed", now);
        }
        if (envelope.isInterruptPending()) {
            log.debug("Orchestrator wait | pid={} interruptId={}", pid,
                    envelope.getInterrupt() != null ? envelope.getInterrupt().getId() : null);
            Envelope snapshot = EnvelopeJson.copy(envelope);
            return Instruction.waitInterrupt(snapshot.getInterrupt(), snapshot);
        }
        TerminalReason exceeded = checkBounds(envelope);
        if (exceeded != null) {
            return terminate(session, exceeded, "Bounds exceeded: " + exceeded.toValue(), now);
        }
        AgentConfig agent = session.config.getAgent(envelope.getCurrentStage());
        if (agent == null) {
            return terminate(session, TerminalReason.TOOL_FAILED_FATALLY,
                    "Stage not found in pipeline: " + envelope.getCurrentStage(), now);
        }
        if (!envelope.getActiveStages().contains(agent.getName())) {
            envelope.startStage(agent.getName());
            envelope.recordAgentStart(agent.getName(), agent.getStageOrder(), now);
        }
        session.started = true;
        log.info("Orchestrator run | pid={} agent={} iteration={} llmCalls={} agentHops={}",
                pid, agent.getName(), envelope.getIteration(), envelope.getLlmCallCount(), envelope.getAgentHopCount());
        return Instruction.runAgent(agent, EnvelopeJson.copy(envelope));
    }

    /** First exceeded bound in the order LLM calls, iterations, agent hops; null when within bounds. */
    public static TerminalReason checkBounds(Envelope envelope) {
        if (envelope.getLlmCallCount() >= envelope.getMaxLlmCalls()) {
            return TerminalReason.MAX_LLM_CALLS_EXCEEDED;
        }
        if (envelope.getIteration() >= envelope.getMaxIterations()) {
            return TerminalReason.MAX_ITERATIONS_EXCEEDED;
        }
        if (envelope.getAgentHopCount() >= envelope.getMaxAgentHops()) {
            return TerminalReason.MAX_AGENT_HOPS_EXCEEDED;
        }
        return null;
    }

    private Instruction terminate(Session session, TerminalReason reason, String message, Instant now) {
        session.envelope.terminate(reason, message, now);
        log.info("Orchestrator terminate | pid={} reason={} message={}", session.pid, reason.toValue(), message);
        return Instruction.terminate(reason, message, EnvelopeJson.copy(session.envelope));
    }

    /**
     * Folds one agent result into the envelope and moves the stage cursor.
     * <p>
     * On success the output is routed through the agent's rules, then {@code default_next}, then stage order.
     * On failure the error is recorded and {@code error_next} is followed; without one the session fails on the
     * next instruction. A result for a terminated envelope is recorded in the history only.
     *
     * @throws KernelException NOT_FOUND for an unknown session, VALIDATION for an unknown agent or negative metrics
     */
    public RoutingDecision reportAgentResult(String pid, String agentName, Map<String, Object> output,
                                             AgentExecutionMetrics metrics, boolean success, String error) {
        Session session = require(pid);
        Instant now = clock.instant();
        session.lastActivityAt = now;
        Envelope envelope = session.envelope;
        AgentExecutionMetrics m = metrics != null ? metrics : AgentExecutionMetrics.NONE;
        m.requireNonNegative();
        AgentConfig agent = session.config.getAgent(agentName);
        if (agent == null) {
            throw KernelException.validation("Unknown agent %s in pipeline %s", agentName, session.config.getName());
        }
        String status = success ? ProcessingRecord.STATUS_SUCCESS : ProcessingRecord.STATUS_ERROR;

        if (envelope.isTerminated()) {
            envelope.recordAgentComplete(agentName, agent.getStageOrder(), status, error, m.getLlmCalls(), now);
            if (!success) {
                envelope.addError(agentName, error, now);
            }
            log.info("Orchestrator report | pid={} agent={} ignored=envelope terminated", pid, agentName);
            return RoutingDecision.recordedOnly(agentName);
        }

        envelope.setOutput(agent.getOutputKey(), output);
        envelope.incrementLlmCalls(m.getLlmCalls());
        envelope.incrementToolCalls(m.getToolCalls());
        envelope.addTokens(m.getTokensIn(), m.getTokensOut());
        envelope.incrementAgentHops();
        envelope.recordAgentComplete(agentName, agent.getStageOrder(), status, error, m.getLlmCalls(), now);

        if (!success) {
            String message = error != null ? error : "agent failed";
            envelope.putOutputValue(agent.getOutputKey(), "error", message);
            envelope.putMetadata(LAST_ERROR_KEY, message);
            envelope.addError(agentName, message, now);
            envelope.failStage(agentName, message);
            if (agent.getErrorNext() == null) {
                session.pendingFailure = agentName + ": " + message;
                log.warn("Orchestrator report | pid={} agent={} failed without error route: {}", pid, agentName, message);
                return RoutingDecision.failedFatally(agentName);
            }
            log.info("Orchestrator report | pid={} agent={} failed, routing to error_next={}",
                    pid, agentName, agent.getErrorNext());
            return moveTo(session, agentName, agent.getErrorNext(), now);
        }

        envelope.completeStage(agentName);
        String target = route(session.config, agent, output);
        log.info("Orchestrator report | pid={} agent={} success, next={}", pid, agentName, target);
        return moveTo(session, agentName, target, now);
    }

    /** Routing rules in order, then {@code default_next}, then the next stage by order ({@code end} after the last). */
    static String route(PipelineConfig config, AgentConfig agent, Map<String, Object> output) {
        for (RoutingRule rule : agent.getRoutingRules()) {
            if (rule.matches(output)) {
                return rule.getTarget();
            }
        }
        if (agent.getDefaultNext() != null) {
            return agent.getDefaultNext();
        }
        return config.nextInOrder(agent.getName());
    }

    private RoutingDecision moveTo(Session session, String from, String target, Instant now) {
        Envelope envelope = session.envelope;
        if (PipelineConfig.CLARIFICATION.equals(target)) {
            envelope.setCurrentStage(from);
            return RoutingDecision.interrupt(from, target, InterruptKind.CLARIFICATION);
        }
        if (PipelineConfig.CONFIRMATION.equals(target)) {
            envelope.setCurrentStage(from);
            return RoutingDecision.interrupt(from, target, InterruptKind.CONFIRMATION);
        }
        String edge = from + "->" + target;
        int traversals = session.edgeTraversals.merge(edge, 1, Integer::sum);
        int limit = session.config.getEdgeLimit(from, target);
        if (limit > 0 && traversals > limit) {
            String message = String.format("Edge limit exceeded: %s (%d > %d)", edge, traversals, limit);
            envelope.terminate(TerminalReason.MAX_ITERATIONS_EXCEEDED, message, now);
            log.info("Orchestrator terminate | pid={} reason={} message={}",
                    session.pid, TerminalReason.MAX_ITERATIONS_EXCEEDED.toValue(), message);
            return RoutingDecision.terminated(from, target, TerminalReason.MAX_ITERATIONS_EXCEEDED);
        }
        if (!Envelope.END_STAGE.equals(target)
                && session.config.indexOf(target) <= session.config.indexOf(from)) {
            envelope.incrementIteration();
        }
        envelope.setCurrentStage(target);
        return RoutingDecision.advance(from, target);
    }

    /**
     * @throws KernelException NOT_FOUND for an unknown session
     */
    public SessionState getSessionState(String pid) {
        return buildState(require(pid));
    }

    /**
     * Points the session at a replacement envelope for the same process. No-op when there is no session.
     */
    public void replaceEnvelope(String pid, Envelope envelope) {
        Session session = pid != null ? sessions.get(pid) : null;
        if (session != null) {
            session.envelope = Objects.requireNonNull(envelope, "envelope");
            session.lastActivityAt = clock.instant();
        }
    }

    public boolean hasSession(String pid) {
        return pid != null && sessions.containsKey(pid);
    }

    public boolean removeSession(String pid) {
        return sessions.remove(pid) != null;
    }

    public int sessionCount() {
        return sessions.size();
    }

    /** Removes sessions idle for longer than {@code retention}. Returns the removed pids. */
    public List<String> cleanupStaleSessions(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        List<String> removed = new ArrayList<>();
        Iterator<Session> it = sessions.values().iterator();
        while (it.hasNext()) {
            Session session = it.next();
            if (session.lastActivityAt.isBefore(cutoff)) {
                it.remove();
                removed.add(session.pid);
            }
        }
        if (!removed.isEmpty()) {
            log.info("Orchestrator cleanup | removed={} remaining={}", removed.size(), sessions.size());
        }
        return removed;
    }

    private Session require(String pid) {
        Session session = pid != null ? sessions.get(pid) : null;
        if (session == null) {
            throw KernelException.notFound("session", pid);
        }
        return session;
    }

    private SessionState buildState(Session session) {
        Envelope envelope = session.envelope;
        SessionStatus status;
        if (envelope.isTerminated()) {
            status = SessionStatus.TERMINATED;
        } else if (envelope.isInterruptPending()) {
            status = SessionStatus.WAITING;
        } else if (session.started) {
            status = SessionStatus.RUNNING;
        } else {
            status = SessionStatus.INITIALIZED;
        }
        List<String> ready = session.config.isEnableDagExecution()
                ? session.config.getReadyStages(envelope.getCompletedStages(), envelope.getFailedStages().keySet())
                : null;
        return new SessionState(session.pid, session.config.getName(), status, envelope.getCurrentStage(),
                envelope.getStageOrder(), ready, envelope.getIteration(), session.edgeTraversals,
                envelope.getTerminalReason(), session.createdAt, session.lastActivityAt, EnvelopeJson.copy(envelope));
    }

    private static final class Session {
        private final String pid;
        private final PipelineConfig config;
        private Envelope envelope;
        private final Map<String, Integer> edgeTraversals = new HashMap<>();
        private final Instant createdAt;
        private Instant lastActivityAt;
        private String pendingFailure;
        private boolean started;

        private Session(String pid, PipelineConfig config, Envelope envelope, Instant now) {
            this.pid = pid;
            this.config = config;
            this.envelope = envelope;
            this.createdAt = now;
            this.lastActivityAt = now;
        }
    }
}
