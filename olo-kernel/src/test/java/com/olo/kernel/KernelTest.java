package com.olo.kernel;

import com.olo.kernel.config.KernelConfig;
import com.olo.kernel.envelope.Envelope;
import com.olo.kernel.envelope.TerminalReason;
import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.FlowInterrupt;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.interrupt.InterruptResponse;
import com.olo.kernel.interrupt.InterruptStatus;
import com.olo.kernel.orchestrator.AgentExecutionMetrics;
import com.olo.kernel.orchestrator.Instruction;
import com.olo.kernel.orchestrator.InstructionKind;
import com.olo.kernel.orchestrator.RoutingDecision;
import com.olo.kernel.orchestrator.SessionStatus;
import com.olo.kernel.pipeline.AgentConfig;
import com.olo.kernel.pipeline.PipelineConfig;
import com.olo.kernel.pipeline.RoutingRule;
import com.olo.kernel.process.ProcessState;
import com.olo.kernel.process.ResourceQuota;
import com.olo.kernel.process.ResourceUsage;
import com.olo.kernel.process.SchedulingPriority;
import com.olo.kernel.quota.QuotaExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KernelTest {

    private MutableClock clock;
    private KernelMetrics metrics;
    private Kernel kernel;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        metrics = new KernelMetrics();
        kernel = new Kernel(KernelConfig.builder().build(), clock, metrics);
    }

    private ProcessInfo running(String pid) {
        kernel.createProcess(pid, "req-" + pid, "u1", "s1", SchedulingPriority.NORMAL, null);
        kernel.getNextRunnable();
        return kernel.startProcess(pid);
    }

    @Test
    void createProcess_schedulesAndReturnsExistingOnDuplicate() {
        ProcessInfo created = kernel.createProcess("p1", "r1", "u1", "s1", null, null);
        ProcessInfo again = kernel.createProcess("p1", "r-other", "u1", "s1", SchedulingPriority.HIGH, null);

        assertEquals(ProcessState.READY, created.getState());
        assertEquals("r1", again.getRequestId());
        assertEquals(SchedulingPriority.NORMAL, again.getPriority());
        assertEquals(1.0, metrics.total(KernelMetrics.PROCESSES_CREATED));
        assertEquals(1, kernel.getSystemStatus().getQueueDepth());
    }

    @Test
    void createProcess_rejectsUserOverBurst() {
        kernel = new Kernel(KernelConfig.builder().rateLimitBurst(2).build(), clock, metrics);
        kernel.createProcess("p1", "r1", "u1", "s-u1", null, null);
        kernel.createProcess("p2", "r2", "u1", "s-u1", null, null);

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> kernel.createProcess("p3", "r3", "u1", "s-u1", null, null));

        assertEquals(ErrorKind.QUOTA_EXCEEDED, e.getKind());
        assertEquals("Burst limit exceeded: 2 requests per 10 seconds", e.getMessage());
        assertEquals(1.0, metrics.total(KernelMetrics.RATE_LIMIT_REJECTIONS));
        kernel.createProcess("p4", "r4", "u2", "s-u2", null, null);
    }

    @Test
    void createProcess_invalidIdentityIsNotCountedAgainstRateLimit() {
        kernel = new Kernel(KernelConfig.builder().rateLimitBurst(1).build(), clock, metrics);

        KernelException e = assertThrows(KernelException.class,
                () -> kernel.createProcess("p1", "r1", "u1", "  ", null, null));
        assertEquals(ErrorKind.VALIDATION, e.getKind());
        assertEquals("session_id is required", e.getMessage());
        assertThrows(KernelException.class, () -> kernel.createProcess("p1", "r1", null, "s1", null, null));

        assertEquals("p2", kernel.createProcess("p2", "r2", "u1", "s1", null, null).getPid());
        assertEquals(1, kernel.getSystemStatus().getRateLimitedUsers());
    }

    @Test
    void recordUsage_overQuotaIsReportedByCheckQuota() {
        ResourceQuota quota = ResourceQuota.builder().maxLlmCalls(10).build();
        kernel.createProcess("p1", "r1", "u1", "s1", SchedulingPriority.NORMAL, quota);

        kernel.recordUsage("p1", 15, 0, 100, 50);
        QuotaCheckResult result = kernel.checkQuota("p1");

        assertFalse(result.isWithinBounds());
        assertEquals("llm_calls 15 >= 10", result.getExceededReason());
        assertEquals(15, result.getUsage().getLlmCalls());
        assertEquals(100L, result.getUsage().getTokensIn());
        assertEquals(1.0, metrics.total(KernelMetrics.QUOTA_VIOLATIONS));
    }

    @Test
    void checkQuota_withinBoundsHasNoReason() {
        kernel.createProcess("p1", "r1", "u1", "s1", null, null);
        kernel.recordToolCall("p1");

        QuotaCheckResult result = kernel.checkQuota("p1");

        assertTrue(result.isWithinBounds());
        assertNull(result.getExceededReason());
        assertEquals(1, result.getUsage().getToolCalls());
    }

    @Test
    void recordUsage_validatesInputAndState() {
        kernel.createProcess("p1", "r1", "u1", "s1", null, null);

        KernelException negative = assertThrows(KernelException.class, () -> kernel.recordUsage("p1", -1, 0, 0, 0));
        assertEquals(ErrorKind.VALIDATION, negative.getKind());

        kernel.terminateProcess("p1", null, null);
        KernelException terminal = assertThrows(KernelException.class, () -> kernel.recordUsage("p1", 1, 0, 0, 0));
        assertEquals(ErrorKind.STATE_TRANSITION, terminal.getKind());

        KernelException missing = assertThrows(KernelException.class, () -> kernel.recordAgentHop("nope"));
        assertEquals(ErrorKind.NOT_FOUND, missing.getKind());
    }

    @Test
    void getNextRunnable_prefersHighPriority() {
        kernel.createProcess("low", "r1", "u1", "s-u1", SchedulingPriority.NORMAL, null);
        kernel.createProcess("high", "r2", "u2", "s-u2", SchedulingPriority.HIGH, null);

        assertEquals("high", kernel.getNextRunnable().orElseThrow().getPid());
        assertEquals("low", kernel.getNextRunnable().orElseThrow().getPid());
        assertTrue(kernel.getNextRunnable().isEmpty());
    }

    @Test
    void createInterrupt_waitsProcessAndResolveResumesIt() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "book a flight");

        FlowInterrupt interrupt = kernel.createInterrupt("p1", InterruptKind.CLARIFICATION, null, null, null,
                "Which date?", null, null);

        assertEquals("s1", interrupt.getSessionId());
        assertEquals(ProcessState.WAITING, kernel.getProcess("p1").getState());
        assertEquals("clarification", kernel.getProcess("p1").getPendingInterrupt());
        assertTrue(kernel.getEnvelope("p1").isInterruptPending());
        assertEquals(1, kernel.getPendingForSession("s1", null).size());

        assertTrue(kernel.resolveInterrupt(interrupt.getId(), InterruptResponse.ofText("Friday"), "u1"));
        assertFalse(kernel.resolveInterrupt(interrupt.getId(), InterruptResponse.ofText("Monday"), "u1"));

        Envelope envelope = kernel.getEnvelope("p1");
        assertEquals(ProcessState.READY, kernel.getProcess("p1").getState());
        assertFalse(envelope.isInterruptPending());
        Map<?, ?> stored = (Map<?, ?>) envelope.getMetadata().get(Kernel.LAST_INTERRUPT_RESPONSE_KEY);
        assertEquals("Friday", stored.get("text"));
        assertEquals(InterruptStatus.RESOLVED, kernel.getInterrupt(interrupt.getId()).orElseThrow().getStatus());
    }

    @Test
    void interruptsHandedOutAreSnapshots() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "book a flight");
        FlowInterrupt created = kernel.createInterrupt("p1", InterruptKind.CLARIFICATION, null, null, null,
                "Which date?", null, null);
        String id = created.getId();

        assertTrue(created.resolve(null, clock.instant()));
        assertTrue(kernel.getInterrupt(id).orElseThrow().resolve(null, clock.instant()));
        assertTrue(kernel.getPendingForSession("s1", null).get(0).cancel("gone", clock.instant()));

        assertTrue(kernel.getInterrupt(id).orElseThrow().isPending());
        assertEquals(ProcessState.WAITING, kernel.getProcess("p1").getState());
        assertTrue(kernel.resolveInterrupt(id, InterruptResponse.ofText("Friday"), "u1"));
        assertEquals(ProcessState.READY, kernel.getProcess("p1").getState());
    }

    @Test
    void resolveInterrupt_rejectsOtherUser() {
        running("p1");
        FlowInterrupt interrupt = kernel.createInterrupt("p1", InterruptKind.CONFIRMATION, null, null, null,
                null, "Send the email?", null);

        assertFalse(kernel.resolveInterrupt(interrupt.getId(), InterruptResponse.ofApproval(true), "intruder"));
        assertEquals(ProcessState.WAITING, kernel.getProcess("p1").getState());
    }

    @Test
    void cancelInterrupt_resumesWaitingProcess() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "hi");
        FlowInterrupt interrupt = kernel.createInterrupt("p1", InterruptKind.AGENT_REVIEW, null, null, null,
                null, null, Map.of("agent", "critic"));

        assertTrue(kernel.cancelInterrupt(interrupt.getId(), "reviewer away"));

        assertEquals(ProcessState.READY, kernel.getProcess("p1").getState());
        assertFalse(kernel.getEnvelope("p1").isInterruptPending());
        assertFalse(kernel.cancelInterrupt(interrupt.getId(), "again"));
    }

    @Test
    void terminateProcess_terminatesEnvelopeAndCancelsInterrupt() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "hi");
        FlowInterrupt interrupt = kernel.createInterrupt("p1", InterruptKind.CLARIFICATION, null, null, null,
                "?", null, null);

        ProcessInfo info = kernel.terminateProcess("p1", null, "user closed the tab");

        assertEquals(ProcessState.TERMINATED, info.getState());
        Envelope envelope = kernel.getEnvelope("p1");
        assertTrue(envelope.isTerminated());
        assertEquals(TerminalReason.USER_CANCELLED, envelope.getTerminalReason());
        assertEquals("user closed the tab", envelope.getTerminationReason());
        assertEquals(InterruptStatus.CANCELLED, kernel.getInterrupt(interrupt.getId()).orElseThrow().getStatus());
        assertEquals(ProcessState.TERMINATED, kernel.terminateProcess("p1", null, null).getState());
    }

    @Test
    void transitionState_routesThroughResumeAndTerminate() {
        running("p1");
        kernel.blockProcess("p1", "waiting on tool slot");

        assertEquals(ProcessState.READY, kernel.transitionState("p1", ProcessState.READY, null).getState());
        assertEquals(ProcessState.TERMINATED, kernel.transitionState("p1", ProcessState.TERMINATED, "stop").getState());

        KernelException e = assertThrows(KernelException.class,
                () -> kernel.transitionState("p1", ProcessState.RUNNING, null));
        assertEquals(ErrorKind.STATE_TRANSITION, e.getKind());
    }

    @Test
    void cleanupProcess_removesProcessEnvelopeAndSession() {
        kernel.createProcess("p1", "r1", "u1", "s1", null, null);
        kernel.createEnvelope("p1", "r1", "u1", "s1", "hi");
        kernel.initializeSession("p1", PipelineConfig.linear("one", List.of(AgentConfig.of("a", 0))), null, false);

        KernelException live = assertThrows(KernelException.class, () -> kernel.cleanupProcess("p1"));
        assertEquals(ErrorKind.STATE_TRANSITION, live.getKind());

        kernel.terminateProcess("p1", TerminalReason.POLICY_VIOLATION, "blocked");
        kernel.cleanupProcess("p1");

        assertEquals(ErrorKind.NOT_FOUND, assertThrows(KernelException.class, () -> kernel.getProcess("p1")).getKind());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(KernelException.class, () -> kernel.getEnvelope("p1")).getKind());
        assertEquals(0, kernel.getSystemStatus().getOrchestrationSessions());
    }

    @Test
    void listProcesses_filtersByStateAndUser() {
        kernel.createProcess("p1", "r1", "u1", "s-u1", null, null);
        kernel.createProcess("p2", "r2", "u2", "s-u2", null, null);
        kernel.terminateProcess("p2", null, null);

        assertEquals(2, kernel.listProcesses(null, null).size());
        assertEquals("p1", kernel.listProcesses(ProcessState.READY, null).get(0).getPid());
        assertEquals("p2", kernel.listProcesses(null, "u2").get(0).getPid());
        assertTrue(kernel.listProcesses(ProcessState.READY, "u2").isEmpty());
        assertEquals(1, kernel.getProcessCounts().get(ProcessState.TERMINATED));
    }

    @Test
    void envelopes_areCopiedOnReadAndFrozenAfterTermination() {
        Envelope created = kernel.createEnvelope("p1", "r1", "u1", "s1", "hello");
        created.putMetadata("local", true);

        Envelope stored = kernel.getEnvelope("p1");
        assertFalse(stored.getMetadata().containsKey("local"));

        stored.putMetadata("tag", "x");
        kernel.updateEnvelope("p1", stored);
        assertEquals("x", kernel.getEnvelope("p1").getMetadata().get("tag"));

        Envelope terminated = kernel.getEnvelope("p1");
        terminated.terminate(TerminalReason.COMPLETED, "done", clock.instant());
        kernel.updateEnvelope("p1", terminated);
        KernelException e = assertThrows(KernelException.class,
                () -> kernel.updateEnvelope("p1", kernel.getEnvelope("p1")));
        assertEquals(ErrorKind.STATE_TRANSITION, e.getKind());
    }

    @Test
    void createEnvelope_withoutPidUsesEnvelopeIdAndDuplicatePidFails() {
        Envelope anonymous = kernel.createEnvelope(null, "r1", "u1", "s1", "hi");
        assertEquals(anonymous.getEnvelopeId(), kernel.getEnvelope(anonymous.getEnvelopeId()).getEnvelopeId());

        kernel.createEnvelope("p1", "r1", "u1", "s1", "hi");
        assertEquals(ErrorKind.VALIDATION, assertThrows(KernelException.class,
                () -> kernel.createEnvelope("p1", "r1", "u1", "s1", "again")).getKind());
    }

    @Test
    void cloneEnvelope_storesCopyUnderFreshId() {
        Envelope original = kernel.createEnvelope("p1", "r1", "u1", "s1", "hello");

        Envelope clone = kernel.cloneEnvelope("p1");

        assertNotEquals(original.getEnvelopeId(), clone.getEnvelopeId());
        assertEquals("hello", clone.getRawInput());
        assertEquals(clone.getEnvelopeId(), kernel.getEnvelope(clone.getEnvelopeId()).getEnvelopeId());
        assertEquals(2, kernel.getSystemStatus().getEnvelopes());
    }

    @Test
    void checkBounds_reportsRemainingBudget() {
        kernel.createEnvelope("p1", "r1", "u1", "s1", "hello");
        PipelineConfig config = new PipelineConfig("bounded", List.of(AgentConfig.of("a", 0)), 3, 4, 5,
                null, null, null);
        kernel.initializeSession("p1", config, null, false);

        BoundsCheckResult bounds = kernel.checkBounds("p1");

        assertTrue(bounds.isCanContinue());
        assertNull(bounds.getTerminalReason());
        assertEquals(3, bounds.getIterationsRemaining());
        assertEquals(4, bounds.getLlmCallsRemaining());
        assertEquals(5, bounds.getAgentHopsRemaining());
    }

    @Test
    void orchestration_clarificationRoundTripThenCompletion() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "book a flight");
        AgentConfig intent = AgentConfig.of("intent", 0).withRouting(
                List.of(new RoutingRule("needs_clarification", true, PipelineConfig.CLARIFICATION)), null, null);
        PipelineConfig config = PipelineConfig.linear("travel", List.of(intent, AgentConfig.of("booker", 1)));
        kernel.initializeSession("p1", config, null, false);
        AgentExecutionMetrics oneCall = new AgentExecutionMetrics(1, 0, 20L, 10L, 5L);

        Instruction first = kernel.getNextInstruction("p1");
        assertEquals(InstructionKind.RUN_AGENT, first.getKind());
        assertEquals("intent", kernel.getProcess("p1").getCurrentStage());

        RoutingDecision ask = kernel.reportAgentResult("p1", "intent",
                Map.of("needs_clarification", true, "question", "Which city?"), oneCall, true, null);
        assertTrue(ask.requiresInterrupt());
        assertEquals(ProcessState.WAITING, kernel.getProcess("p1").getState());
        assertEquals(SessionStatus.WAITING, kernel.getSessionState("p1").getStatus());

        Instruction waiting = kernel.getNextInstruction("p1");
        assertEquals(InstructionKind.WAIT_INTERRUPT, waiting.getKind());
        assertEquals("Which city?", waiting.getInterrupt().getQuestion());
        assertTrue(waiting.getInterrupt().resolve(null, clock.instant()));
        assertTrue(kernel.getSessionState("p1").getEnvelope().getInterrupt().isPending());

        assertTrue(kernel.resolveInterrupt(waiting.getInterrupt().getId(), InterruptResponse.ofText("Paris"), "u1"));
        assertEquals(ProcessState.READY, kernel.getProcess("p1").getState());

        assertEquals("intent", kernel.getNextInstruction("p1").getAgentName());
        kernel.reportAgentResult("p1", "intent", Map.of("city", "Paris"), oneCall, true, null);
        assertEquals("booker", kernel.getNextInstruction("p1").getAgentName());
        kernel.reportAgentResult("p1", "booker", Map.of("booked", true), oneCall, true, null);

        Instruction done = kernel.getNextInstruction("p1");
        assertEquals(InstructionKind.TERMINATE, done.getKind());
        assertEquals(TerminalReason.COMPLETED, done.getTerminalReason());
        ProcessInfo info = kernel.getProcess("p1");
        assertEquals(ProcessState.TERMINATED, info.getState());
        assertEquals(3, info.getUsage().getLlmCalls());
        assertEquals(3, info.getUsage().getAgentHops());
        assertEquals(60L, info.getUsage().getTokensIn());
    }

    @Test
    void reportAgentResult_fatalRouteTerminatesProcess() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "hi");
        kernel.initializeSession("p1", PipelineConfig.linear("one", List.of(AgentConfig.of("tool", 0))), null, false);
        kernel.getNextInstruction("p1");

        kernel.reportAgentResult("p1", "tool", null, null, false, "connection refused");
        Instruction next = kernel.getNextInstruction("p1");

        assertEquals(TerminalReason.TOOL_FAILED_FATALLY, next.getTerminalReason());
        assertEquals(ProcessState.TERMINATED, kernel.getProcess("p1").getState());
    }

    @Test
    void reportAgentResult_loopBackCountsTowardIterationQuota() {
        ResourceQuota quota = ResourceQuota.builder().maxIterations(1).build();
        kernel.createProcess("p1", "r1", "u1", "s1", SchedulingPriority.NORMAL, quota);
        kernel.getNextRunnable();
        kernel.startProcess("p1");
        kernel.createEnvelope("p1", "r1", "u1", "s1", "write a haiku");
        AgentConfig critic = AgentConfig.of("critic", 1)
                .withRouting(List.of(new RoutingRule("revise", true, "draft")), null, null);
        kernel.initializeSession("p1", PipelineConfig.linear("review", List.of(AgentConfig.of("draft", 0), critic)),
                null, false);

        kernel.getNextInstruction("p1");
        kernel.reportAgentResult("p1", "draft", Map.of("text", "v1"), null, true, null);
        assertEquals(0, kernel.getProcess("p1").getUsage().getIterations());
        kernel.getNextInstruction("p1");
        kernel.reportAgentResult("p1", "critic", Map.of("revise", true), null, true, null);

        assertEquals(1, kernel.getProcess("p1").getUsage().getIterations());
        assertEquals("iterations 1 >= 1", kernel.checkQuota("p1").getExceededReason());
    }

    @Test
    void recordInference_chargesProcessAndTripsQuota() {
        ResourceQuota quota = ResourceQuota.builder().maxInferenceRequests(2).build();
        kernel.createProcess("p1", "r1", "u1", "s1", null, quota);

        kernel.recordInference("p1", 1, 400);
        assertTrue(kernel.checkQuota("p1").isWithinBounds());
        ResourceUsage usage = kernel.recordInference("p1", 1, 100);

        assertEquals(2, usage.getInferenceRequests());
        assertEquals(500L, usage.getInferenceInputChars());
        assertEquals("inference_requests 2 >= 2", kernel.checkQuota("p1").getExceededReason());
        assertEquals(ErrorKind.VALIDATION,
                assertThrows(KernelException.class, () -> kernel.recordInference("p1", -1, 0)).getKind());
        kernel.terminateProcess("p1", null, null);
        assertEquals(ErrorKind.STATE_TRANSITION,
                assertThrows(KernelException.class, () -> kernel.recordInference("p1", 1, 0)).getKind());
    }

    @Test
    void createProcess_withParentLinksBothProcesses() {
        kernel.createProcess("parent", "r1", "u1", "s1", null, null);

        ProcessInfo child = kernel.createProcess("child", "r2", "u1", "s1", null, null, "parent");

        assertEquals("parent", child.getParentPid());
        assertEquals(List.of("child"), kernel.getProcess("parent").getChildPids());
        assertNull(kernel.getProcess("parent").getParentPid());
        KernelException e = assertThrows(KernelException.class,
                () -> kernel.createProcess("orphan", "r3", "u1", "s1", null, null, "ghost"));
        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
        assertEquals(2, kernel.listProcesses(null, null).size());
    }

    @Test
    void initializeSession_withoutStoredEnvelopeIsNotFound() {
        KernelException e = assertThrows(KernelException.class, () -> kernel.initializeSession("ghost",
                PipelineConfig.linear("one", List.of(AgentConfig.of("a", 0))), null, false));

        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }

    @Test
    void unexpectedFailureBecomesInternalPanic() {
        KernelException e = assertThrows(KernelException.class, () -> kernel.storeEnvelope("p1", null));

        assertEquals(ErrorKind.INTERNAL, e.getKind());
        assertEquals("Panic in storeEnvelope: envelope", e.getMessage());
        assertEquals(1.0, metrics.total(KernelMetrics.PANICS));
        assertEquals(0, kernel.getSystemStatus().getEnvelopes());
    }

    @Test
    void cleanupZombies_removesOnlyProcessesPastRetention() {
        kernel.createProcess("old", "r1", "u1", "s-u1", null, null);
        kernel.createEnvelope("old", "r1", "u1", null, "x");
        kernel.terminateProcess("old", null, null);
        clock.advance(Duration.ofHours(2));
        kernel.createProcess("recent", "r2", "u1", "s-u1", null, null);
        kernel.terminateProcess("recent", null, null);

        assertEquals(1, kernel.cleanupZombies(Duration.ofHours(1)));

        assertEquals(1, kernel.listProcesses(null, null).size());
        assertEquals("recent", kernel.listProcesses(null, null).get(0).getPid());
        assertEquals(0, kernel.getSystemStatus().getEnvelopes());
        assertEquals(1.0, metrics.total(KernelMetrics.CLEANUP_REMOVED));
    }

    @Test
    void cleanupOrphanEnvelopes_keepsEnvelopesWithProcess() {
        Envelope orphan = kernel.createEnvelope(null, "r1", "u1", null, "x");
        kernel.createProcess("p1", "r2", "u1", "s-u1", null, null);
        kernel.createEnvelope("p1", "r2", "u1", null, "y");
        clock.advance(Duration.ofDays(2));

        assertEquals(1, kernel.cleanupOrphanEnvelopes(Duration.ofDays(1)));

        assertThrows(KernelException.class, () -> kernel.getEnvelope(orphan.getEnvelopeId()));
        assertEquals("y", kernel.getEnvelope("p1").getRawInput());
    }

    @Test
    void cleanupStaleSessions_dropsSessionEnvelopesButKeepsProcess() {
        running("p1");
        kernel.createEnvelope("p1", "req-p1", "u1", "s1", "x");
        kernel.initializeSession("p1", PipelineConfig.linear("one", List.of(AgentConfig.of("a", 0))), null, false);
        clock.advance(Duration.ofHours(2));

        assertEquals(1, kernel.cleanupStaleSessions(Duration.ofHours(1)));

        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(KernelException.class, () -> kernel.getEnvelope("p1")).getKind());
        assertEquals(0, kernel.getSystemStatus().getEnvelopes());
        assertEquals(0, kernel.getSystemStatus().getOrchestrationSessions());
        assertEquals(ProcessState.RUNNING, kernel.getProcess("p1").getState());
    }

    @Test
    void getSystemStatus_summarisesTables() {
        running("p1");
        kernel.createProcess("p2", "r2", "u2", "s-u2", null, null);
        kernel.createEnvelope("p1", "r1", "u1", "s1", "x");
        kernel.createInterrupt("p1", InterruptKind.CHECKPOINT, null, null, null, null, null, null);

        SystemStatus status = kernel.getSystemStatus();

        assertEquals(2, status.getProcessesTotal());
        assertEquals(1, status.getProcessesByState().get("waiting"));
        assertEquals(1, status.getQueueDepth());
        assertEquals(1, status.getEnvelopes());
        assertEquals(1, status.getInterrupts().countByStatus("pending"));
        assertEquals(2, status.getRateLimitedUsers());
        assertEquals(0, status.getTrackedUsers());
    }
}
