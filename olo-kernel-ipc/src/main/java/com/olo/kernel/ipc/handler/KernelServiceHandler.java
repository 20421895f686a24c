package com.olo.kernel.ipc.handler;

import com.olo.kernel.Kernel;
import com.olo.kernel.ProcessInfo;
import com.olo.kernel.SystemStatus;
import com.olo.kernel.envelope.TerminalReason;
import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.InterruptResponse;
import com.olo.kernel.process.ProcessState;
import com.olo.kernel.process.ResourceQuota;
import com.olo.kernel.process.SchedulingPriority;
import com.olo.kernel.quota.QuotaExceededException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@code kernel} service: process lifecycle, usage accounting, quotas and rate limits.
 */
public final class KernelServiceHandler implements ServiceHandler {

    static final String ANONYMOUS_USER = "anonymous";

    private final Kernel kernel;

    public KernelServiceHandler(Kernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public String serviceName() {
        return "kernel";
    }

    @Override
    public Object handle(String method, RequestBody body) {
        switch (method) {
            case "CreateProcess":
                return kernel.createProcess(body.requireText("pid"),
                        body.text("request_id", generatedId("req")),
                        body.text("user_id", ANONYMOUS_USER),
                        body.text("session_id", generatedId("sess")),
                        SchedulingPriority.fromValue(body.text("priority")),
                        body.convert("quota", ResourceQuota.class),
                        body.text("parent_pid"));
            case "GetProcess":
                return kernel.getProcess(body.requireText("pid"));
            case "ScheduleProcess":
                return kernel.scheduleProcess(body.requireText("pid"));
            case "GetNextRunnable":
                return kernel.getNextRunnable()
                        .orElseThrow(() -> new KernelException(ErrorKind.NOT_FOUND, "No runnable processes"));
            case "StartProcess":
                return kernel.startProcess(body.requireText("pid"));
            case "TransitionState":
                return kernel.transitionState(body.requireText("pid"), processState(body.requireText("new_state")),
                        body.text("reason"));
            case "WaitProcess":
                return kernel.waitProcess(body.requireText("pid"), body.requireText("interrupt_id"));
            case "BlockProcess":
                return kernel.blockProcess(body.requireText("pid"), body.text("reason"));
            case "ResumeProcess":
                return kernel.resumeProcess(body.requireText("pid"), body.convert("response", InterruptResponse.class));
            case "TerminateProcess":
                return kernel.terminateProcess(body.requireText("pid"),
                        TerminalReason.fromValue(body.text("terminal_reason")), body.text("reason"));
            case "CleanupProcess":
                kernel.cleanupProcess(body.requireText("pid"));
                return Map.of("success", true);
            case "CheckQuota":
                return kernel.checkQuota(body.requireText("pid"));
            case "RecordUsage":
                return kernel.recordUsage(body.requireText("pid"),
                        body.intValue("llm_calls", 0), body.intValue("tool_calls", 0),
                        body.longValue("tokens_in", 0), body.longValue("tokens_out", 0));
            case "RecordInference":
                return kernel.recordInference(body.requireText("pid"),
                        body.intValue("requests", 1), body.longValue("input_chars", 0));
            case "RecordToolCall":
                return kernel.recordToolCall(body.requireText("pid"));
            case "RecordAgentHop":
                return kernel.recordAgentHop(body.requireText("pid"));
            case "GetRemainingBudget":
                return kernel.getRemainingBudget(body.requireText("pid"));
            case "CheckRateLimit":
                return checkRateLimit(body.requireText("user_id"), body.bool("record", true));
            case "ListProcesses":
                return listProcesses(body);
            case "GetProcessCounts":
                return processCounts();
            case "GetSystemStatus":
                return kernel.getSystemStatus();
            default:
                throw ServiceHandler.unknownMethod(serviceName(), method);
        }
    }

    private Map<String, Object> checkRateLimit(String userId, boolean record) {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            kernel.checkRateLimit(userId, record);
            result.put("allowed", true);
        } catch (QuotaExceededException e) {
            result.put("allowed", false);
            result.put("reason", e.getMessage());
            result.put("limit_type", e.getDimension());
            result.put("limit", e.getLimit());
        }
        result.put("current_count", kernel.getCurrentRate(userId));
        return result;
    }

    private Map<String, Object> listProcesses(RequestBody body) {
        String state = body.text("state");
        List<ProcessInfo> processes = kernel.listProcesses(state != null ? processState(state) : null,
                body.text("user_id"));
        return Map.of("processes", processes);
    }

    private Map<String, Object> processCounts() {
        SystemStatus status = kernel.getSystemStatus();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("counts_by_state", status.getProcessesByState());
        result.put("total", status.getProcessesTotal());
        result.put("queue_depth", status.getQueueDepth());
        return result;
    }

    static ProcessState processState(String value) {
        ProcessState state = ProcessState.fromValue(value);
        if (state == null) {
            throw KernelException.validation("Invalid process state: %s", value);
        }
        return state;
    }

    static String generatedId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
