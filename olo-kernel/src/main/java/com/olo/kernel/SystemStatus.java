package com.olo.kernel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.olo.kernel.interrupt.service.InterruptStats;

import java.util.LinkedHashMap;
import java.util.Map;

/** Snapshot of kernel table sizes. */
public final class SystemStatus {

    private final int processesTotal;
    private final Map<String, Integer> processesByState;
    private final int queueDepth;
    private final int orchestrationSessions;
    private final int envelopes;
    private final InterruptStats interrupts;
    private final int rateLimitedUsers;
    private final int trackedUsers;

    SystemStatus(int processesTotal, Map<String, Integer> processesByState, int queueDepth,
                 int orchestrationSessions, int envelopes, InterruptStats interrupts,
                 int rateLimitedUsers, int trackedUsers) {
        this.processesTotal = processesTotal;
        this.processesByState = new LinkedHashMap<>(processesByState);
        this.queueDepth = queueDepth;
        this.orchestrationSessions = orchestrationSessions;
        this.envelopes = envelopes;
        this.interrupts = interrupts;
        this.rateLimitedUsers = rateLimitedUsers;
        this.trackedUsers = trackedUsers;
    }

    @JsonProperty("processes_total")
    public int getProcessesTotal() {
        return processesTotal;
    }

    @JsonProperty("processes_by_state")
    public Map<String, Integer> getProcessesByState() {
        return processesByState;
    }

    @JsonProperty("queue_depth")
    public int getQueueDepth() {
        return queueDepth;
    }

    @JsonProperty("orchestration_sessions")
    public int getOrchestrationSessions() {
        return orchestrationSessions;
    }

    @JsonProperty("envelopes")
    public int getEnvelopes() {
        return envelopes;
    }

    @JsonProperty("interrupts")
    public InterruptStats getInterrupts() {
        return interrupts;
    }

    /** Users with a live rate-limit window. */
    @JsonProperty("rate_limited_users")
    public int getRateLimitedUsers() {
        return rateLimitedUsers;
    }

    /** Users with a usage aggregate. */
    @JsonProperty("tracked_users")
    public int getTrackedUsers() {
        return trackedUsers;
    }
}
