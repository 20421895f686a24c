package com.olo.kernel.interrupt.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Interrupt table counts by status and by kind (lower-case values as keys). */
public final class InterruptStats {

    private final int total;
    private final Map<String, Integer> byStatus;
    private final Map<String, Integer> byKind;

    public InterruptStats(int total, Map<String, Integer> byStatus, Map<String, Integer> byKind) {
        this.total = total;
        this.byStatus = Map.copyOf(byStatus);
        this.byKind = Map.copyOf(byKind);
    }

    @JsonProperty("total")
    public int getTotal() {
        return total;
    }

    @JsonProperty("by_status")
    public Map<String, Integer> getByStatus() {
        return byStatus;
    }

    @JsonProperty("by_kind")
    public Map<String, Integer> getByKind() {
        return byKind;
    }

    public int countByStatus(String status) {
        return byStatus.getOrDefault(status, 0);
    }
}
