package com.olo.kernel.interrupt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Answer attached to an interrupt on resolution. Which fields are meaningful depends on the kind:
 * text for clarification, approved for confirmation, decision for agent review.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class InterruptResponse {

    private final String text;
    private final Boolean approved;
    private final String decision;
    private final Map<String, Object> data;
    private final Instant receivedAt;

    @JsonCreator
    public InterruptResponse(
            @JsonProperty("text") String text,
            @JsonProperty("approved") Boolean approved,
            @JsonProperty("decision") String decision,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("received_at") Instant receivedAt) {
        this.text = text;
        this.approved = approved;
        this.decision = decision;
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
        this.receivedAt = receivedAt;
    }

    public static InterruptResponse ofText(String text) {
        return new InterruptResponse(text, null, null, null, null);
    }

    public static InterruptResponse ofApproval(boolean approved) {
        return new InterruptResponse(null, approved, null, null, null);
    }

    /** Copy stamped with the time the kernel received it. */
    public InterruptResponse receivedAt(Instant at) {
        return new InterruptResponse(text, approved, decision, data, at);
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("approved")
    public Boolean getApproved() {
        return approved;
    }

    @JsonProperty("decision")
    public String getDecision() {
        return decision;
    }

    @JsonProperty("data")
    public Map<String, Object> getData() {
        return data;
    }

    @JsonProperty("received_at")
    public Instant getReceivedAt() {
        return receivedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InterruptResponse that = (InterruptResponse) o;
        return Objects.equals(text, that.text)
                && Objects.equals(approved, that.approved)
                && Objects.equals(decision, that.decision)
                && Objects.equals(data, that.data)
                && Objects.equals(receivedAt, that.receivedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, approved, decision, data, receivedAt);
    }
}
