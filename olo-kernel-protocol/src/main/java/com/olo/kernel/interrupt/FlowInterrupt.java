package com.olo.kernel.interrupt;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A human-in-the-loop pause point. Created pending; leaves that state exactly once through
 * {@link #resolve}, {@link #cancel} or {@link #expire}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class FlowInterrupt {

    @JsonProperty("id")
    private final String id;
    @JsonProperty("kind")
    private final InterruptKind kind;
    @JsonProperty("request_id")
    private final String requestId;
    @JsonProperty("user_id")
    private final String userId;
    @JsonProperty("session_id")
    private final String sessionId;
    @JsonProperty("envelope_id")
    private final String envelopeId;
    @JsonProperty("question")
    private final String question;
    @JsonProperty("message")
    private final String message;
    @JsonProperty("data")
    private final Map<String, Object> data;
    @JsonProperty("created_at")
    private final Instant createdAt;
    @JsonProperty("expires_at")
    private final Instant expiresAt;
    @JsonProperty("status")
    private InterruptStatus status;
    @JsonProperty("response")
    private InterruptResponse response;
    @JsonProperty("resolved_at")
    private Instant resolvedAt;

    @JsonCreator
    public FlowInterrupt(
            @JsonProperty("id") String id,
            @JsonProperty("kind") InterruptKind kind,
            @JsonProperty("request_id") String requestId,
            @JsonProperty("user_id") String userId,
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("envelope_id") String envelopeId,
            @JsonProperty("question") String question,
            @JsonProperty("message") String message,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("expires_at") Instant expiresAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.requestId = requestId;
        this.userId = userId;
        this.sessionId = sessionId;
        this.envelopeId = envelopeId;
        this.question = question;
        this.message = message;
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.expiresAt = expiresAt;
        this.status = InterruptStatus.PENDING;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == InterruptStatus.PENDING;
    }

    /** True when an expiry is set and {@code now} is past it. Status is not changed. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /** Attaches the response and marks resolved. Returns false unless pending. */
    public boolean resolve(InterruptResponse response, Instant now) {
        if (!isPending()) {
            return false;
        }
        this.response = response != null ? response.receivedAt(now) : null;
        this.status = InterruptStatus.RESOLVED;
        this.resolvedAt = now;
        return true;
    }

    /** Marks cancelled, storing the reason under {@code cancel_reason}. Returns false unless pending. */
    public boolean cancel(String reason, Instant now) {
        if (!isPending()) {
            return false;
        }
        if (reason != null) {
            data.put("cancel_reason", reason);
        }
        this.status = InterruptStatus.CANCELLED;
        this.resolvedAt = now;
        return true;
    }

    public boolean expire(Instant now) {
        if (!isPending()) {
            return false;
        }
        this.status = InterruptStatus.EXPIRED;
        this.resolvedAt = now;
        return true;
    }

    /** Detached snapshot carrying the current status, response and data. */
    public FlowInterrupt copy() {
        FlowInterrupt copy = new FlowInterrupt(id, kind, requestId, userId, sessionId, envelopeId, question, message,
                data, createdAt, expiresAt);
        copy.status = status;
        copy.response = response;
        copy.resolvedAt = resolvedAt;
        return copy;
    }

    public String getId() {
        return id;
    }

    public InterruptKind getKind() {
        return kind;
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

    public String getEnvelopeId() {
        return envelopeId;
    }

    public String getQuestion() {
        return question;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public InterruptStatus getStatus() {
        return status;
    }

    public InterruptResponse getResponse() {
        return response;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }
}
