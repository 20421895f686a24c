package com.olo.kernel.interrupt.service;

import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.FlowInterrupt;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.interrupt.InterruptResponse;
import com.olo.kernel.interrupt.InterruptStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterruptServiceTest {

    private MutableClock clock;
    private InterruptService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        service = new InterruptService(clock, Map.of());
    }

    private FlowInterrupt create(InterruptKind kind, String requestId, String sessionId) {
        return service.create(kind, requestId, "u1", sessionId, "env-1", "Which one?", null, null);
    }

    @Test
    void create_setsIdAndExpiryFromKind() {
        FlowInterrupt interrupt = create(InterruptKind.CONFIRMATION, "r1", "s1");

        assertTrue(interrupt.getId().startsWith("int_"));
        assertEquals(20, interrupt.getId().length());
        assertEquals(clock.instant().plus(Duration.ofHours(1)), interrupt.getExpiresAt());
        assertNull(create(InterruptKind.CHECKPOINT, "r1", "s1").getExpiresAt());
    }

    @Test
    void create_appliesTtlOverride() {
        service = new InterruptService(clock, Map.of(
                InterruptKind.CLARIFICATION, Duration.ofMinutes(5),
                InterruptKind.CONFIRMATION, Duration.ZERO));

        assertEquals(clock.instant().plus(Duration.ofMinutes(5)),
                create(InterruptKind.CLARIFICATION, "r1", "s1").getExpiresAt());
        assertNull(create(InterruptKind.CONFIRMATION, "r1", "s1").getExpiresAt());
    }

    @Test
    void create_requiresKind() {
        assertThrows(KernelException.class, () -> create(null, "r1", "s1"));
    }

    @Test
    void resolve_twiceReturnsTrueThenFalse() {
        FlowInterrupt interrupt = create(InterruptKind.CLARIFICATION, "r1", "s1");

        assertTrue(service.resolve(interrupt.getId(), InterruptResponse.ofText("the blue one"), "u1"));
        assertFalse(service.resolve(interrupt.getId(), InterruptResponse.ofText("again"), "u1"));

        FlowInterrupt stored = service.get(interrupt.getId()).orElseThrow();
        assertEquals(InterruptStatus.RESOLVED, stored.getStatus());
        assertEquals("the blue one", stored.getResponse().getText());
        assertEquals(clock.instant(), stored.getResolvedAt());
    }

    @Test
    void resolve_rejectsWrongUserUnknownIdAndExpired() {
        FlowInterrupt interrupt = create(InterruptKind.TIMEOUT, "r1", "s1");

        assertFalse(service.resolve(interrupt.getId(), InterruptResponse.ofApproval(true), "someone-else"));
        assertFalse(service.resolve("int_missing", InterruptResponse.ofApproval(true), null));

        clock.advance(Duration.ofMinutes(6));
        assertFalse(service.resolve(interrupt.getId(), InterruptResponse.ofApproval(true), null));
        assertEquals(InterruptStatus.EXPIRED, service.get(interrupt.getId()).orElseThrow().getStatus());
    }

    @Test
    void resolve_nullUserSkipsOwnerCheck() {
        FlowInterrupt interrupt = create(InterruptKind.CONFIRMATION, "r1", "s1");

        assertTrue(service.resolve(interrupt.getId(), InterruptResponse.ofApproval(false), null));
    }

    @Test
    void cancel_storesReasonOnce() {
        FlowInterrupt interrupt = create(InterruptKind.AGENT_REVIEW, "r1", "s1");

        assertTrue(service.cancel(interrupt.getId(), "user left"));
        assertFalse(service.cancel(interrupt.getId(), "again"));
        assertEquals("user left", interrupt.getData().get("cancel_reason"));
        assertEquals(InterruptStatus.CANCELLED, interrupt.getStatus());
    }

    @Test
    void getPendingForSession_filtersByKindAndStatusInCreationOrder() {
        FlowInterrupt first = create(InterruptKind.CLARIFICATION, "r1", "s1");
        clock.advance(Duration.ofSeconds(1));
        FlowInterrupt second = create(InterruptKind.CONFIRMATION, "r2", "s1");
        FlowInterrupt resolved = create(InterruptKind.CLARIFICATION, "r3", "s1");
        create(InterruptKind.CLARIFICATION, "r4", "other");
        service.resolve(resolved.getId(), InterruptResponse.ofText("ok"), null);

        assertEquals(List.of(first, second), service.getPendingForSession("s1", null));
        assertEquals(List.of(second), service.getPendingForSession("s1", List.of(InterruptKind.CONFIRMATION)));
        assertTrue(service.getPendingForSession("unknown", List.of()).isEmpty());
    }

    @Test
    void getPendingForRequest_returnsMostRecent() {
        create(InterruptKind.CLARIFICATION, "r1", "s1");
        FlowInterrupt latest = create(InterruptKind.CHECKPOINT, "r1", "s1");

        assertEquals(latest, service.getPendingForRequest("r1").orElseThrow());
        assertFalse(service.getPendingForRequest("r2").isPresent());
    }

    @Test
    void expirePending_marksOnlyOverdue() {
        create(InterruptKind.RESOURCE_EXHAUSTED, "r1", "s1");
        create(InterruptKind.CLARIFICATION, "r2", "s1");
        clock.advance(Duration.ofMinutes(10));

        assertEquals(1, service.expirePending());
        assertEquals(1, service.getStats().countByStatus("expired"));
        assertEquals(1, service.getStats().countByStatus("pending"));
    }

    @Test
    void cleanupResolved_keepsPendingAndRecent() {
        FlowInterrupt old = create(InterruptKind.CLARIFICATION, "r1", "s1");
        create(InterruptKind.CHECKPOINT, "r2", "s1");
        service.cancel(old.getId(), null);
        clock.advance(Duration.ofHours(2));
        FlowInterrupt recent = create(InterruptKind.CLARIFICATION, "r3", "s1");
        service.cancel(recent.getId(), null);

        assertEquals(1, service.cleanupResolved(Duration.ofHours(1)));
        assertFalse(service.get(old.getId()).isPresent());
        assertEquals(2, service.count());
        assertEquals(1, service.getPendingForSession("s1", null).size());
    }

    @Test
    void getStats_countsByKind() {
        create(InterruptKind.CLARIFICATION, "r1", "s1");
        create(InterruptKind.CLARIFICATION, "r2", "s1");
        create(InterruptKind.SYSTEM_ERROR, "r3", "s1");

        InterruptStats stats = service.getStats();
        assertEquals(3, stats.getTotal());
        assertEquals(2, stats.getByKind().get("clarification"));
        assertEquals(0, stats.countByStatus("resolved"));
    }
}
