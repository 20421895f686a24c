package com.olo.kernel.process;

import com.olo.kernel.error.ErrorKind;
import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.InterruptKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessControlBlockTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static ProcessControlBlock newPcb() {
        return new ProcessControlBlock("p1", "r1", "u1", "s1", null, null, T0);
    }

    @Test
    void constructor_rejectsEmptyIdentity() {
        KernelException e = assertThrows(KernelException.class,
                () -> new ProcessControlBlock("p1", "", "u1", "s1", null, null, T0));
        assertEquals(ErrorKind.VALIDATION, e.getKind());
        assertEquals("request_id is required", e.getMessage());
    }

    @Test
    void constructor_appliesDefaults() {
        ProcessControlBlock pcb = newPcb();
        assertEquals(ProcessState.NEW, pcb.getState());
        assertEquals(SchedulingPriority.NORMAL, pcb.getPriority());
        assertEquals(ResourceQuota.DEFAULT, pcb.getQuota());
    }

    @Test
    void invalidTransition_leavesStateUnchanged() {
        ProcessControlBlock pcb = newPcb();

        KernelException e = assertThrows(KernelException.class, () -> pcb.start(T0));

        assertEquals(ErrorKind.STATE_TRANSITION, e.getKind());
        assertEquals(ProcessState.NEW, pcb.getState());
        assertNull(pcb.getStartedAt());
    }

    @Test
    void complete_freezesElapsed() {
        ProcessControlBlock pcb = newPcb();
        pcb.transitionTo(ProcessState.READY);
        pcb.start(T0);
        pcb.refreshElapsed(T0.plusSeconds(2));
        assertEquals(2.0, pcb.getUsage().getElapsedSeconds());

        pcb.complete(T0.plusMillis(3_500));
        pcb.refreshElapsed(T0.plusSeconds(100));

        assertEquals(ProcessState.TERMINATED, pcb.getState());
        assertEquals(3.5, pcb.getUsage().getElapsedSeconds());
        assertEquals(T0.plusMillis(3_500), pcb.getCompletedAt());
    }

    @Test
    void waitAndResume_clearInterruptMetadata() {
        ProcessControlBlock pcb = newPcb();
        pcb.transitionTo(ProcessState.READY);
        pcb.start(T0);
        pcb.waitOn(InterruptKind.CLARIFICATION);
        assertEquals(InterruptKind.CLARIFICATION, pcb.getPendingInterrupt());

        pcb.resume();

        assertEquals(ProcessState.READY, pcb.getState());
        assertNull(pcb.getPendingInterrupt());
    }

    @Test
    void block_recordsReason() {
        ProcessControlBlock pcb = newPcb();
        pcb.transitionTo(ProcessState.READY);
        pcb.start(T0);

        pcb.block("waiting for tool slot");

        assertEquals(ProcessState.BLOCKED, pcb.getState());
        assertEquals("waiting for tool slot", pcb.getInterruptData().get(ProcessControlBlock.BLOCK_REASON_KEY));
        pcb.resume();
        assertTrue(pcb.getInterruptData().isEmpty());
    }

    @Test
    void resume_rejectsRunningProcess() {
        ProcessControlBlock pcb = newPcb();
        pcb.transitionTo(ProcessState.READY);
        pcb.start(T0);

        assertThrows(KernelException.class, pcb::resume);
        assertEquals(ProcessState.RUNNING, pcb.getState());
    }
}
