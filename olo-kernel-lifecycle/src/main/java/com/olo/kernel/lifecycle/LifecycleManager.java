package com.olo.kernel.lifecycle;

import com.olo.kernel.error.KernelException;
import com.olo.kernel.interrupt.InterruptKind;
import com.olo.kernel.process.ProcessControlBlock;
import com.olo.kernel.process.ProcessState;
import com.olo.kernel.process.ResourceQuota;
import com.olo.kernel.process.SchedulingPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Process table and run queue. Owns every {@link ProcessControlBlock} and enforces the state machine.
 * <p>
 * Run queue order: priority heap value, then {@code createdAt}, then submission sequence. Entries whose PCB is
 * no longer Ready are skipped lazily when popped. Not thread-safe; the kernel serializes calls.
 */
public final class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private static final Comparator<QueueEntry> RUN_ORDER = Comparator
            .comparingInt((QueueEntry e) -> e.priority)
            .thenComparing(e -> e.createdAt)
            .thenComparingLong(e -> e.sequence);

    private final Clock clock;
    private final Map<String, ProcessControlBlock> processes = new LinkedHashMap<>();
    private final PriorityQueue<QueueEntry> readyQueue = new PriorityQueue<>(RUN_ORDER);
    /** Sequence of the live queue entry per pid; older entries for the same pid are stale. */
    private final Map<String, Long> liveEntries = new HashMap<>();
    private long sequence;
    private ResourceQuota defaultQuota;

    public LifecycleManager(Clock clock, ResourceQuota defaultQuota) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultQuota = defaultQuota != null ? defaultQuota : ResourceQuota.DEFAULT;
    }

    public LifecycleManager() {
        this(Clock.systemUTC(), ResourceQuota.DEFAULT);
    }

    /**
     * Creates a PCB in NEW. Submitting a pid that already exists returns the existing PCB unchanged.
     *
     * @param quota null for the default quota
     */
    public ProcessControlBlock submit(String pid, String requestId, String userId, String sessionId,
                                      SchedulingPriority priority, ResourceQuota quota) {
        ProcessControlBlock existing = pid != null ? processes.get(pid) : null;
        if (existing != null) {
            log.debug("Lifecycle submit | pid={} already exists, returning existing", pid);
            return existing;
        }
        ProcessControlBlock pcb = new ProcessControlBlock(pid, requestId, userId, sessionId, priority,
                quota != null ? quota : defaultQuota, clock.instant());
        processes.put(pid, pcb);
        log.info("Lifecycle submit | pid={} userId={} priority={}", pid, userId, pcb.getPriority().toValue());
        return pcb;
    }

    /** NEW → READY and enqueue. */
    public void schedule(String pid) {
        ProcessControlBlock pcb = require(pid);
        if (pcb.getState() != ProcessState.NEW) {
            throw KernelException.stateTransition("Cannot schedule process %s in state %s", pid, pcb.getState().toValue());
        }
        pcb.transitionTo(ProcessState.READY);
        enqueue(pcb);
        log.debug("Lifecycle schedule | pid={} queueDepth={}", pid, readyQueue.size());
    }

    /** Pops the highest-priority Ready process, or empty when none is runnable. State is not changed. */
    public Optional<ProcessControlBlock> getNextRunnable() {
        while (!readyQueue.isEmpty()) {
            QueueEntry entry = readyQueue.poll();
            Long live = liveEntries.get(entry.pid);
            if (live == null || live != entry.sequence) {
                continue;
            }
            liveEntries.remove(entry.pid);
            ProcessControlBlock pcb = processes.get(entry.pid);
            if (pcb != null && pcb.getState().isRunnable()) {
                return Optional.of(pcb);
            }
        }
        return Optional.empty();
    }

    /** READY → RUNNING. */
    public void start(String pid) {
        ProcessControlBlock pcb = require(pid);
        if (pcb.getState() != ProcessState.READY) {
            throw KernelException.stateTransition("Cannot start process %s in state %s", pid, pcb.getState().toValue());
        }
        pcb.start(clock.instant());
    }

    /** RUNNING → WAITING on an interrupt of the given kind. */
    public void waitOn(String pid, InterruptKind kind) {
        ProcessControlBlock pcb = requireRunning(pid, "wait");
        pcb.waitOn(kind);
        log.info("Lifecycle wait | pid={} interruptKind={}", pid, kind != null ? kind.toValue() : null);
    }

    /** RUNNING → BLOCKED. */
    public void block(String pid, String reason) {
        ProcessControlBlock pcb = requireRunning(pid, "block");
        pcb.block(reason);
        log.info("Lifecycle block | pid={} reason={}", pid, reason);
    }

    /** WAITING or BLOCKED → READY, then re-enqueue. */
    public void resume(String pid) {
        ProcessControlBlock pcb = require(pid);
        pcb.resume();
        enqueue(pcb);
        log.info("Lifecycle resume | pid={}", pid);
    }

    /** RUNNING → READY (preemption); re-enqueue. */
    public void yieldProcess(String pid) {
        ProcessControlBlock pcb = requireRunning(pid, "yield");
        pcb.transitionTo(ProcessState.READY);
        enqueue(pcb);
    }

    /**
     * Moves to TERMINATED and freezes elapsed time. A process that is already terminal is left as is.
     */
    public void terminate(String pid) {
        ProcessControlBlock pcb = require(pid);
        if (pcb.getState().isTerminal()) {
            return;
        }
        pcb.complete(clock.instant());
        log.info("Lifecycle terminate | pid={} elapsedSeconds={}", pid, pcb.getUsage().getElapsedSeconds());
    }

    /** TERMINATED → ZOMBIE. */
    public void cleanup(String pid) {
        ProcessControlBlock pcb = require(pid);
        if (pcb.getState() != ProcessState.TERMINATED) {
            throw KernelException.stateTransition("Cannot clean up process %s in state %s", pid, pcb.getState().toValue());
        }
        pcb.transitionTo(ProcessState.ZOMBIE);
    }

    /**
     * Generic guarded transition. Routes to the dedicated operation so timestamps, queue membership and interrupt
     * metadata stay consistent.
     */
    public void transition(String pid, ProcessState target, String reason) {
        ProcessControlBlock pcb = require(pid);
        if (target == null) {
            throw KernelException.validation("new_state is required");
        }
        ProcessState from = pcb.getState();
        if (!from.canTransitionTo(target)) {
            throw KernelException.stateTransition("Cannot transition process %s from %s to %s",
                    pid, from.toValue(), target.toValue());
        }
        switch (target) {
            case READY:
                if (from == ProcessState.NEW) {
                    schedule(pid);
                } else if (from == ProcessState.RUNNING) {
                    yieldProcess(pid);
                } else {
                    resume(pid);
                }
                break;
            case RUNNING:
                start(pid);
                break;
            case WAITING:
                waitOn(pid, InterruptKind.fromValue(reason));
                break;
            case BLOCKED:
                block(pid, reason);
                break;
            case TERMINATED:
                terminate(pid);
                break;
            case ZOMBIE:
                cleanup(pid);
                break;
            default:
                throw KernelException.stateTransition("Cannot transition process %s to %s", pid, target.toValue());
        }
        log.debug("Lifecycle transition | pid={} from={} to={} reason={}", pid, from.toValue(), target.toValue(), reason);
    }

    /** Removes the PCB regardless of state. Returns it, or null when unknown. */
    public ProcessControlBlock remove(String pid) {
        liveEntries.remove(pid);
        return processes.remove(pid);
    }

    public Optional<ProcessControlBlock> get(String pid) {
        return Optional.ofNullable(pid != null ? processes.get(pid) : null);
    }

    /**
     * @throws KernelException NOT_FOUND
     */
    public ProcessControlBlock require(String pid) {
        ProcessControlBlock pcb = pid != null ? processes.get(pid) : null;
        if (pcb == null) {
            throw KernelException.notFound("process", pid);
        }
        return pcb;
    }

    private ProcessControlBlock requireRunning(String pid, String op) {
        ProcessControlBlock pcb = require(pid);
        if (pcb.getState() != ProcessState.RUNNING) {
            throw KernelException.stateTransition("Cannot %s process %s in state %s", op, pid, pcb.getState().toValue());
        }
        return pcb;
    }

    public List<ProcessControlBlock> list() {
        return new ArrayList<>(processes.values());
    }

    public List<ProcessControlBlock> listByState(ProcessState state) {
        return processes.values().stream()
                .filter(p -> p.getState() == state)
                .collect(Collectors.toList());
    }

    public List<ProcessControlBlock> listByUser(String userId) {
        return processes.values().stream()
                .filter(p -> p.getUserId().equals(userId))
                .collect(Collectors.toList());
    }

    public int count() {
        return processes.size();
    }

    public int countByState(ProcessState state) {
        int n = 0;
        for (ProcessControlBlock pcb : processes.values()) {
            if (pcb.getState() == state) n++;
        }
        return n;
    }

    public Map<ProcessState, Integer> countsByState() {
        Map<ProcessState, Integer> counts = new EnumMap<>(ProcessState.class);
        for (ProcessState state : ProcessState.values()) {
            counts.put(state, 0);
        }
        for (ProcessControlBlock pcb : processes.values()) {
            counts.merge(pcb.getState(), 1, Integer::sum);
        }
        return counts;
    }

    /** Ready processes still waiting in the run queue. */
    public int queueDepth() {
        int n = 0;
        for (String pid : liveEntries.keySet()) {
            ProcessControlBlock pcb = processes.get(pid);
            if (pcb != null && pcb.getState().isRunnable()) n++;
        }
        return n;
    }

    public ResourceQuota getDefaultQuota() {
        return defaultQuota;
    }

    public void setDefaultQuota(ResourceQuota defaultQuota) {
        this.defaultQuota = Objects.requireNonNull(defaultQuota, "defaultQuota");
    }

    public Instant now() {
        return clock.instant();
    }

    private void enqueue(ProcessControlBlock pcb) {
        long seq = sequence++;
        liveEntries.put(pcb.getPid(), seq);
        readyQueue.add(new QueueEntry(pcb.getPid(), pcb.getPriority().getHeapValue(), pcb.getCreatedAt(), seq));
    }

    private static final class QueueEntry {
        private final String pid;
        private final int priority;
        private final Instant createdAt;
        private final long sequence;

        private QueueEntry(String pid, int priority, Instant createdAt, long sequence) {
            this.pid = pid;
            this.priority = priority;
            this.createdAt = createdAt;
            this.sequence = sequence;
        }
    }
}
