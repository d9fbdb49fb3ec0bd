package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.CoordinationStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for one coordinated task.
 *
 * <p><b>Transitions:</b>
 * <pre>
 * CREATED → DISPATCHING → AWAITING_ENGINES → MERGING → {COMPLETED | DEGRADED | FAILED | TIMED_OUT}
 * any non-terminal phase → FAILED (unexpected fault)
 * </pre>
 *
 * <p>Also tracks the engine futures of the task so that shutdown can cancel them.
 */
public final class TaskLifecycle {

    private final String taskId;
    private final Lock lock = new ReentrantLock();
    private final List<Future<?>> pending = new ArrayList<>();
    private TaskPhase phase = TaskPhase.CREATED;

    public TaskLifecycle(String taskId) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
    }

    public String taskId() {
        return taskId;
    }

    public TaskPhase phase() {
        lock.lock();
        try {
            return phase;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to the next non-terminal phase.
     *
     * @throws IllegalStateException if {@code next} does not directly follow the current phase
     */
    public void advance(TaskPhase next) {
        Objects.requireNonNull(next, "next");
        lock.lock();
        try {
            if (next.isTerminal() || next.ordinal() != phase.ordinal() + 1) {
                throw new IllegalStateException("Task " + taskId + ": illegal transition " + phase + " -> " + next);
            }
            phase = next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enters the terminal phase for {@code status}. Only MERGING may finish normally; FAILED is
     * also reachable from any non-terminal phase.
     *
     * @throws IllegalStateException if the task is already terminal or not ready to finish
     */
    public void finish(CoordinationStatus status) {
        TaskPhase target = TaskPhase.of(Objects.requireNonNull(status, "status"));
        lock.lock();
        try {
            if (phase.isTerminal()) {
                throw new IllegalStateException("Task " + taskId + " already finished as " + phase);
            }
            if (phase != TaskPhase.MERGING && target != TaskPhase.FAILED) {
                throw new IllegalStateException("Task " + taskId + ": illegal transition " + phase + " -> " + target);
            }
            phase = target;
            pending.clear();
        } finally {
            lock.unlock();
        }
    }

    public boolean isFinished() {
        return phase().isTerminal();
    }

    void track(Future<?> future) {
        lock.lock();
        try {
            pending.add(future);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Interrupts every engine call that has not completed.
     *
     * @return number of calls cancelled
     */
    int cancelPending() {
        List<Future<?>> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(pending);
        } finally {
            lock.unlock();
        }
        int cancelled = 0;
        for (Future<?> f : snapshot) {
            if (!f.isDone() && f.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }
}
