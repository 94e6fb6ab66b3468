package com.conclave.core.registry;

import com.conclave.core.model.ExecutionOutcome;
import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.model.Workspace;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for the execution status of every task in a run.
 *
 * <p>All state sits behind one lock. Every mutation bumps a version counter and signals a
 * condition so the execution loop can sleep until something changes. Callers that need to do
 * I/O take a {@link #snapshot()} and work on the copy outside the lock.
 */
@Component
public class ProcessRegistry {

    /**
     * Immutable view of one task's entry.
     *
     * @param taskId             the task
     * @param status             current status
     * @param attempts           attempts started so far
     * @param notBefore          earliest time the next attempt may start, null when not backing off
     * @param latestResult       result of the most recent attempt, null before the first one
     * @param cancellationReason why the task was cancelled, null otherwise
     * @param workspace          workspace of the current or last attempt, null when none
     * @param startedAt          start time of the running attempt, null when not running
     */
    public record TaskState(
        String taskId,
        TaskStatus status,
        int attempts,
        Instant notBefore,
        ExecutionResult latestResult,
        String cancellationReason,
        Workspace workspace,
        Instant startedAt
    ) {}

    private static final class Entry {
        private final String taskId;
        private TaskStatus status = TaskStatus.QUEUED;
        private int attempts;
        private Instant notBefore;
        private ExecutionResult latestResult;
        private String cancellationReason;
        private Workspace workspace;
        private Instant startedAt;

        private Entry(String taskId) {
            this.taskId = taskId;
        }

        private TaskState view() {
            return new TaskState(taskId, status, attempts, notBefore, latestResult,
                    cancellationReason, workspace, startedAt);
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final List<ExecutionResult> auditLog = new ArrayList<>();
    private long version;

    /**
     * Registers a task as QUEUED. A task that is already registered keeps its state.
     *
     * @return true when the task was newly registered
     */
    public boolean register(String taskId) {
        lock.lock();
        try {
            if (entries.containsKey(taskId)) {
                return false;
            }
            entries.put(taskId, new Entry(taskId));
            bump();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a queued task to RUNNING and counts the attempt.
     *
     * @return the 1-based number of the attempt that is starting
     */
    public int markRunning(String taskId, Instant startedAt) {
        lock.lock();
        try {
            Entry entry = require(taskId);
            transition(entry, TaskStatus.RUNNING);
            entry.attempts++;
            entry.startedAt = startedAt;
            entry.notBefore = null;
            bump();
            return entry.attempts;
        } finally {
            lock.unlock();
        }
    }

    public void setWorkspace(String taskId, Workspace workspace) {
        lock.lock();
        try {
            require(taskId).workspace = workspace;
            bump();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the outcome of the running attempt and appends it to the audit log.
     * SUCCESS, FAILED, TIMEOUT and CANCELLED map to SUCCEEDED, FAILED, TIMED_OUT and CANCELLED.
     */
    public TaskStatus recordAttempt(ExecutionResult result) {
        lock.lock();
        try {
            Entry entry = require(result.taskId());
            TaskStatus next = statusFor(result.status());
            transition(entry, next);
            entry.latestResult = result;
            entry.startedAt = null;
            if (next == TaskStatus.CANCELLED && entry.cancellationReason == null) {
                entry.cancellationReason = result.errorMessage();
            }
            auditLog.add(result);
            bump();
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a failed or timed-out task back in the queue.
     *
     * @param notBefore earliest start time of the next attempt
     */
    public void requeue(String taskId, Instant notBefore) {
        lock.lock();
        try {
            Entry entry = require(taskId);
            transition(entry, TaskStatus.QUEUED);
            entry.notBefore = notBefore;
            bump();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles a task in a terminal status. A task already in that status is left alone.
     */
    public void markTerminal(String taskId, TaskStatus status) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException(status + " is not a terminal status");
        }
        lock.lock();
        try {
            Entry entry = require(taskId);
            if (entry.status == status) {
                return;
            }
            transition(entry, status);
            entry.startedAt = null;
            bump();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels a task. Queued or timed-out tasks become CANCELLED at once. A running task only has
     * its reason recorded; its attempt becomes CANCELLED once the worker reports back.
     *
     * @return false when the task was already terminal
     */
    public boolean cancel(String taskId, String reason) {
        lock.lock();
        try {
            Entry entry = require(taskId);
            if (entry.status.isTerminal()) {
                return false;
            }
            if (entry.cancellationReason == null) {
                entry.cancellationReason = reason;
            }
            if (entry.status != TaskStatus.RUNNING) {
                transition(entry, TaskStatus.CANCELLED);
                entry.notBefore = null;
            }
            bump();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<TaskStatus> status(String taskId) {
        lock.lock();
        try {
            Entry entry = entries.get(taskId);
            return entry != null ? Optional.of(entry.status) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<TaskState> state(String taskId) {
        lock.lock();
        try {
            Entry entry = entries.get(taskId);
            return entry != null ? Optional.of(entry.view()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /** Immutable copy of every entry, in registration order. */
    public Map<String, TaskState> snapshot() {
        lock.lock();
        try {
            var copy = new LinkedHashMap<String, TaskState>();
            entries.forEach((id, entry) -> copy.put(id, entry.view()));
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.unlock();
        }
    }

    /** Every recorded attempt, in recording order. */
    public List<ExecutionResult> auditLog() {
        lock.lock();
        try {
            return List.copyOf(auditLog);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> runningIds() {
        lock.lock();
        try {
            var running = new LinkedHashSet<String>();
            entries.forEach((id, entry) -> {
                if (entry.status == TaskStatus.RUNNING) {
                    running.add(id);
                }
            });
            return Collections.unmodifiableSet(running);
        } finally {
            lock.unlock();
        }
    }

    /** Monotonic change counter, for use with {@link #awaitChange(long, Duration)}. */
    public long version() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the registry changes or the timeout elapses.
     *
     * @return true if a change was signalled
     */
    public boolean awaitChange(Duration timeout) throws InterruptedException {
        return awaitChange(version(), timeout);
    }

    /**
     * Waits until the version moves past {@code seenVersion} or the timeout elapses. Returns at
     * once when a change already happened after the caller read {@code seenVersion}.
     *
     * @return true if the version changed
     */
    public boolean awaitChange(long seenVersion, Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (version == seenVersion) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Wakes any waiter without changing task state. Called by workers when they finish. */
    public void signal() {
        lock.lock();
        try {
            bump();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            auditLog.clear();
            bump();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the registry contents with state recorded in a checkpoint.
     */
    public void restore(Map<String, TaskState> states, List<ExecutionResult> audit) {
        lock.lock();
        try {
            entries.clear();
            auditLog.clear();
            for (TaskState state : states.values()) {
                Entry entry = new Entry(state.taskId());
                entry.status = state.status();
                entry.attempts = state.attempts();
                entry.notBefore = state.notBefore();
                entry.latestResult = state.latestResult();
                entry.cancellationReason = state.cancellationReason();
                entry.workspace = state.workspace();
                entry.startedAt = state.startedAt();
                entries.put(entry.taskId, entry);
            }
            if (audit != null) {
                auditLog.addAll(audit);
            }
            bump();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until no task is RUNNING or the timeout elapses.
     *
     * @return true if the registry became idle
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (entries.values().stream().anyMatch(e -> e.status == TaskStatus.RUNNING)) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private static TaskStatus statusFor(ExecutionOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> TaskStatus.SUCCEEDED;
            case FAILED -> TaskStatus.FAILED;
            case TIMEOUT -> TaskStatus.TIMED_OUT;
            case CANCELLED -> TaskStatus.CANCELLED;
        };
    }

    private Entry require(String taskId) {
        Entry entry = entries.get(taskId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown task " + taskId);
        }
        return entry;
    }

    private static void transition(Entry entry, TaskStatus next) {
        if (!entry.status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for " + entry.taskId
                    + ": " + entry.status + " -> " + next);
        }
        entry.status = next;
    }

    private void bump() {
        version++;
        changed.signalAll();
    }
}
