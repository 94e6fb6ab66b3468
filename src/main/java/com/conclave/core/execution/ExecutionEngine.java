package com.conclave.core.execution;

import com.conclave.core.analysis.ConflictDetector;
import com.conclave.core.error.CircuitOpenException;
import com.conclave.core.error.ConclaveException;
import com.conclave.core.error.ExecutorFailureException;
import com.conclave.core.error.ExecutorTimeoutException;
import com.conclave.core.events.ConclaveEvent;
import com.conclave.core.events.EventBus;
import com.conclave.core.logging.MdcContext;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.ExecutionOutcome;
import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.model.Workspace;
import com.conclave.core.registry.ProcessRegistry;
import com.conclave.executor.ExecutorOutput;
import com.conclave.executor.ExecutorRequest;
import com.conclave.executor.ExternalTaskExecutor;
import com.conclave.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a batch of tasks to terminal statuses, running up to {@code maxParallel} at once.
 *
 * <p>The calling thread runs the admission and monitoring loop; executor calls run on worker
 * threads. A queued task is admitted only when there is capacity (one slot while the circuit
 * breaker is open), its backoff has elapsed, all of its dependencies have SUCCEEDED and it
 * conflicts with no running task. Failed or timed-out attempts are retried with capped
 * exponential backoff until the attempt budget is spent. A failure never aborts siblings.
 *
 * <p>A worker that ignores interruption past the stop grace has its attempt recorded, but it
 * keeps its slot, its conflict claims and its workspace until it actually returns.
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    public static final String RUN_CANCELLED = "run-cancelled";
    public static final String BLOCKED_DEPENDENCY_FAILED = "blocked-dependency-failed";

    static final Comparator<Task> ADMISSION_ORDER =
            Comparator.comparing(Task::estimatedDuration).thenComparing(Task::id);

    /** How long an interrupted worker may take to stop before its attempt is recorded anyway. */
    static final Duration DEFAULT_STOP_GRACE = Duration.ofSeconds(30);

    private enum DependencyState { READY, WAITING, BLOCKED }

    private static final class Running {
        private final Task task;
        private final int attempt;
        private final Instant startedAt;
        private final Instant deadline;
        private final CountDownLatch finished = new CountDownLatch(1);
        private final AtomicBoolean started = new AtomicBoolean();
        private volatile ExecutorOutput output;
        private volatile Throwable error;
        private Future<?> future;
        private boolean timedOut;
        private String cancelReason;
        private Instant abandonAt;
        // attempt already recorded; the entry still holds its slot until the worker stops
        private boolean settled;
        private Runnable onRelease;

        private Running(Task task, int attempt, Instant startedAt, Duration timeout) {
            this.task = task;
            this.attempt = attempt;
            this.startedAt = startedAt;
            this.deadline = startedAt.plus(timeout);
        }

        private boolean isDone() {
            return finished.getCount() == 0 || (future != null && future.isCancelled() && !started.get());
        }
    }

    private final ExternalTaskExecutor executor;
    private final WorkspaceManager workspaces;
    private final ProcessRegistry registry;
    private final OutputStore outputStore;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final ConflictDetector conflictDetector;
    private final EventBus eventBus;
    private final ConclaveMetrics metrics;
    private final Clock clock;
    private final Duration pollInterval;
    private final String defaultBaseRef;
    private final Duration stopGrace;

    private final ExecutorService workers;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicBoolean active = new AtomicBoolean();

    public ExecutionEngine(ExternalTaskExecutor executor,
                           WorkspaceManager workspaces,
                           ProcessRegistry registry,
                           OutputStore outputStore,
                           RetryPolicy retryPolicy,
                           CircuitBreaker circuitBreaker,
                           ConflictDetector conflictDetector,
                           EventBus eventBus,
                           ConclaveMetrics metrics,
                           Clock clock,
                           Duration pollInterval,
                           String defaultBaseRef) {
        this(executor, workspaces, registry, outputStore, retryPolicy, circuitBreaker, conflictDetector,
                eventBus, metrics, clock, pollInterval, defaultBaseRef, DEFAULT_STOP_GRACE);
    }

    ExecutionEngine(ExternalTaskExecutor executor,
                    WorkspaceManager workspaces,
                    ProcessRegistry registry,
                    OutputStore outputStore,
                    RetryPolicy retryPolicy,
                    CircuitBreaker circuitBreaker,
                    ConflictDetector conflictDetector,
                    EventBus eventBus,
                    ConclaveMetrics metrics,
                    Clock clock,
                    Duration pollInterval,
                    String defaultBaseRef,
                    Duration stopGrace) {
        this.executor = executor;
        this.workspaces = workspaces;
        this.registry = registry;
        this.outputStore = outputStore;
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreaker;
        this.conflictDetector = conflictDetector;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.defaultBaseRef = defaultBaseRef;
        this.stopGrace = stopGrace;

        var counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "conclave-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs tasks outside a coordinated run: conflicts are computed here and each workspace is
     * removed as soon as its task settles.
     */
    public Map<String, ExecutionResult> run(List<Task> tasks, int maxParallel, Duration perTaskTimeout) {
        var cleanup = new ExecutionListener() {
            @Override
            public void onTaskTerminal(Task task, TaskStatus status, ExecutionResult result) {
                workspaces.remove(task.id());
            }
        };
        String runId = "adhoc-" + clock.millis();
        return run(new ExecutionBatch(runId, tasks, conflictDetector.detectAll(tasks), maxParallel,
                perTaskTimeout, defaultBaseRef, cleanup));
    }

    /**
     * Drives every task in the batch to SUCCEEDED, FAILED or CANCELLED.
     *
     * @return latest result per task, in batch order
     */
    public Map<String, ExecutionResult> run(ExecutionBatch batch) {
        if (!active.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine is already running a batch");
        }
        try {
            return drive(batch);
        } finally {
            active.set(false);
        }
    }

    /**
     * Requests cancellation: queued tasks become CANCELLED, running ones are interrupted.
     * Safe to call repeatedly and from any thread.
     */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested");
        }
        registry.signal();
    }

    public boolean isCancelled() {
        return cancelRequested.get();
    }

    /** Clears cancellation and breaker state before a new run. */
    public void reset() {
        cancelRequested.set(false);
        circuitBreaker.reset();
    }

    @Override
    public void close() {
        cancel();
        workers.shutdownNow();
    }

    private Map<String, ExecutionResult> drive(ExecutionBatch batch) {
        Map<String, Task> tasks = new LinkedHashMap<>();
        for (Task task : batch.tasks()) {
            tasks.put(task.id(), task);
            registry.register(task.id());
        }
        settleLeftovers(batch, tasks);

        log.info("Executing {} task(s) with maxParallel={}, timeout={}s",
                tasks.size(), batch.maxParallel(), batch.perTaskTimeout().toSeconds());

        Map<String, Running> running = new LinkedHashMap<>();
        Set<String> deferred = new HashSet<>();
        boolean interrupted = false;

        while (true) {
            long seen = registry.version();
            if (cancelRequested.get()) {
                cancelOutstanding(batch, tasks, running);
            }
            collectFinished(batch, running);
            enforceTimeouts(running);
            if (!cancelRequested.get()) {
                admit(batch, tasks, running, deferred);
            }
            if (running.isEmpty() && allTerminal(tasks)) {
                break;
            }
            try {
                registry.awaitChange(seen, nextWake(tasks, running));
            } catch (InterruptedException e) {
                log.warn("Execution loop interrupted, cancelling outstanding tasks");
                interrupted = true;
                cancel();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results(tasks);
    }

    /**
     * Tasks registered by an earlier batch or process may sit in TIMED_OUT; settle them before
     * the loop so every pending task is either QUEUED or terminal.
     */
    private void settleLeftovers(ExecutionBatch batch, Map<String, Task> tasks) {
        for (Task task : tasks.values()) {
            var state = registry.state(task.id()).orElseThrow();
            if (state.status() == TaskStatus.TIMED_OUT) {
                if (retryPolicy.canRetry(state.attempts())) {
                    registry.requeue(task.id(), clock.instant());
                } else {
                    registry.markTerminal(task.id(), TaskStatus.FAILED);
                    notifyTerminal(batch, task, TaskStatus.FAILED, state.latestResult());
                }
            } else if (state.status() == TaskStatus.RUNNING) {
                throw new IllegalStateException("Task " + task.id() + " is already running");
            }
        }
    }

    private void admit(ExecutionBatch batch, Map<String, Task> tasks, Map<String, Running> running,
                       Set<String> deferred) {
        if (circuitBreaker.closeIfCooledDown()) {
            publish(ConclaveEvent.CIRCUIT_CLOSED, batch.runId(), null, Map.of());
        }
        int limit;
        try {
            circuitBreaker.ensureClosed();
            limit = batch.maxParallel();
        } catch (CircuitOpenException e) {
            limit = 1;
        }

        Instant now = clock.instant();
        List<Task> queued = tasks.values().stream()
                .filter(t -> registry.status(t.id()).orElse(null) == TaskStatus.QUEUED)
                .sorted(ADMISSION_ORDER)
                .toList();

        for (Task task : queued) {
            DependencyState deps = dependencyState(task, tasks);
            if (deps == DependencyState.BLOCKED && !running.containsKey(task.id())) {
                if (registry.cancel(task.id(), BLOCKED_DEPENDENCY_FAILED)) {
                    log.warn("Cancelling {}: a dependency failed or was cancelled", task.id());
                    publish(ConclaveEvent.TASK_CANCELLED, batch.runId(), task.id(),
                            Map.of("reason", BLOCKED_DEPENDENCY_FAILED));
                    notifyTerminal(batch, task, TaskStatus.CANCELLED, null);
                }
                continue;
            }
            if (running.containsKey(task.id())) {
                continue;
            }
            if (deps == DependencyState.WAITING || running.size() >= limit) {
                continue;
            }
            var state = registry.state(task.id()).orElseThrow();
            if (state.notBefore() != null && now.isBefore(state.notBefore())) {
                continue;
            }
            if (batch.conflicts().conflictsWithAny(task.id(), running.keySet())) {
                if (deferred.add(task.id())) {
                    log.info("Deferring {}: conflicts with a running task", task.id());
                    if (metrics != null) {
                        metrics.recordConflictDeferral(task.id());
                    }
                }
                continue;
            }
            deferred.remove(task.id());
            start(batch, task, running);
        }
    }

    private DependencyState dependencyState(Task task, Map<String, Task> batchTasks) {
        DependencyState result = DependencyState.READY;
        for (String dep : task.dependencies()) {
            TaskStatus status = registry.status(dep).orElse(null);
            if (status == TaskStatus.SUCCEEDED) {
                continue;
            }
            if (status == null || status == TaskStatus.CANCELLED || status == TaskStatus.FAILED
                    || !batchTasks.containsKey(dep)) {
                return DependencyState.BLOCKED;
            }
            result = DependencyState.WAITING;
        }
        return result;
    }

    private void start(ExecutionBatch batch, Task task, Map<String, Running> running) {
        Instant startedAt = clock.instant();
        int attempt = registry.markRunning(task.id(), startedAt);
        MdcContext.setTask(batch.runId(), task.id(), attempt);
        try {
            Workspace workspace;
            try {
                workspaces.remove(task.id());
                workspaces.create(task.id(), batch.baseRef());
                workspace = workspaces.activate(task.id()).orElseThrow();
                registry.setWorkspace(task.id(), workspace);
            } catch (ConclaveException e) {
                log.error("Workspace setup failed for {}: {}", task.id(), e.getMessage());
                settle(batch, task, new ExecutionResult(task.id(), attempt, ExecutionOutcome.FAILED,
                        startedAt, clock.instant(), null, null, null,
                        "Workspace setup failed: " + e.getMessage(), attempt - 1), null);
                return;
            }

            log.info("Starting {} attempt {}/{}: {}", task.id(), attempt, retryPolicy.maxAttempts(), task.title());
            publish(ConclaveEvent.TASK_STARTED, batch.runId(), task.id(),
                    Map.of("attempt", attempt, "title", task.title(), "workspace", workspace.path().toString()));
            safely(() -> batch.listener().onTaskStarted(task, attempt), task.id());

            var request = new ExecutorRequest(batch.runId(), task.id(), attempt, workspace.path(), task,
                    batch.perTaskTimeout());
            var entry = new Running(task, attempt, startedAt, batch.perTaskTimeout());
            running.put(task.id(), entry);
            entry.future = workers.submit(() -> work(entry, request));
        } finally {
            MdcContext.clearTask();
        }
    }

    private void work(Running entry, ExecutorRequest request) {
        entry.started.set(true);
        MdcContext.setTask(request.runId(), request.taskId(), request.attempt());
        try {
            entry.output = executor.execute(request);
        } catch (InterruptedException e) {
            entry.error = e;
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Executor failed for {}: {}", request.taskId(), e.getMessage());
            entry.error = e;
        } finally {
            MdcContext.clear();
            entry.finished.countDown();
            registry.signal();
        }
    }

    private void collectFinished(ExecutionBatch batch, Map<String, Running> running) {
        Instant now = clock.instant();
        for (Running entry : new ArrayList<>(running.values())) {
            boolean done = entry.isDone();
            if (entry.settled) {
                if (done) {
                    release(batch, entry, running);
                }
                continue;
            }
            boolean abandoned = !done && entry.abandonAt != null && !now.isBefore(entry.abandonAt);
            if (!done && !abandoned) {
                continue;
            }
            MdcContext.setTask(batch.runId(), entry.task.id(), entry.attempt);
            try {
                if (abandoned) {
                    log.error("Worker for {} did not stop within {}ms of interruption, recording the attempt"
                            + " and holding its slot until it returns", entry.task.id(), stopGrace.toMillis());
                    entry.settled = true;
                    settle(batch, entry.task, toResult(batch, entry), entry);
                } else {
                    running.remove(entry.task.id());
                    settle(batch, entry.task, toResult(batch, entry), null);
                }
            } finally {
                MdcContext.clearTask();
            }
        }
    }

    private void release(ExecutionBatch batch, Running entry, Map<String, Running> running) {
        running.remove(entry.task.id());
        MdcContext.setTask(batch.runId(), entry.task.id(), entry.attempt);
        try {
            log.info("Abandoned worker for {} attempt {} has stopped", entry.task.id(), entry.attempt);
            if (entry.onRelease != null) {
                entry.onRelease.run();
            }
        } finally {
            MdcContext.clearTask();
        }
    }

    private ExecutionResult toResult(ExecutionBatch batch, Running entry) {
        String taskId = entry.task.id();
        Instant end = clock.instant();
        ExecutorOutput output = entry.output;
        Throwable error = entry.error;

        var refs = output != null
                ? outputStore.store(batch.runId(), taskId, entry.attempt, output.stdout(), output.stderr())
                : OutputStore.OutputRefs.NONE;
        Integer exitCode = output != null ? output.exitCode() : null;

        ExecutionOutcome outcome;
        String message = null;
        if (entry.cancelReason != null) {
            outcome = ExecutionOutcome.CANCELLED;
            message = entry.cancelReason;
        } else if (entry.timedOut || error instanceof ExecutorTimeoutException) {
            outcome = ExecutionOutcome.TIMEOUT;
            message = new ExecutorTimeoutException(taskId, batch.perTaskTimeout()).getMessage();
        } else if (error != null) {
            outcome = ExecutionOutcome.FAILED;
            message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        } else if (output == null) {
            outcome = ExecutionOutcome.FAILED;
            message = "Executor produced no result";
        } else if (output.exitCode() == 0) {
            outcome = ExecutionOutcome.SUCCESS;
        } else {
            outcome = ExecutionOutcome.FAILED;
            message = new ExecutorFailureException(taskId, output.exitCode()).getMessage();
        }
        return new ExecutionResult(taskId, entry.attempt, outcome, entry.startedAt, end, exitCode,
                refs.stdoutRef(), refs.stderrRef(), message, entry.attempt - 1);
    }

    /**
     * Records an attempt and moves the task on. With a non-null {@code holder} the terminal
     * callback waits until that worker has returned.
     */
    private void settle(ExecutionBatch batch, Task task, ExecutionResult result, Running holder) {
        TaskStatus status = registry.recordAttempt(result);
        if (metrics != null) {
            metrics.recordTaskAttempt(result.status().name().toLowerCase(Locale.ROOT), result.duration());
        }
        if (result.status() != ExecutionOutcome.CANCELLED && circuitBreaker.record(!result.isSuccess())) {
            if (metrics != null) {
                metrics.recordCircuitOpened();
            }
            publish(ConclaveEvent.CIRCUIT_OPENED, batch.runId(), task.id(), Map.of());
        }

        switch (result.status()) {
            case SUCCESS -> {
                log.info("{} succeeded on attempt {} in {}ms", task.id(), result.attempt(),
                        result.duration().toMillis());
                publish(ConclaveEvent.TASK_COMPLETED, batch.runId(), task.id(),
                        Map.of("attempt", result.attempt(), "durationMs", result.duration().toMillis()));
                terminal(batch, task, TaskStatus.SUCCEEDED, result, holder);
            }
            case CANCELLED -> {
                log.info("{} cancelled: {}", task.id(), result.errorMessage());
                publish(ConclaveEvent.TASK_CANCELLED, batch.runId(), task.id(),
                        payload("reason", result.errorMessage()));
                terminal(batch, task, TaskStatus.CANCELLED, result, holder);
            }
            case FAILED, TIMEOUT -> settleFailure(batch, task, result, status, holder);
        }
    }

    private void settleFailure(ExecutionBatch batch, Task task, ExecutionResult result, TaskStatus status,
                               Running holder) {
        if (retryPolicy.canRetry(result.attempt())) {
            if (cancelRequested.get()) {
                registry.requeue(task.id(), null);
                registry.cancel(task.id(), RUN_CANCELLED);
                publish(ConclaveEvent.TASK_CANCELLED, batch.runId(), task.id(), Map.of("reason", RUN_CANCELLED));
                terminal(batch, task, TaskStatus.CANCELLED, result, holder);
                return;
            }
            Duration backoff = retryPolicy.backoff(result.attempt());
            registry.requeue(task.id(), clock.instant().plus(backoff));
            log.warn("{} attempt {} {}: {}; retrying in {}ms", task.id(), result.attempt(),
                    result.status() == ExecutionOutcome.TIMEOUT ? "timed out" : "failed",
                    result.errorMessage(), backoff.toMillis());
            if (metrics != null) {
                metrics.recordRetry();
            }
            var payload = payload("error", result.errorMessage());
            payload.put("attempt", result.attempt());
            payload.put("backoffMs", backoff.toMillis());
            publish(ConclaveEvent.TASK_RETRYING, batch.runId(), task.id(), payload);
            safely(() -> batch.listener().onTaskRetrying(task, result, backoff), task.id());
            return;
        }

        if (status == TaskStatus.TIMED_OUT) {
            registry.markTerminal(task.id(), TaskStatus.FAILED);
        }
        log.error("{} failed after {} attempt(s): {}", task.id(), result.attempt(), result.errorMessage());
        var payload = payload("error", result.errorMessage());
        payload.put("attempts", result.attempt());
        publish(ConclaveEvent.TASK_FAILED, batch.runId(), task.id(), payload);
        terminal(batch, task, TaskStatus.FAILED, result, holder);
    }

    private void enforceTimeouts(Map<String, Running> running) {
        Instant now = clock.instant();
        for (Running entry : running.values()) {
            if (entry.settled || entry.timedOut || entry.cancelReason != null || entry.isDone()) {
                continue;
            }
            if (!now.isBefore(entry.deadline)) {
                log.warn("{} attempt {} exceeded its time limit, interrupting", entry.task.id(), entry.attempt);
                entry.timedOut = true;
                entry.abandonAt = now.plus(stopGrace);
                entry.future.cancel(true);
            }
        }
    }

    private void cancelOutstanding(ExecutionBatch batch, Map<String, Task> tasks, Map<String, Running> running) {
        Instant now = clock.instant();
        for (Task task : tasks.values()) {
            TaskStatus status = registry.status(task.id()).orElse(null);
            if (status == TaskStatus.QUEUED || status == TaskStatus.TIMED_OUT) {
                if (registry.cancel(task.id(), RUN_CANCELLED)) {
                    publish(ConclaveEvent.TASK_CANCELLED, batch.runId(), task.id(), Map.of("reason", RUN_CANCELLED));
                    terminal(batch, task, TaskStatus.CANCELLED,
                            registry.state(task.id()).map(ProcessRegistry.TaskState::latestResult).orElse(null),
                            running.get(task.id()));
                }
            }
        }
        for (Running entry : running.values()) {
            if (entry.settled || entry.cancelReason != null || entry.isDone()) {
                continue;
            }
            log.info("Interrupting running task {}", entry.task.id());
            entry.cancelReason = RUN_CANCELLED;
            entry.abandonAt = now.plus(stopGrace);
            registry.cancel(entry.task.id(), RUN_CANCELLED);
            entry.future.cancel(true);
        }
    }

    private Duration nextWake(Map<String, Task> tasks, Map<String, Running> running) {
        Instant now = clock.instant();
        Instant wake = now.plus(pollInterval);
        for (Running entry : running.values()) {
            if (entry.settled) {
                continue;
            }
            Instant candidate = entry.abandonAt != null ? entry.abandonAt : entry.deadline;
            if (candidate.isBefore(wake)) {
                wake = candidate;
            }
        }
        for (String id : tasks.keySet()) {
            var state = registry.state(id).orElse(null);
            if (state != null && state.status() == TaskStatus.QUEUED && state.notBefore() != null
                    && state.notBefore().isBefore(wake)) {
                wake = state.notBefore();
            }
        }
        Duration wait = Duration.between(now, wake);
        return wait.compareTo(Duration.ofMillis(1)) < 0 ? Duration.ofMillis(1) : wait;
    }

    private boolean allTerminal(Map<String, Task> tasks) {
        for (String id : tasks.keySet()) {
            TaskStatus status = registry.status(id).orElse(null);
            if (status == null || !status.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private Map<String, ExecutionResult> results(Map<String, Task> tasks) {
        var results = new LinkedHashMap<String, ExecutionResult>();
        Instant now = clock.instant();
        for (String id : tasks.keySet()) {
            var state = registry.state(id).orElseThrow();
            if (state.latestResult() != null) {
                results.put(id, state.latestResult());
            } else if (state.status() == TaskStatus.CANCELLED) {
                results.put(id, ExecutionResult.cancelled(id, 0, now, state.cancellationReason()));
            }
        }
        return results;
    }

    private void terminal(ExecutionBatch batch, Task task, TaskStatus status, ExecutionResult result,
                          Running holder) {
        if (holder != null) {
            holder.onRelease = () -> notifyTerminal(batch, task, status, result);
        } else {
            notifyTerminal(batch, task, status, result);
        }
    }

    private void notifyTerminal(ExecutionBatch batch, Task task, TaskStatus status, ExecutionResult result) {
        safely(() -> batch.listener().onTaskTerminal(task, status, result), task.id());
    }

    private void safely(Runnable callback, String taskId) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Execution listener failed for {}: {}", taskId, e.getMessage(), e);
        }
    }

    private void publish(String type, String runId, String taskId, Map<String, Object> payload) {
        eventBus.publish(ConclaveEvent.of(type, runId, taskId, payload));
    }

    private static Map<String, Object> payload(String key, Object value) {
        var payload = new HashMap<String, Object>();
        if (value != null) {
            payload.put(key, value);
        }
        return payload;
    }
}
