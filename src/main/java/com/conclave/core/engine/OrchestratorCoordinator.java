package com.conclave.core.engine;

import com.conclave.core.analysis.TaskAnalyzer;
import com.conclave.core.config.ConclaveProperties;
import com.conclave.core.error.ConclaveException;
import com.conclave.core.error.WorkspaceException;
import com.conclave.core.events.ConclaveEvent;
import com.conclave.core.events.EventBus;
import com.conclave.core.execution.ExecutionBatch;
import com.conclave.core.execution.ExecutionEngine;
import com.conclave.core.execution.ExecutionListener;
import com.conclave.core.execution.RetryPolicy;
import com.conclave.core.logging.MdcContext;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.AnalysisResult;
import com.conclave.core.model.ExecutionOutcome;
import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.RunReport;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskReport;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.model.WorkflowPhase;
import com.conclave.core.model.Workspace;
import com.conclave.core.persistence.CheckpointManager;
import com.conclave.core.persistence.WorkflowState;
import com.conclave.core.registry.ProcessRegistry;
import com.conclave.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole pipeline for a batch of task files: analyse, checkpoint, execute the parallel
 * groups in order, integrate each settled task, and report.
 *
 * <p>Every phase change and every task that settles is checkpointed, so a run interrupted at
 * any point can be resumed with {@link #resume}. Terminal tasks are never executed again.
 */
@Service
public class OrchestratorCoordinator {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorCoordinator.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    static final String INTERRUPTED_BY_RESTART = "interrupted by coordinator restart";

    /** Mutable bookkeeping for the run in progress. */
    /** Written by the run thread; read by the shutdown hook when it checkpoints a stuck run. */
    private static final class RunContext {
        private final String runId;
        private final List<String> inputs;
        private final String baseRef;
        private final Instant createdAt;
        private final Instant startedAt;
        private final CopyOnWriteArrayList<String> errors;
        private final CopyOnWriteArrayList<String> checkpointWarnings = new CopyOnWriteArrayList<>();
        private volatile AnalysisResult analysis;
        private volatile WorkflowPhase phase = WorkflowPhase.INITIALIZED;
        private volatile int currentGroup;
        private volatile String fatalError;
        private volatile boolean resumable = true;

        private RunContext(String runId, List<String> inputs, String baseRef, Instant createdAt,
                           Instant startedAt, List<String> errors) {
            this.runId = runId;
            this.inputs = inputs;
            this.baseRef = baseRef;
            this.createdAt = createdAt;
            this.startedAt = startedAt;
            this.errors = new CopyOnWriteArrayList<>(errors);
        }
    }

    private final TaskAnalyzer analyzer;
    private final ExecutionEngine engine;
    private final ProcessRegistry registry;
    private final WorkspaceManager workspaces;
    private final CheckpointManager checkpoints;
    private final RetryPolicy retryPolicy;
    private final EventBus eventBus;
    private final ConclaveProperties properties;
    private final ConclaveMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile RunContext current;
    private volatile CountDownLatch runFinished = new CountDownLatch(0);

    public OrchestratorCoordinator(TaskAnalyzer analyzer,
                                   ExecutionEngine engine,
                                   ProcessRegistry registry,
                                   WorkspaceManager workspaces,
                                   CheckpointManager checkpoints,
                                   RetryPolicy retryPolicy,
                                   EventBus eventBus,
                                   ConclaveProperties properties,
                                   @Autowired(required = false) ConclaveMetrics metrics,
                                   Clock clock) {
        this.analyzer = analyzer;
        this.engine = engine;
        this.registry = registry;
        this.workspaces = workspaces;
        this.checkpoints = checkpoints;
        this.retryPolicy = retryPolicy;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Dry run: analysis only, no workspaces and no checkpoint.
     */
    public AnalysisResult plan(List<Path> inputs) {
        return analyzer.analyzeFiles(inputs);
    }

    /**
     * Runs the task files end to end under a newly generated run id.
     */
    public RunReport run(List<Path> inputs, RunOptions options) {
        String runId = generateRunId();
        String baseRef = options.baseRef() != null ? options.baseRef() : properties.getWorkspace().getBaseRef();
        Instant now = clock.instant();
        var ctx = new RunContext(runId, inputs.stream().map(Path::toString).toList(), baseRef, now, now, List.of());

        MdcContext.setRun(runId);
        begin(ctx);
        try {
            log.info("Starting run {} with {} input file(s), base {}", runId, inputs.size(), baseRef);
            publish(ConclaveEvent.RUN_STARTED, runId, Map.of("inputs", ctx.inputs, "resumed", false));
            checkpoint(ctx);

            if (!analyze(ctx, inputs)) {
                return finish(ctx);
            }
            return executeGroups(ctx, options);
        } finally {
            end();
            MdcContext.clear();
        }
    }

    /**
     * Continues a run from its last checkpoint.
     *
     * @throws IllegalArgumentException when no checkpoint exists or the run already finished
     */
    public RunReport resume(String runId, RunOptions options) {
        WorkflowState state = checkpoints.load(runId)
                .orElseThrow(() -> new IllegalArgumentException("No checkpoint found for run " + runId));
        if (!state.isResumable()) {
            throw new IllegalArgumentException("Run " + runId + " ended " + state.phase() + " and cannot be resumed");
        }

        var ctx = new RunContext(runId, state.inputs(), state.baseRef(), state.createdAt(), clock.instant(),
                state.errors());
        ctx.currentGroup = state.currentGroup();

        MdcContext.setRun(runId);
        begin(ctx);
        try {
            log.info("Resuming run {} from phase {} at group {}", runId, state.phase(), state.currentGroup() + 1);
            publish(ConclaveEvent.RUN_STARTED, runId, Map.of("inputs", ctx.inputs, "resumed", true));

            if (state.tasks().isEmpty()) {
                // Analysis never completed: start it again from the recorded inputs
                if (!analyze(ctx, ctx.inputs.stream().map(Path::of).toList())) {
                    return finish(ctx);
                }
            } else {
                ctx.analysis = new AnalysisResult(state.tasks(), state.groups(), state.conflictMatrix());
                restoreRegistry(state);
                reclaimStaleWorkspaces(state);
                requeueInterrupted(ctx);
            }
            return executeGroups(ctx, options);
        } finally {
            end();
            MdcContext.clear();
        }
    }

    /**
     * Cancels the active run. Queued tasks are cancelled, running ones interrupted. Idempotent.
     */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            log.info("Run cancellation requested");
        }
        engine.cancel();
    }

    /**
     * Cancels the active run and waits for it to write its final checkpoint. If it does not
     * finish in time, a checkpoint of the state so far is written from here.
     */
    public void shutdown(Duration wait) {
        RunContext ctx = current;
        if (ctx == null) {
            return;
        }
        cancel();
        try {
            if (runFinished.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.warn("Run {} did not stop within {}s, writing checkpoint from shutdown", ctx.runId, wait.toSeconds());
        checkpoint(ctx);
    }

    public boolean isRunning() {
        return current != null;
    }

    /**
     * Generates a run ID in the format RUN-yyyyMMdd-HHmmss-NNN, skipping ids that already have a
     * checkpoint.
     */
    public String generateRunId() {
        String stamp = RUN_ID_TIME.format(clock.instant());
        String runId;
        do {
            int count = RUN_COUNTER.incrementAndGet() % 1000;
            runId = String.format("RUN-%s-%03d", stamp, count);
        } while (Files.exists(checkpoints.checkpointFile(runId)));
        return runId;
    }

    private void begin(RunContext ctx) {
        cancelRequested.set(false);
        registry.clear();
        engine.reset();
        workspaces.beginRun(ctx.runId);
        runFinished = new CountDownLatch(1);
        current = ctx;
    }

    private void end() {
        current = null;
        runFinished.countDown();
    }

    private boolean analyze(RunContext ctx, List<Path> inputs) {
        try {
            ctx.analysis = analyzer.analyzeFiles(inputs);
        } catch (ConclaveException e) {
            log.error("Analysis of run {} failed: {}", ctx.runId, e.getMessage());
            ctx.fatalError = e.getMessage();
            ctx.errors.add(e.getMessage());
            ctx.phase = WorkflowPhase.FAILED;
            return false;
        }
        for (Task task : ctx.analysis.tasks()) {
            registry.register(task.id());
        }
        ctx.phase = WorkflowPhase.ANALYZED;
        checkpoint(ctx);
        return true;
    }

    private RunReport executeGroups(RunContext ctx, RunOptions options) {
        int maxParallel = options.maxParallel() != null
                ? options.maxParallel() : properties.getExecution().getMaxParallel();
        Duration timeout = options.taskTimeout() != null
                ? options.taskTimeout() : properties.getExecution().taskTimeout();
        Map<String, Task> index = ctx.analysis.taskIndex();
        List<List<String>> groups = ctx.analysis.groups();

        ctx.phase = WorkflowPhase.EXECUTING;
        checkpoint(ctx);
        try {
            for (int g = ctx.currentGroup; g < groups.size() && !cancelRequested.get(); g++) {
                ctx.currentGroup = g;
                MdcContext.setGroup(ctx.runId, g + 1);
                List<Task> pending = groups.get(g).stream()
                        .filter(id -> !registry.status(id).map(TaskStatus::isTerminal).orElse(false))
                        .map(index::get)
                        .toList();
                if (pending.isEmpty()) {
                    continue;
                }

                log.info("Group {}/{}: executing {}", g + 1, groups.size(), pending.stream().map(Task::id).toList());
                publish(ConclaveEvent.GROUP_STARTED, ctx.runId,
                        Map.of("group", g + 1, "groups", groups.size(), "tasks", pending.stream().map(Task::id).toList()));
                if (metrics != null) {
                    metrics.recordGroupSize(pending.size());
                }
                checkpoint(ctx);

                engine.run(new ExecutionBatch(ctx.runId, pending, ctx.analysis.conflicts(), maxParallel, timeout,
                        ctx.baseRef, integrationListener(ctx)));
            }

            if (cancelRequested.get()) {
                cancelRemaining(ctx);
                ctx.phase = WorkflowPhase.CANCELLED;
            } else {
                ctx.currentGroup = groups.size();
                ctx.phase = WorkflowPhase.COMPLETED;
            }
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly: {}", ctx.runId, e.getMessage(), e);
            ctx.fatalError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            ctx.errors.add(ctx.fatalError);
            ctx.phase = WorkflowPhase.FAILED;
        }

        int leftovers = workspaces.removeAll();
        if (leftovers > 0) {
            log.info("Removed {} leftover workspace(s)", leftovers);
        }
        return finish(ctx);
    }

    /**
     * Integrates and cleans up each task as soon as it settles, then checkpoints.
     */
    private ExecutionListener integrationListener(RunContext ctx) {
        boolean commit = properties.getWorkspace().isCommitResults();
        return new ExecutionListener() {
            @Override
            public void onTaskTerminal(Task task, TaskStatus status, ExecutionResult result) {
                if (status == TaskStatus.SUCCEEDED && commit) {
                    try {
                        workspaces.commitResult(task.id(), "conclave: " + task.id() + " " + task.title());
                    } catch (WorkspaceException e) {
                        log.error("Integration of {} failed: {}", task.id(), e.getMessage());
                        ctx.errors.add("Integration of " + task.id() + " failed: " + e.getMessage());
                    }
                }
                try {
                    workspaces.remove(task.id());
                } catch (WorkspaceException e) {
                    log.error("Could not remove workspace of {}: {}", task.id(), e.getMessage());
                }
                checkpoint(ctx);
            }
        };
    }

    private void cancelRemaining(RunContext ctx) {
        for (Task task : ctx.analysis.tasks()) {
            if (registry.cancel(task.id(), ExecutionEngine.RUN_CANCELLED)) {
                publish(ConclaveEvent.TASK_CANCELLED, ctx.runId, task.id(),
                        Map.of("reason", ExecutionEngine.RUN_CANCELLED));
            }
        }
    }

    private void restoreRegistry(WorkflowState state) {
        var states = new LinkedHashMap<String, ProcessRegistry.TaskState>();
        for (Task task : state.tasks()) {
            String id = task.id();
            states.put(id, new ProcessRegistry.TaskState(
                    id,
                    state.statuses().getOrDefault(id, TaskStatus.QUEUED),
                    state.attempts().getOrDefault(id, 0),
                    null,
                    state.results().get(id),
                    state.cancellationReasons().get(id),
                    state.workspaces().get(id),
                    null));
        }
        registry.restore(states, state.auditLog());
    }

    private void reclaimStaleWorkspaces(WorkflowState state) {
        for (Workspace workspace : state.workspaces().values()) {
            TaskStatus status = state.statuses().get(workspace.taskId());
            if (status != null && status.isTerminal()) {
                continue;
            }
            try {
                workspaces.reclaim(workspace);
                registry.setWorkspace(workspace.taskId(), null);
            } catch (WorkspaceException e) {
                log.warn("Could not reclaim workspace of {}: {}", workspace.taskId(), e.getMessage());
            }
        }
    }

    /**
     * Tasks recorded as RUNNING were cut off by the restart: each gets a failed attempt and is
     * re-queued while it has attempts left.
     */
    private void requeueInterrupted(RunContext ctx) {
        Instant now = clock.instant();
        for (var entry : registry.snapshot().values()) {
            if (entry.status() != TaskStatus.RUNNING) {
                continue;
            }
            int attempt = Math.max(entry.attempts(), 1);
            registry.recordAttempt(new ExecutionResult(entry.taskId(), attempt, ExecutionOutcome.FAILED,
                    now, now, null, null, null, INTERRUPTED_BY_RESTART, attempt - 1));
            if (retryPolicy.canRetry(attempt)) {
                registry.requeue(entry.taskId(), now);
                log.info("{} was running at restart; re-queued (attempt {} of {})",
                        entry.taskId(), attempt, retryPolicy.maxAttempts());
            } else {
                log.warn("{} was running at restart and has no attempts left", entry.taskId());
            }
        }
    }

    private void checkpoint(RunContext ctx) {
        synchronized (ctx) {
            boolean saved = checkpoints.save(toState(ctx));
            if (!saved) {
                ctx.resumable = false;
                ctx.checkpointWarnings.addIfAbsent("Checkpoint write failed during phase " + ctx.phase);
            }
        }
    }

    private WorkflowState toState(RunContext ctx) {
        var statuses = new LinkedHashMap<String, TaskStatus>();
        var attempts = new LinkedHashMap<String, Integer>();
        var results = new LinkedHashMap<String, ExecutionResult>();
        var reasons = new LinkedHashMap<String, String>();
        registry.snapshot().forEach((id, state) -> {
            statuses.put(id, state.status());
            attempts.put(id, state.attempts());
            if (state.latestResult() != null) {
                results.put(id, state.latestResult());
            }
            if (state.cancellationReason() != null) {
                reasons.put(id, state.cancellationReason());
            }
        });
        var live = new LinkedHashMap<String, Workspace>();
        for (Workspace workspace : workspaces.active()) {
            live.put(workspace.taskId(), workspace);
        }

        AnalysisResult analysis = ctx.analysis;
        return new WorkflowState(
                WorkflowState.SCHEMA_VERSION,
                ctx.runId,
                0,
                ctx.phase,
                ctx.createdAt,
                clock.instant(),
                ctx.inputs,
                ctx.baseRef,
                analysis != null ? analysis.tasks() : List.of(),
                analysis != null ? analysis.groups() : List.of(),
                analysis != null ? analysis.conflicts().entries() : List.of(),
                statuses,
                attempts,
                live,
                results,
                reasons,
                registry.auditLog(),
                ctx.currentGroup,
                ctx.errors);
    }

    private RunReport finish(RunContext ctx) {
        checkpoint(ctx);
        RunReport report = report(ctx);
        publish(ConclaveEvent.RUN_COMPLETED, ctx.runId, Map.of(
                "phase", ctx.phase.name(),
                "succeeded", report.count(TaskStatus.SUCCEEDED),
                "failed", report.count(TaskStatus.FAILED),
                "cancelled", report.count(TaskStatus.CANCELLED)));
        if (metrics != null) {
            metrics.recordRunResult(report.succeeded() ? "succeeded" : ctx.phase.name().toLowerCase(Locale.ROOT));
        }
        log.info("Run {} finished: phase {}, {} succeeded, {} failed, {} cancelled", ctx.runId, ctx.phase,
                report.count(TaskStatus.SUCCEEDED), report.count(TaskStatus.FAILED), report.count(TaskStatus.CANCELLED));
        return report;
    }

    private RunReport report(RunContext ctx) {
        var durations = new HashMap<String, Duration>();
        for (ExecutionResult result : registry.auditLog()) {
            durations.merge(result.taskId(), result.duration(), Duration::plus);
        }

        var tasks = new ArrayList<TaskReport>();
        if (ctx.analysis != null) {
            var snapshot = registry.snapshot();
            for (Task task : ctx.analysis.tasks()) {
                var state = snapshot.get(task.id());
                if (state == null) {
                    continue;
                }
                String error = null;
                if (state.status() != TaskStatus.SUCCEEDED) {
                    error = state.status() == TaskStatus.CANCELLED && state.cancellationReason() != null
                            ? state.cancellationReason()
                            : state.latestResult() != null ? state.latestResult().errorMessage() : null;
                }
                tasks.add(new TaskReport(task.id(), task.title(), state.status(), state.attempts(),
                        durations.getOrDefault(task.id(), Duration.ZERO), error));
            }
        }
        return new RunReport(ctx.runId, ctx.phase, tasks, ctx.fatalError, ctx.resumable,
                ctx.checkpointWarnings, ctx.startedAt, clock.instant());
    }

    private void publish(String type, String runId, Map<String, Object> payload) {
        publish(type, runId, null, payload);
    }

    private void publish(String type, String runId, String taskId, Map<String, Object> payload) {
        eventBus.publish(ConclaveEvent.of(type, runId, taskId, payload));
    }
}
