package com.conclave.core.persistence;

import com.conclave.core.config.ConclaveConfig;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.ConflictDescriptor;
import com.conclave.core.model.ConflictDimension;
import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.ExecutionOutcome;
import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.model.WorkflowPhase;
import com.conclave.core.model.Workspace;
import com.conclave.core.model.WorkspaceStatus;
import com.conclave.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.conclave.support.Tasks.task;
import static org.junit.jupiter.api.Assertions.*;

class CheckpointManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ConclaveConfig().objectMapper();
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        manager = new CheckpointManager(objectMapper, tempDir.resolve("runs"),
                new ConclaveMetrics(meterRegistry), clock);
    }

    private WorkflowState state(String runId, WorkflowPhase phase) {
        var result = new ExecutionResult("TASK-001", 1, ExecutionOutcome.SUCCESS, T0, T0.plusSeconds(42),
                0, "out.log", "err.log", null, 0);
        var workspace = new Workspace("TASK-002", tempDir.resolve("wt").resolve("TASK-002"),
                "conclave/" + runId + "/TASK-002", "HEAD", WorkspaceStatus.ACTIVE, T0);
        var conflict = new ConflictMatrix.Entry("TASK-001", "TASK-002",
                new ConflictDescriptor(Set.of(ConflictDimension.FILE), List.of("both modify a.py")));
        return new WorkflowState(WorkflowState.SCHEMA_VERSION, runId, 0, phase, T0, null,
                List.of("tasks/a.json"), "HEAD",
                List.of(task("TASK-001", List.of(), List.of("a.py")),
                        task("TASK-002", List.of(), List.of("a.py"), Duration.ofMinutes(12))),
                List.of(List.of("TASK-001"), List.of("TASK-002")),
                List.of(conflict),
                Map.of("TASK-001", TaskStatus.SUCCEEDED, "TASK-002", TaskStatus.RUNNING),
                Map.of("TASK-001", 1, "TASK-002", 1),
                Map.of("TASK-002", workspace),
                Map.of("TASK-001", result),
                Map.of(),
                List.of(result),
                1,
                List.of());
    }

    @Test
    @DisplayName("save then load restores the run")
    void roundTrip() {
        assertTrue(manager.save(state("RUN-1", WorkflowPhase.EXECUTING)));

        WorkflowState loaded = manager.load("RUN-1").orElseThrow();

        assertEquals("RUN-1", loaded.runId());
        assertEquals(1, loaded.sequence());
        assertEquals(T0, loaded.updatedAt());
        assertEquals(WorkflowPhase.EXECUTING, loaded.phase());
        assertEquals(state("RUN-1", WorkflowPhase.EXECUTING).tasks(), loaded.tasks());
        assertEquals(List.of(List.of("TASK-001"), List.of("TASK-002")), loaded.groups());
        assertEquals(TaskStatus.RUNNING, loaded.statuses().get("TASK-002"));
        assertEquals(Duration.ofSeconds(42), loaded.results().get("TASK-001").duration());
        assertEquals("conclave/RUN-1/TASK-002", loaded.workspaces().get("TASK-002").branchName());
        assertTrue(loaded.conflictMatrix().conflicts("TASK-002", "TASK-001"));
        assertEquals(1, loaded.currentGroup());
        assertTrue(loaded.isResumable());
    }

    @Test
    @DisplayName("sequence increases with every write, across manager instances")
    void monotonicSequence() {
        manager.save(state("RUN-1", WorkflowPhase.ANALYZED));
        clock.advance(Duration.ofSeconds(5));
        manager.save(state("RUN-1", WorkflowPhase.EXECUTING));

        WorkflowState second = manager.load("RUN-1").orElseThrow();
        assertEquals(2, second.sequence());
        assertEquals(T0.plusSeconds(5), second.updatedAt());

        var restarted = new CheckpointManager(objectMapper, tempDir.resolve("runs"), null, clock);
        restarted.save(second);
        assertEquals(3, restarted.load("RUN-1").orElseThrow().sequence());
    }

    @Test
    @DisplayName("write leaves no temp files behind")
    void noTempFiles() throws Exception {
        manager.save(state("RUN-1", WorkflowPhase.EXECUTING));
        manager.save(state("RUN-1", WorkflowPhase.COMPLETED));

        try (var files = Files.list(tempDir.resolve("runs").resolve("RUN-1"))) {
            assertEquals(List.of(CheckpointManager.CHECKPOINT_FILE),
                    files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    @DisplayName("missing or corrupt checkpoints load as empty")
    void unreadable() throws Exception {
        assertTrue(manager.load("RUN-404").isEmpty());

        Path file = manager.checkpointFile("RUN-BAD");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json");

        assertTrue(manager.load("RUN-BAD").isEmpty());
    }

    @Test
    @DisplayName("lists runs and detects the resumable ones")
    void listAndDetect() throws Exception {
        manager.save(state("RUN-C", WorkflowPhase.ANALYZED));
        manager.save(state("RUN-A", WorkflowPhase.EXECUTING));
        manager.save(state("RUN-B", WorkflowPhase.COMPLETED));
        Path corrupt = manager.checkpointFile("RUN-D");
        Files.createDirectories(corrupt.getParent());
        Files.writeString(corrupt, "[]");

        var runs = manager.listRuns();

        assertEquals(List.of("RUN-A", "RUN-B", "RUN-C"), runs.stream().map(CheckpointManager.RunSummary::runId).toList());
        assertEquals(2, runs.get(0).taskCount());
        assertEquals(List.of("RUN-A", "RUN-C"), manager.detectResumableRuns());
    }

    @Test
    @DisplayName("listing an absent directory yields nothing")
    void emptyDirectory() {
        assertTrue(manager.listRuns().isEmpty());
    }

    @Test
    @DisplayName("delete removes the run directory")
    void delete() {
        manager.save(state("RUN-1", WorkflowPhase.COMPLETED));

        assertTrue(manager.delete("RUN-1"));
        assertFalse(Files.exists(tempDir.resolve("runs").resolve("RUN-1")));
        assertFalse(manager.delete("RUN-1"));
    }

    @Test
    @DisplayName("a failed write returns false and is counted")
    void failedWrite() throws Exception {
        Path blocker = tempDir.resolve("blocked");
        Files.writeString(blocker, "not a directory");
        var failing = new CheckpointManager(objectMapper, blocker, new ConclaveMetrics(meterRegistry), clock);

        assertFalse(failing.save(state("RUN-1", WorkflowPhase.EXECUTING)));
        assertEquals(1.0, meterRegistry.get("conclave.checkpoint.writes").tag("result", "failure").counter().count());
    }
}
