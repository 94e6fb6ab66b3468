package com.conclave.dispatch.cli;

import com.conclave.core.engine.OrchestratorCoordinator;
import com.conclave.core.engine.RunOptions;
import com.conclave.core.error.DependencyCycleException;
import com.conclave.core.events.EventBus;
import com.conclave.core.model.AnalysisResult;
import com.conclave.core.model.ConflictDescriptor;
import com.conclave.core.model.ConflictDimension;
import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.ExecutionOutcome;
import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.RunReport;
import com.conclave.core.model.TaskReport;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.model.WorkflowPhase;
import com.conclave.core.persistence.CheckpointManager;
import com.conclave.core.persistence.WorkflowState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.conclave.support.Tasks.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the CLI through picocli directly, without a Spring context.
 */
class CliTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private final OrchestratorCoordinator coordinator = mock(OrchestratorCoordinator.class);
    private final CheckpointManager checkpoints = mock(CheckpointManager.class);
    private final EventBus eventBus = new EventBus();

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(coordinator, eventBus);
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(coordinator);
                }
                if (cls == ResumeCommand.class) {
                    return (K) new ResumeCommand(coordinator, eventBus);
                }
                if (cls == RunsCommand.class) {
                    return (K) new RunsCommand(checkpoints);
                }
                if (cls == InspectCommand.class) {
                    return (K) new InspectCommand(checkpoints);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        var capture = new ByteArrayOutputStream();
        var stream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(stream);
        System.setErr(stream);
        try {
            int exitCode = new CommandLine(new ConclaveCommand(), factory()).execute(args);
            stream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static RunReport report(WorkflowPhase phase, boolean resumable, TaskReport... tasks) {
        return new RunReport("RUN-20260301-120000-001", phase, List.of(tasks), null, resumable, List.of(),
                T0, T0.plusSeconds(75));
    }

    private static TaskReport taskReport(String id, TaskStatus status, String error) {
        return new TaskReport(id, "Task " + id, status, 1, Duration.ofSeconds(12), error);
    }

    @Nested
    @DisplayName("help and usage")
    class Help {

        @Test
        void listsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "plan", "resume", "runs", "inspect")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("isolated git worktrees"));
        }

        @Test
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Conclave 0.1.0"));
        }

        @Test
        void noSubcommandPrintsUsage() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: conclave"));
        }

        @Test
        void missingFilesIsAUsageError() {
            CliResult result = execute("run");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }

        @Test
        void unknownOptionIsAUsageError() {
            assertEquals(2, execute("plan", "--bogus", "a.json").exitCode());
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        void exitsZeroWhenEveryTaskSucceeded() {
            when(coordinator.run(anyList(), any(RunOptions.class))).thenReturn(report(WorkflowPhase.COMPLETED, true,
                    taskReport("TASK-001", TaskStatus.SUCCEEDED, null)));

            CliResult result = execute("run", "a.json", "-p", "3", "--timeout", "90", "--base-ref", "main");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASK-001"));
            assertTrue(result.output().contains("Run complete."));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<Path>> files = ArgumentCaptor.forClass(List.class);
            ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
            verify(coordinator).run(files.capture(), options.capture());
            assertEquals(List.of(Path.of("a.json")), files.getValue());
            assertEquals(new RunOptions(3, Duration.ofSeconds(90), "main"), options.getValue());
        }

        @Test
        void exitsOneWhenAnyTaskFailed() {
            when(coordinator.run(anyList(), any(RunOptions.class))).thenReturn(report(WorkflowPhase.COMPLETED, true,
                    taskReport("TASK-001", TaskStatus.SUCCEEDED, null),
                    taskReport("TASK-002", TaskStatus.FAILED, "Task TASK-002 exited with code 1")));

            CliResult result = execute("run", "a.json", "b.json");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Task TASK-002 exited with code 1"));
        }

        @Test
        void reportsCancellationReason() {
            when(coordinator.run(anyList(), any(RunOptions.class))).thenReturn(report(WorkflowPhase.CANCELLED, false,
                    taskReport("TASK-001", TaskStatus.CANCELLED, "run-cancelled")));

            CliResult result = execute("run", "a.json");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("run-cancelled"));
            assertFalse(result.output().contains("Resume with"));
        }

        @Test
        void warnsWhenCheckpointingFailed() {
            var broken = new RunReport("RUN-X", WorkflowPhase.COMPLETED,
                    List.of(taskReport("TASK-001", TaskStatus.SUCCEEDED, null)), null, false,
                    List.of("Checkpoint write failed during phase EXECUTING"), T0, T0.plusSeconds(1));
            when(coordinator.run(anyList(), any(RunOptions.class))).thenReturn(broken);

            CliResult result = execute("run", "a.json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Checkpoint write failed during phase EXECUTING"));
        }
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        void printsGroupsAndConflicts() {
            var conflicts = ConflictMatrix.builder()
                    .put("TASK-001", "TASK-002",
                            new ConflictDescriptor(Set.of(ConflictDimension.FILE), List.of("both modify app.py")))
                    .build();
            when(coordinator.plan(anyList())).thenReturn(new AnalysisResult(
                    List.of(task("TASK-001"), task("TASK-002")),
                    List.of(List.of("TASK-001"), List.of("TASK-002")),
                    conflicts));

            CliResult result = execute("plan", "a.json", "b.json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 task(s) in 2 group(s)"));
            assertTrue(result.output().contains("both modify app.py"));
        }

        @Test
        void analysisErrorExitsOne() {
            when(coordinator.plan(anyList()))
                    .thenThrow(new DependencyCycleException(List.of("TASK-001", "TASK-002", "TASK-001")));

            CliResult result = execute("plan", "a.json");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Dependency cycle detected"));
        }
    }

    @Nested
    @DisplayName("resume")
    class Resume {

        @Test
        void resumesTheNamedRun() {
            when(coordinator.resume(eq("RUN-1"), any(RunOptions.class))).thenReturn(report(WorkflowPhase.COMPLETED,
                    true, taskReport("TASK-001", TaskStatus.SUCCEEDED, null)));

            CliResult result = execute("resume", "RUN-1", "--max-parallel", "2");

            assertEquals(0, result.exitCode());
            verify(coordinator).resume("RUN-1", new RunOptions(2, null, null));
        }

        @Test
        void unknownRunExitsOne() {
            when(coordinator.resume(anyString(), any(RunOptions.class)))
                    .thenThrow(new IllegalArgumentException("No checkpoint found for run RUN-404"));

            CliResult result = execute("resume", "RUN-404");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No checkpoint found for run RUN-404"));
        }
    }

    @Nested
    @DisplayName("runs and inspect")
    class Inspection {

        @Test
        void noRuns() {
            when(checkpoints.listRuns()).thenReturn(List.of());

            CliResult result = execute("runs");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No runs found."));
        }

        @Test
        void listsMostRecentRuns() {
            when(checkpoints.listRuns()).thenReturn(List.of(
                    new CheckpointManager.RunSummary("RUN-A", WorkflowPhase.COMPLETED, T0, 3, false),
                    new CheckpointManager.RunSummary("RUN-B", WorkflowPhase.EXECUTING, T0, 5, true)));

            CliResult result = execute("runs", "-n", "1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Runs (1 of 2)"));
            assertTrue(result.output().contains("RUN-B"));
            assertFalse(result.output().contains("RUN-A"));
        }

        @Test
        void inspectShowsTaskStates() {
            var failed = new ExecutionResult("TASK-002", 3, ExecutionOutcome.FAILED, T0, T0.plusSeconds(5),
                    1, null, null, "Task TASK-002 exited with code 1", 2);
            var state = new WorkflowState(WorkflowState.SCHEMA_VERSION, "RUN-1", 7, WorkflowPhase.EXECUTING, T0, T0,
                    List.of("a.json"), "HEAD",
                    List.of(task("TASK-001"), task("TASK-002")),
                    List.of(List.of("TASK-001", "TASK-002")),
                    List.of(),
                    Map.of("TASK-001", TaskStatus.SUCCEEDED, "TASK-002", TaskStatus.FAILED),
                    Map.of("TASK-001", 1, "TASK-002", 3),
                    Map.of(),
                    Map.of("TASK-002", failed),
                    Map.of(),
                    List.of(failed),
                    0,
                    List.of("Integration of TASK-001 failed: nothing to commit"));
            when(checkpoints.load("RUN-1")).thenReturn(Optional.of(state));

            CliResult result = execute("inspect", "RUN-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("EXECUTING (resumable)"));
            assertTrue(result.output().contains("sequence 7"));
            assertTrue(result.output().contains("attempts 3, Task TASK-002 exited with code 1"));
            assertTrue(result.output().contains("Integration of TASK-001 failed"));
        }

        @Test
        void inspectUnknownRunExitsOne() {
            when(checkpoints.load("RUN-404")).thenReturn(Optional.empty());

            CliResult result = execute("inspect", "RUN-404");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Run not found: RUN-404"));
        }
    }

    @Test
    @DisplayName("durations are printed compactly")
    void formatDuration() {
        assertEquals("-", ConsoleOutput.formatDuration(null));
        assertEquals("250ms", ConsoleOutput.formatDuration(Duration.ofMillis(250)));
        assertEquals("42s", ConsoleOutput.formatDuration(Duration.ofSeconds(42)));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(Duration.ofSeconds(125)));
    }
}
