package com.conclave.core.analysis;

import com.conclave.core.error.DependencyCycleException;
import com.conclave.core.error.InputParseException;
import com.conclave.core.model.AnalysisResult;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskInput;
import com.conclave.core.scheduler.ParallelGroupPlanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskAnalyzerTest {

    private static TaskAnalyzer analyzer(double decompositionThreshold) {
        var estimator = new ComplexityEstimator(List.of("migration"));
        return new TaskAnalyzer(
                new TaskInputParser(new ObjectMapper()),
                estimator,
                new TaskDecomposer(estimator, decompositionThreshold, 1),
                new ConflictDetector(),
                new ParallelGroupPlanner(),
                0,
                null);
    }

    @Test
    @DisplayName("assigns sequential ids and maps dependency keys to ids")
    void idsAndDependencies() {
        AnalysisResult result = analyzer(7.0).analyze(List.of(
                TaskInput.of("schema", "Create tables", List.of("db/schema.sql"), List.of()),
                TaskInput.of("api", "Add endpoints", List.of("src/api.py"), List.of("schema")),
                TaskInput.of("docs", "Write docs", List.of("README.md"), List.of())));

        assertEquals(List.of("TASK-001", "TASK-002", "TASK-003"), result.tasks().stream().map(Task::id).toList());
        assertEquals(List.of("TASK-001"), result.taskIndex().get("TASK-002").dependencies());
        assertEquals(List.of(List.of("TASK-001", "TASK-003"), List.of("TASK-002")), result.groups());
        assertNotNull(result.taskIndex().get("TASK-003").complexity());
    }

    @Test
    @DisplayName("conflicting inputs land in different groups")
    void conflictsSplitGroups() {
        AnalysisResult result = analyzer(7.0).analyze(List.of(
                TaskInput.of("a", "Edit config", List.of("config.yaml"), List.of()),
                TaskInput.of("b", "Also edit config", List.of("./config.yaml"), List.of())));

        assertEquals(1, result.conflicts().size());
        assertEquals(2, result.groups().size());
    }

    @Test
    @DisplayName("rejects dependency cycles")
    void cycle() {
        var e = assertThrows(DependencyCycleException.class, () -> analyzer(7.0).analyze(List.of(
                TaskInput.of("a", "A", List.of(), List.of("b")),
                TaskInput.of("b", "B", List.of(), List.of("a")))));

        assertEquals(List.of("TASK-001", "TASK-002", "TASK-001"), e.getCycle());
    }

    @Test
    @DisplayName("rejects unknown dependency keys")
    void unknownDependency() {
        assertThrows(InputParseException.class, () -> analyzer(7.0).analyze(List.of(
                TaskInput.of("a", "A", List.of(), List.of("ghost")))));
    }

    @Test
    @DisplayName("dependents of a decomposed task wait for its last subtask")
    void decompositionRewiresDependents() {
        var big = new TaskInput("big", "Big", "Large change", List.of("a.py", "b.py", "c.py", "d.py"),
                null, null, null, null, null, null, null, false, false, null, null,
                List.of("Change a.py and b.py", "Change c.py and d.py"), null);
        var after = TaskInput.of("after", "Follow-up", List.of(), List.of("big"));

        AnalysisResult result = analyzer(1.0).analyze(List.of(big, after));

        assertEquals(List.of("TASK-001.1", "TASK-001.2", "TASK-002"),
                result.tasks().stream().map(Task::id).toList());
        assertEquals(List.of("TASK-001.2"), result.taskIndex().get("TASK-002").dependencies());
        assertEquals(List.of("a.py", "b.py"), result.taskIndex().get("TASK-001.1").targetFiles());
        assertEquals(3, result.groups().size());
    }

    @Test
    @DisplayName("analyses task files from disk")
    void analyzeFiles(@TempDir Path dir) throws Exception {
        Path first = dir.resolve("setup.json");
        Files.writeString(first, "{\"description\": \"Set up\", \"targetFiles\": [\"a.py\"]}");
        Path second = dir.resolve("follow.yaml");
        Files.writeString(second, "description: Follow up\ndependsOn: [setup]\n");

        AnalysisResult result = analyzer(7.0).analyzeFiles(List.of(first, second));

        assertEquals(2, result.tasks().size());
        assertEquals("setup", result.tasks().get(0).key());
        assertEquals(List.of("TASK-001"), result.tasks().get(1).dependencies());
    }
}
