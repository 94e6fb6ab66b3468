package com.conclave.core.analysis;

import com.conclave.core.model.Complexity;
import com.conclave.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityEstimatorTest {

    private final ComplexityEstimator estimator =
            new ComplexityEstimator(List.of("Migration", "security", "schema"));

    private static Task task(String description, List<String> files, List<String> deps, List<String> components) {
        return new Task("TASK-001", "t", "Task", description, deps, files, List.of(), List.of(),
                components, List.of(), List.of(), List.of(), List.of(), false, false, null, 0.0, null, null);
    }

    private static List<String> numbered(String prefix, int n) {
        return IntStream.rangeClosed(1, n).mapToObj(i -> prefix + i).toList();
    }

    @Test
    @DisplayName("small task scores LOW with a heuristic duration")
    void smallTask() {
        var estimate = estimator.estimate(task("Fix typo", List.of("README.md"), List.of(), List.of()), null);

        assertEquals(0.31, estimate.score());
        assertEquals(Complexity.LOW, estimate.complexity());
        assertEquals(Duration.ofMinutes(8), estimate.duration());
    }

    @Test
    @DisplayName("every saturated signal gives the maximum score")
    void saturated() {
        String words = String.join(" ", Collections.nCopies(400, "word"));
        var t = task("migration security schema " + words, numbered("f", 12), numbered("d", 6), numbered("c", 5));

        var estimate = estimator.estimate(t, null);

        assertEquals(10.0, estimate.score());
        assertEquals(Complexity.HIGH, estimate.complexity());
    }

    @Test
    @DisplayName("keywords match case-insensitively")
    void keywordCase() {
        var plain = estimator.estimate(task("Rename a variable", List.of(), List.of(), List.of()), null);
        var risky = estimator.estimate(task("Run the MIGRATION", List.of(), List.of(), List.of()), null);

        assertTrue(risky.score() > plain.score());
    }

    @Test
    @DisplayName("explicit minutes override the heuristic duration")
    void explicitDuration() {
        var estimate = estimator.estimate(task("Fix typo", List.of("README.md"), List.of(), List.of()), 45);

        assertEquals(Duration.ofMinutes(45), estimate.duration());
    }

    @Test
    @DisplayName("score() fills in the task's complexity fields")
    void scoreFillsTask() {
        Task scored = estimator.score(task("Fix typo", List.of("README.md"), List.of(), List.of()), null);

        assertEquals(Complexity.LOW, scored.complexity());
        assertEquals(0.31, scored.complexityScore());
        assertEquals(Duration.ofMinutes(8), scored.estimatedDuration());
    }

    @Test
    @DisplayName("bucket boundaries")
    void buckets() {
        assertEquals(Complexity.LOW, ComplexityEstimator.bucket(3.49));
        assertEquals(Complexity.MEDIUM, ComplexityEstimator.bucket(3.5));
        assertEquals(Complexity.MEDIUM, ComplexityEstimator.bucket(6.99));
        assertEquals(Complexity.HIGH, ComplexityEstimator.bucket(7.0));
    }
}
