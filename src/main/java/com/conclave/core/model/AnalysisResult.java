package com.conclave.core.model;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Output of task analysis: the task set, the conflict matrix and the parallel group plan.
 *
 * @param tasks     analysed tasks, in id order
 * @param groups    parallel groups; group {@code k} only depends on groups before it
 * @param conflicts pairwise conflict matrix
 */
public record AnalysisResult(
    List<Task> tasks,
    List<List<String>> groups,
    ConflictMatrix conflicts
) {

    public AnalysisResult {
        tasks = List.copyOf(tasks);
        groups = groups.stream().map(List::copyOf).toList();
    }

    public Map<String, Task> taskIndex() {
        return tasks.stream().collect(Collectors.toMap(Task::id, Function.identity()));
    }
}
