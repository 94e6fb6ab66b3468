package com.conclave.core.analysis;

import com.conclave.core.config.ConclaveProperties;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.AnalysisResult;
import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskInput;
import com.conclave.core.scheduler.ParallelGroupPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw task inputs into an analysed, conflict-annotated, grouped task set.
 *
 * <p>Pipeline: assign ids, score complexity, validate the dependency graph, decompose
 * complex tasks, build the conflict matrix, plan parallel groups.
 */
@Service
public class TaskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaskAnalyzer.class);

    private final TaskInputParser parser;
    private final ComplexityEstimator estimator;
    private final TaskDecomposer decomposer;
    private final ConflictDetector conflictDetector;
    private final ParallelGroupPlanner planner;
    private final int maxGroupSize;
    private final ConclaveMetrics metrics;

    @Autowired
    public TaskAnalyzer(TaskInputParser parser,
                        ComplexityEstimator estimator,
                        TaskDecomposer decomposer,
                        ConflictDetector conflictDetector,
                        ParallelGroupPlanner planner,
                        ConclaveProperties properties,
                        @Autowired(required = false) ConclaveMetrics metrics) {
        this(parser, estimator, decomposer, conflictDetector, planner,
                properties.getAnalysis().getMaxGroupSize(), metrics);
    }

    public TaskAnalyzer(TaskInputParser parser,
                        ComplexityEstimator estimator,
                        TaskDecomposer decomposer,
                        ConflictDetector conflictDetector,
                        ParallelGroupPlanner planner,
                        int maxGroupSize,
                        ConclaveMetrics metrics) {
        this.parser = parser;
        this.estimator = estimator;
        this.decomposer = decomposer;
        this.conflictDetector = conflictDetector;
        this.planner = planner;
        this.maxGroupSize = maxGroupSize;
        this.metrics = metrics;
    }

    public AnalysisResult analyzeFiles(List<Path> files) {
        return analyze(parser.parseAll(files));
    }

    public AnalysisResult analyze(List<TaskInput> inputs) {
        long start = System.currentTimeMillis();
        parser.validate(inputs);

        Map<String, String> keyToId = new HashMap<>();
        for (int i = 0; i < inputs.size(); i++) {
            keyToId.put(inputs.get(i).key(), taskId(i + 1));
        }

        var scored = new ArrayList<Task>();
        Map<String, TaskInput> inputById = new HashMap<>();
        for (int i = 0; i < inputs.size(); i++) {
            TaskInput input = inputs.get(i);
            String id = taskId(i + 1);
            inputById.put(id, input);
            Task draft = toTask(id, input, input.dependsOn().stream().map(keyToId::get).toList());
            scored.add(estimator.score(draft, input.estimatedMinutes()));
        }

        new DependencyGraph(scored).validate();

        var tasks = new ArrayList<Task>();
        Map<String, String> replacedBy = new HashMap<>();
        for (Task task : scored) {
            List<Task> leaves = decomposer.decompose(task, inputById.get(task.id()).steps());
            if (leaves.size() > 1) {
                replacedBy.put(task.id(), leaves.get(leaves.size() - 1).id());
            }
            tasks.addAll(leaves);
        }
        if (!replacedBy.isEmpty()) {
            tasks.replaceAll(t -> t.withDependencies(
                    t.dependencies().stream().map(d -> replacedBy.getOrDefault(d, d)).toList()));
            new DependencyGraph(tasks).validate();
        }

        ConflictMatrix conflicts = conflictDetector.detectAll(tasks);
        List<List<String>> groups = planner.plan(tasks, conflicts, maxGroupSize);

        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordAnalysisDuration(elapsed);
        }
        log.info("Analysed {} input(s) into {} task(s), {} conflict(s), {} group(s) in {}ms",
                inputs.size(), tasks.size(), conflicts.size(), groups.size(), elapsed);
        return new AnalysisResult(tasks, groups, conflicts);
    }

    static String taskId(int ordinal) {
        return String.format("TASK-%03d", ordinal);
    }

    private static Task toTask(String id, TaskInput input, List<String> dependencies) {
        String title = input.title() != null && !input.title().isBlank() ? input.title() : input.key();
        return new Task(id, input.key(), title, input.description(), dependencies,
                input.targetFiles(), input.targetDirectories(), input.imports(), input.components(),
                input.interfaces(), input.dataModels(), input.exclusiveResources(),
                input.testEnvironments(), input.cpuIntensive(), input.memoryIntensive(),
                null, 0.0, null, null);
    }
}
