package com.conclave.core.analysis;

import com.conclave.core.config.ConclaveProperties;
import com.conclave.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits tasks whose complexity score exceeds the decomposition threshold into a chain of
 * subtasks. Pure and deterministic: the same task always yields the same subtasks.
 *
 * <p>Split order of preference: declared steps, numbered list items in the description,
 * {@code ## } sections of the description, then halves of the target file list.
 */
@Component
public class TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*\\d+[.)]\\s+\\S.*$");
    private static final Pattern SECTION = Pattern.compile("^##\\s+\\S.*$");

    private final ComplexityEstimator estimator;
    private final double threshold;
    private final int maxDepth;

    @Autowired
    public TaskDecomposer(ComplexityEstimator estimator, ConclaveProperties properties) {
        this(estimator, properties.getAnalysis().getDecompositionThreshold(),
                properties.getAnalysis().getMaxDecompositionDepth());
    }

    public TaskDecomposer(ComplexityEstimator estimator, double threshold, int maxDepth) {
        this.estimator = estimator;
        this.threshold = threshold;
        this.maxDepth = maxDepth;
    }

    public boolean needsDecomposition(Task task) {
        return task.complexityScore() > threshold;
    }

    /**
     * Decomposes a scored task.
     *
     * @param task  the scored task
     * @param steps declared outline for the task, possibly empty
     * @return the leaf subtasks in execution order, or the task itself when it does not
     *         exceed the threshold or cannot be split
     */
    public List<Task> decompose(Task task, List<String> steps) {
        return decompose(task, steps, 0);
    }

    private List<Task> decompose(Task task, List<String> steps, int depth) {
        if (!needsDecomposition(task) || depth >= maxDepth) {
            return List.of(task);
        }
        List<Task> parts = split(task, steps);
        if (parts.size() < 2) {
            return List.of(task);
        }
        log.info("Decomposing {} (score {}) into {} subtasks", task.id(), task.complexityScore(), parts.size());

        var leaves = new ArrayList<Task>();
        List<String> previousDeps = task.dependencies();
        for (Task part : parts) {
            Task chained = estimator.score(part.withDependencies(previousDeps), null);
            List<Task> expanded = decompose(chained, List.of(), depth + 1);
            leaves.addAll(expanded);
            previousDeps = List.of(expanded.get(expanded.size() - 1).id());
        }
        return leaves;
    }

    /**
     * Unscored, unchained parts of the task, or a single-element list when it cannot be split.
     */
    List<Task> split(Task task, List<String> steps) {
        List<String> segments = steps.size() >= 2 ? steps : segmentsOf(task.description());
        if (segments.size() >= 2) {
            var parts = new ArrayList<Task>();
            for (int i = 0; i < segments.size(); i++) {
                String segment = segments.get(i).strip();
                List<String> files = filesMentioned(task.targetFiles(), segment);
                parts.add(subtask(task, i + 1, segments.size(), segment,
                        files.isEmpty() ? task.targetFiles() : files));
            }
            return parts;
        }

        List<String> files = task.targetFiles();
        if (files.size() >= 2) {
            int chunk = (files.size() + 1) / 2;
            var parts = new ArrayList<Task>();
            int total = (files.size() + chunk - 1) / chunk;
            for (int start = 0, n = 1; start < files.size(); start += chunk, n++) {
                List<String> slice = files.subList(start, Math.min(start + chunk, files.size()));
                String description = task.description() + "\n\nScope: " + String.join(", ", slice);
                parts.add(subtask(task, n, total, description, slice));
            }
            return parts;
        }
        return List.of(task);
    }

    private static List<String> segmentsOf(String description) {
        if (description == null || description.isBlank()) {
            return List.of();
        }
        String[] lines = description.replace("\r\n", "\n").split("\n");
        List<String> items = collect(lines, NUMBERED_ITEM);
        if (items.size() >= 2) {
            return items;
        }
        return collect(lines, SECTION);
    }

    /**
     * Groups lines into segments starting at each line matching the marker. Lines before the
     * first marker are not part of any segment.
     */
    private static List<String> collect(String[] lines, Pattern marker) {
        var segments = new ArrayList<String>();
        StringBuilder current = null;
        for (String line : lines) {
            Matcher m = marker.matcher(line);
            if (m.matches()) {
                if (current != null) {
                    segments.add(current.toString().strip());
                }
                current = new StringBuilder(line.strip());
            } else if (current != null) {
                current.append('\n').append(line);
            }
        }
        if (current != null) {
            segments.add(current.toString().strip());
        }
        return segments;
    }

    private static List<String> filesMentioned(List<String> files, String segment) {
        return files.stream().filter(segment::contains).toList();
    }

    private static Task subtask(Task parent, int index, int total, String description, List<String> files) {
        return new Task(
                parent.id() + "." + index,
                parent.key() + "." + index,
                parent.title() + " (" + index + "/" + total + ")",
                description,
                List.of(),
                files,
                parent.targetDirectories(),
                parent.imports(),
                parent.components(),
                parent.interfaces(),
                parent.dataModels(),
                parent.exclusiveResources(),
                parent.testEnvironments(),
                parent.cpuIntensive(),
                parent.memoryIntensive(),
                null,
                0.0,
                null,
                parent.id());
    }
}
