package com.conclave.core.scheduler;

import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions tasks into ordered parallel groups by topological layering.
 *
 * <p>Each round takes the tasks whose dependencies all sit in earlier groups, orders them by
 * (estimated duration, id) and places each into the current group unless it conflicts with a
 * task already placed there. Conflicting tasks are deferred to the next round, so two tasks
 * in the same group never conflict and never depend on each other.
 */
@Service
public class ParallelGroupPlanner {

    private static final Logger log = LoggerFactory.getLogger(ParallelGroupPlanner.class);

    static final Comparator<Task> ADMISSION_ORDER =
            Comparator.comparing(Task::estimatedDuration).thenComparing(Task::id);

    public List<List<String>> plan(List<Task> tasks, ConflictMatrix conflicts) {
        return plan(tasks, conflicts, 0);
    }

    /**
     * Compute the parallel groups.
     *
     * @param tasks        all tasks to schedule
     * @param conflicts    pairwise conflicts between the tasks
     * @param maxGroupSize cap on tasks per group; 0 means unbounded
     * @return non-empty groups in execution order
     */
    public List<List<String>> plan(List<Task> tasks, ConflictMatrix conflicts, int maxGroupSize) {
        Map<String, Task> remaining = new LinkedHashMap<>();
        for (Task task : tasks) {
            remaining.put(task.id(), task);
        }
        for (Task task : tasks) {
            for (String dep : task.dependencies()) {
                if (!remaining.containsKey(dep)) {
                    throw new IllegalArgumentException("Task " + task.id() + " depends on unknown task " + dep);
                }
            }
        }

        Set<String> placed = new HashSet<>();
        var groups = new ArrayList<List<String>>();

        while (!remaining.isEmpty()) {
            List<Task> eligible = remaining.values().stream()
                    .filter(t -> placed.containsAll(t.dependencies()))
                    .sorted(ADMISSION_ORDER)
                    .toList();
            if (eligible.isEmpty()) {
                var stuck = new ArrayList<>(remaining.keySet());
                stuck.sort(Comparator.naturalOrder());
                throw new IllegalStateException("No schedulable tasks remain among " + stuck);
            }

            var group = new ArrayList<String>();
            var deferred = new ArrayList<String>();
            for (Task task : eligible) {
                if (maxGroupSize > 0 && group.size() >= maxGroupSize) {
                    deferred.add(task.id());
                    continue;
                }
                if (conflicts.conflictsWithAny(task.id(), group)) {
                    log.debug("  {} conflicts with group {}, deferring", task.id(), groups.size() + 1);
                    deferred.add(task.id());
                    continue;
                }
                group.add(task.id());
            }

            if (!deferred.isEmpty()) {
                log.info("Group {}: {} task(s) deferred to a later group: {}",
                        groups.size() + 1, deferred.size(), deferred);
            }
            for (String id : group) {
                remaining.remove(id);
            }
            placed.addAll(group);
            groups.add(List.copyOf(group));
        }

        log.info("Planned {} task(s) into {} parallel group(s)", tasks.size(), groups.size());
        return List.copyOf(groups);
    }
}
