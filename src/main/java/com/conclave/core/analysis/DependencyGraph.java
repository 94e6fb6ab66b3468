package com.conclave.core.analysis;

import com.conclave.core.error.DependencyCycleException;
import com.conclave.core.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency graph over a task set, validated by depth-first search with three-colour marking.
 */
public class DependencyGraph {

    private enum Colour { WHITE, GREY, BLACK }

    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public DependencyGraph(List<Task> tasks) {
        for (Task task : tasks) {
            this.tasks.put(task.id(), task);
        }
    }

    /**
     * Throws {@link DependencyCycleException} naming the first cycle found. Tasks are visited in
     * id order so the reported cycle is stable. Dependencies outside the task set are ignored.
     */
    public void validate() {
        topologicalOrder();
    }

    /**
     * Task IDs ordered so that every task follows its dependencies.
     */
    public List<String> topologicalOrder() {
        var colours = new HashMap<String, Colour>();
        var order = new ArrayList<String>();
        var ids = new ArrayList<>(tasks.keySet());
        Collections.sort(ids);
        for (String id : ids) {
            if (colours.getOrDefault(id, Colour.WHITE) == Colour.WHITE) {
                visit(id, colours, new ArrayList<>(), order);
            }
        }
        return order;
    }

    private void visit(String id, Map<String, Colour> colours, List<String> path, List<String> order) {
        colours.put(id, Colour.GREY);
        path.add(id);
        var deps = new ArrayList<>(tasks.get(id).dependencies());
        Collections.sort(deps);
        for (String dep : deps) {
            if (!tasks.containsKey(dep)) {
                continue;
            }
            Colour colour = colours.getOrDefault(dep, Colour.WHITE);
            if (colour == Colour.GREY) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                throw new DependencyCycleException(cycle);
            }
            if (colour == Colour.WHITE) {
                visit(dep, colours, path, order);
            }
        }
        path.remove(path.size() - 1);
        colours.put(id, Colour.BLACK);
        order.add(id);
    }
}
