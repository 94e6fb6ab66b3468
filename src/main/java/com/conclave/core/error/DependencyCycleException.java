package com.conclave.core.error;

import java.util.List;

/**
 * The task dependency graph contains a cycle. The cycle is reported as an ordered list of
 * task IDs whose first and last element are the same task.
 */
public class DependencyCycleException extends ConclaveException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
