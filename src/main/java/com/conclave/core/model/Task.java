package com.conclave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * An analysed unit of work. Immutable: execution status lives in the process registry.
 *
 * @param id                 unique identifier generated at analysis time (e.g. "TASK-001", "TASK-003.2")
 * @param key                the input key this task was derived from
 * @param title              short human-readable name
 * @param description        what this task should accomplish
 * @param dependencies       IDs of tasks that must succeed first
 * @param targetFiles        files this task intends to create/modify (used for conflict detection)
 * @param targetDirectories  directories this task owns
 * @param imports            files imported by this task's targets
 * @param components         components whose ownership this task touches
 * @param interfaces         public interfaces this task modifies
 * @param dataModels         persistent models this task writes
 * @param exclusiveResources external resources needing exclusive use
 * @param testEnvironments   test environments needing exclusive use
 * @param cpuIntensive       CPU heavy
 * @param memoryIntensive    memory heavy
 * @param complexity         bucket derived from the score
 * @param complexityScore    score on a 0..10 scale
 * @param estimatedDuration  expected wall-clock duration
 * @param parentId           ID of the task this one was decomposed from, or null
 */
public record Task(
    String id,
    String key,
    String title,
    String description,
    List<String> dependencies,
    List<String> targetFiles,
    List<String> targetDirectories,
    List<String> imports,
    List<String> components,
    List<String> interfaces,
    List<String> dataModels,
    List<String> exclusiveResources,
    List<String> testEnvironments,
    boolean cpuIntensive,
    boolean memoryIntensive,
    Complexity complexity,
    double complexityScore,
    Duration estimatedDuration,
    String parentId
) implements Serializable {

    public Task {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        targetFiles = targetFiles != null ? List.copyOf(targetFiles) : List.of();
        targetDirectories = targetDirectories != null ? List.copyOf(targetDirectories) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        components = components != null ? List.copyOf(components) : List.of();
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
        dataModels = dataModels != null ? List.copyOf(dataModels) : List.of();
        exclusiveResources = exclusiveResources != null ? List.copyOf(exclusiveResources) : List.of();
        testEnvironments = testEnvironments != null ? List.copyOf(testEnvironments) : List.of();
        estimatedDuration = estimatedDuration != null ? estimatedDuration : Duration.ZERO;
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, key, title, description, newDependencies, targetFiles, targetDirectories,
                imports, components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, complexity, complexityScore, estimatedDuration, parentId);
    }

    public Task withComplexity(Complexity newComplexity, double newScore, Duration newEstimate) {
        return new Task(id, key, title, description, dependencies, targetFiles, targetDirectories,
                imports, components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, newComplexity, newScore, newEstimate, parentId);
    }

    @JsonIgnore
    public boolean isSubtask() {
        return parentId != null;
    }
}
