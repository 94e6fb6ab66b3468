package com.conclave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.List;

/**
 * A raw task definition as read from a task file, before analysis.
 *
 * @param key                reference name other inputs use in {@code dependsOn}
 * @param title              short human-readable name
 * @param description        what the task should accomplish (required)
 * @param targetFiles        files the task intends to create or modify
 * @param targetDirectories  directories the task owns
 * @param imports            files the task's targets import
 * @param components         business or architectural components touched
 * @param interfaces         public API surfaces modified
 * @param dataModels         persistent models/schemas written
 * @param exclusiveResources named external resources needing exclusive use
 * @param testEnvironments   test fixtures/environments needing exclusive use
 * @param cpuIntensive       whether the task is CPU heavy
 * @param memoryIntensive    whether the task is memory heavy
 * @param dependsOn          keys of inputs that must complete first
 * @param estimatedMinutes   explicit duration estimate, overrides the heuristic
 * @param steps              optional ordered outline, used for decomposition
 * @param source             where the input was read from (set by the parser)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskInput(
    String key,
    String title,
    String description,
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
    List<String> dependsOn,
    Integer estimatedMinutes,
    List<String> steps,
    String source
) implements Serializable {

    public TaskInput {
        targetFiles = targetFiles != null ? List.copyOf(targetFiles) : List.of();
        targetDirectories = targetDirectories != null ? List.copyOf(targetDirectories) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        components = components != null ? List.copyOf(components) : List.of();
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
        dataModels = dataModels != null ? List.copyOf(dataModels) : List.of();
        exclusiveResources = exclusiveResources != null ? List.copyOf(exclusiveResources) : List.of();
        testEnvironments = testEnvironments != null ? List.copyOf(testEnvironments) : List.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    /** Minimal input for callers that only have a key, a description and target files. */
    public static TaskInput of(String key, String description, List<String> targetFiles, List<String> dependsOn) {
        return new TaskInput(key, key, description, targetFiles, null, null, null, null, null,
                null, null, false, false, dependsOn, null, null, null);
    }

    public TaskInput withKey(String newKey) {
        return new TaskInput(newKey, title, description, targetFiles, targetDirectories, imports,
                components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, dependsOn, estimatedMinutes, steps, source);
    }

    public TaskInput withTitle(String newTitle) {
        return new TaskInput(key, newTitle, description, targetFiles, targetDirectories, imports,
                components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, dependsOn, estimatedMinutes, steps, source);
    }

    public TaskInput withDescription(String newDescription) {
        return new TaskInput(key, title, newDescription, targetFiles, targetDirectories, imports,
                components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, dependsOn, estimatedMinutes, steps, source);
    }

    public TaskInput withTargetFiles(List<String> files) {
        return new TaskInput(key, title, description, files, targetDirectories, imports,
                components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, dependsOn, estimatedMinutes, steps, source);
    }

    public TaskInput withSource(String newSource) {
        return new TaskInput(key, title, description, targetFiles, targetDirectories, imports,
                components, interfaces, dataModels, exclusiveResources, testEnvironments,
                cpuIntensive, memoryIntensive, dependsOn, estimatedMinutes, steps, newSource);
    }
}
