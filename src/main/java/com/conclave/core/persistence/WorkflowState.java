package com.conclave.core.persistence;

import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.model.WorkflowPhase;
import com.conclave.core.model.Workspace;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to resume a run, as written to {@code checkpoint.json}.
 *
 * @param schemaVersion       format version, currently {@value #SCHEMA_VERSION}
 * @param runId               the run
 * @param sequence            monotonic write counter, stamped on save
 * @param phase               run phase at the time of writing
 * @param createdAt           when the run started
 * @param updatedAt           when this checkpoint was written, stamped on save
 * @param inputs              source paths of the task inputs
 * @param baseRef             reference workspaces start from
 * @param tasks               analysed tasks
 * @param groups              parallel groups
 * @param conflicts           conflicting pairs
 * @param statuses            status per task id
 * @param attempts            attempts started per task id
 * @param workspaces          live workspace per task id
 * @param results             latest attempt per task id
 * @param cancellationReasons reason per cancelled task id
 * @param auditLog            every attempt, in recording order
 * @param currentGroup        index of the group being executed
 * @param errors              fatal and checkpoint errors seen so far
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowState(
    int schemaVersion,
    String runId,
    long sequence,
    WorkflowPhase phase,
    Instant createdAt,
    Instant updatedAt,
    List<String> inputs,
    String baseRef,
    List<Task> tasks,
    List<List<String>> groups,
    List<ConflictMatrix.Entry> conflicts,
    Map<String, TaskStatus> statuses,
    Map<String, Integer> attempts,
    Map<String, Workspace> workspaces,
    Map<String, ExecutionResult> results,
    Map<String, String> cancellationReasons,
    List<ExecutionResult> auditLog,
    int currentGroup,
    List<String> errors
) implements Serializable {

    public static final int SCHEMA_VERSION = 1;

    public WorkflowState {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        groups = groups != null ? groups.stream().map(List::copyOf).toList() : List.of();
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        statuses = statuses != null ? Map.copyOf(statuses) : Map.of();
        attempts = attempts != null ? Map.copyOf(attempts) : Map.of();
        workspaces = workspaces != null ? Map.copyOf(workspaces) : Map.of();
        results = results != null ? Map.copyOf(results) : Map.of();
        cancellationReasons = cancellationReasons != null ? Map.copyOf(cancellationReasons) : Map.of();
        auditLog = auditLog != null ? List.copyOf(auditLog) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public WorkflowState stamped(long newSequence, Instant newUpdatedAt) {
        return new WorkflowState(schemaVersion, runId, newSequence, phase, createdAt, newUpdatedAt, inputs,
                baseRef, tasks, groups, conflicts, statuses, attempts, workspaces, results,
                cancellationReasons, auditLog, currentGroup, errors);
    }

    @JsonIgnore
    public boolean isResumable() {
        return phase != null && phase.isResumable();
    }

    public ConflictMatrix conflictMatrix() {
        return ConflictMatrix.fromEntries(conflicts);
    }
}
