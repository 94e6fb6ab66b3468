package com.conclave.core.model;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Instant;

/**
 * An isolated, branch-scoped working copy owned by exactly one task.
 *
 * @param taskId     the owning task
 * @param path       working copy directory
 * @param branchName branch checked out in the working copy
 * @param baseRef    reference the branch was created from
 * @param status     lifecycle status
 * @param createdAt  creation time
 */
public record Workspace(
    String taskId,
    Path path,
    String branchName,
    String baseRef,
    WorkspaceStatus status,
    Instant createdAt
) implements Serializable {

    public Workspace withStatus(WorkspaceStatus newStatus) {
        return new Workspace(taskId, path, branchName, baseRef, newStatus, createdAt);
    }
}
