package com.conclave.workspace;

import java.nio.file.Path;

/**
 * Version-control operations behind {@link WorkspaceManager}. Failures surface as
 * {@link com.conclave.core.error.WorkspaceException}.
 */
public interface WorkspaceBackend {

    /** Creates a working copy at {@code path} on a new branch started from {@code baseRef}. */
    void createWorkingCopy(Path path, String branch, String baseRef);

    /** Removes the working copy. Does nothing when it is already gone. */
    void removeWorkingCopy(Path path, String branch);

    boolean branchExists(String branch);

    /**
     * Stages and commits every change in the working copy.
     *
     * @return true when a commit was created, false when there was nothing to commit
     */
    boolean commitAll(Path path, String message);

    /** Deletes a local branch. Does nothing when it does not exist. */
    void deleteBranch(String branch);
}
