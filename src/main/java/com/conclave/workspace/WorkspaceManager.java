package com.conclave.workspace;

import com.conclave.core.error.WorkspaceException;
import com.conclave.core.error.WorkspaceExistsException;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.Workspace;
import com.conclave.core.model.WorkspaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gives every task its own working copy on its own branch.
 *
 * <p>Layout: {@code <repository>/<root>/<taskId>} on branch {@code <prefix><runId>/<taskId>},
 * suffixed {@code -2}, {@code -3}, ... when that branch already exists.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Run starts: {@link #beginRun} binds the run id used in branch names</li>
 *   <li>Per attempt: {@link #create} adds an isolated working copy</li>
 *   <li>After success: {@link #commitResult} records the task's changes on its branch</li>
 *   <li>When the task settles: {@link #remove} deletes the working copy</li>
 *   <li>On resume: {@link #reclaim} removes working copies left behind by an earlier process</li>
 * </ol>
 *
 * <p>Calls for the same task id are serialised by a per-id lock; different ids proceed
 * concurrently.
 */
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final WorkspaceBackend backend;
    private final Path repository;
    private final Path root;
    private final String branchPrefix;
    private final ConclaveMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Workspace> live = new ConcurrentHashMap<>();
    /** Task ids whose current branch holds a result commit; such branches are kept on removal. */
    private final Set<String> committed = ConcurrentHashMap.newKeySet();

    private volatile String runId = "adhoc";

    public WorkspaceManager(WorkspaceBackend backend, Path repository, String root, String branchPrefix) {
        this(backend, repository, root, branchPrefix, null, Clock.systemUTC());
    }

    public WorkspaceManager(WorkspaceBackend backend, Path repository, String root, String branchPrefix,
                            ConclaveMetrics metrics, Clock clock) {
        this.backend = backend;
        this.repository = repository;
        this.root = repository.resolve(root);
        this.branchPrefix = branchPrefix != null ? branchPrefix : "";
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Binds the run id used in branch names for workspaces created from now on. */
    public void beginRun(String runId) {
        this.runId = runId;
    }

    public Path pathFor(String taskId) {
        return root.resolve(taskId);
    }

    /**
     * Creates a working copy for the task.
     *
     * @throws WorkspaceExistsException if the task already has a live workspace or its directory exists
     * @throws WorkspaceException       if the backend fails
     */
    public Workspace create(String taskId, String baseRef) {
        ReentrantLock lock = lockFor(taskId);
        lock.lock();
        try {
            if (live.containsKey(taskId)) {
                throw new WorkspaceExistsException(taskId);
            }
            Path path = pathFor(taskId);
            if (Files.exists(path)) {
                throw new WorkspaceExistsException(taskId);
            }

            String branch = uniqueBranch(branchPrefix + runId + "/" + taskId);
            log.info("Creating workspace for {} at {} (branch: {}, base: {})", taskId, path, branch, baseRef);
            try {
                backend.createWorkingCopy(path, branch, baseRef);
            } catch (WorkspaceException e) {
                recordMetric("create", false);
                throw e;
            }

            var workspace = new Workspace(taskId, path, branch, baseRef, WorkspaceStatus.CREATED, clock.instant());
            live.put(taskId, workspace);
            committed.remove(taskId);
            recordMetric("create", true);
            return workspace;
        } finally {
            lock.unlock();
        }
    }

    /** Marks the task's workspace as in use by a running attempt. */
    public Optional<Workspace> activate(String taskId) {
        ReentrantLock lock = lockFor(taskId);
        lock.lock();
        try {
            Workspace workspace = live.computeIfPresent(taskId, (id, ws) -> ws.withStatus(WorkspaceStatus.ACTIVE));
            return Optional.ofNullable(workspace);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the task's working copy. The branch is deleted too unless it holds a result commit.
     *
     * @return false when the task had no live workspace
     */
    public boolean remove(String taskId) {
        ReentrantLock lock = lockFor(taskId);
        lock.lock();
        try {
            Workspace workspace = live.get(taskId);
            if (workspace == null) {
                return false;
            }
            log.info("Removing workspace for {} at {}", taskId, workspace.path());
            try {
                backend.removeWorkingCopy(workspace.path(), workspace.branchName());
            } catch (WorkspaceException e) {
                recordMetric("remove", false);
                throw e;
            }
            live.remove(taskId);
            if (!committed.remove(taskId)) {
                deleteBranchQuietly(workspace.branchName());
            }
            recordMetric("remove", true);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Workspace> get(String taskId) {
        return Optional.ofNullable(live.get(taskId));
    }

    /** Live workspaces ordered by task id. */
    public List<Workspace> active() {
        var workspaces = new ArrayList<>(live.values());
        workspaces.sort(Comparator.comparing(Workspace::taskId));
        return workspaces;
    }

    /**
     * Removes a workspace recorded by an earlier process, together with its uncommitted branch.
     * Idempotent: reclaiming something already gone returns false.
     *
     * @return true when a working copy was found on disk and removed
     */
    public boolean reclaim(Workspace recorded) {
        if (recorded == null || recorded.status() == WorkspaceStatus.REMOVED) {
            return false;
        }
        ReentrantLock lock = lockFor(recorded.taskId());
        lock.lock();
        try {
            Workspace tracked = live.get(recorded.taskId());
            if (tracked != null && tracked.path().equals(recorded.path())) {
                live.remove(recorded.taskId());
            }
            boolean present = recorded.path() != null && Files.exists(recorded.path());
            log.info("Reclaiming stale workspace for {} at {} (present: {})",
                    recorded.taskId(), recorded.path(), present);
            if (recorded.path() != null) {
                backend.removeWorkingCopy(recorded.path(), recorded.branchName());
            }
            if (recorded.branchName() != null) {
                deleteBranchQuietly(recorded.branchName());
            }
            recordMetric("reclaim", true);
            return present;
        } catch (WorkspaceException e) {
            recordMetric("reclaim", false);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Integrates a successful task's changes as a commit on its branch.
     *
     * @return true when a commit was created; false when there was nothing to commit or no workspace
     */
    public boolean commitResult(String taskId, String message) {
        ReentrantLock lock = lockFor(taskId);
        lock.lock();
        try {
            Workspace workspace = live.get(taskId);
            if (workspace == null) {
                log.warn("Cannot commit result of {}: no live workspace", taskId);
                return false;
            }
            boolean created;
            try {
                created = backend.commitAll(workspace.path(), message);
            } catch (WorkspaceException e) {
                recordMetric("commit", false);
                throw e;
            }
            if (created) {
                committed.add(taskId);
                log.info("Committed result of {} on branch {}", taskId, workspace.branchName());
            } else {
                log.info("No changes to commit for {}", taskId);
            }
            recordMetric("commit", true);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every live workspace, continuing past individual failures.
     *
     * @return number of workspaces removed
     */
    public int removeAll() {
        int removed = 0;
        for (Workspace workspace : active()) {
            try {
                if (remove(workspace.taskId())) {
                    removed++;
                }
            } catch (WorkspaceException e) {
                log.error("Failed to remove workspace for {}: {}", workspace.taskId(), e.getMessage());
            }
        }
        return removed;
    }

    private String uniqueBranch(String base) {
        String candidate = base;
        int suffix = 2;
        while (backend.branchExists(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    private void deleteBranchQuietly(String branch) {
        try {
            backend.deleteBranch(branch);
        } catch (WorkspaceException e) {
            log.warn("Could not delete branch {}: {}", branch, e.getMessage());
        }
    }

    private ReentrantLock lockFor(String taskId) {
        return locks.computeIfAbsent(taskId, id -> new ReentrantLock());
    }

    private void recordMetric(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordWorktreeOperation(operation, success);
        }
    }
}
