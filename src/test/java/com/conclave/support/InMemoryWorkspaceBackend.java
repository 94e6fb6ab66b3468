package com.conclave.support;

import com.conclave.core.error.WorkspaceException;
import com.conclave.workspace.WorkspaceBackend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Workspace backend that creates plain directories and keeps branches in memory.
 */
public class InMemoryWorkspaceBackend implements WorkspaceBackend {

    public final Set<String> branches = ConcurrentHashMap.newKeySet();
    public final List<String> commits = new CopyOnWriteArrayList<>();
    public final List<String> deletedBranches = new CopyOnWriteArrayList<>();
    public volatile boolean failCreate;
    public volatile boolean failCommit;
    public volatile boolean commitCreatesChange = true;

    @Override
    public void createWorkingCopy(Path path, String branch, String baseRef) {
        if (failCreate) {
            throw new WorkspaceException("simulated create failure for " + path);
        }
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        branches.add(branch);
    }

    @Override
    public void removeWorkingCopy(Path path, String branch) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean branchExists(String branch) {
        return branches.contains(branch);
    }

    @Override
    public boolean commitAll(Path path, String message) {
        if (failCommit) {
            throw new WorkspaceException("simulated commit failure");
        }
        if (!commitCreatesChange) {
            return false;
        }
        commits.add(message);
        return true;
    }

    @Override
    public void deleteBranch(String branch) {
        if (branches.remove(branch)) {
            deletedBranches.add(branch);
        }
    }
}
