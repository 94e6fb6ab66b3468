package com.conclave.workspace;

import com.conclave.core.error.WorkspaceException;
import com.conclave.core.error.WorkspaceExistsException;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.Workspace;
import com.conclave.core.model.WorkspaceStatus;
import com.conclave.support.InMemoryWorkspaceBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceManagerTest {

    @TempDir
    Path repo;

    private InMemoryWorkspaceBackend backend;
    private SimpleMeterRegistry meterRegistry;
    private WorkspaceManager manager;

    @BeforeEach
    void setUp() {
        backend = new InMemoryWorkspaceBackend();
        meterRegistry = new SimpleMeterRegistry();
        manager = new WorkspaceManager(backend, repo, ".worktrees", "conclave/",
                new ConclaveMetrics(meterRegistry), Clock.systemUTC());
        manager.beginRun("RUN-1");
    }

    private double operations(String operation, boolean success) {
        var counter = meterRegistry.find("conclave.parallel.worktree_operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .counter();
        return counter != null ? counter.count() : 0;
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void createsWorkingCopyOnRunScopedBranch() {
            Workspace ws = manager.create("TASK-001", "main");

            assertEquals(repo.resolve(".worktrees").resolve("TASK-001"), ws.path());
            assertEquals("conclave/RUN-1/TASK-001", ws.branchName());
            assertEquals("main", ws.baseRef());
            assertEquals(WorkspaceStatus.CREATED, ws.status());
            assertTrue(Files.isDirectory(ws.path()));
            assertEquals(1.0, operations("create", true));
        }

        @Test
        void suffixesBranchWhenItAlreadyExists() {
            backend.branches.add("conclave/RUN-1/TASK-001");
            backend.branches.add("conclave/RUN-1/TASK-001-2");

            assertEquals("conclave/RUN-1/TASK-001-3", manager.create("TASK-001", "HEAD").branchName());
        }

        @Test
        void rejectsSecondLiveWorkspace() {
            manager.create("TASK-001", "HEAD");

            assertThrows(WorkspaceExistsException.class, () -> manager.create("TASK-001", "HEAD"));
        }

        @Test
        void rejectsExistingDirectory() throws Exception {
            Files.createDirectories(repo.resolve(".worktrees").resolve("TASK-001"));

            assertThrows(WorkspaceExistsException.class, () -> manager.create("TASK-001", "HEAD"));
        }

        @Test
        void backendFailureLeavesNoWorkspace() {
            backend.failCreate = true;

            assertThrows(WorkspaceException.class, () -> manager.create("TASK-001", "HEAD"));
            assertTrue(manager.get("TASK-001").isEmpty());
            assertEquals(1.0, operations("create", false));
        }
    }

    @Test
    @DisplayName("activate marks the workspace in use")
    void activate() {
        manager.create("TASK-001", "HEAD");

        assertEquals(WorkspaceStatus.ACTIVE, manager.activate("TASK-001").orElseThrow().status());
        assertTrue(manager.activate("TASK-999").isEmpty());
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        void removeIsIdempotent() {
            Workspace ws = manager.create("TASK-001", "HEAD");

            assertTrue(manager.remove("TASK-001"));
            assertFalse(manager.remove("TASK-001"));
            assertFalse(Files.exists(ws.path()));
            assertEquals(List.of("conclave/RUN-1/TASK-001"), backend.deletedBranches);
        }

        @Test
        void committedBranchIsKept() {
            manager.create("TASK-001", "HEAD");

            assertTrue(manager.commitResult("TASK-001", "TASK-001: add login"));
            manager.remove("TASK-001");

            assertEquals(List.of("TASK-001: add login"), backend.commits);
            assertTrue(backend.deletedBranches.isEmpty());
            assertTrue(backend.branchExists("conclave/RUN-1/TASK-001"));
        }

        @Test
        void emptyCommitDoesNotKeepBranch() {
            backend.commitCreatesChange = false;
            manager.create("TASK-001", "HEAD");

            assertFalse(manager.commitResult("TASK-001", "nothing"));
            manager.remove("TASK-001");

            assertEquals(List.of("conclave/RUN-1/TASK-001"), backend.deletedBranches);
        }

        @Test
        void removeAllClearsEveryWorkspace() {
            manager.create("TASK-001", "HEAD");
            manager.create("TASK-002", "HEAD");

            assertEquals(2, manager.removeAll());
            assertTrue(manager.active().isEmpty());
        }
    }

    @Test
    @DisplayName("commitResult without a live workspace does nothing")
    void commitWithoutWorkspace() {
        assertFalse(manager.commitResult("TASK-001", "msg"));
        assertTrue(backend.commits.isEmpty());
    }

    @Test
    @DisplayName("commit failures propagate")
    void commitFailure() {
        manager.create("TASK-001", "HEAD");
        backend.failCommit = true;

        assertThrows(WorkspaceException.class, () -> manager.commitResult("TASK-001", "msg"));
        assertEquals(1.0, operations("commit", false));
    }

    @Test
    @DisplayName("active lists live workspaces by task id")
    void activeOrdering() {
        manager.create("TASK-002", "HEAD");
        manager.create("TASK-001", "HEAD");

        assertEquals(List.of("TASK-001", "TASK-002"),
                manager.active().stream().map(Workspace::taskId).toList());
    }

    @Nested
    @DisplayName("reclaim")
    class Reclaim {

        private Workspace stale() throws Exception {
            Path path = repo.resolve(".worktrees").resolve("TASK-007");
            Files.createDirectories(path);
            backend.branches.add("conclave/RUN-0/TASK-007");
            return new Workspace("TASK-007", path, "conclave/RUN-0/TASK-007", "HEAD",
                    WorkspaceStatus.ACTIVE, Instant.parse("2026-01-01T00:00:00Z"));
        }

        @Test
        void removesLeftoverCopyAndBranch() throws Exception {
            Workspace recorded = stale();

            assertTrue(manager.reclaim(recorded));
            assertFalse(Files.exists(recorded.path()));
            assertFalse(backend.branchExists("conclave/RUN-0/TASK-007"));
        }

        @Test
        void reclaimIsIdempotent() throws Exception {
            Workspace recorded = stale();
            manager.reclaim(recorded);

            assertFalse(manager.reclaim(recorded));
        }

        @Test
        void ignoresRemovedAndNull() throws Exception {
            assertFalse(manager.reclaim(null));
            assertFalse(manager.reclaim(stale().withStatus(WorkspaceStatus.REMOVED)));
        }

        @Test
        void allowsRecreatingAfterReclaim() throws Exception {
            manager.reclaim(stale());

            assertDoesNotThrow(() -> manager.create("TASK-007", "HEAD"));
        }
    }

    @Nested
    @DisplayName("concurrent callers")
    class Concurrent {

        private static final int THREADS = 8;

        private <T> List<Future<T>> race(Callable<T> action) throws InterruptedException {
            ExecutorService pool = Executors.newFixedThreadPool(THREADS);
            try {
                var gate = new CountDownLatch(1);
                var futures = new ArrayList<Future<T>>();
                for (int i = 0; i < THREADS; i++) {
                    futures.add(pool.submit(() -> {
                        gate.await();
                        return action.call();
                    }));
                }
                gate.countDown();
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
                return futures;
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("only one of several simultaneous creates for a task wins")
        void simultaneousCreatesForOneTask() throws Exception {
            int created = 0;
            int rejected = 0;
            for (var future : race(() -> manager.create("TASK-001", "HEAD"))) {
                try {
                    assertEquals("TASK-001", future.get().taskId());
                    created++;
                } catch (ExecutionException e) {
                    assertInstanceOf(WorkspaceExistsException.class, e.getCause());
                    rejected++;
                }
            }

            assertEquals(1, created);
            assertEquals(THREADS - 1, rejected);
            assertEquals(1, manager.active().size());
            assertEquals(1.0, operations("create", true));
        }

        @Test
        @DisplayName("only one of several simultaneous removes reports the removal")
        void simultaneousRemovesForOneTask() throws Exception {
            Workspace ws = manager.create("TASK-001", "HEAD");

            long removed = 0;
            for (var future : race(() -> manager.remove("TASK-001"))) {
                if (future.get()) {
                    removed++;
                }
            }

            assertEquals(1, removed);
            assertTrue(manager.get("TASK-001").isEmpty());
            assertFalse(Files.exists(ws.path()));
            assertEquals(List.of(ws.branchName()), backend.deletedBranches);
        }

        @Test
        @DisplayName("different tasks create their workspaces in parallel")
        void distinctTasksInParallel() throws Exception {
            var ids = new AtomicInteger();
            for (var future : race(() -> manager.create("TASK-" + ids.incrementAndGet(), "HEAD"))) {
                assertNotNull(future.get());
            }

            assertEquals(THREADS, manager.active().size());
            assertEquals(THREADS, manager.active().stream().map(Workspace::branchName).distinct().count());
        }
    }
}
