package com.conclave.core.persistence;

import com.conclave.core.error.CheckpointIOException;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.model.WorkflowPhase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed checkpoint store: one {@code <directory>/<runId>/checkpoint.json} per run.
 *
 * <p>Writes go to a temp file in the run directory and are moved into place atomically, so a
 * crash mid-write leaves the previous checkpoint intact. A failed write is logged and counted
 * but never thrown: the run carries on in memory.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    static final String CHECKPOINT_FILE = "checkpoint.json";

    /**
     * One line of the run listing.
     */
    public record RunSummary(String runId, WorkflowPhase phase, Instant updatedAt, int taskCount, boolean resumable) {}

    private final ObjectMapper objectMapper;
    private final Path directory;
    private final ConclaveMetrics metrics;
    private final Clock clock;
    private final Map<String, Long> sequences = new HashMap<>();

    public CheckpointManager(ObjectMapper objectMapper, Path directory, ConclaveMetrics metrics, Clock clock) {
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Path directory() {
        return directory;
    }

    public Path checkpointFile(String runId) {
        return directory.resolve(runId).resolve(CHECKPOINT_FILE);
    }

    /**
     * Stamps {@code sequence} and {@code updatedAt} and writes the checkpoint.
     *
     * @return false when the write failed
     */
    public synchronized boolean save(WorkflowState state) {
        long next = Math.max(sequences.getOrDefault(state.runId(), 0L), state.sequence()) + 1;
        WorkflowState stamped = state.stamped(next, clock.instant());
        Path runDir = directory.resolve(state.runId());
        Path target = runDir.resolve(CHECKPOINT_FILE);
        Path temp = null;
        try {
            Files.createDirectories(runDir);
            temp = Files.createTempFile(runDir, "checkpoint-", ".tmp");
            objectMapper.writeValue(temp.toFile(), stamped);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            sequences.put(state.runId(), next);
            recordMetric(true);
            log.debug("Checkpoint {} #{} written (phase {})", state.runId(), next, state.phase());
            return true;
        } catch (IOException e) {
            var failure = new CheckpointIOException("Failed to write checkpoint for " + state.runId(), e);
            log.error(failure.getMessage(), failure);
            deleteQuietly(temp);
            recordMetric(false);
            return false;
        }
    }

    /**
     * @return the checkpoint, or empty when it is missing or unreadable
     */
    public Optional<WorkflowState> load(String runId) {
        Path file = checkpointFile(runId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            WorkflowState state = objectMapper.readValue(file.toFile(), WorkflowState.class);
            synchronized (this) {
                sequences.merge(runId, state.sequence(), Math::max);
            }
            return Optional.of(state);
        } catch (IOException e) {
            var failure = new CheckpointIOException("Unreadable checkpoint " + file, e);
            log.error(failure.getMessage(), failure);
            return Optional.empty();
        }
    }

    /** Every readable checkpoint, sorted by run id. */
    public List<RunSummary> listRuns() {
        var summaries = new ArrayList<RunSummary>();
        for (String runId : runIds()) {
            load(runId).ifPresent(state -> summaries.add(new RunSummary(state.runId(), state.phase(),
                    state.updatedAt(), state.tasks().size(), state.isResumable())));
        }
        return summaries;
    }

    /** Run ids whose checkpoint phase is INITIALIZED, ANALYZED or EXECUTING, sorted. */
    public List<String> detectResumableRuns() {
        return listRuns().stream()
                .filter(RunSummary::resumable)
                .map(RunSummary::runId)
                .toList();
    }

    /**
     * Deletes the run's checkpoint directory, logs included.
     *
     * @return false when there was nothing to delete
     */
    public synchronized boolean delete(String runId) {
        Path runDir = directory.resolve(runId);
        if (!Files.isDirectory(runDir)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(runDir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to delete checkpoint directory " + runDir, e);
        }
        sequences.remove(runId);
        return true;
    }

    private List<String> runIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(directory)) {
            return children
                    .filter(p -> Files.isRegularFile(p.resolve(CHECKPOINT_FILE)))
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Cannot list checkpoint directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temp checkpoint {}: {}", temp, e.getMessage());
        }
    }

    private void recordMetric(boolean success) {
        if (metrics != null) {
            metrics.recordCheckpointWrite(success);
        }
    }
}
