package com.conclave.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists captured attempt output under {@code <base>/<runId>/logs/}.
 */
public class OutputStore {

    private static final Logger log = LoggerFactory.getLogger(OutputStore.class);

    /**
     * Paths of the stored files; either may be null when nothing was written.
     */
    public record OutputRefs(String stdoutRef, String stderrRef) {
        public static final OutputRefs NONE = new OutputRefs(null, null);
    }

    private final Path baseDirectory;

    public OutputStore(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public Path logDirectory(String runId) {
        return baseDirectory.resolve(runId).resolve("logs");
    }

    /**
     * Writes both streams. Failures are logged and yield null refs; they never fail the attempt.
     */
    public OutputRefs store(String runId, String taskId, int attempt, String stdout, String stderr) {
        Path dir = logDirectory(runId);
        String prefix = taskId + ".attempt-" + attempt;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("Cannot create log directory {}: {}", dir, e.getMessage());
            return OutputRefs.NONE;
        }
        return new OutputRefs(
                write(dir.resolve(prefix + ".stdout.log"), stdout),
                write(dir.resolve(prefix + ".stderr.log"), stderr));
    }

    private static String write(Path file, String content) {
        if (content == null) {
            return null;
        }
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file.toString();
        } catch (IOException e) {
            log.warn("Cannot write attempt output {}: {}", file, e.getMessage());
            return null;
        }
    }
}
