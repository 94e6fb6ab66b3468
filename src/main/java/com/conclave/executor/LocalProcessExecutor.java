package com.conclave.executor;

import com.conclave.core.error.ExecutorFailureException;
import com.conclave.core.error.ExecutorTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed command line as a child process in the task's workspace.
 *
 * <p>The task file is written to {@code <workspace>/.conclave/task.md} and exposed through the
 * {@code CONCLAVE_*} environment variables. Output goes to files rather than pipes so a chatty
 * process can never stall on a full buffer.
 */
public class LocalProcessExecutor implements ExternalTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutor.class);

    private final List<String> command;

    public LocalProcessExecutor(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Executor command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public ExecutorOutput execute(ExecutorRequest request) throws InterruptedException {
        Path workspace = request.workspacePath();
        Path controlDir = workspace.resolve(TaskInstructions.DIRECTORY);
        Path taskFile = controlDir.resolve(TaskInstructions.FILE_NAME);
        Path stdoutFile = controlDir.resolve("attempt-" + request.attempt() + ".stdout");
        Path stderrFile = controlDir.resolve("attempt-" + request.attempt() + ".stderr");

        Process process;
        try {
            Files.createDirectories(controlDir);
            Files.writeString(taskFile, TaskInstructions.render(request.task(), request.attempt()),
                    StandardCharsets.UTF_8);

            var pb = new ProcessBuilder(command)
                    .directory(workspace.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            var env = pb.environment();
            env.put("CONCLAVE_TASK_ID", request.taskId());
            env.put("CONCLAVE_TASK_FILE", taskFile.toAbsolutePath().toString());
            env.put("CONCLAVE_WORKSPACE", workspace.toAbsolutePath().toString());
            env.put("CONCLAVE_ATTEMPT", String.valueOf(request.attempt()));
            if (request.runId() != null) {
                env.put("CONCLAVE_RUN_ID", request.runId());
            }
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutorFailureException("Failed to launch " + command.get(0)
                    + " for task " + request.taskId() + ": " + e.getMessage(), e);
        }
        log.debug("Started process {} for task {} attempt {}", process.pid(), request.taskId(), request.attempt());

        try {
            if (!process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExecutorTimeoutException(request.taskId(), request.timeout());
            }
        } catch (InterruptedException e) {
            log.info("Interrupted, killing process {} for task {}", process.pid(), request.taskId());
            process.destroyForcibly();
            throw e;
        }

        return new ExecutorOutput(process.exitValue(), readQuietly(stdoutFile), readQuietly(stderrFile));
    }

    private static String readQuietly(Path file) {
        try {
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.warn("Could not read captured output {}: {}", file, e.getMessage());
            return "";
        }
    }
}
