package com.conclave.executor;

import com.conclave.core.error.ExecutorFailureException;
import com.conclave.core.error.ExecutorTimeoutException;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs each attempt in a fresh Docker container.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>A bind mount mapping the task's workspace to /workspace</li>
 *   <li>The {@code CONCLAVE_*} environment variables, with paths as seen inside the container</li>
 *   <li>Memory and CPU limits from configuration</li>
 * </ul>
 * The container is force-removed whatever the outcome.
 */
public class DockerTaskExecutor implements ExternalTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(DockerTaskExecutor.class);

    static final String CONTAINER_WORKSPACE = "/workspace";

    private final DockerClient dockerClient;
    private final String image;
    private final List<String> command;
    private final int memoryLimitMb;
    private final int cpuCount;

    public DockerTaskExecutor(DockerClient dockerClient, String image, List<String> command,
                              int memoryLimitMb, int cpuCount) {
        this.dockerClient = dockerClient;
        this.image = image;
        this.command = command != null ? List.copyOf(command) : List.of();
        this.memoryLimitMb = memoryLimitMb;
        this.cpuCount = cpuCount;
    }

    @Override
    public ExecutorOutput execute(ExecutorRequest request) throws InterruptedException {
        writeTaskFile(request);

        String containerName = "conclave-" + sanitize(request.taskId()) + "-a" + request.attempt();
        removeQuietly(containerName);

        String taskFile = CONTAINER_WORKSPACE + "/" + TaskInstructions.DIRECTORY + "/" + TaskInstructions.FILE_NAME;
        var env = new ArrayList<String>();
        env.add("CONCLAVE_TASK_ID=" + request.taskId());
        env.add("CONCLAVE_TASK_FILE=" + taskFile);
        env.add("CONCLAVE_WORKSPACE=" + CONTAINER_WORKSPACE);
        env.add("CONCLAVE_ATTEMPT=" + request.attempt());

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(request.workspacePath().toAbsolutePath().toString(),
                        new Volume(CONTAINER_WORKSPACE), AccessMode.rw))
                .withMemory((long) memoryLimitMb * 1024 * 1024)
                .withCpuCount((long) cpuCount);

        var create = dockerClient.createContainerCmd(image)
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withEnv(env)
                .withWorkingDir(CONTAINER_WORKSPACE);
        if (!command.isEmpty()) {
            create = create.withCmd(command);
        }

        String containerId;
        try {
            containerId = create.exec().getId();
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            removeQuietly(containerName);
            throw new ExecutorFailureException("Failed to start container for task "
                    + request.taskId() + ": " + e.getMessage(), e);
        }
        log.info("Container {} started for task {} attempt {} (image: {})",
                containerName, request.taskId(), request.attempt(), image);

        try {
            int exitCode = awaitExit(containerId, request);
            var stdout = new StringBuilder();
            var stderr = new StringBuilder();
            readLogs(containerId, stdout, stderr);
            return new ExecutorOutput(exitCode, stdout.toString(), stderr.toString());
        } catch (IOException e) {
            throw new ExecutorFailureException("Failed to read container stream for task "
                    + request.taskId() + ": " + e.getMessage(), e);
        } finally {
            removeQuietly(containerId);
        }
    }

    private int awaitExit(String containerId, ExecutorRequest request) throws InterruptedException, IOException {
        try (var callback = dockerClient.waitContainerCmd(containerId).exec(new WaitContainerResultCallback())) {
            if (!callback.awaitCompletion(request.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ExecutorTimeoutException(request.taskId(), request.timeout());
            }
            Integer status = callback.awaitStatusCode();
            return status != null ? status : -1;
        }
    }

    private void readLogs(String containerId, StringBuilder stdout, StringBuilder stderr)
            throws InterruptedException, IOException {
        var collector = new LogContainerResultCallback() {
            @Override
            public void onNext(Frame frame) {
                String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                if (frame.getStreamType() == StreamType.STDERR) {
                    stderr.append(text);
                } else {
                    stdout.append(text);
                }
            }
        };
        try (var callback = dockerClient.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(false)
                .exec(collector)) {
            callback.awaitCompletion(30, TimeUnit.SECONDS);
        }
    }

    private static void writeTaskFile(ExecutorRequest request) {
        Path dir = request.workspacePath().resolve(TaskInstructions.DIRECTORY);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(TaskInstructions.FILE_NAME),
                    TaskInstructions.render(request.task(), request.attempt()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExecutorFailureException("Failed to write task file for " + request.taskId()
                    + ": " + e.getMessage(), e);
        }
    }

    private void removeQuietly(String containerIdOrName) {
        try {
            dockerClient.removeContainerCmd(containerIdOrName).withForce(true).exec();
            log.debug("Removed container {}", containerIdOrName);
        } catch (RuntimeException e) {
            log.debug("Container {} not removed: {}", containerIdOrName, e.getMessage());
        }
    }

    private static String sanitize(String taskId) {
        return taskId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]", "-");
    }
}
