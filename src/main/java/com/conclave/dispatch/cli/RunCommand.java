package com.conclave.dispatch.cli;

import com.conclave.core.engine.OrchestratorCoordinator;
import com.conclave.core.engine.RunOptions;
import com.conclave.core.events.EventBus;
import com.conclave.core.model.RunReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: conclave run &lt;files...&gt;
 * <p>
 * Analyses the task files, executes every parallel group and prints the run report.
 * Exits 0 only when every task succeeded.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Analyse and execute a batch of tasks")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Task files (.json, .yaml, .yml, .md)")
    private List<Path> files;

    @Option(names = {"--max-parallel", "-p"}, description = "Maximum tasks running at once")
    private Integer maxParallel;

    @Option(names = {"--timeout", "-t"}, description = "Time limit per attempt, in seconds")
    private Integer timeoutSeconds;

    @Option(names = "--base-ref", description = "Git reference new workspaces start from")
    private String baseRef;

    private final OrchestratorCoordinator coordinator;
    private final EventBus eventBus;

    public RunCommand(OrchestratorCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Running " + files.size() + " task file(s)...");

        var options = new RunOptions(maxParallel,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null, baseRef);
        RunReport report = new RunSupervisor(coordinator, eventBus)
                .supervise(() -> coordinator.run(files, options));

        ConsoleOutput.report(report);
        if (report.succeeded()) {
            ConsoleOutput.success("Run complete.");
        } else if (report.resumable() && report.phase().isResumable()) {
            ConsoleOutput.info("Resume with: conclave resume " + report.runId());
        }
        return RunSupervisor.exitCode(report);
    }
}
