package com.conclave.dispatch.cli;

import com.conclave.core.engine.OrchestratorCoordinator;
import com.conclave.core.engine.RunOptions;
import com.conclave.core.events.EventBus;
import com.conclave.core.model.RunReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: conclave resume &lt;run-id&gt;
 * <p>
 * Continues an interrupted run from its last checkpoint. Tasks that already finished are not
 * executed again.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume an interrupted run")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--max-parallel", "-p"}, description = "Maximum tasks running at once")
    private Integer maxParallel;

    @Option(names = {"--timeout", "-t"}, description = "Time limit per attempt, in seconds")
    private Integer timeoutSeconds;

    private final OrchestratorCoordinator coordinator;
    private final EventBus eventBus;

    public ResumeCommand(OrchestratorCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var options = new RunOptions(maxParallel,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null, null);
        RunReport report;
        try {
            report = new RunSupervisor(coordinator, eventBus).supervise(() -> coordinator.resume(runId, options));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.report(report);
        if (report.succeeded()) {
            ConsoleOutput.success("Run complete.");
        }
        return RunSupervisor.exitCode(report);
    }
}
