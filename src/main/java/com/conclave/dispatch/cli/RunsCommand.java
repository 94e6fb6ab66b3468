package com.conclave.dispatch.cli;

import com.conclave.core.persistence.CheckpointManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: conclave runs
 * <p>
 * Lists the checkpointed runs as a table: Run ID | Phase | Tasks | Updated | Resumable.
 */
@Command(name = "runs", mixinStandardHelpOptions = true, description = "List checkpointed runs")
@Component
public class RunsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final CheckpointManager checkpoints;

    public RunsCommand(CheckpointManager checkpoints) {
        this.checkpoints = checkpoints;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<CheckpointManager.RunSummary> runs = checkpoints.listRuns();
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        List<CheckpointManager.RunSummary> display = runs.size() > limit
                ? runs.subList(runs.size() - limit, runs.size())
                : runs;

        ConsoleOutput.info("Runs (" + display.size() + " of " + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-12s %-6s %-22s %s%n", "RUN ID", "PHASE", "TASKS", "UPDATED", "RESUMABLE");
        System.out.println("  " + "-".repeat(76));
        for (var run : display) {
            System.out.printf("  %-24s %-12s %-6d %-22s %s%n", run.runId(), run.phase(), run.taskCount(),
                    run.updatedAt(), run.resumable() ? "yes" : "-");
        }
    }
}
