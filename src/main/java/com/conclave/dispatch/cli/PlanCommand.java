package com.conclave.dispatch.cli;

import com.conclave.core.engine.OrchestratorCoordinator;
import com.conclave.core.error.ConclaveException;
import com.conclave.core.model.AnalysisResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: conclave plan &lt;files...&gt;
 * <p>
 * Dry run. Prints the analysed tasks, the parallel groups and every conflicting pair without
 * creating workspaces or checkpoints.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the execution plan for a batch of tasks")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Task files (.json, .yaml, .yml, .md)")
    private List<Path> files;

    private final OrchestratorCoordinator coordinator;

    public PlanCommand(OrchestratorCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AnalysisResult analysis;
        try {
            analysis = coordinator.plan(files);
        } catch (ConclaveException e) {
            ConsoleOutput.error("Analysis failed: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info(analysis.tasks().size() + " task(s) in " + analysis.groups().size() + " group(s)");
        ConsoleOutput.plan(analysis);
        return 0;
    }
}
