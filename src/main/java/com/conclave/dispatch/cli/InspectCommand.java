package com.conclave.dispatch.cli;

import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskStatus;
import com.conclave.core.persistence.CheckpointManager;
import com.conclave.core.persistence.WorkflowState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: conclave inspect &lt;run-id&gt;
 * <p>
 * Shows the checkpointed status, attempt count and latest error of every task in a run.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect the tasks of a run")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final CheckpointManager checkpoints;

    public InspectCommand(CheckpointManager checkpoints) {
        this.checkpoints = checkpoints;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var stateOpt = checkpoints.load(runId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return 1;
        }

        WorkflowState state = stateOpt.get();
        System.out.println();
        System.out.println("RUN " + state.runId());
        System.out.println("──────────────────────────────────");
        System.out.println("  Phase:      " + state.phase() + (state.isResumable() ? " (resumable)" : ""));
        System.out.println("  Started:    " + state.createdAt());
        System.out.println("  Updated:    " + state.updatedAt() + " (sequence " + state.sequence() + ")");
        System.out.println("  Base:       " + state.baseRef());
        System.out.println("  Group:      " + Math.min(state.currentGroup() + 1, state.groups().size())
                + " / " + state.groups().size());
        System.out.println();
        System.out.println("  TASKS:");
        for (Task task : state.tasks()) {
            TaskStatus status = state.statuses().getOrDefault(task.id(), TaskStatus.QUEUED);
            ExecutionResult latest = state.results().get(task.id());
            String detail = "attempts " + state.attempts().getOrDefault(task.id(), 0);
            String reason = state.cancellationReasons().get(task.id());
            if (reason != null) {
                detail += ", " + reason;
            } else if (latest != null && latest.errorMessage() != null) {
                detail += ", " + latest.errorMessage();
            }
            ConsoleOutput.taskStatus(task.id(), status, detail);
        }

        if (!state.errors().isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + state.errors().size() + "):");
            for (var e : state.errors()) {
                ConsoleOutput.error("  " + e);
            }
        }
        return 0;
    }
}
