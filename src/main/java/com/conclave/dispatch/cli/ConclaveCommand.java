package com.conclave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Conclave.
 * Routes to subcommands: run, plan, resume, runs, inspect.
 */
@Command(
        name = "conclave",
        mixinStandardHelpOptions = true,
        version = "Conclave 0.1.0",
        description = "Runs batches of independent coding tasks in parallel, isolated git worktrees",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                ResumeCommand.class,
                RunsCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConclaveCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
