package com.conductor.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: serve, run.
 */
@Command(
        name = "conductor",
        mixinStandardHelpOptions = true,
        version = "Conductor 0.1.0",
        description = "Runs AI coding agents against git projects in isolated worktrees",
        subcommands = {
                ServeCommand.class,
                RunCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConductorCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
