package com.ouroboros.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Ouroboros.
 */
@Command(
        name = "ouroboros",
        mixinStandardHelpOptions = true,
        version = "Ouroboros 0.1.0",
        description = "Self-improvement pipeline for an autonomous agent",
        subcommands = {
                ServeCommand.class,
                ImproveCommand.class,
                OpportunitiesCommand.class,
                RecordCommand.class,
                HistoryCommand.class,
                StatusCommand.class,
                SnapshotsCommand.class,
                RollbackCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OuroborosCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
