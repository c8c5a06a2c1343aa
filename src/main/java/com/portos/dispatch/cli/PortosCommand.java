package com.portos.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the PortOS orchestrator.
 * Routes to subcommands: health, providers, classify, stats.
 */
@Command(
        name = "portos",
        mixinStandardHelpOptions = true,
        version = "PortOS Orchestrator 0.1.0",
        description = "Tool execution, error recovery and provider routing for PortOS agents",
        subcommands = {
                HealthCommand.class,
                ProvidersCommand.class,
                ClassifyCommand.class,
                StatsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PortosCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
