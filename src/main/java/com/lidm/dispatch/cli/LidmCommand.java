package com.lidm.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for LIDM.
 * Routes to subcommands: query, health, serve.
 */
@Command(
        name = "lidm",
        mixinStandardHelpOptions = true,
        version = "LIDM 0.1.0",
        description = "Routes queries across tiered LLM backends with decomposition and self-consistency",
        subcommands = {
                QueryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LidmCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
