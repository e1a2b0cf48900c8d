package com.launchpad.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Launchpad.
 * Routes to subcommands: launch, status, history, health, serve.
 */
@Command(
        name = "launchpad",
        mixinStandardHelpOptions = true,
        version = "Launchpad 0.1.0",
        description = "Multi-agent product launch orchestrator powered by LangGraph4j and Spring AI",
        subcommands = {
                LaunchCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LaunchpadCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
