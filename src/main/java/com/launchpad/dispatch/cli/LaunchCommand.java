package com.launchpad.dispatch.cli;

import com.launchpad.core.engine.LaunchEngine;
import com.launchpad.core.events.EventBus;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: launchpad launch "&lt;name&gt;"
 * <p>
 * Creates a launch and runs every handler in the foreground, printing progress as each
 * handler starts, retries and finishes. Exit code 0 when the launch completes.
 */
@Command(name = "launch", mixinStandardHelpOptions = true, description = "Create and run a product launch")
@Component
public class LaunchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Launch name")
    private String name;

    @Option(names = {"--description", "-d"}, description = "Product description")
    private String description;

    @Option(names = {"--product-type", "-p"}, description = "Product type, e.g. \"SaaS platform\"")
    private String productType;

    @Option(names = {"--target-market", "-t"}, description = "Target market")
    private String targetMarket;

    @Option(names = {"--show-summary"}, description = "Print the launch summary when it completes",
            defaultValue = "true", negatable = true)
    private boolean showSummary;

    private final LaunchEngine launchEngine;
    private final EventBus eventBus;

    public LaunchCommand(LaunchEngine launchEngine, EventBus eventBus) {
        this.launchEngine = launchEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Launch launch;
        try {
            launch = launchEngine.create(new NewLaunch(name, description, productType, targetMarket));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Launch " + launch.id() + " created: " + launch.name());

        Launch finished;
        try (EventBus.Subscription ignored = eventBus.subscribe(launch.id(), ConsoleOutput::progressEvent)) {
            finished = launchEngine.startAndRun(launch.id());
        } catch (LaunchException e) {
            ConsoleOutput.error("Launch aborted: " + e.getMessage());
            return 1;
        }

        System.out.println();
        int position = 1;
        for (AgentResult result : finished.agentResults()) {
            ConsoleOutput.agentResult(position++, result);
        }
        System.out.println();
        ConsoleOutput.status(finished.status());

        if (finished.status() == LaunchStatus.COMPLETED && showSummary && finished.summary() != null) {
            System.out.println();
            System.out.println(finished.summary());
        }
        return finished.status() == LaunchStatus.COMPLETED ? 0 : 1;
    }
}
