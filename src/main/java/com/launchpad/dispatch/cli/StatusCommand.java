package com.launchpad.dispatch.cli;

import com.launchpad.core.engine.LaunchEngine;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchProgress;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: launchpad status &lt;launch-id&gt;
 * <p>
 * Shows the launch status, handler progress and each recorded result.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check launch status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Launch ID")
    private String launchId;

    private final LaunchEngine launchEngine;

    public StatusCommand(LaunchEngine launchEngine) {
        this.launchEngine = launchEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Launch launch;
        LaunchProgress progress;
        try {
            launch = launchEngine.find(launchId);
            progress = launchEngine.status(launchId);
        } catch (LaunchNotFoundException e) {
            ConsoleOutput.error("Launch not found: " + launchId);
            return 1;
        }

        System.out.println();
        System.out.println("LAUNCH " + launch.id());
        System.out.println("Name: " + launch.name());
        if (launch.productType() != null) {
            System.out.println("Product type: " + launch.productType());
        }
        if (launch.targetMarket() != null) {
            System.out.println("Target market: " + launch.targetMarket());
        }
        ConsoleOutput.status(progress.status());
        ConsoleOutput.info("Progress: " + progress.completedCount() + "/" + progress.totalCount() + " handlers completed");

        if (!launch.agentResults().isEmpty()) {
            System.out.println();
            int position = 1;
            for (AgentResult result : launch.agentResults()) {
                ConsoleOutput.agentResult(position++, result);
            }
        }
        return 0;
    }
}
