package com.launchpad.dispatch.cli;

import com.launchpad.core.engine.LaunchEngine;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: launchpad history
 * <p>
 * Lists launches, newest first, as a table: Launch ID | Status | Progress | Name.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List launches")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--status", "-s"}, description = "Only launches with this status (pending, in_progress, completed, failed)")
    private String status;

    private final LaunchEngine launchEngine;

    public HistoryCommand(LaunchEngine launchEngine) {
        this.launchEngine = launchEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        LaunchStatus filter;
        try {
            filter = status == null ? null : LaunchStatus.fromWireName(status);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid status: " + status);
            return;
        }

        List<Launch> launches = launchEngine.list(filter);
        if (launches.isEmpty()) {
            ConsoleOutput.info("No launches found.");
            return;
        }

        List<Launch> display = launches.size() > limit ? launches.subList(0, limit) : launches;

        ConsoleOutput.info("Launches (" + display.size() + " of " + launches.size() + "):");
        System.out.println();
        System.out.printf("  %-38s %-12s %-9s %s%n", "LAUNCH ID", "STATUS", "PROGRESS", "NAME");
        System.out.println("  " + "-".repeat(80));

        for (Launch launch : display) {
            String progress = launch.completedCount() + "/" + launchEngine.status(launch.id()).totalCount();
            System.out.printf("  %-38s %-12s %-9s %s%n", launch.id(), launch.status().wireName(),
                    progress, truncate(launch.name(), 30));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
