package com.launchpad.dispatch.cli;

import com.launchpad.core.events.LaunchEvent;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.LaunchStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Launchpad CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LAUNCHPAD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LAUNCHPAD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(LaunchStatus status) {
        switch (status) {
            case COMPLETED -> success("Status: " + status.wireName());
            case FAILED -> error("Status: " + status.wireName());
            default -> info("Status: " + status.wireName());
        }
    }

    public static void agentResult(int position, AgentResult result) {
        String marker = result.isCompleted() ? "@|fg(green) DONE|@" : "@|fg(red) FAIL|@";
        String detail = result.isCompleted()
                ? result.attempts() + " attempt(s), " + formatDuration(result.executionTimeMs())
                : result.errorMessage();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %2d. %s %-26s %s", position, marker, result.agentName(), detail)));
    }

    /**
     * One line of live progress for a launch event.
     */
    public static void progressEvent(LaunchEvent event) {
        String agent = event.agentName() != null ? event.agentName() : "";
        switch (event.eventType()) {
            case "agent.started" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(blue) [AGENT]|@ " + agent + " running (" + event.payload().get("phase") + ")"));
            case "agent.retrying" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) [RETRY]|@ " + agent + " attempt " + event.payload().get("attempt")
                            + " failed: " + event.payload().get("error")));
            case "agent.completed" -> success(agent + " completed in "
                    + formatDuration(((Number) event.payload().get("executionTimeMs")).longValue()));
            case "agent.failed" -> error(agent + " failed: " + event.payload().get("error"));
            case "launch.completed" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [COMPLETE]|@ launch " + event.launchId()));
            case "launch.failed" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [FAILED]|@ launch " + event.launchId()));
            default -> {
                // launch.created / launch.started are reported by the command itself
            }
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
