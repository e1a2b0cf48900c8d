package com.launchpad.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: launchpad serve
 * <p>
 * Starts Launchpad as a long-running HTTP server exposing the REST API. The web server is
 * enabled by {@link com.launchpad.LaunchpadApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 launchpad serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Launchpad HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Launchpad server running on port " + port);
        System.out.println();
        System.out.println("  Launches:  http://localhost:" + port + "/api/v1/launches");
        System.out.println("  Health:    http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
