package com.launchpad.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for launch execution.
 */
@Service
public class LaunchMetrics {

    private final MeterRegistry registry;

    public LaunchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordHandlerExecution(String agentName, String outcome, long ms) {
        Timer.builder("launchpad.handler.duration")
                .tag("agent", agentName)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts one invocation attempt.
     *
     * @param outcome "success" or the lowercased failure kind, e.g. "timeout"
     */
    public void recordInvocationAttempt(String agentName, String outcome) {
        Counter.builder("launchpad.invocation.attempts")
                .description("Agent invocation attempts, including retries")
                .tag("agent", agentName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordLaunchResult(String status) {
        Counter.builder("launchpad.launches.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRunDuration(long ms) {
        Timer.builder("launchpad.run.duration")
                .description("Wall-clock time of one orchestrator run call")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
