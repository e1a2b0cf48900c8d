package com.launchpad.core.engine;

import com.launchpad.core.events.EventBus;
import com.launchpad.core.events.LaunchEvent;
import com.launchpad.core.llm.AgentInvocationException;
import com.launchpad.core.llm.AgentInvoker;
import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.metrics.LaunchMetrics;
import com.launchpad.core.registry.HandlerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Calls the {@link AgentInvoker} with bounded, sequential retries and a fixed delay.
 * Never throws for invocation problems: the last failure becomes the outcome's message.
 */
@Component
public class RetryingAgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(RetryingAgentInvoker.class);

    private final AgentInvoker agentInvoker;
    private final OrchestratorProperties properties;
    private final LaunchMetrics metrics;
    private final EventBus eventBus;

    public RetryingAgentInvoker(AgentInvoker agentInvoker, OrchestratorProperties properties,
                                LaunchMetrics metrics, EventBus eventBus) {
        this.agentInvoker = agentInvoker;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public InvocationOutcome invoke(String launchId, HandlerSpec handler, AgentPrompt prompt) {
        int maxAttempts = Math.max(0, properties.getMaxRetries()) + 1;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String output = agentInvoker.invoke(prompt, properties.getInvocationTimeout());
                metrics.recordInvocationAttempt(handler.name(), "success");
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", handler.name(), attempt, maxAttempts);
                }
                return InvocationOutcome.success(output, attempt);
            } catch (AgentInvocationException e) {
                lastError = messageOf(e, e.getFailure().name().toLowerCase(Locale.ROOT));
                metrics.recordInvocationAttempt(handler.name(), e.getFailure().name().toLowerCase(Locale.ROOT));
            } catch (RuntimeException e) {
                lastError = messageOf(e, e.getClass().getSimpleName());
                metrics.recordInvocationAttempt(handler.name(), "unexpected");
                log.debug("Unexpected invocation error for {}", handler.name(), e);
            }

            if (attempt == maxAttempts) {
                log.warn("{} failed after {} attempt(s): {}", handler.name(), attempt, lastError);
                return InvocationOutcome.failure(lastError, attempt);
            }

            log.warn("{} attempt {}/{} failed: {}; retrying in {}ms", handler.name(), attempt, maxAttempts,
                    lastError, properties.getRetryDelay().toMillis());
            eventBus.publish(new LaunchEvent("agent.retrying", launchId, handler.name(),
                    Map.of("attempt", attempt, "error", lastError), Instant.now()));
            if (!pause()) {
                log.warn("{} retry interrupted after attempt {}", handler.name(), attempt);
                return InvocationOutcome.failure(lastError, attempt);
            }
        }
        return InvocationOutcome.failure(lastError, maxAttempts);
    }

    private boolean pause() {
        long millis = properties.getRetryDelay().toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String messageOf(Exception e, String fallback) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? fallback : message;
    }
}
