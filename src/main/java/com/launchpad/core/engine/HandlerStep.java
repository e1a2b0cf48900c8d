package com.launchpad.core.engine;

import com.launchpad.core.context.ContextAccumulator;
import com.launchpad.core.context.ContextView;
import com.launchpad.core.events.EventBus;
import com.launchpad.core.events.LaunchEvent;
import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.logging.MdcContext;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.registry.HandlerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Runs one handler against a launch: builds its prompt from the context so far, invokes it
 * with retries and durably records the outcome before returning.
 */
@Component
public class HandlerStep {

    private static final Logger log = LoggerFactory.getLogger(HandlerStep.class);

    private final LaunchStateMachine stateMachine;
    private final ContextAccumulator contextAccumulator;
    private final RetryingAgentInvoker invoker;
    private final EventBus eventBus;

    public HandlerStep(LaunchStateMachine stateMachine, ContextAccumulator contextAccumulator,
                       RetryingAgentInvoker invoker, EventBus eventBus) {
        this.stateMachine = stateMachine;
        this.contextAccumulator = contextAccumulator;
        this.invoker = invoker;
        this.eventBus = eventBus;
    }

    /**
     * @return the recorded result for {@code handler}
     */
    public AgentResult execute(String launchId, HandlerSpec handler) {
        MdcContext.setHandler(launchId, handler.name(), handler.phase().wireName());
        try {
            Launch launch = stateMachine.load(launchId);
            int position = stateMachine.requireNext(launch, handler);
            log.info("Running {} ({}) as step {}", handler.name(), handler.phase().displayName(), position + 1);
            eventBus.publish(new LaunchEvent("agent.started", launchId, handler.name(),
                    Map.of("phase", handler.phase().wireName(), "position", position), Instant.now()));

            long started = System.nanoTime();
            InvocationOutcome outcome = invokeHandler(launch, handler);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            Launch updated = outcome.succeeded()
                    ? stateMachine.recordSuccess(launchId, handler, outcome.output(), outcome.attempts(), elapsedMs)
                    : stateMachine.recordFailure(launchId, handler, outcome.errorMessage(), outcome.attempts(), elapsedMs);
            AgentResult result = updated.resultFor(handler.name()).orElseThrow();

            log.info("{} {} in {}ms after {} attempt(s)", handler.name(), result.status().wireName(),
                    elapsedMs, result.attempts());
            return result;
        } finally {
            MdcContext.clearHandler();
        }
    }

    private InvocationOutcome invokeHandler(Launch launch, HandlerSpec handler) {
        AgentPrompt prompt;
        try {
            ContextView context = contextAccumulator.buildContext(launch);
            prompt = handler.promptBuilder().build(launch, context);
        } catch (RuntimeException e) {
            log.error("Could not build prompt for {}", handler.name(), e);
            return InvocationOutcome.failure("Prompt construction failed: " + e.getMessage(), 0);
        }
        return invoker.invoke(launch.id(), handler, prompt);
    }
}
