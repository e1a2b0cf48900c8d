package com.launchpad.core.context;

import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.Phase;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextAccumulatorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final HandlerRegistry registry = HandlerRegistry.of(spec("a"), spec("b"), spec("c"));
    private final ContextAccumulator accumulator = new ContextAccumulator(registry);

    private static HandlerSpec spec(String name) {
        return new HandlerSpec(name, Phase.RESEARCH, null, (launch, context) -> new AgentPrompt("s", "u"));
    }

    private static Launch launchWith(AgentResult... results) {
        return new Launch("L-1", "Widget", null, null, null, LaunchStatus.IN_PROGRESS, NOW, NOW, null,
                List.of(results));
    }

    @Test
    @DisplayName("no results gives the empty view")
    void empty() {
        ContextView view = accumulator.buildContext(launchWith());

        assertTrue(view.isEmpty());
        assertEquals("No previous context available.", view.render());
    }

    @Test
    @DisplayName("entries follow registry order regardless of result order")
    void registryOrder() {
        ContextView view = accumulator.buildContext(launchWith(
                AgentResult.completed("b", "beta", NOW, 1, 1),
                AgentResult.completed("a", "alpha", NOW, 1, 1)));

        assertEquals(List.of("a", "b"), view.agentNames());
        assertEquals("### 1. a\nalpha\n\n### 2. b\nbeta", view.render());
    }

    @Test
    @DisplayName("failed and unknown results are left out")
    void skipsFailedAndUnknown() {
        ContextView view = accumulator.buildContext(launchWith(
                AgentResult.completed("a", "alpha", NOW, 1, 1),
                AgentResult.completed("ghost", "boo", NOW, 1, 1),
                AgentResult.failed("b", "boom", NOW, 3, 1)));

        assertEquals(List.of("a"), view.agentNames());
        assertEquals("alpha", view.outputOf("a").orElseThrow());
        assertTrue(view.outputOf("b").isEmpty());
    }

    @Test
    @DisplayName("rebuilding from the same results yields an equal view")
    void deterministic() {
        Launch launch = launchWith(AgentResult.completed("a", "alpha", NOW, 1, 1));

        assertEquals(accumulator.buildContext(launch), accumulator.buildContext(launch));
        assertEquals(accumulator.buildContext(launch).render(), accumulator.buildContext(launch).render());
    }
}
