package com.launchpad.core.graph;

import com.launchpad.core.engine.HandlerStep;
import com.launchpad.core.engine.LaunchStateMachine;
import com.launchpad.core.engine.ResumePoint;
import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.Phase;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LaunchGraphTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private HandlerRegistry registry;
    private LaunchStateMachine stateMachine;
    private HandlerStep handlerStep;
    private LaunchGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        registry = HandlerRegistry.of(spec("a"), spec("b"));
        stateMachine = mock(LaunchStateMachine.class);
        handlerStep = mock(HandlerStep.class);
        graph = new LaunchGraph(registry, stateMachine, handlerStep);
    }

    private static HandlerSpec spec(String name) {
        return new HandlerSpec(name, Phase.RESEARCH, null, (launch, context) -> new AgentPrompt("s", "u"));
    }

    private static Launch launch(LaunchStatus status) {
        return new Launch("L-1", "Widget", null, null, null, status, NOW, NOW, null, List.of());
    }

    private static LaunchState state(String outcome) {
        return new LaunchState(Map.of("launchId", "L-1", "outcome", outcome));
    }

    @Test
    @DisplayName("a completed handler routes to the next one, the last one to END")
    void routesAfterHandler() {
        assertEquals("run_b", graph.routeAfterHandler(state("completed"), registry.handlerAt(0)));
        assertEquals(END, graph.routeAfterHandler(state("completed"), registry.handlerAt(1)));
        assertEquals(END, graph.routeAfterHandler(state("failed"), registry.handlerAt(0)));
    }

    @Test
    @DisplayName("resume routes by the launch's resume point")
    void resumeRoutes() {
        Launch inProgress = launch(LaunchStatus.IN_PROGRESS);
        when(stateMachine.load("L-1")).thenReturn(inProgress);

        when(stateMachine.resumePoint(inProgress)).thenReturn(ResumePoint.next(registry.handlerAt(1)));
        assertEquals(Map.of("route", "run_b"), graph.resume(state("")));

        when(stateMachine.resumePoint(inProgress)).thenReturn(ResumePoint.finalizeRun());
        assertEquals(Map.of("route", LaunchGraph.FINALIZE_RUN), graph.resume(state("")));

        when(stateMachine.resumePoint(inProgress)).thenReturn(ResumePoint.abort());
        assertEquals(Map.of("route", LaunchGraph.ABORT_RUN), graph.resume(state("")));
    }

    @Test
    @DisplayName("a launch that is no longer in progress ends the run immediately")
    void terminalLaunchEnds() {
        when(stateMachine.load("L-1")).thenReturn(launch(LaunchStatus.COMPLETED));

        graph.run("L-1");

        verifyNoInteractions(handlerStep);
        verify(stateMachine, never()).resumePoint(any());
    }

    @Test
    @DisplayName("the full run visits handlers in order and stops after a failure")
    void runsHandlersInOrder() {
        Launch inProgress = launch(LaunchStatus.IN_PROGRESS);
        when(stateMachine.load("L-1")).thenReturn(inProgress);
        when(stateMachine.resumePoint(inProgress)).thenReturn(ResumePoint.next(registry.handlerAt(0)));
        when(handlerStep.execute("L-1", registry.handlerAt(0)))
                .thenReturn(AgentResult.failed("a", "boom", NOW, 3, 1));

        graph.run("L-1");

        verify(handlerStep).execute("L-1", registry.handlerAt(0));
        verify(handlerStep, never()).execute("L-1", registry.handlerAt(1));
    }

    @Test
    @DisplayName("launch errors raised inside a node surface unwrapped")
    void unwrapsLaunchErrors() {
        Launch inProgress = launch(LaunchStatus.IN_PROGRESS);
        when(stateMachine.load("L-1")).thenReturn(inProgress);
        when(stateMachine.resumePoint(inProgress)).thenReturn(ResumePoint.next(registry.handlerAt(0)));
        when(handlerStep.execute("L-1", registry.handlerAt(0)))
                .thenThrow(new LaunchConflictException("L-1", "Result position 0 is not free"));

        LaunchConflictException e = assertThrows(LaunchConflictException.class, () -> graph.run("L-1"));
        assertEquals("Result position 0 is not free", e.getMessage());
    }
}
