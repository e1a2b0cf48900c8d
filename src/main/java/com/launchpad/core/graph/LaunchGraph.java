package com.launchpad.core.graph;

import com.launchpad.core.engine.HandlerStep;
import com.launchpad.core.engine.LaunchStateMachine;
import com.launchpad.core.engine.ResumePoint;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.AgentResultStatus;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives one launch run.
 * <p>
 * Graph topology, one node per registered handler in registry order:
 * <pre>
 *   START -> resume_run -> [route]
 *         -> run_&lt;first missing handler&gt; -> [routeAfterHandler]
 *            -> run_&lt;next handler&gt; ...      (completed and not last)
 *            -> END                            (failed, or last handler)
 *         -> finalize_run -> END               (all results completed, status not yet written)
 *         -> abort_run -> END                  (failed result, status not yet written)
 *         -> END                               (launch no longer in progress)
 * </pre>
 * Every node re-reads the launch from the repository, so re-invoking the graph on a
 * half-finished launch continues from its first missing result.
 */
@Component
public class LaunchGraph {

    private static final Logger log = LoggerFactory.getLogger(LaunchGraph.class);

    static final String RESUME_RUN = "resume_run";
    static final String FINALIZE_RUN = "finalize_run";
    static final String ABORT_RUN = "abort_run";
    private static final int EXTRA_STEPS = 8;

    private final HandlerRegistry registry;
    private final LaunchStateMachine stateMachine;
    private final HandlerStep handlerStep;
    private final CompiledGraph<LaunchState> compiledGraph;

    public LaunchGraph(HandlerRegistry registry, LaunchStateMachine stateMachine,
                       HandlerStep handlerStep) throws GraphStateException {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.handlerStep = handlerStep;

        var graph = new StateGraph<>(LaunchState.SCHEMA, LaunchState::new)
                .addNode(RESUME_RUN, node_async(this::resume))
                .addNode(FINALIZE_RUN, node_async(this::finalizeRun))
                .addNode(ABORT_RUN, node_async(this::abortRun))
                .addEdge(START, RESUME_RUN)
                .addEdge(FINALIZE_RUN, END)
                .addEdge(ABORT_RUN, END);

        var resumeRoutes = new HashMap<String, String>();
        resumeRoutes.put(FINALIZE_RUN, FINALIZE_RUN);
        resumeRoutes.put(ABORT_RUN, ABORT_RUN);
        resumeRoutes.put(END, END);

        for (HandlerSpec handler : registry.orderedHandlers()) {
            String nodeId = nodeId(handler);
            resumeRoutes.put(nodeId, nodeId);
            graph.addNode(nodeId, node_async(state -> runHandler(state, handler)));

            var handlerRoutes = new HashMap<String, String>();
            handlerRoutes.put(END, END);
            registry.next(handler).ifPresent(next -> handlerRoutes.put(nodeId(next), nodeId(next)));
            graph.addConditionalEdges(nodeId,
                    edge_async(state -> routeAfterHandler(state, handler)),
                    handlerRoutes);
        }

        graph.addConditionalEdges(RESUME_RUN, edge_async(LaunchState::route), resumeRoutes);

        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(recursionLimit(registry))
                .build());
        log.info("Launch graph compiled with {} handler nodes", registry.size());
    }

    /**
     * One pass visits the resume node, every handler at most once and one repair node.
     */
    static int recursionLimit(HandlerRegistry registry) {
        return registry.size() + EXTRA_STEPS;
    }

    /**
     * Runs the launch from its first missing result until it completes, fails or stops.
     * Launch errors raised inside a node surface unwrapped.
     */
    public void run(String launchId) {
        var config = RunnableConfig.builder()
                .threadId(launchId)
                .build();
        try {
            compiledGraph.invoke(Map.of("launchId", launchId), config);
        } catch (RuntimeException e) {
            LaunchException launchError = findLaunchException(e);
            if (launchError != null) {
                throw launchError;
            }
            throw e;
        }
    }

    Map<String, Object> resume(LaunchState state) {
        Launch launch = stateMachine.load(state.launchId());
        if (launch.status() != LaunchStatus.IN_PROGRESS) {
            log.info("Launch {} is {}, nothing to run", launch.id(), launch.status().wireName());
            return Map.of("route", END);
        }
        ResumePoint point = stateMachine.resumePoint(launch);
        String route = switch (point.kind()) {
            case NEXT -> nodeId(point.handler());
            case FINALIZE -> FINALIZE_RUN;
            case ABORT -> ABORT_RUN;
        };
        if (!launch.agentResults().isEmpty()) {
            log.info("Resuming launch {} at {} ({} result(s) already recorded)",
                    launch.id(), route, launch.agentResults().size());
        }
        return Map.of("route", route);
    }

    Map<String, Object> runHandler(LaunchState state, HandlerSpec handler) {
        AgentResult result = handlerStep.execute(state.launchId(), handler);
        return Map.of("outcome", result.status().wireName());
    }

    Map<String, Object> finalizeRun(LaunchState state) {
        log.warn("Launch {} has all results but was not completed; completing now", state.launchId());
        stateMachine.complete(stateMachine.load(state.launchId()));
        return Map.of("outcome", LaunchStatus.COMPLETED.wireName());
    }

    Map<String, Object> abortRun(LaunchState state) {
        log.warn("Launch {} ended on a failed result but was not failed; failing now", state.launchId());
        stateMachine.fail(state.launchId());
        return Map.of("outcome", LaunchStatus.FAILED.wireName());
    }

    String routeAfterHandler(LaunchState state, HandlerSpec handler) {
        if (!AgentResultStatus.COMPLETED.wireName().equals(state.outcome())) {
            return END;
        }
        return registry.next(handler).map(LaunchGraph::nodeId).orElse(END);
    }

    static String nodeId(HandlerSpec handler) {
        return "run_" + handler.name();
    }

    private static LaunchException findLaunchException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof LaunchException launchException) {
                return launchException;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
