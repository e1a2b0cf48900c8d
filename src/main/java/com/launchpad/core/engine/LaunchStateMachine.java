package com.launchpad.core.engine;

import com.launchpad.core.events.EventBus;
import com.launchpad.core.events.LaunchEvent;
import com.launchpad.core.metrics.LaunchMetrics;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchSequencingException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.persistence.LaunchRepository;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import com.launchpad.core.summary.LaunchSummaryComposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Owns every legal change to a launch's status and result list.
 * <p>
 * {@code pending -> in_progress -> {completed, failed}}. Each write goes through a conditional
 * repository call, so a transition that lost a race is rejected rather than applied twice.
 * Results are accepted strictly in registry order.
 */
@Component
public class LaunchStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LaunchStateMachine.class);

    private final LaunchRepository repository;
    private final HandlerRegistry registry;
    private final LaunchSummaryComposer summaryComposer;
    private final EventBus eventBus;
    private final LaunchMetrics metrics;
    private final Clock clock;

    public LaunchStateMachine(LaunchRepository repository, HandlerRegistry registry,
                              LaunchSummaryComposer summaryComposer, EventBus eventBus,
                              LaunchMetrics metrics, Clock clock) {
        this.repository = repository;
        this.registry = registry;
        this.summaryComposer = summaryComposer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Launch load(String launchId) {
        return repository.findById(launchId).orElseThrow(() -> new LaunchNotFoundException(launchId));
    }

    /**
     * Moves a pending launch to in progress.
     *
     * @throws LaunchSequencingException if the launch is not pending
     * @throws LaunchConflictException   if another caller started it first
     */
    public Launch start(String launchId) {
        Launch launch = load(launchId);
        if (launch.status() != LaunchStatus.PENDING) {
            throw new LaunchSequencingException(launchId,
                    "Launch " + launchId + " is " + launch.status().wireName() + "; only pending launches can be started");
        }
        if (!repository.compareAndSetStatus(launchId, LaunchStatus.PENDING, LaunchStatus.IN_PROGRESS, null)) {
            throw new LaunchConflictException(launchId, "Launch " + launchId + " was started concurrently");
        }
        log.info("Launch {} started", launchId);
        publish("launch.started", launchId, null, Map.of("handlers", registry.size()));
        return load(launchId);
    }

    /**
     * Checks that {@code handler} is the next one the launch expects and returns its position.
     *
     * @throws LaunchSequencingException if the launch is not in progress or expects another handler
     */
    public int requireNext(Launch launch, HandlerSpec handler) {
        if (launch.status() != LaunchStatus.IN_PROGRESS) {
            throw new LaunchSequencingException(launch.id(),
                    "Launch " + launch.id() + " is " + launch.status().wireName() + "; cannot run " + handler.name());
        }
        ResumePoint point = resumePoint(launch);
        if (point.kind() != ResumePoint.Kind.NEXT || !point.handler().name().equals(handler.name())) {
            String expected = point.kind() == ResumePoint.Kind.NEXT ? point.handler().name() : "none";
            throw new LaunchSequencingException(launch.id(),
                    "Out-of-order result for " + handler.name() + " on launch " + launch.id() + "; expected " + expected);
        }
        return launch.agentResults().size();
    }

    /**
     * Records a completed handler. When it is the last handler the launch is completed
     * with a summary.
     */
    public Launch recordSuccess(String launchId, HandlerSpec handler, String output,
                                int attempts, long executionTimeMs) {
        int position = requireNext(load(launchId), handler);
        AgentResult result = AgentResult.completed(handler.name(), output, clock.instant(), attempts, executionTimeMs);
        repository.appendAgentResult(launchId, position, result);
        recorded(launchId, result);

        Launch launch = load(launchId);
        if (registry.isLast(handler)) {
            return complete(launch);
        }
        return launch;
    }

    /**
     * Records a failed handler and fails the launch. Nothing runs after it.
     */
    public Launch recordFailure(String launchId, HandlerSpec handler, String errorMessage,
                                int attempts, long executionTimeMs) {
        int position = requireNext(load(launchId), handler);
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        AgentResult result = AgentResult.failed(handler.name(), message, clock.instant(), attempts, executionTimeMs);
        repository.appendAgentResult(launchId, position, result);
        recorded(launchId, result);
        return fail(launchId);
    }

    /**
     * Marks an in-progress launch whose every handler completed as completed.
     */
    public Launch complete(Launch launch) {
        if (launch.completedCount() < registry.size()) {
            throw new LaunchSequencingException(launch.id(),
                    "Launch " + launch.id() + " has " + launch.completedCount() + "/" + registry.size()
                            + " completed handlers; cannot complete");
        }
        String summary = summaryComposer.compose(launch);
        transition(launch.id(), LaunchStatus.COMPLETED, summary);
        return load(launch.id());
    }

    public Launch fail(String launchId) {
        transition(launchId, LaunchStatus.FAILED, null);
        return load(launchId);
    }

    /**
     * Decides where an in-progress launch continues: the first handler without a result,
     * or a pending status write left behind by an interrupted run.
     */
    public ResumePoint resumePoint(Launch launch) {
        var last = launch.lastResult();
        if (last.isPresent() && !last.get().isCompleted()) {
            return ResumePoint.abort();
        }
        int position = launch.agentResults().size();
        if (position >= registry.size()) {
            return ResumePoint.finalizeRun();
        }
        return ResumePoint.next(registry.handlerAt(position));
    }

    private void transition(String launchId, LaunchStatus next, String summary) {
        if (!repository.compareAndSetStatus(launchId, LaunchStatus.IN_PROGRESS, next, summary)) {
            Launch current = load(launchId);
            throw new LaunchConflictException(launchId,
                    "Launch " + launchId + " is " + current.status().wireName() + "; cannot move to " + next.wireName());
        }
        log.info("Launch {} {}", launchId, next.wireName());
        metrics.recordLaunchResult(next.wireName());
        publish("launch." + next.wireName(), launchId, null, Map.of("status", next.wireName()));
    }

    private void recorded(String launchId, AgentResult result) {
        metrics.recordHandlerExecution(result.agentName(), result.status().wireName(), result.executionTimeMs());
        var payload = new HashMap<String, Object>();
        payload.put("attempts", result.attempts());
        payload.put("executionTimeMs", result.executionTimeMs());
        if (!result.isCompleted()) {
            payload.put("error", result.errorMessage());
        }
        publish("agent." + result.status().wireName(), launchId, result.agentName(), payload);
    }

    private void publish(String type, String launchId, String agentName, Map<String, Object> payload) {
        eventBus.publish(new LaunchEvent(type, launchId, agentName, payload, clock.instant()));
    }
}
