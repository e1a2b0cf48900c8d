package com.launchpad.core.engine;

import com.launchpad.core.events.EventBus;
import com.launchpad.core.events.LaunchEvent;
import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchProgress;
import com.launchpad.core.model.LaunchSequencingException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import com.launchpad.core.persistence.LaunchRepository;
import com.launchpad.core.registry.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Entry point used by the REST and CLI layers. Creates, starts, resumes, inspects and
 * deletes launches; runs are dispatched to the launch run pool unless the caller asks to
 * wait for the outcome.
 */
@Service
public class LaunchEngine {

    private static final Logger log = LoggerFactory.getLogger(LaunchEngine.class);

    private final LaunchRepository repository;
    private final LaunchStateMachine stateMachine;
    private final LaunchOrchestrator orchestrator;
    private final HandlerRegistry registry;
    private final EventBus eventBus;
    private final OrchestratorProperties properties;
    private final ExecutorService runExecutor;

    public LaunchEngine(LaunchRepository repository, LaunchStateMachine stateMachine,
                        LaunchOrchestrator orchestrator, HandlerRegistry registry, EventBus eventBus,
                        OrchestratorProperties properties,
                        @Qualifier("launchRunExecutor") ExecutorService runExecutor) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.eventBus = eventBus;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    public Launch create(NewLaunch newLaunch) {
        Launch launch = repository.create(newLaunch);
        log.info("Created launch {} '{}'", launch.id(), launch.name());

        var payload = new HashMap<String, Object>();
        payload.put("name", launch.name());
        if (launch.productType() != null) {
            payload.put("productType", launch.productType());
        }
        eventBus.publish(new LaunchEvent("launch.created", launch.id(), null, payload, Instant.now()));
        return launch;
    }

    /**
     * Moves a pending launch to in progress, then runs it in the background (or inline when
     * {@code launchpad.orchestrator.async-start} is false).
     *
     * @return the launch right after the start transition, or after the run when inline
     */
    public Launch start(String launchId) {
        Launch started = stateMachine.start(launchId);
        if (properties.isAsyncStart()) {
            dispatch(launchId);
            return started;
        }
        return orchestrator.run(launchId);
    }

    /**
     * Starts the launch and waits for the run to end.
     */
    public Launch startAndRun(String launchId) {
        stateMachine.start(launchId);
        return orchestrator.run(launchId);
    }

    /**
     * Continues an in-progress launch from its first missing result.
     */
    public Launch resume(String launchId) {
        Launch launch = find(launchId);
        if (launch.status() != LaunchStatus.IN_PROGRESS) {
            throw new LaunchSequencingException(launchId,
                    "Launch " + launchId + " is " + launch.status().wireName() + "; only in-progress launches can be resumed");
        }
        if (properties.isAsyncStart()) {
            dispatch(launchId);
            return launch;
        }
        return orchestrator.run(launchId);
    }

    public LaunchProgress status(String launchId) {
        Launch launch = find(launchId);
        return new LaunchProgress(launch.id(), launch.status(), launch.completedCount(), registry.size());
    }

    public Launch find(String launchId) {
        return repository.findById(launchId).orElseThrow(() -> new LaunchNotFoundException(launchId));
    }

    public List<Launch> list() {
        return repository.findAll();
    }

    public List<Launch> list(LaunchStatus status) {
        return status == null ? repository.findAll() : repository.findByStatus(status);
    }

    public List<AgentResult> results(String launchId) {
        return find(launchId).agentResults();
    }

    /**
     * Deletes the launch and its results. A run still executing on it stops with
     * {@link LaunchNotFoundException} at its next write.
     */
    public void delete(String launchId) {
        if (!repository.delete(launchId)) {
            throw new LaunchNotFoundException(launchId);
        }
        log.info("Deleted launch {}", launchId);
        eventBus.publish(new LaunchEvent("launch.deleted", launchId, null, Map.of(), Instant.now()));
    }

    private void dispatch(String launchId) {
        runExecutor.execute(() -> {
            try {
                orchestrator.run(launchId);
            } catch (LaunchConflictException e) {
                log.info("Launch {} not dispatched: {}", launchId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Background run of launch {} aborted", launchId, e);
            }
        });
        log.debug("Dispatched launch {} to the run pool", launchId);
    }
}
