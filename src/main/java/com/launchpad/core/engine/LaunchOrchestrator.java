package com.launchpad.core.engine;

import com.launchpad.core.graph.LaunchGraph;
import com.launchpad.core.logging.MdcContext;
import com.launchpad.core.metrics.LaunchMetrics;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchSequencingException;
import com.launchpad.core.model.LaunchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives an in-progress launch through its handlers via the {@link LaunchGraph}.
 * <p>
 * Invocation failures never escape {@link #run}: they end as a failed launch. Sequencing
 * violations, conflicts and unknown launches do.
 */
@Service
public class LaunchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LaunchOrchestrator.class);

    private final LaunchStateMachine stateMachine;
    private final LaunchGraph launchGraph;
    private final LaunchLocks locks;
    private final LaunchMetrics metrics;

    public LaunchOrchestrator(LaunchStateMachine stateMachine, LaunchGraph launchGraph,
                              LaunchLocks locks, LaunchMetrics metrics) {
        this.stateMachine = stateMachine;
        this.launchGraph = launchGraph;
        this.locks = locks;
        this.metrics = metrics;
    }

    /**
     * Runs every handler that has no result yet, in registry order, stopping at the first
     * failure. Safe to call again on a launch left in progress by an earlier run.
     *
     * @return the launch as persisted when the run stopped
     * @throws LaunchSequencingException if the launch is not in progress
     * @throws com.launchpad.core.model.LaunchConflictException if another run holds the launch
     * @throws com.launchpad.core.model.LaunchNotFoundException if the launch does not exist
     */
    public Launch run(String launchId) {
        long started = System.nanoTime();
        try (LaunchLocks.Held held = locks.acquire(launchId)) {
            MdcContext.setLaunch(launchId);
            Launch launch = stateMachine.load(launchId);
            if (launch.status() != LaunchStatus.IN_PROGRESS) {
                throw new LaunchSequencingException(launchId,
                        "Launch " + launchId + " is " + launch.status().wireName() + "; only in-progress launches can run");
            }

            log.info("Running launch {} '{}' from result #{}", launchId, launch.name(),
                    launch.agentResults().size() + 1);
            launchGraph.run(launchId);

            Launch finished = stateMachine.load(launchId);
            log.info("Launch {} run ended: {} ({} handler(s) completed)", launchId,
                    finished.status().wireName(), finished.completedCount());
            return finished;
        } finally {
            metrics.recordRunDuration((System.nanoTime() - started) / 1_000_000);
            MdcContext.clear();
        }
    }
}
