package com.launchpad.core.persistence;

import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for launches and their handler results.
 * <p>
 * Writes are conditional so two writers racing on the same launch cannot both win:
 * status changes compare-and-set on the expected status, result appends claim an exact
 * position and only while the launch is in progress. Implementations throw
 * {@link com.launchpad.core.model.LaunchPersistenceException} for storage failures.
 */
public interface LaunchRepository {

    /**
     * Creates a new launch in {@link LaunchStatus#PENDING} with no results.
     */
    Launch create(NewLaunch newLaunch);

    /**
     * Loads the launch together with its results in creation order.
     */
    Optional<Launch> findById(String launchId);

    /**
     * All launches, newest first.
     */
    List<Launch> findAll();

    List<Launch> findByStatus(LaunchStatus status);

    /**
     * Appends a result at {@code position} (0-based). Succeeds only if the launch is
     * in progress, already holds exactly {@code position} results and has no result for the
     * same handler.
     *
     * @throws com.launchpad.core.model.LaunchNotFoundException if the launch does not exist
     * @throws com.launchpad.core.model.LaunchConflictException if any of the conditions fails
     */
    void appendAgentResult(String launchId, int position, AgentResult result);

    /**
     * Moves the launch from {@code expected} to {@code next}. A non-null {@code summary}
     * replaces the stored one.
     *
     * @return false if the launch is missing or its status is no longer {@code expected}
     */
    boolean compareAndSetStatus(String launchId, LaunchStatus expected, LaunchStatus next, String summary);

    /**
     * Removes the launch and all of its results in one step.
     *
     * @return false if there was nothing to delete
     */
    boolean delete(String launchId);
}
