package com.launchpad.core.persistence;

import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link LaunchRepository} backed by a concurrent map of immutable {@link Launch} snapshots.
 * Each conditional write is a single atomic {@code compute} on the launch's entry.
 * State is lost on restart.
 */
public class InMemoryLaunchRepository implements LaunchRepository {

    private final ConcurrentHashMap<String, Launch> launches = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLaunchRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Launch create(NewLaunch newLaunch) {
        Instant now = clock.instant();
        var launch = new Launch(UUID.randomUUID().toString(), newLaunch.name(), newLaunch.description(),
                newLaunch.productType(), newLaunch.targetMarket(), LaunchStatus.PENDING,
                now, now, null, List.of());
        launches.put(launch.id(), launch);
        return launch;
    }

    @Override
    public Optional<Launch> findById(String launchId) {
        return Optional.ofNullable(launches.get(launchId));
    }

    @Override
    public List<Launch> findAll() {
        return launches.values().stream()
                .sorted(Comparator.comparing(Launch::createdAt).reversed())
                .toList();
    }

    @Override
    public List<Launch> findByStatus(LaunchStatus status) {
        return findAll().stream().filter(l -> l.status() == status).toList();
    }

    @Override
    public void appendAgentResult(String launchId, int position, AgentResult result) {
        Launch updated = launches.computeIfPresent(launchId, (id, current) -> {
            if (current.status() != LaunchStatus.IN_PROGRESS) {
                throw new LaunchConflictException(id,
                        "Cannot record " + result.agentName() + ": launch is " + current.status().wireName());
            }
            if (current.agentResults().size() != position) {
                throw new LaunchConflictException(id,
                        "Result position " + position + " is not free (" + current.agentResults().size() + " recorded)");
            }
            if (current.resultFor(result.agentName()).isPresent()) {
                throw new LaunchConflictException(id, "Result for " + result.agentName() + " already recorded");
            }
            var results = new ArrayList<>(current.agentResults());
            results.add(result);
            return new Launch(current.id(), current.name(), current.description(), current.productType(),
                    current.targetMarket(), current.status(), current.createdAt(), clock.instant(),
                    current.summary(), results);
        });
        if (updated == null) {
            throw new LaunchNotFoundException(launchId);
        }
    }

    @Override
    public boolean compareAndSetStatus(String launchId, LaunchStatus expected, LaunchStatus next, String summary) {
        var swapped = new boolean[1];
        launches.computeIfPresent(launchId, (id, current) -> {
            if (current.status() != expected) {
                return current;
            }
            swapped[0] = true;
            return current.withStatus(next, clock.instant(), summary);
        });
        return swapped[0];
    }

    @Override
    public boolean delete(String launchId) {
        return launches.remove(launchId) != null;
    }
}
