package com.launchpad.core.engine;

import com.launchpad.core.model.LaunchConflictException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Grants at most one active run per launch within this process.
 */
@Component
public class LaunchLocks {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /**
     * @throws LaunchConflictException if another run already holds the launch
     */
    public Held acquire(String launchId) {
        if (!running.add(launchId)) {
            throw new LaunchConflictException(launchId, "Launch " + launchId + " is already running");
        }
        return () -> running.remove(launchId);
    }

    public boolean isRunning(String launchId) {
        return running.contains(launchId);
    }

    /**
     * An acquired lock; closing it releases the launch.
     */
    @FunctionalInterface
    public interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
