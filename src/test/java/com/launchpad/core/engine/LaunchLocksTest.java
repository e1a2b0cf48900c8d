package com.launchpad.core.engine;

import com.launchpad.core.model.LaunchConflictException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LaunchLocksTest {

    private final LaunchLocks locks = new LaunchLocks();

    @Test
    void secondAcquireIsConflict() {
        try (LaunchLocks.Held held = locks.acquire("L-1")) {
            assertTrue(locks.isRunning("L-1"));
            LaunchConflictException e = assertThrows(LaunchConflictException.class, () -> locks.acquire("L-1"));
            assertEquals("L-1", e.getLaunchId());
        }
        assertFalse(locks.isRunning("L-1"));
    }

    @Test
    void locksAreIndependentPerLaunch() {
        try (LaunchLocks.Held a = locks.acquire("L-1"); LaunchLocks.Held b = locks.acquire("L-2")) {
            assertTrue(locks.isRunning("L-1"));
            assertTrue(locks.isRunning("L-2"));
        }
    }
}
