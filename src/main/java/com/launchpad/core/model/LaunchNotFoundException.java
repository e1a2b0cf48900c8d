package com.launchpad.core.model;

/**
 * Thrown when an operation names a launch that does not exist (or was deleted mid-run).
 */
public class LaunchNotFoundException extends LaunchException {

    public LaunchNotFoundException(String launchId) {
        super(launchId, "Launch not found: " + launchId);
    }
}
