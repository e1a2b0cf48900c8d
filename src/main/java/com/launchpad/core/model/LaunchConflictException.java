package com.launchpad.core.model;

/**
 * Thrown when a conditional write loses a race (status changed underneath, result slot already
 * taken) or when another run already holds the launch. The losing transition is rejected, not
 * retried; callers may retry the whole request.
 */
public class LaunchConflictException extends LaunchException {

    public LaunchConflictException(String launchId, String message) {
        super(launchId, message);
    }

    public LaunchConflictException(String launchId, String message, Throwable cause) {
        super(launchId, message, cause);
    }
}
