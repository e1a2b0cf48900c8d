package com.launchpad.core.model;

/**
 * Thrown when a request would break the launch state machine: starting a launch that is not
 * pending, running one that is not in progress, or recording a handler out of order.
 * Never silently corrected.
 */
public class LaunchSequencingException extends LaunchException {

    public LaunchSequencingException(String launchId, String message) {
        super(launchId, message);
    }
}
