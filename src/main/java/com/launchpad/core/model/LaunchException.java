package com.launchpad.core.model;

/**
 * Base type for errors that reject a launch operation. These indicate misuse or a lost race
 * and propagate to callers of start / run, unlike invocation errors which are absorbed into a
 * failed {@link AgentResult}.
 */
public abstract class LaunchException extends RuntimeException {

    private final String launchId;

    protected LaunchException(String launchId, String message) {
        super(message);
        this.launchId = launchId;
    }

    protected LaunchException(String launchId, String message, Throwable cause) {
        super(message, cause);
        this.launchId = launchId;
    }

    public String getLaunchId() {
        return launchId;
    }
}
