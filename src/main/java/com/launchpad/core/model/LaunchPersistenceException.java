package com.launchpad.core.model;

/**
 * Storage failure that is neither a missing launch nor a conditional-write conflict.
 */
public class LaunchPersistenceException extends LaunchException {

    public LaunchPersistenceException(String launchId, String message, Throwable cause) {
        super(launchId, message, cause);
    }
}
