package com.launchpad.core.engine;

/**
 * Final outcome of a handler's invocation after retries: either generated output or the
 * message of the last failure.
 */
public record InvocationOutcome(String output, String errorMessage, int attempts) {

    public static InvocationOutcome success(String output, int attempts) {
        return new InvocationOutcome(output, null, attempts);
    }

    public static InvocationOutcome failure(String errorMessage, int attempts) {
        return new InvocationOutcome(null, errorMessage, attempts);
    }

    public boolean succeeded() {
        return output != null;
    }
}
