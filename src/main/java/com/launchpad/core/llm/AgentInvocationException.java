package com.launchpad.core.llm;

/**
 * Thrown when an agent invocation fails. Checked, so every call site decides how the failure
 * is absorbed.
 */
public class AgentInvocationException extends Exception {

    private final InvocationFailure failure;

    public AgentInvocationException(InvocationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AgentInvocationException(InvocationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public InvocationFailure getFailure() {
        return failure;
    }
}
