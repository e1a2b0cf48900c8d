package com.launchpad.core.llm;

/**
 * Classification of an agent invocation failure. All kinds are retried the same way.
 */
public enum InvocationFailure {
    TIMEOUT,
    TRANSPORT,
    PROVIDER_ERROR,
    MALFORMED_RESPONSE
}
