package com.launchpad.core.llm;

import java.time.Duration;

/**
 * Single external call: given a prompt, return generated text or fail with a classified error.
 * Implementations do not retry; the engine owns the retry policy.
 */
public interface AgentInvoker {

    /**
     * @param prompt  system + user message for the handler
     * @param timeout upper bound for the call; exceeding it fails with {@link InvocationFailure#TIMEOUT}
     * @return generated text, never blank
     * @throws AgentInvocationException on timeout, transport, provider or malformed-response failure
     */
    String invoke(AgentPrompt prompt, Duration timeout) throws AgentInvocationException;
}
