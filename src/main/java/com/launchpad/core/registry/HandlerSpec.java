package com.launchpad.core.registry;

import com.launchpad.core.model.Phase;

import java.util.Objects;

/**
 * Immutable descriptor of one handler in the launch pipeline.
 *
 * @param name          unique handler identity, also the {@code agent_name} of its results
 * @param phase         display phase
 * @param role          human-readable role, e.g. "Market Intelligence Specialist"
 * @param promptBuilder renders the handler's prompt from the context so far
 */
public record HandlerSpec(
    String name,
    Phase phase,
    String role,
    PromptBuilder promptBuilder
) {

    public HandlerSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Handler name must not be blank");
        }
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(promptBuilder, "promptBuilder");
        role = role == null ? name : role;
    }

    @Override
    public String toString() {
        return name + " [" + phase.wireName() + "]";
    }
}
