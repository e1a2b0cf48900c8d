package com.launchpad.core.llm;

import java.io.Serializable;
import java.util.Objects;

/**
 * Request handed to the LLM: the handler's role instructions plus the user message built from
 * the launch brief and accumulated context.
 */
public record AgentPrompt(String system, String user) implements Serializable {

    public AgentPrompt {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(user, "user");
    }
}
