package com.launchpad.core.registry;

import com.launchpad.core.context.ContextView;
import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.model.Launch;

/**
 * Pure function from a launch and its context so far to the prompt for one handler.
 */
@FunctionalInterface
public interface PromptBuilder {

    AgentPrompt build(Launch launch, ContextView context);
}
