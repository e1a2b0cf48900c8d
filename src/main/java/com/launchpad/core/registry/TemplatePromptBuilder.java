package com.launchpad.core.registry;

import com.launchpad.core.context.ContextView;
import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.model.Launch;

import java.util.List;

/**
 * Prompt builder shared by the standard handlers. The system message carries the role and goal;
 * the user message carries the launch brief, the full ordered history of earlier handlers and
 * the handler's deliverables.
 */
public final class TemplatePromptBuilder implements PromptBuilder {

    private static final String UNKNOWN = "Unknown";

    private final String role;
    private final String goal;
    private final List<String> deliverables;

    public TemplatePromptBuilder(String role, String goal, List<String> deliverables) {
        this.role = role;
        this.goal = goal;
        this.deliverables = List.copyOf(deliverables);
    }

    @Override
    public AgentPrompt build(Launch launch, ContextView context) {
        String system = "You are a " + role + ". " + goal + ".\n"
                + "Build on the work of the specialists who ran before you and stay consistent with it. "
                + "Format your response with clear sections and specific, actionable insights.";

        var user = new StringBuilder();
        user.append("PRODUCT LAUNCH BRIEF\n");
        user.append("Product: ").append(orUnknown(launch.name())).append('\n');
        user.append("Type: ").append(orUnknown(launch.productType())).append('\n');
        user.append("Target Market: ").append(orUnknown(launch.targetMarket())).append('\n');
        if (launch.description() != null && !launch.description().isBlank()) {
            user.append("Description: ").append(launch.description().trim()).append('\n');
        }
        user.append("\nPREVIOUS SPECIALIST OUTPUTS\n");
        user.append(context.render()).append('\n');
        user.append("\nYOUR DELIVERABLES\n");
        for (int i = 0; i < deliverables.size(); i++) {
            user.append(i + 1).append(". ").append(deliverables.get(i)).append('\n');
        }
        return new AgentPrompt(system, user.toString());
    }

    public String role() {
        return role;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
