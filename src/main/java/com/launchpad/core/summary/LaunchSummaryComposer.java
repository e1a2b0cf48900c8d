package com.launchpad.core.summary;

import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.Phase;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the summary stored on a launch when its last handler completes.
 * <p>
 * The summary is a pure function of the launch brief and its ordered results: phase by phase,
 * each handler contributes a short excerpt of its output, and the reporting phase is included
 * in full. Calling it twice on the same launch yields the same text.
 */
@Component
public class LaunchSummaryComposer {

    static final int EXCERPT_LENGTH = 300;

    private static final String RULE = "=".repeat(50);

    private final HandlerRegistry registry;

    public LaunchSummaryComposer(HandlerRegistry registry) {
        this.registry = registry;
    }

    public String compose(Launch launch) {
        var sb = new StringBuilder();
        sb.append("LAUNCH SUMMARY: ").append(launch.name()).append('\n');
        sb.append(RULE).append('\n');
        sb.append("Product Type: ").append(orUnknown(launch.productType())).append('\n');
        sb.append("Target Market: ").append(orUnknown(launch.targetMarket())).append('\n');
        sb.append("Handlers completed: ").append(launch.completedCount())
                .append('/').append(registry.size()).append('\n');

        for (Map.Entry<Phase, List<HandlerSpec>> phase : handlersByPhase().entrySet()) {
            List<String> lines = new ArrayList<>();
            for (HandlerSpec handler : phase.getValue()) {
                launch.resultFor(handler.name())
                        .filter(AgentResult::isCompleted)
                        .ifPresent(result -> lines.add(phase.getKey() == Phase.REPORTING
                                ? result.output().strip()
                                : "• " + titleOf(handler.name()) + ": " + excerpt(result.output())));
            }
            if (lines.isEmpty()) {
                continue;
            }
            String header = phase.getKey().displayName().toUpperCase(Locale.ROOT);
            sb.append('\n').append(header).append('\n');
            sb.append("-".repeat(header.length())).append('\n');
            sb.append(String.join("\n", lines)).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private Map<Phase, List<HandlerSpec>> handlersByPhase() {
        var byPhase = new LinkedHashMap<Phase, List<HandlerSpec>>();
        for (HandlerSpec handler : registry.orderedHandlers()) {
            byPhase.computeIfAbsent(handler.phase(), p -> new ArrayList<>()).add(handler);
        }
        return byPhase;
    }

    static String excerpt(String output) {
        String text = output.strip().replaceAll("\\s+", " ");
        return text.length() > EXCERPT_LENGTH ? text.substring(0, EXCERPT_LENGTH) + "..." : text;
    }

    static String titleOf(String agentName) {
        var words = new ArrayList<String>();
        for (String part : agentName.split("_")) {
            if (!part.isEmpty()) {
                words.add(Character.toUpperCase(part.charAt(0)) + part.substring(1));
            }
        }
        return String.join(" ", words);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "Unknown" : value;
    }
}
