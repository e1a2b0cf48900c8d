package com.launchpad.core.context;

import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.Launch;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;

/**
 * Derives the context view of a launch from its persisted results.
 * <p>
 * Walks the registry order rather than the results' insertion order, so a store that hands
 * rows back shuffled still yields the same view. Only completed results contribute; results
 * naming a handler the registry does not know are dropped.
 */
@Component
public class ContextAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ContextAccumulator.class);

    private final HandlerRegistry registry;

    public ContextAccumulator(HandlerRegistry registry) {
        this.registry = registry;
    }

    public ContextView buildContext(Launch launch) {
        if (launch.agentResults().isEmpty()) {
            return ContextView.empty();
        }

        var completedByName = new HashMap<String, AgentResult>();
        for (AgentResult result : launch.agentResults()) {
            if (!result.isCompleted()) {
                continue;
            }
            if (registry.find(result.agentName()).isEmpty()) {
                log.warn("Launch {} has a result for unknown handler '{}', leaving it out of context",
                        launch.id(), result.agentName());
                continue;
            }
            completedByName.putIfAbsent(result.agentName(), result);
        }

        var entries = new ArrayList<ContextEntry>(completedByName.size());
        for (HandlerSpec handler : registry.orderedHandlers()) {
            AgentResult result = completedByName.get(handler.name());
            if (result != null) {
                entries.add(new ContextEntry(handler.name(), result.output()));
            }
        }
        return new ContextView(entries);
    }
}
