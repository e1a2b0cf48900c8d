package com.launchpad.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of work: one product launch and the handler results accumulated for it so far.
 * <p>
 * {@code agentResults} is in creation order and is always a prefix of the registry order.
 */
public record Launch(
    String id,
    String name,
    String description,
    String productType,
    String targetMarket,
    LaunchStatus status,
    Instant createdAt,
    Instant updatedAt,
    String summary,
    List<AgentResult> agentResults
) implements Serializable {

    public Launch {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        agentResults = agentResults == null ? List.of() : List.copyOf(agentResults);
    }

    public int completedCount() {
        return (int) agentResults.stream().filter(AgentResult::isCompleted).count();
    }

    public Optional<AgentResult> lastResult() {
        return agentResults.isEmpty()
                ? Optional.empty()
                : Optional.of(agentResults.get(agentResults.size() - 1));
    }

    public Optional<AgentResult> resultFor(String agentName) {
        return agentResults.stream()
                .filter(r -> r.agentName().equals(agentName))
                .findFirst();
    }

    public Launch withStatus(LaunchStatus newStatus, Instant at, String newSummary) {
        return new Launch(id, name, description, productType, targetMarket, newStatus,
                createdAt, at, newSummary != null ? newSummary : summary, agentResults);
    }
}
