package com.launchpad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.launchpad.core.model.Launch;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for launch endpoints.
 */
public record LaunchResponse(
    String id,
    String name,
    String description,
    @JsonProperty("product_type") String productType,
    @JsonProperty("target_market") String targetMarket,
    String status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    String summary,
    @JsonProperty("agent_results") List<AgentResultResponse> agentResults
) {

    public static LaunchResponse from(Launch launch) {
        return new LaunchResponse(launch.id(), launch.name(), launch.description(), launch.productType(),
                launch.targetMarket(), launch.status().wireName(), launch.createdAt(), launch.updatedAt(),
                launch.summary(), launch.agentResults().stream().map(AgentResultResponse::from).toList());
    }
}
