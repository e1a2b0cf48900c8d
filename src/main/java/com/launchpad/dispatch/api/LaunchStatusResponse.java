package com.launchpad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.launchpad.core.model.LaunchProgress;

/**
 * JSON response for GET /api/v1/launches/{id}/status.
 */
public record LaunchStatusResponse(
    @JsonProperty("launch_id") String launchId,
    String status,
    @JsonProperty("completed_agents") int completedAgents,
    @JsonProperty("total_agents") int totalAgents
) {

    public static LaunchStatusResponse from(LaunchProgress progress) {
        return new LaunchStatusResponse(progress.launchId(), progress.status().wireName(),
                progress.completedCount(), progress.totalCount());
    }
}
