package com.launchpad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.launchpad.core.model.AgentResult;

import java.time.Instant;

/**
 * JSON form of one handler result.
 */
public record AgentResultResponse(
    @JsonProperty("agent_name") String agentName,
    String status,
    String output,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("error_flag") boolean errorFlag,
    Instant timestamp,
    int attempts,
    @JsonProperty("execution_time_ms") long executionTimeMs
) {

    public static AgentResultResponse from(AgentResult result) {
        return new AgentResultResponse(result.agentName(), result.status().wireName(), result.output(),
                result.errorMessage(), result.errorFlag(), result.timestamp(), result.attempts(),
                result.executionTimeMs());
    }
}
