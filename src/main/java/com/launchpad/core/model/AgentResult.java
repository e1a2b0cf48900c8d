package com.launchpad.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one handler execution for one launch. Written exactly once and never edited.
 *
 * @param agentName       registry name of the handler
 * @param status          completed or failed
 * @param output          generated text, present iff completed
 * @param errorMessage    failure explanation, present iff failed
 * @param errorFlag       true iff failed
 * @param timestamp       completion time
 * @param attempts        invocation attempts spent on this outcome (1 = no retry)
 * @param executionTimeMs wall-clock time of the handler step including retries
 */
public record AgentResult(
    String agentName,
    AgentResultStatus status,
    String output,
    String errorMessage,
    boolean errorFlag,
    Instant timestamp,
    int attempts,
    long executionTimeMs
) implements Serializable {

    public AgentResult {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        if (status == AgentResultStatus.COMPLETED) {
            if (output == null || errorMessage != null || errorFlag) {
                throw new IllegalArgumentException(
                        "Completed result for " + agentName + " must carry output and no error");
            }
        } else {
            if (errorMessage == null || output != null || !errorFlag) {
                throw new IllegalArgumentException(
                        "Failed result for " + agentName + " must carry an error message and no output");
            }
        }
    }

    public static AgentResult completed(String agentName, String output, Instant timestamp,
                                        int attempts, long executionTimeMs) {
        return new AgentResult(agentName, AgentResultStatus.COMPLETED, output, null, false,
                timestamp, attempts, executionTimeMs);
    }

    public static AgentResult failed(String agentName, String errorMessage, Instant timestamp,
                                     int attempts, long executionTimeMs) {
        return new AgentResult(agentName, AgentResultStatus.FAILED, null, errorMessage, true,
                timestamp, attempts, executionTimeMs);
    }

    public boolean isCompleted() {
        return status == AgentResultStatus.COMPLETED;
    }
}
