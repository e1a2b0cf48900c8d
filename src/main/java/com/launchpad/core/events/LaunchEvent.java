package com.launchpad.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a launch is created, run or deleted.
 *
 * @param eventType  e.g. "launch.started", "agent.completed", "agent.retrying"
 * @param launchId   the launch this event belongs to
 * @param agentName  the handler this event relates to (null for launch-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record LaunchEvent(
    String eventType,
    String launchId,
    String agentName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
