package com.launchpad.core.graph;

import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.Map;

/**
 * Graph state for one launch run.
 * <p>
 * Carries only routing data. The launch itself is re-read from the repository by every node,
 * so the durable store stays the single source of truth.
 */
public class LaunchState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
        "launchId", Channels.base(() -> ""),
        "route",    Channels.base(() -> ""),
        "outcome",  Channels.base(() -> "")
    );

    public LaunchState(Map<String, Object> initData) {
        super(initData);
    }

    public String launchId() {
        return this.<String>value("launchId").orElse("");
    }

    /** Node chosen by {@code resume_run}. */
    public String route() {
        return this.<String>value("route").orElse("");
    }

    /** Result status of the last handler node, {@code completed} or {@code failed}. */
    public String outcome() {
        return this.<String>value("outcome").orElse("");
    }
}
