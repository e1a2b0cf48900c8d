package com.launchpad.core.model;

import java.util.Locale;

/**
 * Terminal outcome of one handler execution. Results are only ever written once a handler
 * has finished, so there is no pending or running value.
 */
public enum AgentResultStatus {
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentResultStatus fromWireName(String raw) {
        return AgentResultStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
