package com.launchpad.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Launchpad-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setLaunch(String launchId) {
        MDC.put("launchId", launchId);
    }

    public static void setHandler(String launchId, String agentName, String phase) {
        MDC.put("launchId", launchId);
        MDC.put("agentName", agentName);
        MDC.put("phase", phase);
    }

    public static void clearHandler() {
        MDC.remove("agentName");
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("launchId");
        MDC.remove("agentName");
        MDC.remove("phase");
    }
}
