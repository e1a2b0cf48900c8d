package com.launchpad.core.context;

import java.io.Serializable;

/**
 * One completed handler's contribution to the shared context.
 */
public record ContextEntry(String agentName, String output) implements Serializable {}
