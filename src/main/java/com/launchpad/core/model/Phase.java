package com.launchpad.core.model;

import java.util.Locale;

/**
 * Launch phase a handler belongs to. Display metadata only: execution order is the flat
 * registry order, phases never gate anything.
 */
public enum Phase {
    RESEARCH,
    PLANNING,
    DEVELOPMENT,
    LAUNCH,
    MONITORING,
    REPORTING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT) + " Phase";
    }
}
