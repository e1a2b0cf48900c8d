package com.launchpad.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a launch.
 * <p>
 * {@code PENDING -> IN_PROGRESS -> {COMPLETED, FAILED}}. The two terminal states have no exit.
 */
public enum LaunchStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Persisted / JSON form ({@code pending}, {@code in_progress}, ...).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LaunchStatus fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Launch status must not be blank");
        }
        return LaunchStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
