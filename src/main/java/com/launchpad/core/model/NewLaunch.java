package com.launchpad.core.model;

/**
 * Data needed to create a launch. Only {@code name} is required.
 */
public record NewLaunch(
    String name,
    String description,
    String productType,
    String targetMarket
) {

    public NewLaunch {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Launch name is required");
        }
    }
}
