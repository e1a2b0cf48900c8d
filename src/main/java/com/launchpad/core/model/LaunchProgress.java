package com.launchpad.core.model;

/**
 * Cheap status read of a launch: lifecycle status plus how many handlers have completed
 * out of how many the registry defines.
 */
public record LaunchProgress(
    String launchId,
    LaunchStatus status,
    int completedCount,
    int totalCount
) {}
