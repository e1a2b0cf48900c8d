package com.launchpad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/launches.
 *
 * @param name         launch name, required
 * @param description  free-text product description; nullable
 * @param productType  e.g. "SaaS platform"; nullable
 * @param targetMarket e.g. "mid-market retailers"; nullable
 */
public record LaunchRequest(
    String name,
    String description,
    @JsonProperty("product_type") String productType,
    @JsonProperty("target_market") String targetMarket
) {}
