package com.finops.costanomaly.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Cost record as delivered by the billing collectors, before timestamp parsing.
 *
 * Collectors attach extra attributes (service, region, usage type); those are ignored here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawCostRecord(
        String timestamp,
        Double cost
) {}
