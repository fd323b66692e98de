package com.btcdirection.prediction.dto;

import com.btcdirection.common.model.EnsembleDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Most recent stored decision; {@code isFuture} is true while its target date is after today (UTC).
 */
public record LatestDecision(
    @JsonProperty("decision") EnsembleDecision decision,
    @JsonProperty("isFuture") boolean isFuture
) {}
