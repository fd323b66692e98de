package com.btcdirection.prediction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Health report of the prediction store. {@code latestTargetDate} is {@code null}
 * while no decision has been stored.
 */
public record SystemStatus(
    @JsonProperty("status") String status,
    @JsonProperty("hasTomorrowPrediction") boolean hasTomorrowPrediction,
    @JsonProperty("latestTargetDate") LocalDate latestTargetDate
) {}
