package com.btcdirection.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Daily sentiment after aggregation, gap filling and rolling derivation.
 *
 * <p>Rolling fields are {@code null} only while the trailing history is shorter
 * than their window. {@code quantileBucket} is 0-based.
 */
public record DailySentimentRow(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("meanSentiment") double meanSentiment,
    @JsonProperty("provenance") SentimentProvenance provenance,
    @JsonProperty("articleCount") int articleCount,
    @JsonProperty("sent3d") Double sent3d,
    @JsonProperty("sent5d") Double sent5d,
    @JsonProperty("sentVol") Double sentVol,
    @JsonProperty("sentDelta") Double sentDelta,
    @JsonProperty("sentAccel") Double sentAccel,
    @JsonProperty("quantileBucket") int quantileBucket,
    @JsonProperty("q2Flag") boolean q2Flag,
    @JsonProperty("q5Flag") boolean q5Flag
) {}
