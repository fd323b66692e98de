package com.btcdirection.feature.dto;

/** Sentiment sidecar reply; {@code score} is expected in [-1, 1]. */
public record ScoreResponse(Double score) {}
