package com.btcdirection.prediction.dto;

/**
 * Body sent to the model-serving sidecar. {@code rows} is oldest first and
 * already scaled; a single-row model receives exactly one row.
 */
public record PredictRequest(String modelId, String version, double[][] rows) {}
