package com.btcdirection.prediction.dto;

public record PredictResponse(Double probabilityUp) {}
