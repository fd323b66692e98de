package com.btcdirection.feature.dto;

public record ScoreRequest(String text) {}
