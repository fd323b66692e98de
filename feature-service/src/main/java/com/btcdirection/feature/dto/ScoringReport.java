package com.btcdirection.feature.dto;

/**
 * Result of a scoring pass over unscored articles.
 */
public record ScoringReport(int attempted, int scored, int failed) {

    public static ScoringReport empty() {
        return new ScoringReport(0, 0, 0);
    }
}
