package com.btcdirection.common.model;

/**
 * Whether a day's mean sentiment came from scored articles or from gap filling.
 */
public enum SentimentProvenance {
    OBSERVED,
    INTERPOLATED
}
