package com.btcdirection.common.model;

/**
 * Coarse label for how far the weighted probability sits from a coin flip.
 */
public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    static final double HIGH_DISTANCE   = 0.10;
    static final double MEDIUM_DISTANCE = 0.05;

    public static ConfidenceLevel fromProbability(double probabilityUp) {
        double distance = Math.abs(probabilityUp - 0.5);
        if (distance > HIGH_DISTANCE)   return HIGH;
        if (distance > MEDIUM_DISTANCE) return MEDIUM;
        return LOW;
    }
}
