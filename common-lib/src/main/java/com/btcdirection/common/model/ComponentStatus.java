package com.btcdirection.common.model;

/**
 * Outcome of invoking one ensemble component for one prediction cycle.
 * Only {@link #OK} contributes to the weighted probability.
 */
public enum ComponentStatus {
    OK,
    FAILED,
    UNAVAILABLE,
    UNRESOLVED_ALIAS,
    DISABLED;

    public boolean contributed() {
        return this == OK;
    }
}
