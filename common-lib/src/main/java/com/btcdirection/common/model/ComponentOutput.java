package com.btcdirection.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit record of a single component invocation.
 *
 * <p>{@code probabilityUp} and {@code vote} are {@code null} unless
 * {@code status == OK}. {@code detail} carries the failure reason otherwise.
 */
public record ComponentOutput(
    @JsonProperty("componentId") String componentId,
    @JsonProperty("weight") double weight,
    @JsonProperty("shape") String shape,
    @JsonProperty("status") ComponentStatus status,
    @JsonProperty("probabilityUp") Double probabilityUp,
    @JsonProperty("vote") Integer vote,
    @JsonProperty("detail") String detail
) {
    public static ComponentOutput ok(String id, double weight, String shape,
                                     double probabilityUp, int vote) {
        return new ComponentOutput(id, weight, shape, ComponentStatus.OK, probabilityUp, vote, null);
    }

    public static ComponentOutput skipped(String id, double weight, String shape,
                                          ComponentStatus status, String detail) {
        return new ComponentOutput(id, weight, shape, status, null, null, detail);
    }
}
