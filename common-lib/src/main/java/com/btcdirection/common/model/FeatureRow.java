package com.btcdirection.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit of persistence and of model input: one date, the contract features in
 * contract order, and (for historical rows only) the next-day target.
 *
 * <p>{@code target} is {@code null} when the next day's close is not yet known;
 * such a row may feed a live prediction but never training.
 */
public record FeatureRow(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("contractVersion") String contractVersion,
    @JsonProperty("features") Map<String, Double> features,
    @JsonProperty("target") Integer target
) {
    public FeatureRow {
        features = features == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public Double feature(String name) {
        return features.get(name);
    }

    @JsonIgnore
    public boolean hasTarget() {
        return target != null;
    }
}
