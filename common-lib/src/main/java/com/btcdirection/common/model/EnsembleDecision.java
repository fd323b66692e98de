package com.btcdirection.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of one prediction cycle.
 *
 * <ul>
 *   <li>{@code targetDate}   : the day being predicted (feature date + 1)</li>
 *   <li>{@code direction}    : 1 = up, 0 = down</li>
 *   <li>{@code confidence}   : probability of the winning class</li>
 *   <li>{@code probabilityUp}: weighted, renormalized probability of "up"</li>
 *   <li>{@code components}   : every configured component, including the ones that did not vote</li>
 * </ul>
 */
public record EnsembleDecision(
    @JsonProperty("targetDate") LocalDate targetDate,
    @JsonProperty("featureDate") LocalDate featureDate,
    @JsonProperty("direction") int direction,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("probabilityUp") double probabilityUp,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("confidenceLevel") ConfidenceLevel confidenceLevel,
    @JsonProperty("contractVersion") String contractVersion,
    @JsonProperty("components") List<ComponentOutput> components
) {
    public EnsembleDecision {
        components = components == null ? List.of() : List.copyOf(components);
    }
}
