package com.btcdirection.prediction.component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Descriptor shipped next to each model artifact.
 *
 * <pre>
 * {
 *   "modelId": "lr",
 *   "version": "2025-06-30",
 *   "featureNames": ["BTC_Nasdaq_beta_10d", ...],
 *   "aliasVersion": "v1-2025-06",
 *   "aliases": {"BTC_Nasdaq_beta_10d": "btc_nasdaq_beta_10d"},
 *   "scaler": {"mean": [...], "scale": [...]}
 * }
 * </pre>
 *
 * {@code featureNames} is the trained input order; {@code scaler} is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelManifest(
    @JsonProperty("modelId") String modelId,
    @JsonProperty("version") String version,
    @JsonProperty("featureNames") List<String> featureNames,
    @JsonProperty("aliasVersion") String aliasVersion,
    @JsonProperty("aliases") Map<String, String> aliases,
    @JsonProperty("scaler") Scaler scaler
) {
    public record Scaler(@JsonProperty("mean") double[] mean,
                         @JsonProperty("scale") double[] scale) {}

    public ModelManifest {
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        aliases      = aliases == null ? Map.of() : Map.copyOf(aliases);
    }
}
