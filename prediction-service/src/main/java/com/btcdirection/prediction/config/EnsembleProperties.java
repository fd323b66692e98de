package com.btcdirection.prediction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Static ensemble configuration. Weights and threshold come from offline
 * calibration and are never learned here.
 */
@Data
@ConfigurationProperties(prefix = "ensemble")
public class EnsembleProperties {

    /** Decision threshold on the weighted probability of "up". */
    private double threshold = 0.5;

    /** Window length used for {@code window} components that do not state one. */
    private int windowSize = 5;

    private List<Component> components = new ArrayList<>();

    @Data
    public static class Component {
        private String id;
        private double weight;
        /** {@code single_row} or {@code window:N}; plain {@code window} uses {@link #windowSize}. */
        private String shape = "single_row";
        /** Resource location of the artifact manifest. */
        private String manifest;
        /** Predict path on the model-serving sidecar. */
        private String path;
    }
}
