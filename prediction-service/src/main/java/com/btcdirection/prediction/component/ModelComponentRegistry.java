package com.btcdirection.prediction.component;

import com.btcdirection.common.ensemble.ModelComponent;
import com.btcdirection.common.model.InputShape;
import com.btcdirection.prediction.client.ModelServingClient;
import com.btcdirection.prediction.config.EnsembleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the configured {@link ModelComponent}s once, at startup.
 *
 * <p>A missing or unreadable manifest does not stop the service: the component is
 * registered as unavailable and the ensemble renormalizes over the others.
 * Configuration errors (duplicate id, negative weight, bad shape) fail fast.
 */
@Component
public class ModelComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelComponentRegistry.class);

    private final List<ModelComponent> components;

    public ModelComponentRegistry(EnsembleProperties properties,
                                  ModelManifestLoader manifestLoader,
                                  ModelServingClient servingClient,
                                  @Value("${ensemble.predict-timeout-ms:5000}") long predictTimeoutMs) {
        Duration timeout = Duration.ofMillis(predictTimeoutMs);
        List<ModelComponent> built = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (EnsembleProperties.Component cfg : properties.getComponents()) {
            if (cfg.getId() == null || cfg.getId().isBlank()) {
                throw new IllegalArgumentException("ensemble component without id");
            }
            if (!ids.add(cfg.getId())) {
                throw new IllegalArgumentException("duplicate ensemble component id " + cfg.getId());
            }
            if (!(cfg.getWeight() >= 0.0) || Double.isInfinite(cfg.getWeight())) {
                throw new IllegalArgumentException(
                    "component " + cfg.getId() + " has invalid weight " + cfg.getWeight());
            }
            InputShape shape = shape(cfg.getShape(), properties.getWindowSize());
            built.add(build(cfg, shape, manifestLoader, servingClient, timeout));
        }
        this.components = List.copyOf(built);

        log.info("Ensemble components registered. total={} available={} threshold={}",
                 components.size(),
                 components.stream().filter(ModelComponent::isAvailable).count(),
                 properties.getThreshold());
    }

    public List<ModelComponent> components() {
        return components;
    }

    /** Longest history any component consumes. */
    public int maxWindow() {
        return components.stream().mapToInt(c -> c.shape().windowSize()).max().orElse(1);
    }

    static InputShape shape(String configured, int defaultWindow) {
        if (configured != null && configured.trim().equals("window")) {
            return InputShape.window(defaultWindow);
        }
        return InputShape.parse(configured);
    }

    private static ModelComponent build(EnsembleProperties.Component cfg, InputShape shape,
                                        ModelManifestLoader loader, ModelServingClient client,
                                        Duration timeout) {
        ModelManifest manifest;
        try {
            manifest = loader.load(cfg.getManifest());
        } catch (IOException e) {
            log.warn("Model manifest unavailable. component={} location={} reason={}",
                     cfg.getId(), cfg.getManifest(), e.getMessage());
            return RemoteModelComponent.unavailable(cfg.getId(), cfg.getWeight(), shape,
                "manifest unavailable: " + e.getMessage());
        }

        String problem = validate(manifest);
        if (problem != null) {
            log.warn("Model manifest rejected. component={} location={} reason={}",
                     cfg.getId(), cfg.getManifest(), problem);
            return RemoteModelComponent.unavailable(cfg.getId(), cfg.getWeight(), shape, problem);
        }

        log.info("Model component loaded. component={} version={} shape={} weight={} inputs={}",
                 cfg.getId(), manifest.version(), shape, cfg.getWeight(), manifest.featureNames().size());
        return RemoteModelComponent.available(cfg.getId(), cfg.getWeight(), shape, manifest,
                                              cfg.getPath(), client, timeout);
    }

    static String validate(ModelManifest manifest) {
        if (manifest.featureNames().isEmpty()) {
            return "manifest lists no feature names";
        }
        ModelManifest.Scaler scaler = manifest.scaler();
        if (scaler != null) {
            int n = manifest.featureNames().size();
            if (scaler.mean() == null || scaler.scale() == null
                    || scaler.mean().length != n || scaler.scale().length != n) {
                return "scaler width does not match " + n + " feature names";
            }
        }
        return null;
    }
}
