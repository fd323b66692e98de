package com.btcdirection.prediction.component;

import com.btcdirection.common.ensemble.FeatureAliasTable;
import com.btcdirection.common.ensemble.ModelComponent;
import com.btcdirection.common.ensemble.ScalingTransform;
import com.btcdirection.common.ensemble.StandardScalingTransform;
import com.btcdirection.common.model.InputShape;
import com.btcdirection.prediction.client.ModelServingClient;
import com.btcdirection.prediction.dto.PredictRequest;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link ModelComponent} whose artifact is served by the model-serving sidecar.
 *
 * <p>{@link #predict} blocks on the HTTP call and must run on a thread that may
 * block. A component built without a manifest reports itself unavailable and is
 * never invoked.
 */
public class RemoteModelComponent implements ModelComponent {

    private final String id;
    private final double weight;
    private final InputShape shape;
    private final ModelManifest manifest;
    private final String unavailableReason;
    private final String path;
    private final ModelServingClient client;
    private final Duration timeout;
    private final FeatureAliasTable aliasTable;
    private final ScalingTransform scaling;

    private RemoteModelComponent(String id, double weight, InputShape shape, ModelManifest manifest,
                                 String unavailableReason, String path, ModelServingClient client,
                                 Duration timeout) {
        this.id                = id;
        this.weight            = weight;
        this.shape             = shape;
        this.manifest          = manifest;
        this.unavailableReason = unavailableReason;
        this.path              = path;
        this.client            = client;
        this.timeout           = timeout;
        this.aliasTable        = manifest == null
            ? FeatureAliasTable.identity()
            : new FeatureAliasTable(manifest.aliasVersion(), manifest.aliases());
        this.scaling           = manifest == null || manifest.scaler() == null
            ? null
            : new StandardScalingTransform(manifest.scaler().mean(), manifest.scaler().scale());
    }

    public static RemoteModelComponent available(String id, double weight, InputShape shape,
                                                 ModelManifest manifest, String path,
                                                 ModelServingClient client, Duration timeout) {
        return new RemoteModelComponent(id, weight, shape, manifest, null, path, client, timeout);
    }

    public static RemoteModelComponent unavailable(String id, double weight, InputShape shape, String reason) {
        return new RemoteModelComponent(id, weight, shape, null, reason, null, null, null);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public double weight() {
        return weight;
    }

    @Override
    public InputShape shape() {
        return shape;
    }

    @Override
    public List<String> requiredInputs() {
        return manifest == null ? List.of() : manifest.featureNames();
    }

    @Override
    public FeatureAliasTable aliasTable() {
        return aliasTable;
    }

    @Override
    public Optional<ScalingTransform> scaling() {
        return Optional.ofNullable(scaling);
    }

    @Override
    public boolean isAvailable() {
        return manifest != null;
    }

    @Override
    public String unavailableReason() {
        return unavailableReason;
    }

    public String version() {
        return manifest == null ? null : manifest.version();
    }

    @Override
    public double predict(double[][] input) {
        if (!isAvailable()) {
            throw new IllegalStateException("component " + id + " is unavailable: " + unavailableReason);
        }
        Double p = client.predict(path, new PredictRequest(id, manifest.version(), input)).block(timeout);
        if (p == null) {
            throw new IllegalStateException("component " + id + " returned no probability");
        }
        return p;
    }
}
