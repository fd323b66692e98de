package com.btcdirection.common.ensemble;

import com.btcdirection.common.model.InputShape;

import java.util.List;
import java.util.Optional;

/**
 * One independently trained predictor taking part in the ensemble.
 *
 * <p>Implementations are black boxes to the engine: it dispatches on
 * {@link #shape()} and never inspects the concrete model type.
 */
public interface ModelComponent {

    String id();

    /** Fixed, non-negative configuration weight. */
    double weight();

    InputShape shape();

    /** Input names as the model was trained, in the order {@link #predict} expects. */
    List<String> requiredInputs();

    FeatureAliasTable aliasTable();

    Optional<ScalingTransform> scaling();

    /** {@code false} when the artifact could not be loaded. */
    boolean isAvailable();

    default String unavailableReason() {
        return null;
    }

    /**
     * @param input one row per time step, oldest first; a single row for {@code single_row}
     * @return probability that tomorrow's close is higher, in [0, 1]
     */
    double predict(double[][] input);
}
