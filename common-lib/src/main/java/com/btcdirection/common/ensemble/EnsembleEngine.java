package com.btcdirection.common.ensemble;

import com.btcdirection.common.model.EnsembleDecision;
import com.btcdirection.common.model.FeatureRow;

import java.util.List;

/**
 * Strategy contract for turning the latest feature history and a set of model
 * components into one binary decision.
 *
 * <p>Implementations must be stateless and must never fall back to a default
 * direction: when no component yields a usable probability they throw
 * {@link com.btcdirection.common.exception.NoViableModelComponentsException}.
 */
public interface EnsembleEngine {

    /**
     * @param history    complete feature rows, oldest first, the last one being the latest
     * @param components configured components in configuration order
     */
    EnsembleDecision decide(List<FeatureRow> history, List<ModelComponent> components);
}
