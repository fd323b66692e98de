package com.btcdirection.common.ensemble;

import com.btcdirection.common.exception.MissingUpstreamDataException;
import com.btcdirection.common.exception.NoViableModelComponentsException;
import com.btcdirection.common.exception.UnresolvedFeatureAliasException;
import com.btcdirection.common.feature.FeatureContract;
import com.btcdirection.common.model.ComponentOutput;
import com.btcdirection.common.model.ComponentStatus;
import com.btcdirection.common.model.ConfidenceLevel;
import com.btcdirection.common.model.EnsembleDecision;
import com.btcdirection.common.model.FeatureRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default {@link EnsembleEngine}: weighted mean of per-component {@code probability_up}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Skip components with zero weight ({@code DISABLED}) or no artifact ({@code UNAVAILABLE}).</li>
 *   <li>Resolve each component's inputs through its alias table ({@code UNRESOLVED_ALIAS} on failure).</li>
 *   <li>Select the latest row or the left-padded window, apply the component's scaler, predict.
 *       A thrown error or a probability outside [0, 1] marks the component {@code FAILED}.</li>
 *   <li>{@code p = Σ(wᵢ·pᵢ) / Σwᵢ} over components with status {@code OK} only.</li>
 *   <li>{@code direction = p >= threshold ? 1 : 0};
 *       {@code confidence = direction == 1 ? p : 1 - p}.</li>
 * </ol>
 *
 * <p>Stateless; the threshold is an opaque calibration parameter.
 */
public class WeightedProbabilityEnsemble implements EnsembleEngine {

    private final FeatureContract contract;
    private final double threshold;

    public WeightedProbabilityEnsemble(FeatureContract contract, double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got " + threshold);
        }
        this.contract  = contract;
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public EnsembleDecision decide(List<FeatureRow> history, List<ModelComponent> components) {
        if (history == null || history.isEmpty()) {
            throw new MissingUpstreamDataException("ensemble", "no feature rows available for prediction");
        }
        FeatureRow latest = history.get(history.size() - 1);

        List<ComponentOutput> outputs = new ArrayList<>(components.size());
        double weightedSum = 0.0;
        double totalWeight = 0.0;

        for (ModelComponent component : components) {
            ComponentOutput output = invoke(component, history);
            outputs.add(output);
            if (output.status().contributed()) {
                weightedSum += component.weight() * output.probabilityUp();
                totalWeight += component.weight();
            }
        }

        if (totalWeight <= 0.0) {
            throw new NoViableModelComponentsException(outputs);
        }

        double probabilityUp = weightedSum / totalWeight;
        int direction = vote(probabilityUp);
        double confidence = direction == 1 ? probabilityUp : 1.0 - probabilityUp;

        return new EnsembleDecision(
            latest.date().plusDays(1),
            latest.date(),
            direction,
            confidence,
            probabilityUp,
            threshold,
            ConfidenceLevel.fromProbability(probabilityUp),
            contract.version(),
            outputs);
    }

    ComponentOutput invoke(ModelComponent component, List<FeatureRow> history) {
        String id    = component.id();
        double w     = component.weight();
        String shape = component.shape().toString();

        if (w <= 0.0) {
            return ComponentOutput.skipped(id, w, shape, ComponentStatus.DISABLED, "zero weight");
        }
        if (!component.isAvailable()) {
            return ComponentOutput.skipped(id, w, shape, ComponentStatus.UNAVAILABLE,
                component.unavailableReason());
        }

        Map<String, String> resolved;
        try {
            resolved = component.aliasTable().resolve(id, component.requiredInputs(), contract);
        } catch (UnresolvedFeatureAliasException e) {
            return ComponentOutput.skipped(id, w, shape, ComponentStatus.UNRESOLVED_ALIAS, e.getMessage());
        }

        try {
            List<FeatureRow> rows = FeatureWindows.select(history, component.shape());
            double[][] input = FeatureWindows.stack(rows, resolved.values(),
                component.scaling().orElse(null));
            double p = component.predict(input);
            if (!(p >= 0.0 && p <= 1.0)) {
                return ComponentOutput.skipped(id, w, shape, ComponentStatus.FAILED,
                    "probability out of range: " + p);
            }
            return ComponentOutput.ok(id, w, shape, p, vote(p));
        } catch (RuntimeException e) {
            return ComponentOutput.skipped(id, w, shape, ComponentStatus.FAILED,
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private int vote(double probabilityUp) {
        return probabilityUp >= threshold ? 1 : 0;
    }
}
