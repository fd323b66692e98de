package com.btcdirection.common.ensemble;

import com.btcdirection.common.exception.UnresolvedFeatureAliasException;
import com.btcdirection.common.feature.FeatureContract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned mapping from a model's trained column names to feature-contract names,
 * shipped alongside each model artifact.
 *
 * <p>Resolution is explicit: an alias entry first, otherwise an exact contract
 * name. There is no case folding or fuzzy matching.
 */
public final class FeatureAliasTable {

    private final String version;
    private final Map<String, String> aliases;

    public FeatureAliasTable(String version, Map<String, String> aliases) {
        this.version = version;
        this.aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }

    public static FeatureAliasTable identity() {
        return new FeatureAliasTable("identity", Map.of());
    }

    public String version() {
        return version;
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    /**
     * @param componentId owning component, for the error message
     * @param modelNames  the model's input names in model order
     * @return model name → contract name, in model order
     * @throws UnresolvedFeatureAliasException listing every name that cannot be mapped
     */
    public Map<String, String> resolve(String componentId, List<String> modelNames,
                                       FeatureContract contract) {
        Map<String, String> resolved = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String modelName : modelNames) {
            String target = aliases.getOrDefault(modelName, modelName);
            if (contract.contains(target)) {
                resolved.put(modelName, target);
            } else {
                missing.add(modelName);
            }
        }
        if (!missing.isEmpty()) {
            throw new UnresolvedFeatureAliasException(componentId, missing);
        }
        return resolved;
    }
}
