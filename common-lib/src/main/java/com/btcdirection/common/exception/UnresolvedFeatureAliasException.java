package com.btcdirection.common.exception;

import java.util.List;

/**
 * One or more model input names could not be mapped onto the feature contract.
 * Fatal for the owning component only.
 */
public class UnresolvedFeatureAliasException extends PipelineException {
    private final String componentId;
    private final List<String> missingNames;

    public UnresolvedFeatureAliasException(String componentId, List<String> missingNames) {
        super("ensemble", "component " + componentId + " cannot resolve model inputs " + missingNames);
        this.componentId = componentId;
        this.missingNames = List.copyOf(missingNames);
    }

    public String getComponentId() {
        return componentId;
    }

    public List<String> getMissingNames() {
        return missingNames;
    }
}
