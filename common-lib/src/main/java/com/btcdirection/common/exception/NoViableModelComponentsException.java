package com.btcdirection.common.exception;

import com.btcdirection.common.model.ComponentOutput;

import java.util.List;

/**
 * Every configured component failed, was unavailable or carried zero weight.
 * The prediction cycle fails; no default direction is emitted.
 */
public class NoViableModelComponentsException extends PipelineException {
    private final List<ComponentOutput> outputs;

    public NoViableModelComponentsException(List<ComponentOutput> outputs) {
        super("ensemble", "no component produced a usable probability (" + outputs.size() + " configured)");
        this.outputs = List.copyOf(outputs);
    }

    public List<ComponentOutput> getOutputs() {
        return outputs;
    }
}
