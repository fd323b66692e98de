package com.btcdirection.common.ensemble;

import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.common.model.InputShape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds component inputs from oldest-first feature history.
 */
public final class FeatureWindows {

    private FeatureWindows() {}

    /**
     * The rows a component of {@code shape} consumes, oldest first.
     *
     * <p>A window longer than the available history is left-padded by repeating
     * the earliest row. Never right-pads, never reaches past the latest row.
     */
    public static List<FeatureRow> select(List<FeatureRow> history, InputShape shape) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("feature history is empty");
        }
        int size = shape.windowSize();
        int available = history.size();
        if (available >= size) {
            return List.copyOf(history.subList(available - size, available));
        }
        List<FeatureRow> window = new ArrayList<>(size);
        FeatureRow earliest = history.get(0);
        for (int i = 0; i < size - available; i++) window.add(earliest);
        window.addAll(history);
        return List.copyOf(window);
    }

    /**
     * Stacks rows into a matrix using the given contract names as columns.
     */
    public static double[][] stack(List<FeatureRow> rows, Collection<String> columns,
                                   ScalingTransform scaling) {
        double[][] matrix = new double[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            FeatureRow row = rows.get(r);
            double[] values = new double[columns.size()];
            int c = 0;
            for (String column : columns) {
                Double v = row.feature(column);
                if (v == null) {
                    throw new IllegalArgumentException("row " + row.date() + " has no value for " + column);
                }
                values[c++] = v;
            }
            matrix[r] = scaling != null ? scaling.transform(values) : values;
        }
        return matrix;
    }
}
