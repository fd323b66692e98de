package com.btcdirection.common.ensemble;

import java.util.Arrays;

/**
 * {@code (x - mean) / scale} per position. A zero scale is treated as 1.0 so
 * constant training columns pass through centred.
 */
public final class StandardScalingTransform implements ScalingTransform {

    private final double[] mean;
    private final double[] scale;

    public StandardScalingTransform(double[] mean, double[] scale) {
        if (mean == null || scale == null || mean.length != scale.length) {
            throw new IllegalArgumentException("scaler mean and scale must have the same length");
        }
        this.mean  = Arrays.copyOf(mean, mean.length);
        this.scale = Arrays.copyOf(scale, scale.length);
    }

    @Override
    public double[] transform(double[] row) {
        if (row.length != mean.length) {
            throw new IllegalArgumentException(
                "scaler expects " + mean.length + " values, got " + row.length);
        }
        double[] out = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            double s = scale[i] == 0.0 ? 1.0 : scale[i];
            out[i] = (row[i] - mean[i]) / s;
        }
        return out;
    }
}
