package com.btcdirection.common.ensemble;

/**
 * Fixed, externally fitted per-feature transform applied to each input row
 * before a component sees it.
 */
@FunctionalInterface
public interface ScalingTransform {

    double[] transform(double[] row);
}
