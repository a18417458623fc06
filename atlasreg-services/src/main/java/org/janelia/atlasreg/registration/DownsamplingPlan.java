package org.janelia.atlasreg.registration;

import java.util.Arrays;

/**
 * Per axis reduction factors of both sides of a step. At most one side is reduced.
 */
public class DownsamplingPlan {

    private static final double[] NO_REDUCTION = {1, 1, 1};

    private final double[] fixedFactors;
    private final double[] movingFactors;

    private DownsamplingPlan(double[] fixedFactors, double[] movingFactors) {
        this.fixedFactors = fixedFactors;
        this.movingFactors = movingFactors;
    }

    static DownsamplingPlan none() {
        return new DownsamplingPlan(NO_REDUCTION.clone(), NO_REDUCTION.clone());
    }

    static DownsamplingPlan reduceFixed(double[] factors) {
        return new DownsamplingPlan(factors.clone(), NO_REDUCTION.clone());
    }

    static DownsamplingPlan reduceMoving(double[] factors) {
        return new DownsamplingPlan(NO_REDUCTION.clone(), factors.clone());
    }

    public double[] getFixedFactors() {
        return fixedFactors.clone();
    }

    public double[] getMovingFactors() {
        return movingFactors.clone();
    }

    @Override
    public String toString() {
        return "fixed " + Arrays.toString(fixedFactors) + ", moving " + Arrays.toString(movingFactors);
    }
}
