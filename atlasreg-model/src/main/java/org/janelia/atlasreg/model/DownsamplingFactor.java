package org.janelia.atlasreg.model;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * How the finer image of a registration step is reduced before the engine sees it.
 * Either no reduction, a factor derived from the resolutions of both sides, or an explicit per axis factor.
 */
public class DownsamplingFactor {

    public enum Mode {
        NONE,
        AUTO,
        EXPLICIT
    }

    public static final DownsamplingFactor NONE = new DownsamplingFactor(Mode.NONE, null);
    public static final DownsamplingFactor AUTO = new DownsamplingFactor(Mode.AUTO, null);

    private final Mode mode;
    private final double[] factors;

    private DownsamplingFactor(Mode mode, double[] factors) {
        this.mode = mode;
        this.factors = factors;
    }

    public static DownsamplingFactor uniform(double factor) {
        return explicit(factor, factor, factor);
    }

    public static DownsamplingFactor explicit(double fx, double fy, double fz) {
        return new DownsamplingFactor(Mode.EXPLICIT, new double[] {fx, fy, fz});
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isAuto() {
        return mode == Mode.AUTO;
    }

    /**
     * @return true when no reduction is needed, i.e. NONE or an explicit factor of 1 on every axis
     */
    public boolean isIdentity() {
        if (mode == Mode.NONE) {
            return true;
        } else if (mode == Mode.EXPLICIT) {
            return Arrays.stream(factors).allMatch(f -> f == 1.);
        } else {
            return false;
        }
    }

    public double[] getFactors() {
        Preconditions.checkState(mode == Mode.EXPLICIT, "Only explicit downsampling has factors");
        return factors.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DownsamplingFactor that = (DownsamplingFactor) o;
        return mode == that.mode && Arrays.equals(factors, that.factors);
    }

    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + Arrays.hashCode(factors);
    }

    @Override
    public String toString() {
        return mode == Mode.EXPLICIT ? Arrays.toString(factors) : mode.name().toLowerCase();
    }
}
