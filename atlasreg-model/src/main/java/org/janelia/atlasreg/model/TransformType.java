package org.janelia.atlasreg.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Transform models an engine pass may estimate, with the kind of inverse each one supports.
 */
public enum TransformType {
    TRANSLATION("translation", InverseSupport.EXACT, true),
    RIGID("rigid", InverseSupport.EXACT, true),
    SIMILARITY("similarity", InverseSupport.EXACT, true),
    AFFINE("affine", InverseSupport.EXACT, true),
    BSPLINE("bspline", InverseSupport.APPROXIMATE, false),
    SPLINE_KERNEL("spline-kernel", InverseSupport.NONE, false);

    public enum InverseSupport {
        EXACT,
        APPROXIMATE,
        NONE
    }

    private final String label;
    private final InverseSupport inverseSupport;
    private final boolean linear;

    TransformType(String label, InverseSupport inverseSupport, boolean linear) {
        this.label = label;
        this.inverseSupport = inverseSupport;
        this.linear = linear;
    }

    public String getLabel() {
        return label;
    }

    public InverseSupport getInverseSupport() {
        return inverseSupport;
    }

    public boolean isLinear() {
        return linear;
    }

    public boolean isInvertible() {
        return inverseSupport != InverseSupport.NONE;
    }

    public static TransformType fromString(String value) {
        String normalized = StringUtils.trimToEmpty(value).toLowerCase().replace('_', '-');
        for (TransformType t : values()) {
            if (t.label.equals(normalized)) {
                return t;
            }
        }
        switch (normalized) {
            case "euler":
                return RIGID;
            case "b-spline":
                return BSPLINE;
            case "splinekernel":
                return SPLINE_KERNEL;
            default:
                throw new IllegalArgumentException("Unknown transform type: " + value);
        }
    }
}
