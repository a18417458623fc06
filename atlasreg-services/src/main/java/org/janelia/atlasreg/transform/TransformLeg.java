package org.janelia.atlasreg.transform;

import org.janelia.atlasreg.geometry.Affine3D;
import org.janelia.atlasreg.geometry.SpatialTransform;

/**
 * One transform of a composed chain: either a grid scaling, a folded group of affine transforms or a transform
 * estimated by the engine.
 */
public class TransformLeg {

    private final SpatialTransform transform;
    private final String description;
    private final Integer stepIndex;
    private final String passName;
    private final String parametersRef;
    private final boolean inverse;

    private TransformLeg(SpatialTransform transform, String description, Integer stepIndex, String passName,
                         String parametersRef, boolean inverse) {
        this.transform = transform;
        this.description = description;
        this.stepIndex = stepIndex;
        this.passName = passName;
        this.parametersRef = parametersRef;
        this.inverse = inverse;
    }

    public static TransformLeg affine(Affine3D transform, String description) {
        return new TransformLeg(transform, description, null, null, null, false);
    }

    public static TransformLeg pass(SpatialTransform transform, int stepIndex, String passName, String parametersRef, boolean inverse) {
        String description = "step " + stepIndex + " " + passName + (inverse ? " inverse" : "");
        return new TransformLeg(transform, description, stepIndex, passName, parametersRef, inverse);
    }

    public SpatialTransform getTransform() {
        return transform.copy();
    }

    public boolean isAffine() {
        return transform instanceof Affine3D;
    }

    /**
     * @return the leg as a 3D affine; only valid for affine legs
     */
    public Affine3D getAffine() {
        return ((Affine3D) transform).copy();
    }

    public String getDescription() {
        return description;
    }

    public Integer getStepIndex() {
        return stepIndex;
    }

    public String getPassName() {
        return passName;
    }

    public String getParametersRef() {
        return parametersRef;
    }

    public boolean isInverse() {
        return inverse;
    }

    @Override
    public String toString() {
        return description;
    }
}
