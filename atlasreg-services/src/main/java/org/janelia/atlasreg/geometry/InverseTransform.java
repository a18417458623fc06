package org.janelia.atlasreg.geometry;

/**
 * Swaps the directions of an invertible transform.
 */
public class InverseTransform implements InvertibleSpatialTransform {

    private final InvertibleSpatialTransform transform;

    public InverseTransform(InvertibleSpatialTransform transform) {
        this.transform = transform;
    }

    @Override
    public void apply(double[] source, double[] target) {
        transform.applyInverse(target, source);
    }

    @Override
    public void applyInverse(double[] source, double[] target) {
        transform.apply(target, source);
    }

    @Override
    public InvertibleSpatialTransform inverse() {
        return transform;
    }

    @Override
    public InverseTransform copy() {
        return new InverseTransform(transform.copy());
    }
}
