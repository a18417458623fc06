package org.janelia.atlasreg.geometry;

public interface InvertibleSpatialTransform extends SpatialTransform {

    /**
     * @param source receives the point in the source space
     * @param target point in the target space
     */
    void applyInverse(double[] source, double[] target);

    InvertibleSpatialTransform inverse();

    @Override
    InvertibleSpatialTransform copy();
}
