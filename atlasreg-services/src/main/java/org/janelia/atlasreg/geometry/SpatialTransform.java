package org.janelia.atlasreg.geometry;

/**
 * Maps 3D points from a source space to a target space.
 * Implementations may keep scratch state, so a transform used from several threads must be copied first.
 */
public interface SpatialTransform {

    int DIMENSIONS = 3;

    /**
     * @param source point in the source space
     * @param target receives the point in the target space
     */
    void apply(double[] source, double[] target);

    SpatialTransform copy();
}
