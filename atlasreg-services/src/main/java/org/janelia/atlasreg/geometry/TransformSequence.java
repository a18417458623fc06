package org.janelia.atlasreg.geometry;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Applies transforms one after the other: the first one added sees the source point.
 */
public class TransformSequence implements SpatialTransform {

    private final List<SpatialTransform> transforms = new ArrayList<>();
    private final double[] scratch = new double[DIMENSIONS];

    public TransformSequence add(SpatialTransform transform) {
        Preconditions.checkArgument(transform != null, "Cannot add a null transform to a sequence");
        transforms.add(transform);
        return this;
    }

    public int size() {
        return transforms.size();
    }

    @Override
    public void apply(double[] source, double[] target) {
        System.arraycopy(source, 0, target, 0, DIMENSIONS);
        for (SpatialTransform transform : transforms) {
            System.arraycopy(target, 0, scratch, 0, DIMENSIONS);
            transform.apply(scratch, target);
        }
    }

    @Override
    public TransformSequence copy() {
        TransformSequence sequence = new TransformSequence();
        transforms.forEach(t -> sequence.add(t.copy()));
        return sequence;
    }
}
