package org.janelia.atlasreg.transform;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.atlasreg.engine.TransformParameters;
import org.janelia.atlasreg.geometry.SpatialTransform;
import org.janelia.atlasreg.geometry.TransformSequence;
import org.janelia.atlasreg.image.GridTransforms;
import org.janelia.atlasreg.image.ImageGrid;

/**
 * End to end transform of a registration chain for one direction and one variant.
 *
 * The sampling transform maps voxel coordinates of the output grid to voxel coordinates of the input grid; images
 * on the input grid are resampled through it onto the output grid.
 */
public class ComposedTransform {

    private final TransformDirection direction;
    private final TransformVariant variant;
    private final ImageGrid inputGrid;
    private final ImageGrid outputGrid;
    private final List<TransformLeg> legs;

    public ComposedTransform(TransformDirection direction, TransformVariant variant,
                             ImageGrid inputGrid, ImageGrid outputGrid, List<TransformLeg> legs) {
        this.direction = direction;
        this.variant = variant;
        this.inputGrid = inputGrid;
        this.outputGrid = outputGrid;
        this.legs = ImmutableList.copyOf(legs);
    }

    public TransformDirection getDirection() {
        return direction;
    }

    public TransformVariant getVariant() {
        return variant;
    }

    public ImageGrid getInputGrid() {
        return inputGrid;
    }

    public ImageGrid getOutputGrid() {
        return outputGrid;
    }

    public List<TransformLeg> getLegs() {
        return legs;
    }

    public boolean isAffine() {
        return legs.size() == 1 && legs.get(0).isAffine();
    }

    public SpatialTransform getSamplingTransform() {
        if (legs.size() == 1) {
            return legs.get(0).getTransform();
        }
        TransformSequence sequence = new TransformSequence();
        legs.forEach(leg -> sequence.add(leg.getTransform()));
        return sequence;
    }

    /**
     * The same transform for input images sampled on a different grid that covers the same physical box.
     */
    public ComposedTransform withInputGrid(ImageGrid newInputGrid) {
        List<TransformLeg> newLegs = new ArrayList<>(legs);
        newLegs.add(TransformLeg.affine(GridTransforms.between(inputGrid, newInputGrid), "input grid " + newInputGrid));
        return new ComposedTransform(direction, variant, newInputGrid, outputGrid, TransformComposer.fold(newLegs));
    }

    public TransformParameters toTransformParameters() {
        return new TransformParameters(getSamplingTransform(), null, outputGrid, inputGrid);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("direction", direction)
                .append("variant", variant)
                .append("inputGrid", inputGrid)
                .append("outputGrid", outputGrid)
                .append("legs", legs)
                .toString();
    }
}
