package org.janelia.atlasreg.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.atlasreg.geometry.Affine3D;
import org.janelia.atlasreg.geometry.SpatialTransform;
import org.janelia.atlasreg.geometry.TransformSequence;
import org.janelia.atlasreg.image.ImageGrid;

/**
 * Transform produced by a registration engine.
 *
 * The sampling transform maps voxel coordinates of the fixed grid to voxel coordinates of the moving grid, which is
 * what is needed to resample a moving image into the fixed space. The inverse, when the engine could compute one,
 * maps moving voxel coordinates to fixed voxel coordinates.
 */
public class TransformParameters {

    private final SpatialTransform fixedToMoving;
    private final SpatialTransform movingToFixed;
    private final ImageGrid fixedGrid;
    private final ImageGrid movingGrid;
    private final String parametersRef;
    private final String inverseParametersRef;
    private final List<String> log;

    public TransformParameters(SpatialTransform fixedToMoving, SpatialTransform movingToFixed,
                               ImageGrid fixedGrid, ImageGrid movingGrid) {
        this(fixedToMoving, movingToFixed, fixedGrid, movingGrid, null, null, ImmutableList.of());
    }

    public TransformParameters(SpatialTransform fixedToMoving, SpatialTransform movingToFixed,
                               ImageGrid fixedGrid, ImageGrid movingGrid,
                               String parametersRef, String inverseParametersRef,
                               List<String> log) {
        Preconditions.checkArgument(fixedToMoving != null, "A sampling transform is required");
        this.fixedToMoving = fixedToMoving;
        this.movingToFixed = movingToFixed;
        this.fixedGrid = fixedGrid;
        this.movingGrid = movingGrid;
        this.parametersRef = parametersRef;
        this.inverseParametersRef = inverseParametersRef;
        this.log = log == null ? ImmutableList.of() : ImmutableList.copyOf(log);
    }

    /**
     * Chain parameters estimated one on top of the other. Each one starts from the result of the previous one,
     * so a fixed point goes through the first transform, then through the second and so on.
     */
    public static TransformParameters concatenate(List<TransformParameters> parameters) {
        Preconditions.checkArgument(!parameters.isEmpty(), "Nothing to concatenate");
        if (parameters.size() == 1) {
            return parameters.get(0);
        }
        TransformSequence fixedToMoving = new TransformSequence();
        parameters.forEach(p -> fixedToMoving.add(p.getFixedToMoving()));
        TransformSequence movingToFixed = null;
        if (parameters.stream().allMatch(TransformParameters::hasInverse)) {
            movingToFixed = new TransformSequence();
            for (TransformParameters p : Lists.reverse(parameters)) {
                movingToFixed.add(p.getMovingToFixed().get());
            }
        }
        List<String> log = new ArrayList<>();
        parameters.forEach(p -> log.addAll(p.getLog()));
        return new TransformParameters(fixedToMoving, movingToFixed,
                parameters.get(0).getFixedGrid(),
                parameters.get(parameters.size() - 1).getMovingGrid(),
                null, null, log);
    }

    /**
     * @return a copy of the sampling transform; each caller gets its own copy since transforms are not thread safe
     */
    public SpatialTransform getFixedToMoving() {
        return fixedToMoving.copy();
    }

    public Optional<SpatialTransform> getMovingToFixed() {
        return movingToFixed == null ? Optional.empty() : Optional.of(movingToFixed.copy());
    }

    public boolean hasInverse() {
        return movingToFixed != null;
    }

    public boolean isAffine() {
        return fixedToMoving instanceof Affine3D;
    }

    public ImageGrid getFixedGrid() {
        return fixedGrid;
    }

    public ImageGrid getMovingGrid() {
        return movingGrid;
    }

    public String getParametersRef() {
        return parametersRef;
    }

    public String getInverseParametersRef() {
        return inverseParametersRef;
    }

    public List<String> getLog() {
        return log;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("fixedGrid", fixedGrid)
                .append("movingGrid", movingGrid)
                .append("affine", isAffine())
                .append("inverse", hasInverse())
                .append("parametersRef", parametersRef)
                .toString();
    }
}
