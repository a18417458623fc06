package org.janelia.atlasreg.registration;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.atlasreg.engine.TransformParameters;
import org.janelia.atlasreg.image.GridTransforms;
import org.janelia.atlasreg.image.ImageGrid;

/**
 * Result of one registration step at working resolution, together with the grids needed to use it at full
 * resolution. Never changes after creation.
 */
public class TransformResult {

    private final RegistrationStep step;
    private final List<PassResult> passes;
    private final ImageGrid fixedWorkingGrid;
    private final ImageGrid movingWorkingGrid;
    private final ImageGrid fixedFullGrid;
    private final ImageGrid movingFullGrid;
    private final TransformParameters cumulative;

    public TransformResult(RegistrationStep step, List<PassResult> passes,
                           ImageGrid fixedWorkingGrid, ImageGrid movingWorkingGrid,
                           ImageGrid fixedFullGrid, ImageGrid movingFullGrid) {
        Preconditions.checkArgument(!passes.isEmpty(), "Step %s has no passes", step.getIndex());
        this.step = step;
        this.passes = ImmutableList.copyOf(passes);
        this.fixedWorkingGrid = fixedWorkingGrid;
        this.movingWorkingGrid = movingWorkingGrid;
        this.fixedFullGrid = fixedFullGrid;
        this.movingFullGrid = movingFullGrid;
        this.cumulative = TransformParameters.concatenate(passes.stream().map(PassResult::getParameters).collect(Collectors.toList()));
    }

    public RegistrationStep getStep() {
        return step;
    }

    public int getStepIndex() {
        return step.getIndex();
    }

    public List<PassResult> getPasses() {
        return passes;
    }

    /**
     * @return all passes chained, fixed working voxel to moving working voxel
     */
    public TransformParameters getWorkingParameters() {
        return cumulative;
    }

    public ImageGrid getFixedWorkingGrid() {
        return fixedWorkingGrid;
    }

    public ImageGrid getMovingWorkingGrid() {
        return movingWorkingGrid;
    }

    public ImageGrid getFixedFullGrid() {
        return fixedFullGrid;
    }

    public ImageGrid getMovingFullGrid() {
        return movingFullGrid;
    }

    public double[] getFixedScale() {
        return GridTransforms.scaleFactors(fixedFullGrid, fixedWorkingGrid);
    }

    public double[] getMovingScale() {
        return GridTransforms.scaleFactors(movingFullGrid, movingWorkingGrid);
    }

    /**
     * @return the first pass that cannot be inverted, if any
     */
    public Optional<PassResult> findNonInvertiblePass() {
        return passes.stream().filter(p -> !p.isInvertible()).findFirst();
    }

    public List<String> getTrace() {
        return cumulative.getLog();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("step", step)
                .append("passes", passes.size())
                .append("fixedWorkingGrid", fixedWorkingGrid)
                .append("movingWorkingGrid", movingWorkingGrid)
                .toString();
    }
}
