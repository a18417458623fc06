package org.janelia.atlasreg.registration;

import java.util.Arrays;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.atlasreg.engine.RegistrationEngine;
import org.janelia.atlasreg.engine.TransformParameters;
import org.janelia.atlasreg.image.GridTransforms;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.ImageStore;
import org.janelia.atlasreg.image.Interpolation;
import org.janelia.atlasreg.image.VolumeImage;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;
import org.slf4j.Logger;

/**
 * Provides the images a step is registered with. The finer side of a step is reduced to the working resolution,
 * the other side is used as is.
 */
public class ResolutionManager {

    private static final double[] FULL_RESOLUTION = {1, 1, 1};

    private final ImageStore imageStore;
    private final RegistrationEngine engine;
    private final WorkingImageCache cache;
    private final double tolerance;
    private final Logger logger;

    public ResolutionManager(ImageStore imageStore, RegistrationEngine engine, WorkingImageCache cache,
                             double tolerance, Logger logger) {
        this.imageStore = imageStore;
        this.engine = engine;
        this.cache = cache;
        this.tolerance = tolerance;
        this.logger = logger;
    }

    public WorkingImages prepare(RegistrationStep step) {
        DownsamplingPlan plan = plan(step);
        logger.info("Working resolution of step {}: {}", step.getIndex(), plan);
        VolumeImage<?> fixed = workingImage(step.getFixed(), plan.getFixedFactors());
        VolumeImage<?> moving = workingImage(step.getMoving(), plan.getMovingFactors());
        return new WorkingImages(fixed, moving, ImageGrid.of(step.getFixed()), ImageGrid.of(step.getMoving()));
    }

    /**
     * Decide which side of the step is reduced and by how much.
     *
     * @throws UnsupportedDownsampleException if the sides are finer on different axes or if an explicit factor does
     * not bring the finer side to the resolution of the other one
     */
    public DownsamplingPlan plan(RegistrationStep step) {
        DownsamplingFactor downsampling = step.getDownsampling();
        if (downsampling.isIdentity()) {
            return DownsamplingPlan.none();
        }
        double[] fixedResolution = step.getFixed().getResolution();
        double[] movingResolution = step.getMoving().getResolution();
        double[] ratio = new double[3];
        boolean movingFiner = true;
        boolean fixedFiner = true;
        for (int d = 0; d < 3; d++) {
            ratio[d] = fixedResolution[d] / movingResolution[d];
            movingFiner &= ratio[d] >= 1 - tolerance;
            fixedFiner &= ratio[d] <= 1 + tolerance;
        }
        double[] required;
        String reducedSpecId;
        if (movingFiner) {
            required = ratio;
            reducedSpecId = step.getMoving().getId();
        } else if (fixedFiner) {
            required = Arrays.stream(ratio).map(r -> 1 / r).toArray();
            reducedSpecId = step.getFixed().getId();
        } else {
            throw new UnsupportedDownsampleException(step.getIndex(), step.getMoving().getId(), downsampling.toString(), ratio,
                    "each side is finer along a different axis");
        }
        double[] factors;
        if (downsampling.isAuto()) {
            factors = required;
        } else {
            factors = downsampling.getFactors();
            for (int d = 0; d < 3; d++) {
                if (Math.abs(factors[d] - required[d]) > tolerance * required[d]) {
                    throw new UnsupportedDownsampleException(step.getIndex(), reducedSpecId, downsampling.toString(), required,
                            "the factor does not match the resolution ratio of the step");
                }
            }
        }
        if (isFullResolution(factors)) {
            return DownsamplingPlan.none();
        }
        return movingFiner ? DownsamplingPlan.reduceMoving(factors) : DownsamplingPlan.reduceFixed(factors);
    }

    private boolean isFullResolution(double[] factors) {
        return Arrays.stream(factors).allMatch(f -> Math.abs(f - 1) <= tolerance);
    }

    private VolumeImage<?> workingImage(AtlasSpec spec, double[] factors) {
        VolumeImage<?> fullImage = cache.get(spec.getId(), FULL_RESOLUTION, () -> readTemplate(spec));
        if (isFullResolution(factors)) {
            return fullImage;
        }
        return cache.get(spec.getId(), factors, () -> reduce(spec, fullImage, factors));
    }

    private VolumeImage<?> readTemplate(AtlasSpec spec) {
        logger.info("Read template of {} from {}", spec.getId(), spec.getTemplatePath());
        VolumeImage<?> image = imageStore.read(spec.getTemplatePath());
        long[] expected = spec.getDimensions();
        if (!Arrays.equals(expected, image.getDimensions())) {
            throw new InvalidSpecException(spec.getId(), "template " + spec.getTemplatePath() + " has size "
                    + Arrays.toString(image.getDimensions()) + " instead of " + Arrays.toString(expected));
        }
        return image.withResolution(spec.getResolution());
    }

    private VolumeImage<?> reduce(AtlasSpec spec, VolumeImage<?> fullImage, double[] factors) {
        ImageGrid fullGrid = ImageGrid.of(spec);
        long[] workingDims = new long[3];
        double[] workingResolution = new double[3];
        for (int d = 0; d < 3; d++) {
            workingDims[d] = Math.max(1, Math.round(fullGrid.dimension(d) / factors[d]));
            workingResolution[d] = fullGrid.extent(d) / workingDims[d];
        }
        ImageGrid workingGrid = new ImageGrid(workingDims, workingResolution);
        logger.info("Downsample {} from {} to {}", spec.getId(), fullGrid, workingGrid);
        return downsample(fullImage, fullGrid, workingGrid);
    }

    private <T extends RealType<T> & NativeType<T>> VolumeImage<T> downsample(VolumeImage<T> fullImage, ImageGrid fullGrid, ImageGrid workingGrid) {
        TransformParameters scaling = new TransformParameters(
                GridTransforms.coarseToFine(GridTransforms.scaleFactors(fullGrid, workingGrid)),
                GridTransforms.fineToCoarse(GridTransforms.scaleFactors(fullGrid, workingGrid)),
                workingGrid,
                fullGrid);
        return engine.resample(fullImage, scaling, Interpolation.LINEAR);
    }
}
