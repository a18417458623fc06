package org.janelia.atlasreg.apply;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.atlasreg.engine.RegistrationEngine;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.ImageStore;
import org.janelia.atlasreg.image.Interpolation;
import org.janelia.atlasreg.image.VolumeImage;
import org.janelia.atlasreg.model.ImageKind;
import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;
import org.janelia.atlasreg.transform.ComposedTransform;
import org.slf4j.Logger;

/**
 * Resamples images through a composed transform. Intensity images are interpolated linearly, label images with
 * nearest neighbor so that no new label values appear.
 */
public class ImageApplier {

    private final RegistrationEngine engine;
    private final ImageStore imageStore;
    private final ExecutorService executorService;
    private final double gridTolerance;
    private final Logger logger;

    public ImageApplier(RegistrationEngine engine, ImageStore imageStore, ExecutorService executorService,
                        double gridTolerance, Logger logger) {
        this.engine = engine;
        this.imageStore = imageStore;
        this.executorService = executorService;
        this.gridTolerance = gridTolerance;
        this.logger = logger;
    }

    /**
     * Resample one image. An image sampled differently from the input grid of the transform is accepted as long as
     * it covers the same physical box.
     *
     * @throws GridMismatchException if the image covers a different box
     */
    public <T extends RealType<T> & NativeType<T>> VolumeImage<T> apply(ComposedTransform composed, VolumeImage<T> image, ImageKind kind) {
        return apply(composed, image, kind, null);
    }

    private <T extends RealType<T> & NativeType<T>> VolumeImage<T> apply(ComposedTransform composed, VolumeImage<T> image,
                                                                         ImageKind kind, Path imagePath) {
        ImageGrid expected = composed.getInputGrid();
        ImageGrid actual = image.getGrid();
        ComposedTransform transform = composed;
        if (!actual.hasSameSampling(expected, gridTolerance)) {
            if (!actual.hasSameExtent(expected, gridTolerance)) {
                throw new GridMismatchException(imagePath, expected, actual);
            }
            logger.info("Image {} is sampled on {} instead of {}", imagePath, actual, expected);
            transform = composed.withInputGrid(actual);
        }
        return engine.resample(image, transform.toTransformParameters(), Interpolation.forKind(kind));
    }

    /**
     * Read, resample and write every image on the executor. A failing image does not stop the others.
     *
     * @return one result per task, in task order
     */
    public List<ImageTaskResult> applyAll(ComposedTransform composed, List<ImageTask> tasks) {
        List<Future<ImageTaskResult>> futures = new ArrayList<>();
        for (ImageTask task : tasks) {
            futures.add(executorService.submit(() -> applyTask(composed, task)));
        }
        List<ImageTaskResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            ImageTask task = tasks.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AtlasRegistrationException("Interrupted while resampling " + task.getInput(), e);
            } catch (ExecutionException e) {
                logger.error("Error resampling {}", task.getInput(), e.getCause());
                results.add(ImageTaskResult.failure(task, e.getCause()));
            }
        }
        return results;
    }

    private VolumeImage<?> withOwnerResolution(VolumeImage<?> image, ImageTask task) {
        ImageGrid ownerGrid = task.getOwnerGrid();
        if (ownerGrid == null
                || !Arrays.equals(ownerGrid.getDimensions(), image.getDimensions())
                || image.getGrid().hasSameSampling(ownerGrid, gridTolerance)) {
            return image;
        }
        logger.info("Image {} declares voxel size {}; using {} of the image owner",
                task.getInput(), Arrays.toString(image.getResolution()), Arrays.toString(ownerGrid.getResolution()));
        return image.withResolution(ownerGrid.getResolution());
    }

    private ImageTaskResult applyTask(ComposedTransform composed, ImageTask task) {
        try {
            logger.info("Resample {} image {} to {}", task.getKind(), task.getInput(), task.getOutput());
            VolumeImage<?> image = withOwnerResolution(imageStore.read(task.getInput()), task);
            VolumeImage<?> resampled = apply(composed, image, task.getKind(), task.getInput());
            imageStore.write(resampled, task.getOutput());
            return ImageTaskResult.success(task);
        } catch (RuntimeException e) {
            logger.error("Error resampling {}", task.getInput(), e);
            return ImageTaskResult.failure(task, e);
        }
    }
}
