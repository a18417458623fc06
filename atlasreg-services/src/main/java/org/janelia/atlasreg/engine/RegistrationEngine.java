package org.janelia.atlasreg.engine;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.atlasreg.image.Interpolation;
import org.janelia.atlasreg.image.VolumeImage;
import org.janelia.atlasreg.model.TransformTemplate;

/**
 * The external registration engine. These two operations are all the orchestration depends on.
 */
public interface RegistrationEngine {

    /**
     * Estimate the transform that aligns the moving image with the fixed image.
     *
     * @param fixed image that defines the output space
     * @param moving image to be aligned
     * @param template configuration of this pass
     * @param initial transform found by the previous passes or null for the first pass; the returned transform is
     *                applied after it
     * @return the transform estimated by this pass
     * @throws RegistrationEngineException if the engine did not converge or failed
     */
    TransformParameters register(VolumeImage<?> fixed,
                                 VolumeImage<?> moving,
                                 TransformTemplate template,
                                 TransformParameters initial) throws RegistrationEngineException;

    /**
     * Resample an image given on the moving grid of the parameters onto their fixed grid.
     */
    <T extends RealType<T> & NativeType<T>> VolumeImage<T> resample(VolumeImage<T> image,
                                                                     TransformParameters parameters,
                                                                     Interpolation interpolation);
}
