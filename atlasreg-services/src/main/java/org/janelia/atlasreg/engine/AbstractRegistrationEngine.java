package org.janelia.atlasreg.engine;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.atlasreg.image.ImageResampler;
import org.janelia.atlasreg.image.Interpolation;
import org.janelia.atlasreg.image.VolumeImage;

/**
 * Base for engine adapters whose transforms can be evaluated in process. Resampling pulls every fixed voxel from
 * the moving image through the sampling transform.
 */
public abstract class AbstractRegistrationEngine implements RegistrationEngine {

    @Override
    public <T extends RealType<T> & NativeType<T>> VolumeImage<T> resample(VolumeImage<T> image,
                                                                            TransformParameters parameters,
                                                                            Interpolation interpolation) {
        return ImageResampler.resample(image, parameters.getFixedToMoving(), parameters.getFixedGrid(), interpolation);
    }
}
