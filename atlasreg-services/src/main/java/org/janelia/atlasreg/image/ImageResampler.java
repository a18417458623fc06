package org.janelia.atlasreg.image;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessible;
import net.imglib2.RealRandomAccess;
import net.imglib2.RealRandomAccessible;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.janelia.atlasreg.geometry.SpatialTransform;

/**
 * Pulls every voxel of an output grid from an input image through a sampling transform.
 * Voxels that map outside of the input image take the value the interpolation extends the image with.
 */
public class ImageResampler {

    /**
     * @param image input image
     * @param sampling transform from output voxel coordinates to input voxel coordinates
     * @param outputGrid grid of the result
     * @param interpolation how values between input voxels are computed
     */
    public static <T extends RealType<T> & NativeType<T>> VolumeImage<T> resample(VolumeImage<T> image,
                                                                                   SpatialTransform sampling,
                                                                                   ImageGrid outputGrid,
                                                                                   Interpolation interpolation) {
        T type = image.getType();
        Img<T> output = new ArrayImgFactory<>(type).create(outputGrid.getDimensions());
        RandomAccessible<T> extended = interpolation.extend(image.getData());
        RealRandomAccessible<T> interpolated = Views.interpolate(extended, interpolation.<T>newInterpolatorFactory());
        RealRandomAccess<T> inputAccess = interpolated.realRandomAccess();
        SpatialTransform transform = sampling.copy();
        double[] outputPosition = new double[3];
        double[] inputPosition = new double[3];
        Cursor<T> outputCursor = output.localizingCursor();
        while (outputCursor.hasNext()) {
            outputCursor.fwd();
            outputCursor.localize(outputPosition);
            transform.apply(outputPosition, inputPosition);
            inputAccess.setPosition(inputPosition);
            outputCursor.get().set(inputAccess.get());
        }
        return new VolumeImage<>(output, outputGrid.getResolution());
    }
}
