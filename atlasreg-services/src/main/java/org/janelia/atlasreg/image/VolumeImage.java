package org.janelia.atlasreg.image;

import com.google.common.base.Preconditions;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;

/**
 * A 3D image together with its voxel size.
 *
 * @param <T> voxel type
 */
public class VolumeImage<T extends RealType<T> & NativeType<T>> {

    private final RandomAccessibleInterval<T> data;
    private final double[] resolution;

    public VolumeImage(RandomAccessibleInterval<T> data, double[] resolution) {
        Preconditions.checkArgument(data.numDimensions() == 3, "Only 3D images are supported");
        Preconditions.checkArgument(resolution != null && resolution.length == 3, "The image resolution must have 3 components");
        this.data = data;
        this.resolution = resolution.clone();
    }

    public static <T extends RealType<T> & NativeType<T>> VolumeImage<T> create(T type, ImageGrid grid) {
        Img<T> img = new ArrayImgFactory<>(type).create(grid.getDimensions());
        return new VolumeImage<>(img, grid.getResolution());
    }

    public RandomAccessibleInterval<T> getData() {
        return data;
    }

    public double[] getResolution() {
        return resolution.clone();
    }

    public long[] getDimensions() {
        return Intervals.dimensionsAsLongArray(data);
    }

    public ImageGrid getGrid() {
        return new ImageGrid(getDimensions(), resolution);
    }

    public T getType() {
        return Util.getTypeFromInterval(data).createVariable();
    }

    /**
     * @return the same voxels with another voxel size
     */
    public VolumeImage<T> withResolution(double[] newResolution) {
        return new VolumeImage<>(data, newResolution);
    }

    @Override
    public String toString() {
        return "VolumeImage(" + getGrid() + ")";
    }
}
