package org.janelia.atlasreg.image;

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.janelia.atlasreg.model.AtlasSpec;

/**
 * Voxel lattice of a 3D image: number of voxels and voxel size per axis.
 */
public class ImageGrid {

    private final long[] dimensions;
    private final double[] resolution;

    public ImageGrid(long[] dimensions, double[] resolution) {
        Preconditions.checkArgument(dimensions.length == 3 && resolution.length == 3, "Only 3D grids are supported");
        this.dimensions = dimensions.clone();
        this.resolution = resolution.clone();
    }

    public static ImageGrid of(AtlasSpec spec) {
        return new ImageGrid(spec.getDimensions(), spec.getResolution());
    }

    public long[] getDimensions() {
        return dimensions.clone();
    }

    public long dimension(int d) {
        return dimensions[d];
    }

    public double[] getResolution() {
        return resolution.clone();
    }

    public double resolution(int d) {
        return resolution[d];
    }

    public double extent(int d) {
        return dimensions[d] * resolution[d];
    }

    /**
     * @return true if both grids cover the same physical box within the given relative tolerance
     */
    public boolean hasSameExtent(ImageGrid other, double tolerance) {
        for (int d = 0; d < 3; d++) {
            if (!closeTo(extent(d), other.extent(d), tolerance)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if both grids have the same dimensions and, within the given relative tolerance, the same voxel size
     */
    public boolean hasSameSampling(ImageGrid other, double tolerance) {
        for (int d = 0; d < 3; d++) {
            if (dimensions[d] != other.dimensions[d] || !closeTo(resolution[d], other.resolution[d], tolerance)) {
                return false;
            }
        }
        return true;
    }

    private static boolean closeTo(double a, double b, double tolerance) {
        return Math.abs(a - b) <= tolerance * Math.max(Math.abs(a), Math.abs(b));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImageGrid that = (ImageGrid) o;
        return Arrays.equals(dimensions, that.dimensions) && Arrays.equals(resolution, that.resolution);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dimensions) + Arrays.hashCode(resolution);
    }

    @Override
    public String toString() {
        return Arrays.toString(dimensions) + "@" + Arrays.toString(resolution) + "um";
    }
}
