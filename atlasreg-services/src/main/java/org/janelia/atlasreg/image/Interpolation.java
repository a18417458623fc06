package org.janelia.atlasreg.image;

import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.janelia.atlasreg.model.ImageKind;

public enum Interpolation {
    LINEAR,
    NEAREST_NEIGHBOR;

    /**
     * Label images must never be blended so they are always sampled with nearest neighbor.
     */
    public static Interpolation forKind(ImageKind kind) {
        return kind == ImageKind.LABEL ? NEAREST_NEIGHBOR : LINEAR;
    }

    public <T extends RealType<T>> InterpolatorFactory<T, RandomAccessible<T>> newInterpolatorFactory() {
        if (this == NEAREST_NEIGHBOR) {
            return new NearestNeighborInterpolatorFactory<>();
        } else {
            return new NLinearInterpolatorFactory<>();
        }
    }

    /**
     * Extend the image beyond its bounds. Nearest neighbor sampling repeats the border voxels so that only labels
     * present in the image can appear; linear sampling fades to 0.
     */
    public <T extends RealType<T>> RandomAccessible<T> extend(RandomAccessibleInterval<T> data) {
        if (this == NEAREST_NEIGHBOR) {
            return Views.extendBorder(data);
        } else {
            return Views.extendZero(data);
        }
    }
}
