package org.janelia.atlasreg.image;

import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.atlasreg.geometry.Affine3D;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ImageResamplerTest {

    private static final ImageGrid GRID = new ImageGrid(new long[] {10, 8, 6}, new double[] {2, 2, 2});

    @Test
    public void identityKeepsEveryVoxel() {
        VolumeImage<FloatType> image = TestImages.gradient(GRID);
        VolumeImage<FloatType> resampled = ImageResampler.resample(image, new Affine3D(), GRID, Interpolation.LINEAR);

        assertArrayEquals(GRID.getDimensions(), resampled.getDimensions());
        assertEquals(TestImages.valueAt(image, 3, 4, 5), TestImages.valueAt(resampled, 3, 4, 5), 1e-6);
    }

    @Test
    public void linearInterpolationOfShiftedGradient() {
        VolumeImage<FloatType> image = TestImages.gradient(GRID);
        Affine3D shift = new Affine3D();
        shift.translate(0.5, 0, 0);
        VolumeImage<FloatType> resampled = ImageResampler.resample(image, shift, GRID, Interpolation.LINEAR);

        // x + 2y + 3z at (2.5, 1, 1)
        assertEquals(7.5, TestImages.valueAt(resampled, 2, 1, 1), 1e-5);
    }

    @Test
    public void voxelsOutsideTheInputAreZero() {
        VolumeImage<FloatType> image = TestImages.gradient(GRID);
        Affine3D shift = new Affine3D();
        shift.translate(100, 0, 0);
        VolumeImage<FloatType> resampled = ImageResampler.resample(image, shift, GRID, Interpolation.LINEAR);

        assertEquals(0, TestImages.valueAt(resampled, 5, 5, 5), 0);
    }

    @Test
    public void nearestNeighborNeverCreatesNewLabels() {
        VolumeImage<UnsignedShortType> labels = TestImages.labels(GRID, 3);
        Affine3D scaling = new Affine3D();
        scaling.scale(0.37);
        ImageGrid outputGrid = new ImageGrid(new long[] {20, 16, 12}, new double[] {1, 1, 1});
        VolumeImage<UnsignedShortType> resampled = ImageResampler.resample(labels, scaling, outputGrid, Interpolation.NEAREST_NEIGHBOR);

        assertThat(TestImages.distinctValues(resampled), contains(10, 20, 30));
        assertArrayEquals(new double[] {1, 1, 1}, resampled.getResolution(), 0);
    }
}
