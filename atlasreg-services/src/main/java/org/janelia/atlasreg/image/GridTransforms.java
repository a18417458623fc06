package org.janelia.atlasreg.image;

import org.janelia.atlasreg.geometry.Affine3D;

/**
 * Affine maps between voxel coordinates of grids that cover the same physical box.
 * Voxel centers are aligned: voxel i of a grid with voxel size r covers [i * r, (i + 1) * r).
 */
public class GridTransforms {

    /**
     * Map voxel coordinates of a coarse grid to voxel coordinates of a fine grid, where scale[d] is the number of
     * fine voxels per coarse voxel: fine = scale * coarse + (scale - 1) / 2.
     */
    public static Affine3D coarseToFine(double[] scale) {
        return Affine3D.fromRowPacked(
                scale[0], 0, 0, (scale[0] - 1) / 2,
                0, scale[1], 0, (scale[1] - 1) / 2,
                0, 0, scale[2], (scale[2] - 1) / 2);
    }

    public static Affine3D fineToCoarse(double[] scale) {
        return coarseToFine(scale).inverse();
    }

    /**
     * Map voxel coordinates of the "from" grid to voxel coordinates of the "to" grid, both covering the same box.
     */
    public static Affine3D between(ImageGrid from, ImageGrid to) {
        double[] scale = new double[3];
        for (int d = 0; d < 3; d++) {
            scale[d] = from.resolution(d) / to.resolution(d);
        }
        return coarseToFine(scale);
    }

    /**
     * Per axis ratio between the number of voxels of the full and the reduced grid.
     */
    public static double[] scaleFactors(ImageGrid full, ImageGrid reduced) {
        double[] scale = new double[3];
        for (int d = 0; d < 3; d++) {
            scale[d] = (double) full.dimension(d) / reduced.dimension(d);
        }
        return scale;
    }

    public static boolean isIdentity(double[] scale) {
        for (double s : scale) {
            if (s != 1.) {
                return false;
            }
        }
        return true;
    }
}
