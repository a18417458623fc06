package org.janelia.atlasreg.registration;

import org.janelia.atlasreg.image.GridTransforms;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.VolumeImage;

/**
 * The images a step is registered with, plus the per axis ratio between their full and working voxel counts.
 */
public class WorkingImages {

    private final VolumeImage<?> fixed;
    private final VolumeImage<?> moving;
    private final ImageGrid fixedFullGrid;
    private final ImageGrid movingFullGrid;

    public WorkingImages(VolumeImage<?> fixed, VolumeImage<?> moving, ImageGrid fixedFullGrid, ImageGrid movingFullGrid) {
        this.fixed = fixed;
        this.moving = moving;
        this.fixedFullGrid = fixedFullGrid;
        this.movingFullGrid = movingFullGrid;
    }

    public VolumeImage<?> getFixed() {
        return fixed;
    }

    public VolumeImage<?> getMoving() {
        return moving;
    }

    public ImageGrid getFixedFullGrid() {
        return fixedFullGrid;
    }

    public ImageGrid getMovingFullGrid() {
        return movingFullGrid;
    }

    public ImageGrid getFixedWorkingGrid() {
        return fixed.getGrid();
    }

    public ImageGrid getMovingWorkingGrid() {
        return moving.getGrid();
    }

    public double[] getFixedScale() {
        return GridTransforms.scaleFactors(fixedFullGrid, getFixedWorkingGrid());
    }

    public double[] getMovingScale() {
        return GridTransforms.scaleFactors(movingFullGrid, getMovingWorkingGrid());
    }
}
