package org.janelia.atlasreg.model;

/**
 * Semantics of the voxel values of an image.
 */
public enum ImageKind {
    /** continuous values, may be interpolated */
    INTENSITY,
    /** discrete labels, must never be blended */
    LABEL
}
