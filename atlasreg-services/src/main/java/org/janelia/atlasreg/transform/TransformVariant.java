package org.janelia.atlasreg.transform;

public enum TransformVariant {
    /** defined on the reduced grids the registration ran on */
    WORKING,
    /** defined on the original image grids */
    FULL
}
