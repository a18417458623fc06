package org.janelia.atlasreg.transform;

public enum TransformDirection {
    /** resamples sample images into atlas space */
    FORWARD,
    /** resamples atlas images into sample space */
    INVERSE
}
