package org.janelia.atlasreg.registration;

import java.util.Arrays;

import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;

/**
 * Raised when the working resolution of a step cannot be reached with the requested downsampling factor.
 */
public class UnsupportedDownsampleException extends AtlasRegistrationException {

    private final int stepIndex;
    private final String specId;
    private final String requested;
    private final double[] required;

    public UnsupportedDownsampleException(int stepIndex, String specId, String requested, double[] required, String reason) {
        super("Step " + stepIndex + " cannot downsample " + specId + " by " + requested
                + (required == null ? "" : " (resolution ratio " + Arrays.toString(required) + ")")
                + ": " + reason);
        this.stepIndex = stepIndex;
        this.specId = specId;
        this.requested = requested;
        this.required = required == null ? null : required.clone();
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getSpecId() {
        return specId;
    }

    public String getRequested() {
        return requested;
    }

    public double[] getRequired() {
        return required == null ? null : required.clone();
    }
}
