package org.janelia.atlasreg.registration;

import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;

/**
 * Raised when no registration step can be derived for a sample, e.g. the target atlas has no template.
 */
public class EmptyChainException extends AtlasRegistrationException {

    private final String sampleId;

    public EmptyChainException(String sampleId, String message) {
        super("No registration chain for " + sampleId + ": " + message);
        this.sampleId = sampleId;
    }

    public String getSampleId() {
        return sampleId;
    }
}
