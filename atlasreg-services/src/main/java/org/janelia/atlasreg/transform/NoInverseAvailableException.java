package org.janelia.atlasreg.transform;

import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;

/**
 * A pass of the chain cannot be inverted so no inverse transform can be composed. The forward transform of the
 * same chain is not affected.
 */
public class NoInverseAvailableException extends AtlasRegistrationException {

    private final int stepIndex;
    private final String templateName;

    public NoInverseAvailableException(int stepIndex, String templateName) {
        super("Pass " + templateName + " of step " + stepIndex + " has no inverse");
        this.stepIndex = stepIndex;
        this.templateName = templateName;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getTemplateName() {
        return templateName;
    }
}
