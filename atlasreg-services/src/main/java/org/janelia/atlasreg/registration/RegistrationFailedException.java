package org.janelia.atlasreg.registration;

import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;

/**
 * A registration pass did not produce a transform. Results of earlier steps are still valid.
 */
public class RegistrationFailedException extends AtlasRegistrationException {

    private final int stepIndex;
    private final String fixedId;
    private final String movingId;
    private final String templateName;

    public RegistrationFailedException(RegistrationStep step, String templateName, String message, Throwable cause) {
        super("Step " + step.getIndex() + " (" + step.getMoving().getId() + " -> " + step.getFixed().getId() + ") failed in pass "
                + templateName + ": " + message, cause);
        this.stepIndex = step.getIndex();
        this.fixedId = step.getFixed().getId();
        this.movingId = step.getMoving().getId();
        this.templateName = templateName;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getFixedId() {
        return fixedId;
    }

    public String getMovingId() {
        return movingId;
    }

    public String getTemplateName() {
        return templateName;
    }
}
