package org.janelia.atlasreg.pipeline;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.atlasreg.transform.TransformDirection;

/**
 * A failure that stopped part of a run: a registration step, or one direction of one level.
 */
public class RunFailure {
    private final int stepIndex;
    private final String levelId;
    private final TransformDirection direction;
    private final Throwable cause;

    public RunFailure(int stepIndex, String levelId, TransformDirection direction, Throwable cause) {
        this.stepIndex = stepIndex;
        this.levelId = levelId;
        this.direction = direction;
        this.cause = cause;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getLevelId() {
        return levelId;
    }

    /**
     * @return the direction that failed or null if the registration step itself failed
     */
    public TransformDirection getDirection() {
        return direction;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("stepIndex", stepIndex)
                .append("levelId", levelId)
                .append("direction", direction)
                .append("cause", cause.getMessage())
                .toString();
    }
}
