package org.janelia.atlasreg.engine;

/**
 * Reported by a registration engine that could not estimate a transform, e.g. because the optimizer diverged.
 */
public class RegistrationEngineException extends Exception {

    public RegistrationEngineException(String message) {
        super(message);
    }

    public RegistrationEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
