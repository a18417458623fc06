package org.janelia.atlasreg.model.exceptions;

/**
 * Base class of all failures raised while describing, resolving or running an atlas registration.
 */
public class AtlasRegistrationException extends RuntimeException {

    public AtlasRegistrationException(String message) {
        super(message);
    }

    public AtlasRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }

}
