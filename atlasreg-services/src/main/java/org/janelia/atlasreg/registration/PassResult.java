package org.janelia.atlasreg.registration;

import org.janelia.atlasreg.engine.TransformParameters;
import org.janelia.atlasreg.model.TransformTemplate;

/**
 * Transform estimated by one engine pass.
 */
public class PassResult {
    private final TransformTemplate template;
    private final TransformParameters parameters;

    public PassResult(TransformTemplate template, TransformParameters parameters) {
        this.template = template;
        this.parameters = parameters;
    }

    public TransformTemplate getTemplate() {
        return template;
    }

    public TransformParameters getParameters() {
        return parameters;
    }

    /**
     * A pass can be inverted only if its template allows it and the engine returned an inverse.
     */
    public boolean isInvertible() {
        return template.isInvertible() && parameters.hasInverse();
    }
}
