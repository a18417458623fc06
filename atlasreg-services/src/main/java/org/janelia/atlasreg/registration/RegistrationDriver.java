package org.janelia.atlasreg.registration;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.atlasreg.engine.RegistrationEngine;
import org.janelia.atlasreg.engine.RegistrationEngineException;
import org.janelia.atlasreg.engine.TransformParameters;
import org.janelia.atlasreg.model.TransformTemplate;
import org.slf4j.Logger;

/**
 * Runs the engine passes of a step one after the other. A pass starts from everything the previous passes found.
 * Failures are never retried here.
 */
public class RegistrationDriver {

    private final RegistrationEngine engine;
    private final Logger logger;

    public RegistrationDriver(RegistrationEngine engine, Logger logger) {
        this.engine = engine;
        this.logger = logger;
    }

    public TransformResult run(RegistrationStep step, WorkingImages workingImages) {
        List<PassResult> passes = new ArrayList<>();
        List<TransformTemplate> templates = step.getTransformTemplates();
        for (int passIndex = 0; passIndex < templates.size(); passIndex++) {
            TransformTemplate template = templates.get(passIndex);
            TransformParameters initial = passes.isEmpty()
                    ? null
                    : TransformParameters.concatenate(passes.stream().map(PassResult::getParameters).collect(Collectors.toList()));
            logger.info("Step {} pass {}/{}: register {} to {} with {}",
                    step.getIndex(), passIndex + 1, templates.size(), step.getMoving().getId(), step.getFixed().getId(), template);
            TransformParameters parameters;
            try {
                parameters = engine.register(workingImages.getFixed(), workingImages.getMoving(), template, initial);
            } catch (RegistrationEngineException e) {
                logger.warn("Step {} pass {} failed: {}", step.getIndex(), template.getName(), e.getMessage());
                throw new RegistrationFailedException(step, template.getName(), e.getMessage(), e);
            } catch (RuntimeException e) {
                logger.warn("Step {} pass {} failed unexpectedly: {}", step.getIndex(), template.getName(), e.toString());
                throw new RegistrationFailedException(step, template.getName(), String.valueOf(e.getMessage()), e);
            }
            if (parameters == null) {
                throw new RegistrationFailedException(step, template.getName(), "the engine returned no transform", null);
            }
            parameters.getLog().forEach(line -> logger.debug("Step {} pass {}: {}", step.getIndex(), template.getName(), line));
            passes.add(new PassResult(template, parameters));
        }
        return new TransformResult(step, passes,
                workingImages.getFixedWorkingGrid(), workingImages.getMovingWorkingGrid(),
                workingImages.getFixedFullGrid(), workingImages.getMovingFullGrid());
    }
}
