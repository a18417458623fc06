package org.janelia.atlasreg.registration;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.collections4.CollectionUtils;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.SampleSpec;
import org.janelia.atlasreg.model.TransformTemplate;
import org.janelia.atlasreg.model.exceptions.CyclicChainException;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;
import org.slf4j.Logger;

/**
 * Turns a sample and its target hierarchy into the ordered list of pairwise registrations.
 */
public class ChainResolver {

    private static final double RESOLUTION_EPSILON = 1e-9;

    private final Logger logger;

    public ChainResolver(Logger logger) {
        this.logger = logger;
    }

    /**
     * The first step aligns the sample to the target; every further step aligns the previous fixed level to its
     * parent, until an atlas without parent is reached.
     *
     * @throws EmptyChainException if the target is undefined or has no template
     * @throws CyclicChainException if the parent links of the target loop
     * @throws InvalidSpecException if a step would register into a finer grid without permission or has no transform templates
     */
    public RegistrationChain resolve(SampleSpec sample) {
        AtlasSpec target = sample.getTarget()
                .orElseThrow(() -> new EmptyChainException(sample.getId(), "target atlas " + sample.getTargetId() + " is not defined"));
        if (target.getTemplatePath() == null) {
            throw new EmptyChainException(sample.getId(), "target atlas " + target.getId() + " has no template");
        }
        List<AtlasSpec> levels = sample.getAtlases().ancestry(target);
        List<RegistrationStep> steps = new ArrayList<>();
        List<String> violations = new ArrayList<>();
        AtlasSpec moving = sample.getSource();
        for (AtlasSpec fixed : levels) {
            int stepIndex = steps.size();
            List<TransformTemplate> templates = CollectionUtils.isEmpty(fixed.getTransformTemplates())
                    ? sample.getTransformTemplates()
                    : fixed.getTransformTemplates();
            if (CollectionUtils.isEmpty(templates)) {
                violations.add("step " + stepIndex + " (" + moving.getId() + " -> " + fixed.getId() + ") has no transform templates");
            }
            DownsamplingFactor downsampling = stepIndex == 0
                    ? sample.getDownsamplingOverride().orElse(fixed.getDownsampling())
                    : fixed.getDownsampling();
            checkResolution(stepIndex, fixed, moving, violations);
            steps.add(new RegistrationStep(stepIndex, fixed, moving, downsampling, templates));
            moving = fixed;
        }
        if (!violations.isEmpty()) {
            throw new InvalidSpecException(sample.getId(), violations);
        }
        RegistrationChain chain = new RegistrationChain(steps);
        logger.info("Resolved registration chain {} for sample {}", chain, sample.getId());
        return chain;
    }

    /**
     * Registering into a finer grid than the one being registered is only allowed if the fixed level says so.
     */
    private void checkResolution(int stepIndex, AtlasSpec fixed, AtlasSpec moving, List<String> violations) {
        if (fixed.isAllowFinerResolution()) {
            return;
        }
        double[] fixedResolution = fixed.getResolution();
        double[] movingResolution = moving.getResolution();
        for (int d = 0; d < 3; d++) {
            if (fixedResolution[d] < movingResolution[d] - RESOLUTION_EPSILON) {
                violations.add("step " + stepIndex + " registers " + moving.getId() + " into the finer grid of " + fixed.getId()
                        + " on axis " + d + " (" + movingResolution[d] + "um -> " + fixedResolution[d] + "um)");
                return;
            }
        }
    }
}
