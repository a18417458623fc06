package org.janelia.atlasreg.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.janelia.atlasreg.geometry.Affine3D;
import org.janelia.atlasreg.image.GridTransforms;
import org.janelia.atlasreg.registration.PassResult;
import org.janelia.atlasreg.registration.TransformResult;
import org.slf4j.Logger;

/**
 * Chains the step results of a registration into end to end transforms.
 *
 * Each step is used on its full resolution grids: the fixed full grid is scaled down to the working grid, the passes
 * are applied and the moving working grid is scaled up to the full grid. Consecutive affine legs are folded into a
 * single matrix so that purely affine chains compose exactly.
 */
public class TransformComposer {

    private final Logger logger;

    public TransformComposer(Logger logger) {
        this.logger = logger;
    }

    /**
     * Compose the transform that resamples images of the first moving level (the sample) into the space of the last
     * fixed level. Always possible since only the estimated sampling transforms are needed.
     *
     * @param results step results in source to atlas order
     */
    public ComposedTransform composeForward(List<TransformResult> results, TransformVariant variant) {
        checkContinuity(results);
        TransformResult first = results.get(0);
        TransformResult last = results.get(results.size() - 1);
        List<TransformLeg> legs = new ArrayList<>();
        if (variant == TransformVariant.WORKING) {
            addScale(legs, GridTransforms.coarseToFine(last.getFixedScale()), last.getFixedScale(), "step " + last.getStepIndex() + " fixed working to full");
        }
        for (TransformResult result : Lists.reverse(results)) {
            addScale(legs, GridTransforms.fineToCoarse(result.getFixedScale()), result.getFixedScale(),
                    "step " + result.getStepIndex() + " fixed full to working");
            for (PassResult pass : result.getPasses()) {
                legs.add(TransformLeg.pass(pass.getParameters().getFixedToMoving(), result.getStepIndex(),
                        pass.getTemplate().getName(), pass.getParameters().getParametersRef(), false));
            }
            addScale(legs, GridTransforms.coarseToFine(result.getMovingScale()), result.getMovingScale(),
                    "step " + result.getStepIndex() + " moving working to full");
        }
        if (variant == TransformVariant.WORKING) {
            addScale(legs, GridTransforms.fineToCoarse(first.getMovingScale()), first.getMovingScale(), "step 0 moving full to working");
        }
        ComposedTransform composed = new ComposedTransform(TransformDirection.FORWARD, variant,
                variant == TransformVariant.WORKING ? first.getMovingWorkingGrid() : first.getMovingFullGrid(),
                variant == TransformVariant.WORKING ? last.getFixedWorkingGrid() : last.getFixedFullGrid(),
                fold(legs));
        logger.debug("Composed {}", composed);
        return composed;
    }

    /**
     * Compose the transform that resamples images of the last fixed level into the space of the first moving level.
     *
     * @param results step results in source to atlas order
     * @throws NoInverseAvailableException if any pass of the chain cannot be inverted
     */
    public ComposedTransform composeInverse(List<TransformResult> results, TransformVariant variant) {
        checkContinuity(results);
        for (TransformResult result : results) {
            Optional<PassResult> nonInvertible = result.findNonInvertiblePass();
            if (nonInvertible.isPresent()) {
                throw new NoInverseAvailableException(result.getStepIndex(), nonInvertible.get().getTemplate().getName());
            }
        }
        TransformResult first = results.get(0);
        TransformResult last = results.get(results.size() - 1);
        List<TransformLeg> legs = new ArrayList<>();
        if (variant == TransformVariant.WORKING) {
            addScale(legs, GridTransforms.coarseToFine(first.getMovingScale()), first.getMovingScale(), "step 0 moving working to full");
        }
        for (TransformResult result : results) {
            addScale(legs, GridTransforms.fineToCoarse(result.getMovingScale()), result.getMovingScale(),
                    "step " + result.getStepIndex() + " moving full to working");
            for (PassResult pass : Lists.reverse(result.getPasses())) {
                legs.add(TransformLeg.pass(pass.getParameters().getMovingToFixed().get(), result.getStepIndex(),
                        pass.getTemplate().getName(), pass.getParameters().getInverseParametersRef(), true));
            }
            addScale(legs, GridTransforms.coarseToFine(result.getFixedScale()), result.getFixedScale(),
                    "step " + result.getStepIndex() + " fixed working to full");
        }
        if (variant == TransformVariant.WORKING) {
            addScale(legs, GridTransforms.fineToCoarse(last.getFixedScale()), last.getFixedScale(),
                    "step " + last.getStepIndex() + " fixed full to working");
        }
        ComposedTransform composed = new ComposedTransform(TransformDirection.INVERSE, variant,
                variant == TransformVariant.WORKING ? last.getFixedWorkingGrid() : last.getFixedFullGrid(),
                variant == TransformVariant.WORKING ? first.getMovingWorkingGrid() : first.getMovingFullGrid(),
                fold(legs));
        logger.debug("Composed {}", composed);
        return composed;
    }

    private void addScale(List<TransformLeg> legs, Affine3D scaling, double[] scale, String description) {
        if (!GridTransforms.isIdentity(scale)) {
            legs.add(TransformLeg.affine(scaling, description));
        }
    }

    private void checkContinuity(List<TransformResult> results) {
        Preconditions.checkArgument(!results.isEmpty(), "Nothing to compose");
        for (int i = 1; i < results.size(); i++) {
            TransformResult previous = results.get(i - 1);
            TransformResult current = results.get(i);
            Preconditions.checkArgument(current.getStep().getMoving().getId().equals(previous.getStep().getFixed().getId()),
                    "Step %s does not continue from step %s", current.getStepIndex(), previous.getStepIndex());
        }
    }

    /**
     * Merge every run of consecutive affine legs into one leg. The result is never empty: an empty chain becomes the
     * identity.
     */
    static List<TransformLeg> fold(List<TransformLeg> legs) {
        List<TransformLeg> folded = new ArrayList<>();
        Affine3D pendingAffine = null;
        List<String> pendingDescriptions = new ArrayList<>();
        for (TransformLeg leg : legs) {
            if (leg.isAffine()) {
                if (pendingAffine == null) {
                    pendingAffine = leg.getAffine();
                } else {
                    pendingAffine.preConcatenate(leg.getAffine());
                }
                pendingDescriptions.add(leg.getDescription());
            } else {
                if (pendingAffine != null) {
                    folded.add(TransformLeg.affine(pendingAffine, String.join(", ", pendingDescriptions)));
                    pendingAffine = null;
                    pendingDescriptions.clear();
                }
                folded.add(leg);
            }
        }
        if (pendingAffine != null) {
            folded.add(TransformLeg.affine(pendingAffine, String.join(", ", pendingDescriptions)));
        }
        if (folded.isEmpty()) {
            folded.add(TransformLeg.affine(new Affine3D(), "identity"));
        }
        return folded;
    }
}
