package org.janelia.atlasreg.model;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.janelia.atlasreg.model.exceptions.CyclicChainException;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;

/**
 * Checks atlas and sample descriptions against their invariants. Validation has no side effects, so validating
 * the same spec twice gives the same answer.
 */
public class AtlasSpecValidator {

    private final AtlasHierarchy atlases;

    public AtlasSpecValidator(AtlasHierarchy atlases) {
        this.atlases = atlases;
    }

    /**
     * Validate the spec and all its ancestors.
     *
     * @return every violation found; empty if the spec is valid
     */
    public List<String> validate(AtlasSpec spec) {
        List<String> violations = new ArrayList<>(checkOwnInvariants(spec));
        if (!spec.hasParent()) {
            return violations;
        }
        if (spec.getParentId().equals(spec.getId())) {
            violations.add("atlas " + spec.getId() + " is its own parent");
            return violations;
        }
        if (!atlases.contains(spec.getParentId())) {
            violations.add("parent atlas " + spec.getParentId() + " is not defined");
            return violations;
        }
        try {
            List<AtlasSpec> lineage = atlases.ancestry(spec);
            lineage.stream().skip(1).forEach(ancestor -> checkOwnInvariants(ancestor).stream()
                    .map(v -> "ancestor " + ancestor.getId() + ": " + v)
                    .forEach(violations::add));
        } catch (CyclicChainException e) {
            violations.add("cyclic parent chain " + String.join(" -> ", e.getVisited()) + " -> " + e.getRepeated());
        } catch (InvalidSpecException e) {
            e.getViolations().forEach(v -> violations.add("ancestor " + e.getSpecId() + ": " + v));
        }
        return violations;
    }

    public void validateOrThrow(AtlasSpec spec) {
        List<String> violations = validate(spec);
        if (!violations.isEmpty()) {
            throw new InvalidSpecException(spec.getId(), violations);
        }
    }

    /**
     * Validate a sample: its own template description, its target and the target's ancestry.
     */
    public List<String> validate(SampleSpec sample) {
        List<String> violations = new ArrayList<>();
        checkOwnInvariants(sample.getSource()).stream()
                .map(v -> "source: " + v)
                .forEach(violations::add);
        String sampleId = sample.getId();
        if (StringUtils.isNotBlank(sampleId) && sample.getAtlases().contains(sampleId)) {
            // working images and step results are keyed by id
            violations.add("sample id " + sampleId + " collides with atlas " + sampleId);
        }
        sample.getChannels().stream()
                .filter(image -> image.getKind() != ImageKind.INTENSITY)
                .forEach(image -> violations.add("channel " + image.getPath() + " must be an intensity image"));
        if (StringUtils.isBlank(sample.getTargetId())) {
            violations.add("target atlas is not set");
        } else if (!sample.getAtlases().contains(sample.getTargetId())) {
            violations.add("target atlas " + sample.getTargetId() + " is not defined");
        } else {
            validate(sample.getTarget().get()).stream()
                    .map(v -> "target " + sample.getTargetId() + ": " + v)
                    .forEach(violations::add);
        }
        sample.getDownsamplingOverride().ifPresent(f -> checkDownsampling(f, violations));
        return violations;
    }

    public void validateOrThrow(SampleSpec sample) {
        List<String> violations = validate(sample);
        if (!violations.isEmpty()) {
            throw new InvalidSpecException(sample.getId(), violations);
        }
    }

    private List<String> checkOwnInvariants(AtlasSpec spec) {
        List<String> violations = new ArrayList<>();
        if (StringUtils.isBlank(spec.getId())) {
            violations.add("id is missing");
        }
        if (spec.getTemplatePath() == null) {
            violations.add("template path is missing");
        }
        double[] resolution = spec.getResolution();
        if (resolution == null || resolution.length != 3) {
            violations.add("resolution must have 3 components");
        } else {
            for (double r : resolution) {
                if (!(r > 0) || Double.isInfinite(r)) {
                    violations.add("resolution components must be positive, found " + r);
                }
            }
        }
        int[] size = spec.getSize();
        if (size == null || size.length != 3) {
            violations.add("size must have 3 components");
        } else {
            for (int s : size) {
                if (s <= 0) {
                    violations.add("size components must be positive, found " + s);
                }
            }
        }
        violations.addAll(OrientationCode.check(spec.getOrientation()));
        int nAnnotations = spec.getAnnotationPaths().size();
        int nTrees = spec.getStructureTreePaths().size();
        if (nTrees > 0 && nTrees != nAnnotations) {
            violations.add("found " + nTrees + " structure trees for " + nAnnotations + " annotations");
        }
        if (size != null && size.length == 3) {
            for (ReferencePoint p : spec.getReferencePoints()) {
                for (int d = 0; d < 3; d++) {
                    if (p.get(d) < 0 || p.get(d) >= size[d]) {
                        violations.add("reference point " + p + " is outside the template");
                        break;
                    }
                }
            }
        }
        checkDownsampling(spec.getDownsampling(), violations);
        return violations;
    }

    private void checkDownsampling(DownsamplingFactor downsampling, List<String> violations) {
        if (downsampling.getMode() != DownsamplingFactor.Mode.EXPLICIT) {
            return;
        }
        for (double f : downsampling.getFactors()) {
            if (!(f >= 1) || Double.isInfinite(f)) {
                violations.add("downsampling factor must be at least 1, found " + f);
            }
        }
    }
}
