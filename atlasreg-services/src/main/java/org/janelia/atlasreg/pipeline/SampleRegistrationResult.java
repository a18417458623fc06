package org.janelia.atlasreg.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.janelia.atlasreg.apply.ImageTaskResult;
import org.janelia.atlasreg.registration.RegistrationChain;
import org.janelia.atlasreg.registration.TransformResult;
import org.janelia.atlasreg.transform.ComposedTransform;

/**
 * Everything a registration run produced for one sample, including what failed.
 */
public class SampleRegistrationResult {

    private final String sampleId;
    private final RegistrationChain chain;
    private final List<TransformResult> stepResults = new ArrayList<>();
    private final List<RunFailure> failures = new ArrayList<>();
    private final Map<String, ComposedTransform> composedTransforms = new LinkedHashMap<>();
    private final List<ImageTaskResult> imageResults = new ArrayList<>();

    SampleRegistrationResult(String sampleId, RegistrationChain chain) {
        this.sampleId = sampleId;
        this.chain = chain;
    }

    void addStepResult(TransformResult result) {
        stepResults.add(result);
    }

    void addFailure(RunFailure failure) {
        failures.add(failure);
    }

    void addComposedTransform(String name, ComposedTransform composed) {
        composedTransforms.put(name, composed);
    }

    void addImageResults(List<ImageTaskResult> results) {
        imageResults.addAll(results);
    }

    public String getSampleId() {
        return sampleId;
    }

    public RegistrationChain getChain() {
        return chain;
    }

    /**
     * @return results of the completed steps; they can be passed to a new run to resume it
     */
    public List<TransformResult> getStepResults() {
        return Collections.unmodifiableList(stepResults);
    }

    public List<RunFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public Optional<RunFailure> getStepFailure() {
        return failures.stream().filter(f -> f.getDirection() == null).findFirst();
    }

    /**
     * @return composed transforms keyed by "level-direction-variant", e.g. "ccf-forward-full"
     */
    public Map<String, ComposedTransform> getComposedTransforms() {
        return Collections.unmodifiableMap(composedTransforms);
    }

    public List<ImageTaskResult> getImageResults() {
        return Collections.unmodifiableList(imageResults);
    }

    public boolean isChainComplete() {
        return stepResults.size() == chain.size();
    }

    public boolean isSuccessful() {
        return isChainComplete() && failures.isEmpty() && imageResults.stream().allMatch(ImageTaskResult::isSuccessful);
    }
}
