package org.janelia.atlasreg.registration;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.TransformTemplate;

/**
 * One pairwise registration of a chain: the moving level is aligned to the fixed level.
 */
public class RegistrationStep {

    private final int index;
    private final AtlasSpec fixed;
    private final AtlasSpec moving;
    private final DownsamplingFactor downsampling;
    private final List<TransformTemplate> transformTemplates;

    public RegistrationStep(int index, AtlasSpec fixed, AtlasSpec moving,
                            DownsamplingFactor downsampling, List<TransformTemplate> transformTemplates) {
        this.index = index;
        this.fixed = fixed;
        this.moving = moving;
        this.downsampling = downsampling;
        this.transformTemplates = ImmutableList.copyOf(transformTemplates);
    }

    public int getIndex() {
        return index;
    }

    public AtlasSpec getFixed() {
        return fixed;
    }

    public AtlasSpec getMoving() {
        return moving;
    }

    public DownsamplingFactor getDownsampling() {
        return downsampling;
    }

    public List<TransformTemplate> getTransformTemplates() {
        return transformTemplates;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("index", index)
                .append("fixed", fixed.getId())
                .append("moving", moving.getId())
                .append("downsampling", downsampling)
                .toString();
    }
}
