package org.janelia.atlasreg.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * The subject of a registration: the sample template described as an atlas level, the images that share its grid
 * and the atlas it has to be registered into.
 */
public class SampleSpec {

    private final AtlasSpec source;
    private final List<AssociatedImage> channels;
    private final AtlasHierarchy atlases;
    private final String targetId;
    private final RegistrationDirection direction;
    private final Map<String, RegistrationDirection> levelDirections;
    private final List<TransformTemplate> transformTemplates;
    private final DownsamplingFactor downsamplingOverride;
    private final Path targetParametersOutput;

    private SampleSpec(Builder builder) {
        Preconditions.checkArgument(builder.source != null, "Sample source spec is required");
        Preconditions.checkArgument(builder.atlases != null, "Sample atlas hierarchy is required");
        this.source = builder.source;
        this.channels = ImmutableList.copyOf(builder.channels);
        this.atlases = builder.atlases;
        this.targetId = builder.targetId;
        this.direction = builder.direction == null ? RegistrationDirection.BOTH : builder.direction;
        this.levelDirections = ImmutableMap.copyOf(builder.levelDirections);
        this.transformTemplates = ImmutableList.copyOf(builder.transformTemplates);
        this.downsamplingOverride = builder.downsamplingOverride;
        this.targetParametersOutput = builder.targetParametersOutput;
    }

    public static Builder builder(AtlasSpec source, AtlasHierarchy atlases) {
        return new Builder(source, atlases);
    }

    public String getId() {
        return source.getId();
    }

    public AtlasSpec getSource() {
        return source;
    }

    public List<AssociatedImage> getChannels() {
        return channels;
    }

    /**
     * @return the channels followed by the sample annotations (as labels)
     */
    public List<AssociatedImage> getAssociatedImages() {
        List<AssociatedImage> images = new ArrayList<>(channels);
        images.addAll(source.getAnnotationImages());
        return images;
    }

    public AtlasHierarchy getAtlases() {
        return atlases;
    }

    public String getTargetId() {
        return targetId;
    }

    public Optional<AtlasSpec> getTarget() {
        return targetId == null ? Optional.empty() : atlases.get(targetId);
    }

    public RegistrationDirection getDirection() {
        return direction;
    }

    public Map<String, RegistrationDirection> getLevelDirections() {
        return levelDirections;
    }

    /**
     * Directions requested for the given level of the chain. The final level defaults to the sample direction,
     * intermediate levels produce outputs only when they are listed explicitly.
     */
    public Optional<RegistrationDirection> getDirectionFor(String levelId, boolean finalLevel) {
        RegistrationDirection levelDirection = levelDirections.get(levelId);
        if (levelDirection != null) {
            return Optional.of(levelDirection);
        } else if (finalLevel) {
            return Optional.of(direction);
        } else {
            return Optional.empty();
        }
    }

    public List<TransformTemplate> getTransformTemplates() {
        return transformTemplates;
    }

    public Optional<DownsamplingFactor> getDownsamplingOverride() {
        return Optional.ofNullable(downsamplingOverride);
    }

    public Optional<Path> getTargetParametersOutput() {
        return Optional.ofNullable(targetParametersOutput);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("source", source.getId())
                .append("targetId", targetId)
                .append("direction", direction)
                .toString();
    }

    public static class Builder {
        private final AtlasSpec source;
        private final AtlasHierarchy atlases;
        private List<AssociatedImage> channels = new ArrayList<>();
        private String targetId;
        private RegistrationDirection direction;
        private Map<String, RegistrationDirection> levelDirections = new LinkedHashMap<>();
        private List<TransformTemplate> transformTemplates = new ArrayList<>();
        private DownsamplingFactor downsamplingOverride;
        private Path targetParametersOutput;

        private Builder(AtlasSpec source, AtlasHierarchy atlases) {
            this.source = source;
            this.atlases = atlases;
        }

        public Builder addChannel(Path path) {
            channels.add(new AssociatedImage(path, ImageKind.INTENSITY));
            return this;
        }

        public Builder channels(List<AssociatedImage> channels) {
            this.channels = new ArrayList<>(channels);
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder direction(RegistrationDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder levelDirection(String levelId, RegistrationDirection levelDirection) {
            this.levelDirections.put(levelId, levelDirection);
            return this;
        }

        public Builder transformTemplates(List<TransformTemplate> transformTemplates) {
            this.transformTemplates = new ArrayList<>(transformTemplates);
            return this;
        }

        public Builder addTransformTemplate(TransformTemplate transformTemplate) {
            this.transformTemplates.add(transformTemplate);
            return this;
        }

        public Builder downsamplingOverride(DownsamplingFactor downsamplingOverride) {
            this.downsamplingOverride = downsamplingOverride;
            return this;
        }

        public Builder targetParametersOutput(Path targetParametersOutput) {
            this.targetParametersOutput = targetParametersOutput;
            return this;
        }

        public SampleSpec build() {
            return new SampleSpec(this);
        }
    }
}
