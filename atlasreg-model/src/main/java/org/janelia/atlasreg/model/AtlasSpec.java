package org.janelia.atlasreg.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * One node of an atlas hierarchy: a template image with its annotations, the physical grid it is sampled on
 * and an optional link to the parent atlas it is registered into.
 *
 * Instances are immutable. Invariants are not enforced at construction so that all violations of a document
 * can be reported together by {@link AtlasSpecValidator}.
 */
public class AtlasSpec {

    private final String id;
    private final Path templatePath;
    private final List<Path> annotationPaths;
    private final List<Path> structureTreePaths;
    private final double[] resolution;
    private final int[] size;
    private final List<ReferencePoint> referencePoints;
    private final String structure;
    private final String orientation;
    private final String parentId;
    private final DownsamplingFactor downsampling;
    private final List<TransformTemplate> transformTemplates;
    private final boolean allowFinerResolution;
    private final Path documentPath;

    private AtlasSpec(Builder builder) {
        this.id = builder.id;
        this.templatePath = builder.templatePath;
        this.annotationPaths = ImmutableList.copyOf(builder.annotationPaths);
        this.structureTreePaths = ImmutableList.copyOf(builder.structureTreePaths);
        this.resolution = builder.resolution == null ? null : builder.resolution.clone();
        this.size = builder.size == null ? null : builder.size.clone();
        this.referencePoints = ImmutableList.copyOf(builder.referencePoints);
        this.structure = builder.structure;
        this.orientation = builder.orientation;
        this.parentId = builder.parentId;
        this.downsampling = builder.downsampling == null ? DownsamplingFactor.NONE : builder.downsampling;
        this.transformTemplates = ImmutableList.copyOf(builder.transformTemplates);
        this.allowFinerResolution = builder.allowFinerResolution;
        this.documentPath = builder.documentPath;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .templatePath(templatePath)
                .annotationPaths(annotationPaths)
                .structureTreePaths(structureTreePaths)
                .resolution(resolution)
                .size(size)
                .referencePoints(referencePoints)
                .structure(structure)
                .orientation(orientation)
                .parentId(parentId)
                .downsampling(downsampling)
                .transformTemplates(transformTemplates)
                .allowFinerResolution(allowFinerResolution)
                .documentPath(documentPath);
    }

    public String getId() {
        return id;
    }

    public Path getTemplatePath() {
        return templatePath;
    }

    public List<Path> getAnnotationPaths() {
        return annotationPaths;
    }

    public List<Path> getStructureTreePaths() {
        return structureTreePaths;
    }

    /**
     * @return voxel size in micrometers along x, y and z
     */
    public double[] getResolution() {
        return resolution == null ? null : resolution.clone();
    }

    /**
     * @return number of voxels along x, y and z
     */
    public int[] getSize() {
        return size == null ? null : size.clone();
    }

    public long[] getDimensions() {
        return size == null ? null : Arrays.stream(size).asLongStream().toArray();
    }

    public List<ReferencePoint> getReferencePoints() {
        return referencePoints;
    }

    public String getStructure() {
        return structure;
    }

    public String getOrientation() {
        return orientation;
    }

    public String getParentId() {
        return parentId;
    }

    public boolean hasParent() {
        return parentId != null;
    }

    public DownsamplingFactor getDownsampling() {
        return downsampling;
    }

    public List<TransformTemplate> getTransformTemplates() {
        return transformTemplates;
    }

    public boolean isAllowFinerResolution() {
        return allowFinerResolution;
    }

    /**
     * @return the document this spec was loaded from or null if it was built programmatically
     */
    public Path getDocumentPath() {
        return documentPath;
    }

    /**
     * @return the annotations as label images, in declaration order
     */
    public List<AssociatedImage> getAnnotationImages() {
        List<AssociatedImage> images = new ArrayList<>();
        annotationPaths.forEach(p -> images.add(new AssociatedImage(p, ImageKind.LABEL)));
        return images;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AtlasSpec that = (AtlasSpec) o;
        return allowFinerResolution == that.allowFinerResolution &&
                Objects.equals(id, that.id) &&
                Objects.equals(templatePath, that.templatePath) &&
                annotationPaths.equals(that.annotationPaths) &&
                structureTreePaths.equals(that.structureTreePaths) &&
                Arrays.equals(resolution, that.resolution) &&
                Arrays.equals(size, that.size) &&
                referencePoints.equals(that.referencePoints) &&
                Objects.equals(structure, that.structure) &&
                Objects.equals(orientation, that.orientation) &&
                Objects.equals(parentId, that.parentId) &&
                downsampling.equals(that.downsampling) &&
                transformTemplates.equals(that.transformTemplates);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, templatePath, annotationPaths, structureTreePaths, referencePoints,
                structure, orientation, parentId, downsampling, transformTemplates, allowFinerResolution);
        result = 31 * result + Arrays.hashCode(resolution);
        result = 31 * result + Arrays.hashCode(size);
        return result;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("id", id)
                .append("templatePath", templatePath)
                .append("resolution", resolution)
                .append("size", size)
                .append("parentId", parentId)
                .toString();
    }

    public static class Builder {
        private final String id;
        private Path templatePath;
        private List<Path> annotationPaths = new ArrayList<>();
        private List<Path> structureTreePaths = new ArrayList<>();
        private double[] resolution;
        private int[] size;
        private List<ReferencePoint> referencePoints = new ArrayList<>();
        private String structure;
        private String orientation;
        private String parentId;
        private DownsamplingFactor downsampling;
        private List<TransformTemplate> transformTemplates = new ArrayList<>();
        private boolean allowFinerResolution;
        private Path documentPath;

        private Builder(String id) {
            this.id = id;
        }

        public Builder templatePath(Path templatePath) {
            this.templatePath = templatePath;
            return this;
        }

        public Builder annotationPaths(List<Path> annotationPaths) {
            this.annotationPaths = new ArrayList<>(annotationPaths);
            return this;
        }

        public Builder addAnnotation(Path annotationPath) {
            this.annotationPaths.add(annotationPath);
            return this;
        }

        public Builder structureTreePaths(List<Path> structureTreePaths) {
            this.structureTreePaths = new ArrayList<>(structureTreePaths);
            return this;
        }

        public Builder addStructureTree(Path structureTreePath) {
            this.structureTreePaths.add(structureTreePath);
            return this;
        }

        public Builder resolution(double... resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder size(int... size) {
            this.size = size;
            return this;
        }

        public Builder referencePoints(List<ReferencePoint> referencePoints) {
            this.referencePoints = new ArrayList<>(referencePoints);
            return this;
        }

        public Builder addReferencePoint(ReferencePoint referencePoint) {
            this.referencePoints.add(referencePoint);
            return this;
        }

        public Builder structure(String structure) {
            this.structure = structure;
            return this;
        }

        public Builder orientation(String orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder downsampling(DownsamplingFactor downsampling) {
            this.downsampling = downsampling;
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

        public Builder allowFinerResolution(boolean allowFinerResolution) {
            this.allowFinerResolution = allowFinerResolution;
            return this;
        }

        public Builder documentPath(Path documentPath) {
            this.documentPath = documentPath;
            return this;
        }

        public AtlasSpec build() {
            return new AtlasSpec(this);
        }
    }
}
