package org.janelia.atlasreg.model;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Named configuration for one registration engine pass.
 */
public class TransformTemplate {

    private final String name;
    private final TransformType type;
    private final Boolean invertibleOverride;
    private final Path parameterFile;
    private final Map<String, String> parameters;

    public TransformTemplate(String name, TransformType type) {
        this(name, type, null, null, ImmutableMap.of());
    }

    public TransformTemplate(String name, TransformType type, Boolean invertibleOverride, Path parameterFile, Map<String, String> parameters) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "Transform template name is required");
        Preconditions.checkArgument(type != null, "Transform template %s has no type", name);
        this.name = name;
        this.type = type;
        this.invertibleOverride = invertibleOverride;
        this.parameterFile = parameterFile;
        this.parameters = parameters == null ? ImmutableMap.of() : ImmutableMap.copyOf(parameters);
    }

    public String getName() {
        return name;
    }

    public TransformType getType() {
        return type;
    }

    public Path getParameterFile() {
        return parameterFile;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * A template is invertible if its type supports an inverse and it is not explicitly declared otherwise.
     */
    public boolean isInvertible() {
        if (invertibleOverride != null && !invertibleOverride) {
            return false;
        }
        return type.isInvertible();
    }

    public Boolean getInvertibleOverride() {
        return invertibleOverride;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransformTemplate that = (TransformTemplate) o;
        return name.equals(that.name) &&
                type == that.type &&
                Objects.equals(invertibleOverride, that.invertibleOverride) &&
                Objects.equals(parameterFile, that.parameterFile) &&
                parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, invertibleOverride, parameterFile, parameters);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("name", name)
                .append("type", type)
                .append("invertible", isInvertible())
                .toString();
    }
}
