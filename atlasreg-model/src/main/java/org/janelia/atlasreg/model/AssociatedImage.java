package org.janelia.atlasreg.model;

import java.nio.file.Path;
import java.util.Objects;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * An image that lives on the grid of a template and follows it through registration.
 */
public class AssociatedImage {
    private final Path path;
    private final ImageKind kind;

    public AssociatedImage(Path path, ImageKind kind) {
        Preconditions.checkArgument(path != null, "Associated image path is required");
        Preconditions.checkArgument(kind != null, "Associated image kind is required");
        this.path = path;
        this.kind = kind;
    }

    public Path getPath() {
        return path;
    }

    public ImageKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssociatedImage that = (AssociatedImage) o;
        return path.equals(that.path) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, kind);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("path", path)
                .append("kind", kind)
                .toString();
    }
}
