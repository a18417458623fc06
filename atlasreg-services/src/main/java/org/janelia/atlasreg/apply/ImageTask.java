package org.janelia.atlasreg.apply;

import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.model.ImageKind;

/**
 * An image to be resampled and where to write the result.
 */
public class ImageTask {
    private final Path input;
    private final ImageKind kind;
    private final Path output;
    private final ImageGrid ownerGrid;

    public ImageTask(Path input, ImageKind kind, Path output) {
        this(input, kind, output, null);
    }

    /**
     * @param ownerGrid grid of the atlas or sample the image belongs to; an image of the same size is read with the
     *                  owner's resolution whatever voxel size its file declares
     */
    public ImageTask(Path input, ImageKind kind, Path output, ImageGrid ownerGrid) {
        this.input = input;
        this.kind = kind;
        this.output = output;
        this.ownerGrid = ownerGrid;
    }

    public Path getInput() {
        return input;
    }

    public ImageKind getKind() {
        return kind;
    }

    public Path getOutput() {
        return output;
    }

    public ImageGrid getOwnerGrid() {
        return ownerGrid;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("input", input)
                .append("kind", kind)
                .append("output", output)
                .append("ownerGrid", ownerGrid)
                .toString();
    }
}
