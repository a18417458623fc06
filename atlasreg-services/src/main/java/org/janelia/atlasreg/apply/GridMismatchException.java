package org.janelia.atlasreg.apply;

import java.nio.file.Path;

import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;

/**
 * An image does not cover the physical box of the grid it is supposed to share.
 */
public class GridMismatchException extends AtlasRegistrationException {

    private final Path imagePath;
    private final ImageGrid expected;
    private final ImageGrid actual;

    public GridMismatchException(Path imagePath, ImageGrid expected, ImageGrid actual) {
        super("Image " + (imagePath == null ? "" : imagePath + " ") + "has grid " + actual + " incompatible with " + expected);
        this.imagePath = imagePath;
        this.expected = expected;
        this.actual = actual;
    }

    public Path getImagePath() {
        return imagePath;
    }

    public ImageGrid getExpected() {
        return expected;
    }

    public ImageGrid getActual() {
        return actual;
    }
}
