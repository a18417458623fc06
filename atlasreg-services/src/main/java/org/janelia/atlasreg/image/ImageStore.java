package org.janelia.atlasreg.image;

import java.nio.file.Path;

/**
 * Reads and writes volume images.
 */
public interface ImageStore {
    VolumeImage<?> read(Path imagePath);
    void write(VolumeImage<?> image, Path imagePath);
}
