package org.janelia.atlasreg.image;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.atlasreg.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class NrrdImageStoreTest {

    private static final Logger LOG = LoggerFactory.getLogger(NrrdImageStoreTest.class);

    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("nrrdtest");
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    @Test
    public void writeAndReadCompressedFloatImage() {
        ImageGrid grid = new ImageGrid(new long[] {7, 5, 3}, new double[] {10, 10, 20});
        NrrdImageStore imageStore = new NrrdImageStore(true, LOG);
        Path imagePath = testDirectory.resolve("out/gradient.nrrd");
        imageStore.write(TestImages.gradient(grid), imagePath);

        VolumeImage<?> image = imageStore.read(imagePath);

        assertThat(image.getType(), instanceOf(FloatType.class));
        assertEquals(grid, image.getGrid());
        assertEquals(6 + 2 * 4 + 3 * 2, TestImages.valueAt(image, 6, 4, 2), 1e-6);
    }

    @Test
    public void writeAndReadRawLabelImage() {
        ImageGrid grid = new ImageGrid(new long[] {9, 2, 2}, new double[] {25, 25, 25});
        NrrdImageStore imageStore = new NrrdImageStore(false, LOG);
        Path imagePath = testDirectory.resolve("labels.nrrd");
        imageStore.write(TestImages.labels(grid, 3), imagePath);

        VolumeImage<?> image = imageStore.read(imagePath);

        assertThat(image.getType(), instanceOf(UnsignedShortType.class));
        assertEquals(10, TestImages.valueAt(image, 0, 1, 1), 0);
        assertEquals(30, TestImages.valueAt(image, 8, 0, 0), 0);
    }

    @Test
    public void readSpaceDirectionsAndBigEndianData() throws IOException {
        Path imagePath = testDirectory.resolve("directions.nrrd");
        ByteBuffer data = ByteBuffer.allocate(8 * 2).order(ByteOrder.BIG_ENDIAN);
        for (int i = 0; i < 8; i++) {
            data.putShort((short) (1000 + i));
        }
        try (OutputStream out = Files.newOutputStream(imagePath)) {
            out.write(("NRRD0004\n" +
                    "# written by hand\n" +
                    "type: unsigned short\n" +
                    "dimension: 3\n" +
                    "space: right-anterior-superior\n" +
                    "sizes: 2 2 2\n" +
                    "space directions: (0,3,4) (5,0,0) (0,0,2.5)\n" +
                    "endian: big\n" +
                    "encoding: raw\n" +
                    "\n").getBytes(StandardCharsets.US_ASCII));
            out.write(data.array());
        }

        VolumeImage<?> image = new NrrdImageStore(false, LOG).read(imagePath);

        assertArrayEquals(new double[] {5, 5, 2.5}, image.getResolution(), 1e-12);
        assertEquals(1000, TestImages.valueAt(image, 0, 0, 0), 0);
        assertEquals(1007, TestImages.valueAt(image, 1, 1, 1), 0);
    }

    @Test
    public void readDetachedData() throws IOException {
        Path headerPath = testDirectory.resolve("detached.nhdr");
        Files.write(testDirectory.resolve("detached.raw"), new byte[] {0, 0, 1, 2, 3, 4, 5, 6, 7, 8});
        Files.write(headerPath, ("NRRD0004\n" +
                "type: uint8\n" +
                "dimension: 3\n" +
                "sizes: 2 2 2\n" +
                "spacings: 1 2 3\n" +
                "byte skip: 2\n" +
                "data file: detached.raw\n" +
                "\n").getBytes(StandardCharsets.US_ASCII));

        VolumeImage<?> image = new NrrdImageStore(false, LOG).read(headerPath);

        assertArrayEquals(new double[] {1, 2, 3}, image.getResolution(), 0);
        assertEquals(1, TestImages.valueAt(image, 0, 0, 0), 0);
        assertEquals(8, TestImages.valueAt(image, 1, 1, 1), 0);
    }

    @Test
    public void rejectNon3DImages() throws IOException {
        Path imagePath = testDirectory.resolve("flat.nrrd");
        Files.write(imagePath, ("NRRD0004\n" +
                "type: uint8\n" +
                "dimension: 2\n" +
                "sizes: 2 2\n" +
                "encoding: raw\n" +
                "\n").getBytes(StandardCharsets.US_ASCII));
        try {
            new NrrdImageStore(false, LOG).read(imagePath);
            fail("2D image should have been rejected");
        } catch (UncheckedIOException e) {
            assertThat(e.getCause().getMessage(), containsString("is not a 3D image"));
        }
    }

    @Test
    public void truncatedDataIsAnError() throws IOException {
        Path imagePath = testDirectory.resolve("truncated.nrrd");
        Files.write(imagePath, ("NRRD0004\n" +
                "type: uint8\n" +
                "dimension: 3\n" +
                "sizes: 2 2 2\n" +
                "encoding: raw\n" +
                "\n" +
                "abc").getBytes(StandardCharsets.US_ASCII));
        try {
            new NrrdImageStore(false, LOG).read(imagePath);
            fail("Truncated image should have been rejected");
        } catch (UncheckedIOException e) {
            assertThat(e.getMessage(), containsString(imagePath.toString()));
        }
    }
}
