package org.janelia.atlasreg.registration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.collect.ImmutableList;
import org.janelia.atlasreg.engine.FakeRegistrationEngine;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.NrrdImageStore;
import org.janelia.atlasreg.image.TestImages;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.TransformTemplate;
import org.janelia.atlasreg.model.TransformType;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;
import org.janelia.atlasreg.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ResolutionManagerTest {

    private static final Logger LOG = LoggerFactory.getLogger(ResolutionManagerTest.class);
    private static final double TOLERANCE = 0.01;
    private static final double EPSILON = 1e-9;

    private Path testDirectory;
    private FakeRegistrationEngine engine;
    private WorkingImageCache cache;
    private ResolutionManager resolutionManager;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("resolutiontest");
        engine = new FakeRegistrationEngine();
        cache = new WorkingImageCache();
        resolutionManager = new ResolutionManager(new NrrdImageStore(false, LOG), engine, cache, TOLERANCE, LOG);
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    private AtlasSpec atlasWithTemplate(String id, double resolution, int size) {
        ImageGrid grid = new ImageGrid(new long[] {size, size, size}, new double[] {resolution, resolution, resolution});
        Path templatePath = TestImages.write(TestImages.gradient(grid), testDirectory.resolve(id + ".nrrd"));
        return atlasSpec(id, resolution, size).templatePath(templatePath).build();
    }

    private AtlasSpec.Builder atlasSpec(String id, double resolution, int size) {
        return AtlasSpec.builder(id)
                .resolution(resolution, resolution, resolution)
                .size(size, size, size)
                .orientation("LR:SI:PA");
    }

    private RegistrationStep step(AtlasSpec fixed, AtlasSpec moving, DownsamplingFactor downsampling) {
        return new RegistrationStep(0, fixed, moving, downsampling,
                ImmutableList.of(new TransformTemplate("affine", TransformType.AFFINE)));
    }

    @Test
    public void autoDownsamplingBringsTheFinerSideToTheCoarserGrid() {
        AtlasSpec atlas = atlasWithTemplate("atlas", 25, 8);
        AtlasSpec sample = atlasWithTemplate("sample", 10, 20);

        WorkingImages workingImages = resolutionManager.prepare(step(atlas, sample, DownsamplingFactor.AUTO));

        assertArrayEquals(new long[] {8, 8, 8}, workingImages.getMovingWorkingGrid().getDimensions());
        assertArrayEquals(new double[] {25, 25, 25}, workingImages.getMovingWorkingGrid().getResolution(), EPSILON);
        assertArrayEquals(new double[] {2.5, 2.5, 2.5}, workingImages.getMovingScale(), EPSILON);
        assertArrayEquals(new double[] {1, 1, 1}, workingImages.getFixedScale(), EPSILON);
        assertEquals(ImageGrid.of(sample), workingImages.getMovingFullGrid());
        assertEquals(1, engine.getResampleCalls());
    }

    @Test
    public void matchingExplicitFactorIsAccepted() {
        AtlasSpec atlas = atlasSpec("atlas", 25, 40).build();
        AtlasSpec sample = atlasSpec("sample", 10, 100).build();

        DownsamplingPlan plan = resolutionManager.plan(step(atlas, sample, DownsamplingFactor.uniform(2.5)));

        assertArrayEquals(new double[] {2.5, 2.5, 2.5}, plan.getMovingFactors(), EPSILON);
        assertArrayEquals(new double[] {1, 1, 1}, plan.getFixedFactors(), EPSILON);
    }

    @Test
    public void explicitFactorThatMissesTheOtherGridIsRejected() {
        AtlasSpec atlas = atlasSpec("atlas", 25, 40).build();
        AtlasSpec sample = atlasSpec("sample", 10, 100).build();
        try {
            resolutionManager.plan(step(atlas, sample, DownsamplingFactor.uniform(2)));
            fail("Factor 2 cannot bring 10um to 25um");
        } catch (UnsupportedDownsampleException e) {
            assertEquals(0, e.getStepIndex());
            assertEquals("sample", e.getSpecId());
            assertArrayEquals(new double[] {2.5, 2.5, 2.5}, e.getRequired(), EPSILON);
        }
    }

    @Test
    public void finerFixedSideIsReduced() {
        AtlasSpec atlas = atlasSpec("atlas", 10, 100).allowFinerResolution(true).build();
        AtlasSpec sample = atlasSpec("sample", 25, 40).build();

        DownsamplingPlan plan = resolutionManager.plan(step(atlas, sample, DownsamplingFactor.AUTO));

        assertArrayEquals(new double[] {2.5, 2.5, 2.5}, plan.getFixedFactors(), EPSILON);
        assertArrayEquals(new double[] {1, 1, 1}, plan.getMovingFactors(), EPSILON);
    }

    @Test
    public void mixedResolutionRatiosAreRejected() {
        AtlasSpec atlas = AtlasSpec.builder("atlas").resolution(25, 25, 5).size(40, 40, 200).orientation("LR:SI:PA").build();
        AtlasSpec sample = atlasSpec("sample", 10, 100).build();
        try {
            resolutionManager.plan(step(atlas, sample, DownsamplingFactor.AUTO));
            fail("Mixed ratios cannot be handled by reducing one side");
        } catch (UnsupportedDownsampleException e) {
            assertThat(e.getMessage(), containsString("different axis"));
        }
    }

    @Test
    public void sameResolutionNeedsNoReduction() {
        AtlasSpec atlas = atlasWithTemplate("atlas", 25, 6);
        AtlasSpec sample = atlasWithTemplate("sample", 25, 6);

        WorkingImages workingImages = resolutionManager.prepare(step(atlas, sample, DownsamplingFactor.AUTO));

        assertEquals(workingImages.getMovingFullGrid(), workingImages.getMovingWorkingGrid());
        assertEquals(0, engine.getResampleCalls());
    }

    @Test
    public void noDownsamplingUsesFullImages() {
        AtlasSpec atlas = atlasWithTemplate("atlas", 25, 8);
        AtlasSpec sample = atlasWithTemplate("sample", 10, 20);

        WorkingImages workingImages = resolutionManager.prepare(step(atlas, sample, DownsamplingFactor.NONE));

        assertArrayEquals(new long[] {20, 20, 20}, workingImages.getMovingWorkingGrid().getDimensions());
        assertEquals(0, engine.getResampleCalls());
    }

    @Test
    public void workingImagesAreProducedOncePerRun() {
        AtlasSpec atlas = atlasWithTemplate("atlas", 25, 8);
        AtlasSpec sample = atlasWithTemplate("sample", 10, 20);
        RegistrationStep step = step(atlas, sample, DownsamplingFactor.AUTO);

        WorkingImages first = resolutionManager.prepare(step);
        WorkingImages second = resolutionManager.prepare(step);

        assertSame(first.getMoving(), second.getMoving());
        assertSame(first.getFixed(), second.getFixed());
        assertEquals(1, engine.getResampleCalls());
        assertTrue(cache.contains("sample", new double[] {2.5, 2.5, 2.5}));
    }

    @Test
    public void templateSizeMustMatchTheAtlasSize() {
        AtlasSpec atlas = atlasWithTemplate("atlas", 25, 8);
        ImageGrid grid = new ImageGrid(new long[] {20, 20, 21}, new double[] {10, 10, 10});
        Path templatePath = TestImages.write(TestImages.gradient(grid), testDirectory.resolve("odd.nrrd"));
        AtlasSpec sample = atlasSpec("sample", 10, 20).templatePath(templatePath).build();
        try {
            resolutionManager.prepare(step(atlas, sample, DownsamplingFactor.AUTO));
            fail("Template size mismatch should have been rejected");
        } catch (InvalidSpecException e) {
            assertEquals("sample", e.getSpecId());
        }
    }

    @Test
    public void atlasResolutionOverridesTheFileVoxelSize() {
        ImageGrid fileGrid = new ImageGrid(new long[] {8, 8, 8}, new double[] {1, 1, 1});
        Path templatePath = TestImages.write(TestImages.gradient(fileGrid), testDirectory.resolve("nospacing.nrrd"));
        AtlasSpec atlas = atlasSpec("atlas", 25, 8).templatePath(templatePath).build();
        AtlasSpec sample = atlasWithTemplate("sample", 25, 8);

        WorkingImages workingImages = resolutionManager.prepare(step(atlas, sample, DownsamplingFactor.NONE));

        assertNotNull(workingImages.getFixed());
        assertArrayEquals(new double[] {25, 25, 25}, workingImages.getFixed().getResolution(), EPSILON);
    }
}
