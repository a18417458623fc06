package org.janelia.atlasreg.registration;

import java.nio.file.Paths;

import com.google.common.collect.ImmutableList;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.atlasreg.engine.FakeRegistrationEngine;
import org.janelia.atlasreg.engine.RegistrationEngine;
import org.janelia.atlasreg.engine.RegistrationEngineException;
import org.janelia.atlasreg.geometry.Affine3D;
import org.janelia.atlasreg.geometry.SpatialTransform;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.VolumeImage;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.TransformTemplate;
import org.janelia.atlasreg.model.TransformType;
import org.janelia.atlasreg.transform.SmoothDeformation;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RegistrationDriverTest {

    private static final TransformTemplate RIGID = new TransformTemplate("rigid", TransformType.RIGID);
    private static final TransformTemplate WARP = new TransformTemplate("warp", TransformType.BSPLINE);
    private static final ImageGrid GRID = new ImageGrid(new long[] {6, 6, 6}, new double[] {25, 25, 25});

    private Logger logger;
    private RegistrationStep step;
    private WorkingImages workingImages;

    @Before
    public void setUp() {
        logger = mock(Logger.class);
        AtlasSpec atlas = AtlasSpec.builder("atlas").templatePath(Paths.get("atlas.nrrd")).resolution(25, 25, 25).size(6, 6, 6).build();
        AtlasSpec sample = AtlasSpec.builder("sample").templatePath(Paths.get("sample.nrrd")).resolution(25, 25, 25).size(6, 6, 6).build();
        step = new RegistrationStep(0, atlas, sample, DownsamplingFactor.NONE, ImmutableList.of(RIGID, WARP));
        workingImages = new WorkingImages(VolumeImage.create(new FloatType(), GRID), VolumeImage.create(new FloatType(), GRID), GRID, GRID);
    }

    @Test
    public void passesRunInOrderEachStartingFromThePreviousOnes() {
        Affine3D shift = new Affine3D();
        shift.translate(1, 2, 3);
        FakeRegistrationEngine engine = new FakeRegistrationEngine()
                .withTransform("rigid", shift)
                .withTransform("warp", new SmoothDeformation(0.5, 0.2));
        RegistrationDriver driver = new RegistrationDriver(engine, logger);

        TransformResult result = driver.run(step, workingImages);

        assertThat(engine.getRegisterCalls().stream().map(FakeRegistrationEngine.RegisterCall::getTemplateName).toArray(),
                arrayContaining("rigid", "warp"));
        assertNull(engine.getRegisterCalls().get(0).getInitial());
        double[] seeded = new double[3];
        engine.getRegisterCalls().get(1).getInitial().getFixedToMoving().apply(new double[] {0, 0, 0}, seeded);
        assertArrayEquals(new double[] {1, 2, 3}, seeded, 1e-12);

        assertThat(result.getPasses().stream().map(p -> p.getTemplate().getName()).toArray(),
                arrayContaining("rigid", "warp"));
        assertThat(result.getTrace(), contains("registered rigid", "registered warp"));
        SpatialTransform working = result.getWorkingParameters().getFixedToMoving();
        double[] moved = new double[3];
        working.apply(new double[] {0, 0, 0}, moved);
        new SmoothDeformation(0.5, 0.2).apply(new double[] {1, 2, 3}, seeded);
        assertArrayEquals(seeded, moved, 1e-12);
        assertTrue(result.getWorkingParameters().hasInverse());
        assertFalse(result.findNonInvertiblePass().isPresent());
    }

    @Test
    public void failingPassStopsTheStepWithoutRetry() {
        FakeRegistrationEngine engine = new FakeRegistrationEngine().failingOn("warp");
        RegistrationDriver driver = new RegistrationDriver(engine, logger);
        try {
            driver.run(step, workingImages);
            fail("Failing pass should have stopped the step");
        } catch (RegistrationFailedException e) {
            assertEquals(0, e.getStepIndex());
            assertEquals("warp", e.getTemplateName());
            assertEquals("atlas", e.getFixedId());
            assertEquals("sample", e.getMovingId());
        }
        assertEquals(2, engine.getRegisterCalls().size());
        assertEquals("the failure is logged once, by whoever handles it", 0,
                mockingDetails(logger).getInvocations().stream()
                        .filter(invocation -> invocation.getMethod().getName().equals("error"))
                        .count());
    }

    @Test
    public void passWithoutInverseIsReported() {
        FakeRegistrationEngine engine = new FakeRegistrationEngine().withoutInverse("warp");
        TransformResult result = new RegistrationDriver(engine, logger).run(step, workingImages);

        assertEquals("warp", result.findNonInvertiblePass().get().getTemplate().getName());
        assertFalse(result.getWorkingParameters().hasInverse());
    }

    @Test
    public void unexpectedEngineErrorsAndMissingResultsAreFailures() throws RegistrationEngineException {
        RegistrationEngine engine = mock(RegistrationEngine.class);
        when(engine.register(any(), any(), any(), isNull())).thenThrow(new IllegalStateException("engine crashed"));
        try {
            new RegistrationDriver(engine, logger).run(step, workingImages);
            fail("Engine crash should have been reported");
        } catch (RegistrationFailedException e) {
            assertEquals("rigid", e.getTemplateName());
        }
        verify(engine, times(1)).register(any(), any(), any(), isNull());

        RegistrationEngine silentEngine = mock(RegistrationEngine.class);
        try {
            new RegistrationDriver(silentEngine, logger).run(step, workingImages);
            fail("Missing engine result should have been reported");
        } catch (RegistrationFailedException e) {
            assertEquals("rigid", e.getTemplateName());
        }
    }
}
