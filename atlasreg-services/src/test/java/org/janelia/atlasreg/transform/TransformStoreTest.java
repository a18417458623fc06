package org.janelia.atlasreg.transform;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.janelia.atlasreg.geometry.Affine3D;
import org.janelia.atlasreg.geometry.SpatialTransform;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;
import org.janelia.atlasreg.model.loader.ObjectMapperFactory;
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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TransformStoreTest {

    private static final Logger LOG = LoggerFactory.getLogger(TransformStoreTest.class);
    private static final ImageGrid SAMPLE_GRID = new ImageGrid(new long[] {20, 20, 20}, new double[] {10, 10, 10});
    private static final ImageGrid ATLAS_GRID = new ImageGrid(new long[] {8, 8, 8}, new double[] {25, 25, 25});

    private Path testDirectory;
    private TransformStore transformStore;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("transformstoretest");
        transformStore = new TransformStore(LOG);
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    private double[] apply(SpatialTransform transform, double... p) {
        double[] q = new double[3];
        transform.apply(p, q);
        return q;
    }

    @Test
    public void affineTransformIsRestoredWithoutEngine() throws IOException {
        Affine3D affine = new Affine3D();
        affine.set(2.5, 0, 0, 0.75, 0, 2.5, 0, 0.75, 0, 0.1, 2.5, 0.75);
        ComposedTransform composed = new ComposedTransform(TransformDirection.FORWARD, TransformVariant.FULL,
                SAMPLE_GRID, ATLAS_GRID, ImmutableList.of(TransformLeg.affine(affine, "step 0")));
        Path transformPath = testDirectory.resolve("transforms/atlas-forward-full.json");

        transformStore.write(composed, transformPath);
        ComposedTransform restored = transformStore.read(transformPath, null);

        assertEquals(TransformDirection.FORWARD, restored.getDirection());
        assertEquals(TransformVariant.FULL, restored.getVariant());
        assertEquals(SAMPLE_GRID, restored.getInputGrid());
        assertEquals(ATLAS_GRID, restored.getOutputGrid());
        assertTrue(restored.isAffine());
        assertArrayEquals(apply(affine, 1, 2, 3), apply(restored.getSamplingTransform(), 1, 2, 3), 1e-12);

        JsonNode document = ObjectMapperFactory.instance().getDefaultObjectMapper().readTree(transformPath.toFile());
        assertEquals("affine", document.get("legs").get(0).get("type").asText());
        assertEquals(12, document.get("legs").get(0).get("matrix").size());
    }

    @Test
    public void engineLegsAreRestoredThroughTheResolver() {
        SmoothDeformation warp = new SmoothDeformation(0.5, 0.2);
        Affine3D scaling = new Affine3D();
        scaling.scale(2);
        ComposedTransform composed = new ComposedTransform(TransformDirection.INVERSE, TransformVariant.FULL,
                ATLAS_GRID, SAMPLE_GRID, ImmutableList.of(
                        TransformLeg.pass(warp.inverse(), 0, "warp", "engine/warp-inverse", true),
                        TransformLeg.affine(scaling, "step 0 fixed working to full")));
        Path transformPath = testDirectory.resolve("atlas-inverse-full.json");

        transformStore.write(composed, transformPath);
        ComposedTransform restored = transformStore.read(transformPath, (ref, inverse) -> {
            assertEquals("engine/warp-inverse", ref);
            assertTrue(inverse);
            return warp.inverse();
        });

        assertEquals(2, restored.getLegs().size());
        assertEquals("warp", restored.getLegs().get(0).getPassName());
        assertArrayEquals(apply(composed.getSamplingTransform(), 3, 4, 5), apply(restored.getSamplingTransform(), 3, 4, 5), 1e-12);
    }

    @Test
    public void engineLegsWithoutReferenceCannotBeRestored() {
        ComposedTransform composed = new ComposedTransform(TransformDirection.FORWARD, TransformVariant.FULL,
                SAMPLE_GRID, ATLAS_GRID, ImmutableList.of(TransformLeg.pass(new SmoothDeformation(0.5, 0.2), 0, "warp", null, false)));
        Path transformPath = testDirectory.resolve("unresolvable.json");
        transformStore.write(composed, transformPath);
        try {
            transformStore.read(transformPath, (ref, inverse) -> new Affine3D());
            fail("Leg without engine reference should not be restored");
        } catch (AtlasRegistrationException e) {
            assertThat(e.getMessage(), containsString("Cannot restore leg"));
        }
    }
}
