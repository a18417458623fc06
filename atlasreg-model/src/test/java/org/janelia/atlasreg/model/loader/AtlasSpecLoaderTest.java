package org.janelia.atlasreg.model.loader;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.janelia.atlasreg.model.AtlasHierarchy;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.ReferencePoint;
import org.janelia.atlasreg.model.TransformType;
import org.janelia.atlasreg.model.exceptions.CyclicChainException;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AtlasSpecLoaderTest {

    private static final String TEST_DATA = "src/test/resources/testdata";

    private AtlasSpecLoader atlasSpecLoader;

    @Before
    public void setUp() {
        atlasSpecLoader = new AtlasSpecLoader();
    }

    @Test
    public void loadCcfPrefixedDocument() {
        Path ccfDocument = Paths.get(TEST_DATA, "atlases/ccf.yml");
        AtlasSpec ccf = atlasSpecLoader.load(ccfDocument);
        Path atlasDir = ccfDocument.toAbsolutePath().getParent();

        assertEquals("ccf", ccf.getId());
        assertEquals(atlasDir.resolve("ccf/average_template_25.nrrd"), ccf.getTemplatePath());
        assertThat(ccf.getAnnotationPaths(), contains(atlasDir.resolve("ccf/annotation_25.nrrd")));
        assertThat(ccf.getStructureTreePaths(), contains(atlasDir.resolve("ccf/structure_tree.csv")));
        assertArrayEquals(new double[] {25, 25, 25}, ccf.getResolution(), 0.);
        assertArrayEquals(new int[] {40, 40, 40}, ccf.getSize());
        assertThat(ccf.getReferencePoints(), contains(new ReferencePoint("bregma", 20, 10, 5)));
        assertEquals("brain", ccf.getStructure());
        assertEquals("LR:SI:PA", ccf.getOrientation());
        assertFalse(ccf.hasParent());
        assertEquals(DownsamplingFactor.NONE, ccf.getDownsampling());
        assertThat(ccf.getTransformTemplates(), hasSize(2));
        assertEquals(TransformType.AFFINE, ccf.getTransformTemplates().get(0).getType());
        assertEquals(TransformType.BSPLINE, ccf.getTransformTemplates().get(1).getType());
        assertEquals("250", ccf.getTransformTemplates().get(1).getParameters().get("FinalGridSpacingInPhysicalUnits"));
    }

    @Test
    public void loadTargetPrefixedDocumentWithParent() {
        AtlasSpec mid = atlasSpecLoader.load(Paths.get(TEST_DATA, "atlases/mid.yml"));

        assertEquals("mid", mid.getId());
        assertEquals("ccf", mid.getParentId());
        assertArrayEquals(new double[] {10, 10, 10}, mid.getResolution(), 0.);
        assertTrue(mid.getDownsampling().isAuto());
        assertThat(mid.getStructureTreePaths(), hasSize(0));
    }

    @Test
    public void loadHierarchyFollowsParentDocuments() {
        AtlasHierarchy atlases = new AtlasHierarchy();
        AtlasSpec mid = atlasSpecLoader.loadHierarchy(Paths.get(TEST_DATA, "atlases/mid.yml"), atlases);

        assertEquals("mid", mid.getId());
        assertEquals(2, atlases.size());
        assertEquals("ccf", atlases.resolveParent(mid).map(AtlasSpec::getId).orElse(null));
    }

    @Test
    public void loadDoesNotChangeTheDocument() throws Exception {
        Path document = Paths.get(TEST_DATA, "atlases/ccf.yml");
        JsonNode tree = ObjectMapperFactory.instance().getYamlObjectMapper().readTree(document.toFile());
        JsonNode copy = tree.deepCopy();

        AtlasSpec first = atlasSpecLoader.load(tree, document.toAbsolutePath().getParent(), "ccf");
        AtlasSpec second = atlasSpecLoader.load(tree, document.toAbsolutePath().getParent(), "ccf");

        assertEquals(copy, tree);
        assertEquals(first, second);
    }

    @Test
    public void documentIdDefaultsToTheFileName() {
        AtlasSpec a = atlasSpecLoader.load(Paths.get(TEST_DATA, "cyclic/a.yml"));
        assertEquals("a", a.getId());
        assertEquals("b", a.getParentId());
    }

    @Test
    public void missingPrefixIsRejected() {
        try {
            atlasSpecLoader.load(Paths.get(TEST_DATA, "invalid/unprefixed.yml"));
            fail("Expected an invalid spec exception");
        } catch (InvalidSpecException e) {
            assertThat(e.getViolations().get(0), containsString("must start with one of"));
        }
    }

    @Test
    public void allMalformedValuesAreReported() {
        try {
            atlasSpecLoader.load(Paths.get(TEST_DATA, "invalid/malformed.yml"));
            fail("Expected an invalid spec exception");
        } catch (InvalidSpecException e) {
            assertThat(e.getViolations(), hasSize(3));
            assertThat(e.getViolations(), hasItem(containsString("non numeric value ten")));
            assertThat(e.getViolations(), hasItem(containsString("target-template-size")));
            assertThat(e.getViolations(), hasItem(containsString("thin-plate")));
        }
    }

    @Test
    public void cyclicParentDocumentsAreDetected() {
        try {
            atlasSpecLoader.loadHierarchy(Paths.get(TEST_DATA, "cyclic/a.yml"), new AtlasHierarchy());
            fail("Expected a cyclic chain exception");
        } catch (CyclicChainException e) {
            assertThat(e.getVisited(), contains("a", "b"));
            assertEquals("a", e.getRepeated());
        }
    }

    @Test
    public void selfParentDocumentTerminates() {
        try {
            atlasSpecLoader.loadHierarchy(Paths.get(TEST_DATA, "cyclic/self.yml"), new AtlasHierarchy());
            fail("Expected a cyclic chain exception");
        } catch (CyclicChainException e) {
            assertEquals("self", e.getRepeated());
        }
    }

    @Test
    public void parentGivenByIdIsKeptAsIs() {
        ObjectNode document = ObjectMapperFactory.instance().getYamlObjectMapper().createObjectNode();
        document.put("target-template-path", "/data/t.nrrd");
        document.put("target-template-parent", "allen");
        AtlasSpec spec = atlasSpecLoader.load(document, null, "t");
        assertEquals("allen", spec.getParentId());
        assertThat(spec.getResolution(), nullValue());
        assertThat(spec.getTemplatePath(), equalTo(Paths.get("/data/t.nrrd")));
    }
}
