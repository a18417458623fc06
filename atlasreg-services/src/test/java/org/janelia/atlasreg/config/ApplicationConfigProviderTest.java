package org.janelia.atlasreg.config;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ApplicationConfigProviderTest {

    @Test
    public void defaultResourceProvidesAllSettings() {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromResource("/atlasreg.properties")
                .build();
        AtlasRegistrationSettings settings = new AtlasRegistrationSettings(applicationConfig);

        assertEquals(0.01, settings.getDownsamplingTolerance(), 1e-12);
        assertEquals(0.01, settings.getGridTolerance(), 1e-12);
        assertEquals(4, settings.getApplyThreadPoolSize());
        assertFalse(settings.isSaveWorkingTransforms());
        assertEquals("nrrd", settings.getImageExtension());
        assertTrue(settings.isCompressOutput());
    }

    @Test
    public void laterSourcesOverrideEarlierOnes() {
        Properties systemProperties = new Properties();
        systemProperties.setProperty(AtlasRegistrationSettings.APPLY_THREAD_POOL_SIZE, "2");
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromResource("/atlasreg.properties")
                .fromMap(ImmutableMap.of(AtlasRegistrationSettings.APPLY_THREAD_POOL_SIZE, "8",
                        AtlasRegistrationSettings.SAVE_WORKING_TRANSFORMS, "true"))
                .fromProperties(systemProperties)
                .build();
        AtlasRegistrationSettings settings = new AtlasRegistrationSettings(applicationConfig);

        assertEquals(2, settings.getApplyThreadPoolSize());
        assertTrue(settings.isSaveWorkingTransforms());
    }

    @Test
    public void environmentEntriesAreMappedToDottedKeys() {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromResource("/atlasreg.properties")
                .fromEnvironment(ImmutableMap.of("ATLASREG_AtlasRegistration_Grid_Tolerance", "0.05"))
                .build();

        assertEquals(0.05, new AtlasRegistrationSettings(applicationConfig).getGridTolerance(), 1e-12);
    }

    @Test
    public void missingEntriesFallBackToDefaults() {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromResource("/missing.properties")
                .build();
        AtlasRegistrationSettings settings = new AtlasRegistrationSettings(applicationConfig);

        assertEquals(0.01, settings.getDownsamplingTolerance(), 1e-12);
        assertEquals(4, settings.getApplyThreadPoolSize());
        assertEquals("nrrd", settings.getImageExtension());
    }

    @Test
    public void fileEntriesOverrideResourceDefaults() throws Exception {
        Path configFile = Files.createTempFile("atlasreg", ".properties");
        try {
            Files.write(configFile, (AtlasRegistrationSettings.IMAGE_EXTENSION + "=nhdr\n").getBytes(StandardCharsets.UTF_8));
            ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                    .fromResource("/atlasreg.properties")
                    .fromFile(configFile.toString())
                    .build();

            assertEquals("nhdr", new AtlasRegistrationSettings(applicationConfig).getImageExtension());
        } finally {
            Files.deleteIfExists(configFile);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedNumbersAreRejected() {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromMap(ImmutableMap.of(AtlasRegistrationSettings.APPLY_THREAD_POOL_SIZE, "four"))
                .build();

        new AtlasRegistrationSettings(applicationConfig).getApplyThreadPoolSize();
    }
}
