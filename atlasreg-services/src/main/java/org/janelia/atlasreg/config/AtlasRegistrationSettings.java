package org.janelia.atlasreg.config;

/**
 * Names and defaults of the configuration entries used by the registration pipeline.
 */
public final class AtlasRegistrationSettings {

    public static final String DOWNSAMPLING_TOLERANCE = "AtlasRegistration.Downsampling.Tolerance";
    public static final String GRID_TOLERANCE = "AtlasRegistration.Grid.Tolerance";
    public static final String APPLY_THREAD_POOL_SIZE = "AtlasRegistration.Apply.ThreadPoolSize";
    public static final String SAVE_WORKING_TRANSFORMS = "AtlasRegistration.Output.SaveWorkingTransforms";
    public static final String IMAGE_EXTENSION = "AtlasRegistration.Output.ImageExtension";
    public static final String COMPRESS_OUTPUT = "AtlasRegistration.Output.Compress";

    static final double DEFAULT_TOLERANCE = 0.01;
    static final int DEFAULT_THREAD_POOL_SIZE = 4;

    private final ApplicationConfig applicationConfig;

    public AtlasRegistrationSettings(ApplicationConfig applicationConfig) {
        this.applicationConfig = applicationConfig;
    }

    public double getDownsamplingTolerance() {
        return applicationConfig.getDoublePropertyValue(DOWNSAMPLING_TOLERANCE, DEFAULT_TOLERANCE);
    }

    public double getGridTolerance() {
        return applicationConfig.getDoublePropertyValue(GRID_TOLERANCE, DEFAULT_TOLERANCE);
    }

    public int getApplyThreadPoolSize() {
        return applicationConfig.getIntegerPropertyValue(APPLY_THREAD_POOL_SIZE, DEFAULT_THREAD_POOL_SIZE);
    }

    public boolean isSaveWorkingTransforms() {
        return applicationConfig.getBooleanPropertyValue(SAVE_WORKING_TRANSFORMS, false);
    }

    public String getImageExtension() {
        return applicationConfig.getStringPropertyValue(IMAGE_EXTENSION, "nrrd");
    }

    public boolean isCompressOutput() {
        return applicationConfig.getBooleanPropertyValue(COMPRESS_OUTPUT, true);
    }
}
