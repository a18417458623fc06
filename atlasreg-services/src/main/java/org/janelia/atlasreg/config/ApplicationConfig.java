package org.janelia.atlasreg.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Flat key/value configuration. Typed getters fall back to the given default when the entry is missing or blank.
 */
public interface ApplicationConfig {
    String getStringPropertyValue(String name, String defaultValue);
    boolean getBooleanPropertyValue(String name, boolean defaultValue);
    int getIntegerPropertyValue(String name, int defaultValue);
    double getDoublePropertyValue(String name, double defaultValue);
    void load(InputStream stream) throws IOException;
    void put(String key, String value);
    void putAll(Map<String, String> properties);
    Map<String, String> asMap();
}
