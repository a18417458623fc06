package org.janelia.atlasreg.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;

public class ApplicationConfigImpl implements ApplicationConfig {
    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public String getStringPropertyValue(String name, String defaultValue) {
        String value = entries.get(name);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    @Override
    public boolean getBooleanPropertyValue(String name, boolean defaultValue) {
        return parse(name, Boolean::valueOf, defaultValue);
    }

    @Override
    public int getIntegerPropertyValue(String name, int defaultValue) {
        return parse(name, Integer::valueOf, defaultValue);
    }

    @Override
    public double getDoublePropertyValue(String name, double defaultValue) {
        return parse(name, Double::valueOf, defaultValue);
    }

    private <T> T parse(String name, Function<String, T> parser, T defaultValue) {
        String value = entries.get(name);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for configuration entry " + name, e);
        }
    }

    @Override
    public void load(InputStream stream) throws IOException {
        Properties loaded = new Properties();
        loaded.load(stream);
        putAll(Maps.fromProperties(loaded));
    }

    @Override
    public void put(String key, String value) {
        if (key != null && value != null) {
            entries.put(key, value);
        }
    }

    @Override
    public void putAll(Map<String, String> properties) {
        properties.forEach(this::put);
    }

    @Override
    public Map<String, String> asMap() {
        return ImmutableMap.copyOf(entries);
    }
}
