package org.janelia.atlasreg.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the application configuration. Sources are applied in call order so later sources override earlier ones;
 * environment entries named ATLASREG_Some_Key are finally mapped onto "Some.Key".
 */
public class ApplicationConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationConfigProvider.class);

    private static final String DEFAULT_APPLICATION_CONFIG_RESOURCES = "/atlasreg.properties";
    private static final String ENV_ENTRY_PREFIX = "env.";
    private static final String ATLASREG_ENV_PREFIX = ENV_ENTRY_PREFIX + "atlasreg_";

    private final ApplicationConfig applicationConfig = new ApplicationConfigImpl();

    public ApplicationConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_APPLICATION_CONFIG_RESOURCES)
                .fromEnvironment(System.getenv())
                .fromProperties(System.getProperties());
    }

    public ApplicationConfigProvider fromResource(String resourceName) {
        if (StringUtils.isBlank(resourceName)) {
            return this;
        }
        InputStream resourceStream = this.getClass().getResourceAsStream(resourceName);
        if (resourceStream == null) {
            LOG.warn("Configuration resource {} not found", resourceName);
            return this;
        }
        return read(resourceStream, "resource " + resourceName);
    }

    public ApplicationConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configPath = Paths.get(fileName);
        if (!Files.isRegularFile(configPath)) {
            LOG.warn("Configuration file {} not found", configPath);
            return this;
        }
        try {
            return read(Files.newInputStream(configPath), "file " + configPath);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ApplicationConfigProvider fromEnvironment(Map<String, String> environment) {
        environment.forEach((name, value) -> applicationConfig.put(ENV_ENTRY_PREFIX + name, value));
        return this;
    }

    public ApplicationConfigProvider fromMap(Map<String, String> map) {
        applicationConfig.putAll(map);
        return this;
    }

    public ApplicationConfigProvider fromProperties(Properties properties) {
        properties.stringPropertyNames().forEach(k -> applicationConfig.put(k, properties.getProperty(k)));
        return this;
    }

    private ApplicationConfigProvider read(InputStream configStream, String source) {
        LOG.info("Reading application config from {}", source);
        try (InputStream toRead = configStream) {
            applicationConfig.load(toRead);
        } catch (IOException e) {
            LOG.error("Error reading configuration from {}", source, e);
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ApplicationConfig build() {
        applicationConfig.asMap().forEach((key, value) -> {
            if (key.toLowerCase().startsWith(ATLASREG_ENV_PREFIX)) {
                String settingName = key.substring(ATLASREG_ENV_PREFIX.length()).replace('_', '.');
                LOG.debug("Environment entry {} sets {}", key, settingName);
                applicationConfig.put(settingName, value);
            }
        });
        return applicationConfig;
    }

}
