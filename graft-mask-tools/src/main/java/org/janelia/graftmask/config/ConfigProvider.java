package org.janelia.graftmask.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from the default classpath resource optionally overridden by a properties file.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/graftmask.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties = new Properties();

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                LOG.debug("Read config from {}", resourceName);
                properties.load(configStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
        return this;
    }

    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configPath = Paths.get(fileName);
        if (!Files.exists(configPath)) {
            throw new IllegalArgumentException("Config file " + fileName + " does not exist");
        }
        try (InputStream configStream = Files.newInputStream(configPath)) {
            LOG.info("Read config from {}", configPath);
            properties.load(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
