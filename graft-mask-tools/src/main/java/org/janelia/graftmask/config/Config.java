package org.janelia.graftmask.config;

import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

/**
 * Property based configuration.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = properties.getProperty(name);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public int getIntegerPropertyValue(String name, int defaultValue) {
        String value = getStringPropertyValue(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value '" + value + "' for " + name, e);
        }
    }

    public double getDoublePropertyValue(String name, double defaultValue) {
        String value = getStringPropertyValue(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value '" + value + "' for " + name, e);
        }
    }
}
