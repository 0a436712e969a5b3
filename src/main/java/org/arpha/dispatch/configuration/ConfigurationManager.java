package org.arpha.dispatch.configuration;

import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    static final String DEFAULT_RESOURCE = "dispatch.properties";

    private static ConfigurationManager INSTANCE;
    private final Properties properties;

    private ConfigurationManager(Properties properties) {
        this.properties = properties;
    }

    public static synchronized ConfigurationManager getINSTANCE() {
        if (INSTANCE == null) {
            INSTANCE = new ConfigurationManager(loadResource(DEFAULT_RESOURCE));
        }

        return INSTANCE;
    }

    /**
     * Layers the properties of the given file over the classpath defaults.
     */
    public static synchronized void overrideProperties(String path) {
        Properties merged = new Properties();
        merged.putAll(getINSTANCE().properties);

        try (FileInputStream input = new FileInputStream(path)) {
            merged.load(input);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", path, e);
            throw new ConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", path, e);
            throw new ConfigurationException("Error loading configuration file: " + path, e);
        }
        INSTANCE = new ConfigurationManager(merged);
    }

    public static ConfigurationManager of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ConfigurationManager(copy);
    }

    static Properties loadResource(String resource) {
        Properties properties = new Properties();
        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                log.warn("Configuration resource {} not found on classpath, using defaults", resource);
                return properties;
            }
            properties.load(input);
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", resource, e);
            throw new ConfigurationException("Error loading configuration resource: " + resource, e);
        }
        return properties;
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer format for property: {}", key, e);
                throw new ConfigurationException("Invalid integer format for property: " + key, e);
            }
        } else {
            log.info("Using default value for property: {}", key);
        }
        return defaultValue;
    }

}
