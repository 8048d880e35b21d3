/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cyclus.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Cyclus graph compiler.
 *
 * <p>Values are resolved from built-in defaults, then the first readable
 * properties file (the {@code cyclus.config.file} system property, the
 * working directory, the user's home, {@code /etc/cyclus}, then the
 * classpath), then any {@code cyclus.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CyclusConfiguration {
    private static final Logger logger = Logger.getLogger(CyclusConfiguration.class.getName());

    public static final String BACK_COMPAT_KEY = "cyclus.graph.compat.cylc7";
    public static final String MAX_EXPANDED_LINES_KEY = "cyclus.graph.expansion.max.lines";
    public static final String METRICS_ENABLED_KEY = "cyclus.monitoring.metrics.enabled";
    public static final String CONFIG_FILE_PROPERTY = "cyclus.config.file";

    // Default configuration values
    private static final boolean DEFAULT_BACK_COMPAT = false;
    private static final int DEFAULT_MAX_EXPANDED_LINES = 100000;
    private static final boolean DEFAULT_METRICS_ENABLED = true;

    private final Properties properties;

    public CyclusConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public CyclusConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Graph compiler configuration
    public boolean isBackCompat() {
        return getBooleanProperty(BACK_COMPAT_KEY, DEFAULT_BACK_COMPAT);
    }

    public int getMaxExpandedLines() {
        return getIntProperty(MAX_EXPANDED_LINES_KEY, DEFAULT_MAX_EXPANDED_LINES);
    }

    // Monitoring configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, DEFAULT_METRICS_ENABLED);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warning("Non-positive value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(BACK_COMPAT_KEY, String.valueOf(DEFAULT_BACK_COMPAT));
        properties.setProperty(MAX_EXPANDED_LINES_KEY, String.valueOf(DEFAULT_MAX_EXPANDED_LINES));
        properties.setProperty(METRICS_ENABLED_KEY, String.valueOf(DEFAULT_METRICS_ENABLED));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                System.getProperty(CONFIG_FILE_PROPERTY),
                "cyclus.properties",
                "config/cyclus.properties",
                System.getProperty("user.home") + "/.cyclus/cyclus.properties",
                "/etc/cyclus/cyclus.properties"
        };

        for (String configFile : configFiles) {
            if (configFile == null) {
                continue;
            }
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("cyclus.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("cyclus."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "CyclusConfiguration{" +
                "backCompat=" + isBackCompat() +
                ", maxExpandedLines=" + getMaxExpandedLines() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
