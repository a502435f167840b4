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


package dev.mars.tast.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration management for the Tast compiler.
 * Values come from built-in defaults, then the first readable {@code tast.properties}
 * file (working directory, {@code config/}, {@code ~/.tast/}) or the classpath copy,
 * then {@code tast.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TastConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TastConfiguration.class);

    public static final String EXCESS_PASSES_KEY = "tast.validation.excess-passes";
    public static final String PARSE_PARALLELISM_KEY = "tast.parse.parallelism";
    public static final String SOURCE_EXTENSION_KEY = "tast.source.extension";
    public static final String DEFAULT_STRATEGY_KEY = "tast.plan.default-strategy";
    public static final String METRICS_ENABLED_KEY = "tast.metrics.enabled";

    private static final ExcessPassesPolicy DEFAULT_EXCESS_PASSES = ExcessPassesPolicy.IGNORE;
    private static final int DEFAULT_PARSE_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());
    private static final String DEFAULT_SOURCE_EXTENSION = ".tast";
    private static final String DEFAULT_STRATEGY = "topological";

    /** Strategy names accepted by {@link #DEFAULT_STRATEGY_KEY}. */
    public static final Set<String> SUPPORTED_STRATEGIES = Set.of("topological", "dfs", "bfs");

    private final Properties properties;

    public TastConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Creates a configuration from defaults overlaid with the given properties only.
     * Files and system properties are not consulted.
     */
    public TastConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Defaults only.
     */
    public static TastConfiguration defaults() {
        return new TastConfiguration(null);
    }

    // Validation
    public ExcessPassesPolicy getExcessPassesPolicy() {
        String value = properties.getProperty(EXCESS_PASSES_KEY);
        if (value != null) {
            try {
                return ExcessPassesPolicy.fromString(value);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid value for property {}: {}. Using default: {}",
                        EXCESS_PASSES_KEY, value, DEFAULT_EXCESS_PASSES);
            }
        }
        return DEFAULT_EXCESS_PASSES;
    }

    // Parsing
    public int getParseParallelism() {
        int value = getIntProperty(PARSE_PARALLELISM_KEY, DEFAULT_PARSE_PARALLELISM);
        if (value < 1) {
            logger.warn("Property {} must be positive, got {}. Using 1", PARSE_PARALLELISM_KEY, value);
            return 1;
        }
        return value;
    }

    public String getSourceExtension() {
        return getStringProperty(SOURCE_EXTENSION_KEY, DEFAULT_SOURCE_EXTENSION);
    }

    // Planning
    public String getDefaultStrategy() {
        String value = getStringProperty(DEFAULT_STRATEGY_KEY, DEFAULT_STRATEGY).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_STRATEGIES.contains(value)) {
            logger.warn("Invalid value for property {}: {}. Using default: {}",
                    DEFAULT_STRATEGY_KEY, value, DEFAULT_STRATEGY);
            return DEFAULT_STRATEGY;
        }
        return value;
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, true);
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

    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
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
        properties.setProperty(EXCESS_PASSES_KEY, DEFAULT_EXCESS_PASSES.name().toLowerCase(Locale.ROOT));
        properties.setProperty(PARSE_PARALLELISM_KEY, String.valueOf(DEFAULT_PARSE_PARALLELISM));
        properties.setProperty(SOURCE_EXTENSION_KEY, DEFAULT_SOURCE_EXTENSION);
        properties.setProperty(DEFAULT_STRATEGY_KEY, DEFAULT_STRATEGY);
        properties.setProperty(METRICS_ENABLED_KEY, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "tast.properties",
                "config/tast.properties",
                System.getProperty("user.home") + "/.tast/tast.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("tast.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("tast."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TastConfiguration{" +
                "excessPasses=" + getExcessPassesPolicy() +
                ", parseParallelism=" + getParseParallelism() +
                ", sourceExtension='" + getSourceExtension() + '\'' +
                ", defaultStrategy='" + getDefaultStrategy() + '\'' +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
