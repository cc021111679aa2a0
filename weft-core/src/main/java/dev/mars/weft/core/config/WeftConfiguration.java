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

package dev.mars.weft.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for Weft hosts.
 *
 * <p>Loads configuration from weft.properties with environment variable override support.
 * Environment variables take precedence and use uppercase with underscores
 * (e.g., weft.rpc.timeout-ms -> WEFT_RPC_TIMEOUT_MS).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public final class WeftConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(WeftConfiguration.class);
    private static final String CONFIG_FILE = "weft.properties";

    public static final String RPC_TIMEOUT_MS = "weft.rpc.timeout-ms";
    public static final String BROADCAST_TIMEOUT_MS = "weft.broadcast.timeout-ms";
    public static final String PERSISTENCE_TYPE = "weft.persistence.type";
    public static final String PERSISTENCE_PATH = "weft.persistence.path";
    public static final String PERSISTENCE_FSYNC = "weft.persistence.fsync";
    public static final String ADDRESS_PREFIX = "weft.address.prefix";
    public static final String RETAINED_TERMINATED = "weft.control.retained-terminated";

    private static volatile WeftConfiguration instance;

    private final Properties properties;

    private WeftConfiguration(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the singleton configuration instance, loading weft.properties on first use.
     */
    public static WeftConfiguration get() {
        WeftConfiguration result = instance;
        if (result == null) {
            synchronized (WeftConfiguration.class) {
                result = instance;
                if (result == null) {
                    Properties properties = new Properties();
                    loadProperties(properties);
                    result = new WeftConfiguration(properties);
                    result.logConfiguration();
                    instance = result;
                }
            }
        }
        return result;
    }

    /**
     * Creates a configuration backed by the given properties instead of
     * weft.properties. Environment variables and system properties still
     * take precedence.
     */
    public static WeftConfiguration fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new WeftConfiguration(copy);
    }

    // ==================== Control Configuration ====================

    /**
     * Timeout of a controller RPC. A request unanswered within this bound
     * fails with a control timeout.
     */
    public long getRpcTimeoutMs() {
        return getLong(RPC_TIMEOUT_MS, 10000);
    }

    /**
     * Delivery bound of a state-change broadcast. Broadcasts that cannot be
     * delivered within it are dropped with a warning.
     */
    public long getBroadcastTimeoutMs() {
        return getLong(BROADCAST_TIMEOUT_MS, 2000);
    }

    public String getAddressPrefix() {
        return getString(ADDRESS_PREFIX, "weft");
    }

    /**
     * How many terminated processes keep answering control RPCs with their
     * final state. Zero removes the pid address as soon as a process terminates.
     */
    public int getRetainedTerminated() {
        return getInt(RETAINED_TERMINATED, 1024);
    }

    // ==================== Persistence Configuration ====================

    /**
     * Gets the checkpoint store type.
     * Supported values: "memory" (default), "file".
     */
    public String getPersistenceType() {
        return getString(PERSISTENCE_TYPE, "memory");
    }

    public String getPersistencePath() {
        return getString(PERSISTENCE_PATH, "./data/checkpoints");
    }

    /**
     * Whether the file store fsyncs each checkpoint.
     * Defaults to true for durability; set to false only for testing.
     */
    public boolean getPersistenceFsync() {
        return getBoolean(PERSISTENCE_FSYNC, true);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with environment variable and system property override.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., WEFT_RPC_TIMEOUT_MS)</li>
     *   <li>System property (e.g., -Dweft.rpc.timeout-ms=5000)</li>
     *   <li>Properties file (weft.properties)</li>
     *   <li>Default value</li>
     * </ol>
     *
     * @param key the property key (e.g., "weft.rpc.timeout-ms")
     * @param defaultValue the default value if not found
     * @return the resolved property value
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private static void loadProperties(Properties properties) {
        try (InputStream input = WeftConfiguration.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }

    private void logConfiguration() {
        logger.info("=== Weft Configuration ===");
        logger.info("  RPC Timeout:          {}ms", getRpcTimeoutMs());
        logger.info("  Broadcast Timeout:    {}ms", getBroadcastTimeoutMs());
        logger.info("  Address Prefix:       {}", getAddressPrefix());
        logger.info("  --- Persistence ---");
        logger.info("  Type:                 {}", getPersistenceType());
        logger.info("  Path:                 {}", getPersistencePath());
        logger.info("  Fsync:                {}", getPersistenceFsync());
        logger.info("==========================");
    }
}
