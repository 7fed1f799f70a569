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
package dev.mars.livesync.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Configuration management for LiveSync.
 *
 * <p>Sources are layered, later ones winning: {@code /livesync-default.properties},
 * {@code /livesync-<profile>.properties}, {@code LIVESYNC_*} environment
 * variables, then {@code livesync.*} system properties. The result is validated
 * eagerly; every problem is reported in a single {@link IllegalStateException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class LiveSyncConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(LiveSyncConfiguration.class);

    private static final Pattern CHANNEL_PATTERN = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final Properties properties;
    private final String profile;

    public LiveSyncConfiguration() {
        this(getActiveProfile());
    }

    public LiveSyncConfiguration(String profile) {
        this(profile, Map.of());
    }

    /**
     * Creates a configuration with programmatic overrides applied on top of all
     * other sources, without touching system properties.
     *
     * @param profile   the configuration profile to use
     * @param overrides property values that win over every other source
     */
    public LiveSyncConfiguration(String profile, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach(properties::setProperty);
        validateConfiguration();
        logger.info("Loaded LiveSync configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("livesync.profile",
               System.getenv("LIVESYNC_PROFILE") != null ? System.getenv("LIVESYNC_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/livesync-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/livesync-" + profile + ".properties");
        }

        System.getenv().forEach((key, value) -> {
            if (key.startsWith("LIVESYNC_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        // System properties last so tests can override with -D
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("livesync.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateReconnectConfig(errors);
        validateBufferConfig(errors);
        validateDatabaseConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.info("Configuration validation passed");
    }

    private void validateReconnectConfig(List<String> errors) {
        String mode = getString("livesync.reconnect.mode", "FIXED");
        ReconnectPolicy.BackoffMode backoffMode = null;
        try {
            backoffMode = ReconnectPolicy.BackoffMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Reconnect mode must be FIXED or EXPONENTIAL");
        }

        Duration initialDelay = getDuration("livesync.reconnect.initial-delay", Duration.ofSeconds(5));
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            errors.add("Reconnect initial delay must be positive");
        }

        Duration maxDelay = getDuration("livesync.reconnect.max-delay", Duration.ofSeconds(30));
        if (backoffMode == ReconnectPolicy.BackoffMode.EXPONENTIAL) {
            if (maxDelay.compareTo(initialDelay) < 0) {
                errors.add("Reconnect max delay must not be shorter than initial delay");
            }
            if (getDouble("livesync.reconnect.multiplier", 2.0) < 1.0) {
                errors.add("Reconnect multiplier must be at least 1.0");
            }
        }

        if (getInt("livesync.reconnect.max-attempts", 0) < 0) {
            errors.add("Reconnect max attempts must be non-negative");
        }
    }

    private void validateBufferConfig(List<String> errors) {
        int queueCapacity = getInt("livesync.queue.capacity", 1024);
        if (queueCapacity < 1 || queueCapacity > 1_000_000) {
            errors.add("Queue capacity must be between 1 and 1000000");
        }

        if (getInt("livesync.hold-buffer.capacity", 1024) < 1) {
            errors.add("Hold buffer capacity must be at least 1");
        }

        if (getInt("livesync.dedup.window-size", 4096) < 1) {
            errors.add("Deduplication window size must be at least 1");
        }

        int maxItems = getInt("livesync.feed.max-items", 20);
        if (maxItems < 1 || maxItems > 1000) {
            errors.add("Feed max items must be between 1 and 1000");
        }
    }

    private void validateDatabaseConfig(List<String> errors) {
        int port = getInt("livesync.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getInt("livesync.database.pool.max-size", 4) < 1) {
            errors.add("Database pool max size must be at least 1");
        }

        if (!CHANNEL_PATTERN.matcher(getString("livesync.pg.channel", "livesync_changes")).matches()) {
            errors.add("PostgreSQL channel must be a lower-case identifier");
        }
    }

    public String getProfile() {
        return profile;
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration builders
    public ReconnectPolicy getReconnectPolicy() {
        return ReconnectPolicy.builder()
            .mode(ReconnectPolicy.BackoffMode.valueOf(
                getString("livesync.reconnect.mode", "FIXED").trim().toUpperCase(Locale.ROOT)))
            .initialDelay(getDuration("livesync.reconnect.initial-delay", Duration.ofSeconds(5)))
            .maxDelay(getDuration("livesync.reconnect.max-delay", Duration.ofSeconds(30)))
            .multiplier(getDouble("livesync.reconnect.multiplier", 2.0))
            .maxAttempts(getInt("livesync.reconnect.max-attempts", 0))
            .build();
    }

    public SyncConfig getSyncConfig() {
        return new SyncConfig(
            getInt("livesync.queue.capacity", 1024),
            getInt("livesync.hold-buffer.capacity", 1024),
            getInt("livesync.dedup.window-size", 4096),
            getInt("livesync.feed.max-items", 20),
            getBoolean("livesync.notifications.enabled", true),
            getBoolean("livesync.posts.enabled", true)
        );
    }

    public DatabaseConfig getDatabaseConfig() {
        return new DatabaseConfig(
            getString("livesync.database.host", "localhost"),
            getInt("livesync.database.port", 5432),
            getString("livesync.database.name", "livesync"),
            getString("livesync.database.username", "livesync"),
            getString("livesync.database.password", ""),
            getInt("livesync.database.pool.max-size", 4),
            getString("livesync.pg.channel", "livesync_changes")
        );
    }

    // Configuration data classes
    public static class SyncConfig {
        private final int queueCapacity;
        private final int holdBufferCapacity;
        private final int dedupWindowSize;
        private final int feedMaxItems;
        private final boolean notificationsEnabled;
        private final boolean postsEnabled;

        public SyncConfig(int queueCapacity, int holdBufferCapacity, int dedupWindowSize,
                          int feedMaxItems, boolean notificationsEnabled, boolean postsEnabled) {
            this.queueCapacity = queueCapacity;
            this.holdBufferCapacity = holdBufferCapacity;
            this.dedupWindowSize = dedupWindowSize;
            this.feedMaxItems = feedMaxItems;
            this.notificationsEnabled = notificationsEnabled;
            this.postsEnabled = postsEnabled;
        }

        public int getQueueCapacity() { return queueCapacity; }
        public int getHoldBufferCapacity() { return holdBufferCapacity; }
        public int getDedupWindowSize() { return dedupWindowSize; }
        public int getFeedMaxItems() { return feedMaxItems; }
        public boolean isNotificationsEnabled() { return notificationsEnabled; }
        public boolean isPostsEnabled() { return postsEnabled; }
    }

    public static class DatabaseConfig {
        private final String host;
        private final int port;
        private final String database;
        private final String username;
        private final String password;
        private final int poolMaxSize;
        private final String channel;

        public DatabaseConfig(String host, int port, String database, String username,
                              String password, int poolMaxSize, String channel) {
            this.host = host;
            this.port = port;
            this.database = database;
            this.username = username;
            this.password = password;
            this.poolMaxSize = poolMaxSize;
            this.channel = channel;
        }

        public String getHost() { return host; }
        public int getPort() { return port; }
        public String getDatabase() { return database; }
        public String getUsername() { return username; }
        public String getPassword() { return password; }
        public int getPoolMaxSize() { return poolMaxSize; }
        public String getChannel() { return channel; }
    }
}
