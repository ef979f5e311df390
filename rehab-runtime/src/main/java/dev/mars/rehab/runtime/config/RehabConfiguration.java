package dev.mars.rehab.runtime.config;

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


import dev.mars.rehab.pipeline.config.BreakerConfig;
import dev.mars.rehab.pipeline.config.PipelineConfig;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Layered configuration for the tracking runtime.
 *
 * <p>Sources are applied in order, later ones winning: {@code /rehab-default.properties},
 * {@code /rehab-<profile>.properties}, {@code REHAB_*} environment variables, explicit
 * overrides, then {@code rehab.*} system properties. Durations use ISO-8601
 * ({@code PT0.05S}) or a bare number of milliseconds.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class RehabConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RehabConfiguration.class);

    public static final String DEFAULT_PROFILE = "default";
    private static final String PREFIX = "rehab.";
    private static final String ENV_PREFIX = "REHAB_";

    private final Properties properties;
    private final String profile;

    public RehabConfiguration() {
        this(getActiveProfile());
    }

    public RehabConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Loads the profile and applies programmatic overrides on top of it, without
     * touching system properties.
     */
    public RehabConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile, overrides);
        validateConfiguration();
        logger.info("Loaded RehabTrack configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        String env = System.getenv("REHAB_PROFILE");
        return System.getProperty("rehab.profile", env != null ? env : DEFAULT_PROFILE);
    }

    private Properties loadProperties(String profile, Properties overrides) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/rehab-default.properties");
        if (!DEFAULT_PROFILE.equals(profile)) {
            loadPropertiesFromResource(props, "/rehab-" + profile + ".properties");
        }

        applyEnvironment(props, System.getenv());

        overrides.forEach((key, value) -> props.setProperty(key.toString(), value.toString()));

        // System properties last so -D always wins
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(PREFIX)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Maps {@code REHAB_*} variables onto property keys. A variable matches an already
     * known key when the key's dots and dashes are read as underscores, so
     * {@code REHAB_PIPELINE_BATCH_SIZE} sets {@code rehab.pipeline.batch-size}; otherwise
     * underscores become dots.
     */
    static void applyEnvironment(Properties props, Map<String, String> environment) {
        environment.forEach((key, value) -> {
            if (!key.startsWith(ENV_PREFIX) || "REHAB_PROFILE".equals(key)) {
                return;
            }
            String normalized = key.toLowerCase(Locale.ROOT);
            String target = null;
            for (String known : props.stringPropertyNames()) {
                if (known.replace('.', '_').replace('-', '_').equals(normalized)) {
                    target = known;
                    break;
                }
            }
            props.setProperty(target != null ? target : normalized.replace('_', '.'), value);
        });
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

        validateStoreConfig(errors);
        validatePipelineConfig(errors);
        validateProjectionConfig(errors);
        validateCircuitBreakerConfig(errors);
        validateHealthCheckConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateStoreConfig(List<String> errors) {
        String type = getString("rehab.store.type", StoreType.MEMORY.key());
        if (StoreType.fromKey(type) == null) {
            errors.add("Store type must be 'memory' or 'postgres', was '" + type + "'");
            return;
        }
        if (StoreType.fromKey(type) != StoreType.POSTGRES) {
            return;
        }
        if (getString("rehab.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }
        int port = getInt("rehab.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }
        if (getString("rehab.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }
        if (getString("rehab.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }
        if (getInt("rehab.database.pool.max-size", 16) < 1) {
            errors.add("Maximum pool size must be at least 1");
        }
    }

    private void validatePipelineConfig(List<String> errors) {
        requireAtLeast(errors, "rehab.pipeline.concurrency", 10, 1, "Pipeline concurrency");
        requireAtLeast(errors, "rehab.pipeline.batch-size", 100, 1, "Pipeline batch size");
        requireAtLeast(errors, "rehab.pipeline.queue-capacity", 1000, 1, "Pipeline queue capacity");
        requireAtLeast(errors, "rehab.pipeline.max-attempts", 5, 1, "Pipeline max attempts");
        if (getDouble("rehab.pipeline.backoff-multiplier", 2.0) < 1.0) {
            errors.add("Pipeline backoff multiplier must be at least 1.0");
        }
        Duration initial = getDuration("rehab.pipeline.initial-backoff", Duration.ofMillis(10));
        Duration max = getDuration("rehab.pipeline.max-backoff", Duration.ofSeconds(1));
        if (max.compareTo(initial) < 0) {
            errors.add("Pipeline max backoff must be greater than or equal to initial backoff");
        }
        if (getDuration("rehab.pipeline.apply-timeout", Duration.ofSeconds(5)).isZero()) {
            errors.add("Pipeline apply timeout must be positive");
        }
        if (getDuration("rehab.pipeline.catch-up-interval", Duration.ofSeconds(1)).toMillis() < 10) {
            errors.add("Pipeline catch-up interval must be at least 10ms");
        }
    }

    private void validateProjectionConfig(List<String> errors) {
        requireAtLeast(errors, "rehab.projection.rebuild-page-size", 500, 1, "Projection rebuild page size");
        requireAtLeast(errors, "rehab.projection.quality-sample-window", 50, 2, "Quality sample window");
        requireAtLeast(errors, "rehab.projection.rebuild-threads", 2, 1, "Projection rebuild threads");
    }

    private void validateCircuitBreakerConfig(List<String> errors) {
        if (!getBoolean("rehab.circuit-breaker.enabled", true)) {
            return;
        }
        requireAtLeast(errors, "rehab.circuit-breaker.failure-threshold", 5, 1, "Circuit breaker failure threshold");
        if (getDuration("rehab.circuit-breaker.wait-duration", Duration.ofSeconds(30)).toMillis() < 1000) {
            errors.add("Circuit breaker wait duration must be at least 1000ms");
        }
        double rate = getDouble("rehab.circuit-breaker.failure-rate-threshold", 50.0);
        if (rate <= 0 || rate > 100) {
            errors.add("Circuit breaker failure rate threshold must be in (0, 100]");
        }
    }

    private void validateHealthCheckConfig(List<String> errors) {
        if (getLong("rehab.health-check.lag-threshold", 10000) < 0) {
            errors.add("Health check lag threshold must be non-negative");
        }
        if (getLong("rehab.health-check.dead-letter-threshold", 0) < 0) {
            errors.add("Health check dead letter threshold must be non-negative");
        }
    }

    private void requireAtLeast(List<String> errors, String key, int defaultValue, int min, String label) {
        if (getInt(key, defaultValue) < min) {
            errors.add(label + " must be at least " + min);
        }
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

    public double getDouble(String key, double defaultValue) {
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

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (DateTimeParseException | NumberFormatException e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public String getProfile() {
        return profile;
    }

    /**
     * @return a copy of the effective properties
     */
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }

    // Typed sections
    public StoreConfig getStoreConfig() {
        return new StoreConfig(
            StoreType.fromKey(getString("rehab.store.type", StoreType.MEMORY.key())),
            getString("rehab.database.host", "localhost"),
            getInt("rehab.database.port", 5432),
            getString("rehab.database.name", "rehab"),
            getString("rehab.database.username", "rehab"),
            getString("rehab.database.password", ""),
            getBoolean("rehab.database.ssl.enabled", false),
            getBoolean("rehab.database.initialize-schema", true),
            getInt("rehab.database.pool.max-size", 16),
            getInt("rehab.database.pool.max-wait-queue-size", 128),
            Duration.ofMillis(getLong("rehab.database.pool.connection-timeout-ms", 30000)),
            Duration.ofMillis(getLong("rehab.database.pool.idle-timeout-ms", 600000))
        );
    }

    public PipelineConfig getPipelineConfig() {
        return PipelineConfig.builder()
            .concurrency(getInt("rehab.pipeline.concurrency", 10))
            .batchSize(getInt("rehab.pipeline.batch-size", 100))
            .batchTimeout(getDuration("rehab.pipeline.batch-timeout", Duration.ofMillis(50)))
            .queueCapacity(getInt("rehab.pipeline.queue-capacity", 1000))
            .applyTimeout(getDuration("rehab.pipeline.apply-timeout", Duration.ofSeconds(5)))
            .applyThreads(getInt("rehab.pipeline.apply-threads", 0))
            .maxAttempts(getInt("rehab.pipeline.max-attempts", 5))
            .initialBackoff(getDuration("rehab.pipeline.initial-backoff", Duration.ofMillis(10)))
            .maxBackoff(getDuration("rehab.pipeline.max-backoff", Duration.ofSeconds(1)))
            .backoffMultiplier(getDouble("rehab.pipeline.backoff-multiplier", 2.0))
            .catchUpInterval(getDuration("rehab.pipeline.catch-up-interval", Duration.ofSeconds(1)))
            .build();
    }

    public ProjectionConfig getProjectionConfig() {
        return new ProjectionConfig(
            getInt("rehab.projection.rebuild-page-size", 500),
            getInt("rehab.projection.quality-sample-window", 50),
            getInt("rehab.projection.rebuild-threads", 2)
        );
    }

    public BreakerConfig getCircuitBreakerConfig() {
        return new BreakerConfig(
            getBoolean("rehab.circuit-breaker.enabled", true),
            getInt("rehab.circuit-breaker.failure-threshold", 5),
            getDuration("rehab.circuit-breaker.wait-duration", Duration.ofSeconds(30)),
            getInt("rehab.circuit-breaker.ring-buffer-size", 100),
            getDouble("rehab.circuit-breaker.failure-rate-threshold", 50.0)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("rehab.metrics.enabled", true),
            getString("rehab.metrics.instance-id", "rehab-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    public HealthCheckConfig getHealthCheckConfig() {
        return new HealthCheckConfig(
            getBoolean("rehab.health-check.enabled", true),
            getDuration("rehab.health-check.interval", Duration.ofSeconds(30)),
            getDuration("rehab.health-check.timeout", Duration.ofSeconds(5)),
            getLong("rehab.health-check.lag-threshold", 10000),
            getLong("rehab.health-check.dead-letter-threshold", 0)
        );
    }

    @Override
    public String toString() {
        return "RehabConfiguration{profile='" + profile + "', store=" + getString("rehab.store.type", "memory") + '}';
    }

    // Configuration data classes
    public enum StoreType {
        MEMORY("memory"),
        POSTGRES("postgres");

        private final String key;

        StoreType(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        static StoreType fromKey(String key) {
            for (StoreType type : values()) {
                if (type.key.equalsIgnoreCase(key.trim())) {
                    return type;
                }
            }
            return null;
        }
    }

    public static class StoreConfig {
        private final StoreType type;
        private final String host;
        private final int port;
        private final String database;
        private final String username;
        private final String password;
        private final boolean sslEnabled;
        private final boolean initializeSchema;
        private final int maxPoolSize;
        private final int maxWaitQueueSize;
        private final Duration connectionTimeout;
        private final Duration idleTimeout;

        public StoreConfig(StoreType type, String host, int port, String database, String username,
                           String password, boolean sslEnabled, boolean initializeSchema, int maxPoolSize,
                           int maxWaitQueueSize, Duration connectionTimeout, Duration idleTimeout) {
            this.type = type;
            this.host = host;
            this.port = port;
            this.database = database;
            this.username = username;
            this.password = password;
            this.sslEnabled = sslEnabled;
            this.initializeSchema = initializeSchema;
            this.maxPoolSize = maxPoolSize;
            this.maxWaitQueueSize = maxWaitQueueSize;
            this.connectionTimeout = connectionTimeout;
            this.idleTimeout = idleTimeout;
        }

        public StoreType getType() { return type; }
        public String getHost() { return host; }
        public int getPort() { return port; }
        public String getDatabase() { return database; }
        public String getUsername() { return username; }
        public String getPassword() { return password; }
        public boolean isSslEnabled() { return sslEnabled; }
        public boolean isInitializeSchema() { return initializeSchema; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public int getMaxWaitQueueSize() { return maxWaitQueueSize; }
        public Duration getConnectionTimeout() { return connectionTimeout; }
        public Duration getIdleTimeout() { return idleTimeout; }

        public PgConnectOptions toConnectOptions() {
            PgConnectOptions connectOptions = new PgConnectOptions()
                .setHost(host)
                .setPort(port)
                .setDatabase(database)
                .setUser(username)
                .setPassword(password);
            connectOptions.setSslMode(sslEnabled ? SslMode.REQUIRE : SslMode.DISABLE);
            return connectOptions;
        }

        public PoolOptions toPoolOptions() {
            return new PoolOptions()
                .setMaxSize(maxPoolSize)
                .setMaxWaitQueueSize(maxWaitQueueSize)
                .setConnectionTimeout((int) connectionTimeout.toSeconds())
                .setConnectionTimeoutUnit(TimeUnit.SECONDS)
                .setIdleTimeout((int) idleTimeout.toSeconds())
                .setIdleTimeoutUnit(TimeUnit.SECONDS);
        }

        @Override
        public String toString() {
            // never prints the password
            return "StoreConfig{type=" + type + ", host='" + host + "', port=" + port
                + ", database='" + database + "', username='" + username + "', maxPoolSize=" + maxPoolSize + '}';
        }
    }

    public static class ProjectionConfig {
        private final int rebuildPageSize;
        private final int qualitySampleWindow;
        private final int rebuildThreads;

        public ProjectionConfig(int rebuildPageSize, int qualitySampleWindow, int rebuildThreads) {
            this.rebuildPageSize = rebuildPageSize;
            this.qualitySampleWindow = qualitySampleWindow;
            this.rebuildThreads = rebuildThreads;
        }

        public int getRebuildPageSize() { return rebuildPageSize; }
        public int getQualitySampleWindow() { return qualitySampleWindow; }
        public int getRebuildThreads() { return rebuildThreads; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public static class HealthCheckConfig {
        private final boolean enabled;
        private final Duration interval;
        private final Duration timeout;
        private final long lagThreshold;
        private final long deadLetterThreshold;

        public HealthCheckConfig(boolean enabled, Duration interval, Duration timeout,
                                 long lagThreshold, long deadLetterThreshold) {
            this.enabled = enabled;
            this.interval = interval;
            this.timeout = timeout;
            this.lagThreshold = lagThreshold;
            this.deadLetterThreshold = deadLetterThreshold;
        }

        public boolean isEnabled() { return enabled; }
        public Duration getInterval() { return interval; }
        public Duration getTimeout() { return timeout; }

        /**
         * Total lag above which the lag check reports DEGRADED.
         */
        public long getLagThreshold() { return lagThreshold; }

        /**
         * Dead letter count above which the dead letter check reports DEGRADED.
         */
        public long getDeadLetterThreshold() { return deadLetterThreshold; }
    }
}
