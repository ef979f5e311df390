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


import dev.mars.rehab.pipeline.config.PipelineConfig;
import dev.mars.rehab.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class RehabConfigurationTest {

    private static final String TEST_PROFILE = "test";

    @AfterEach
    void tearDown() {
        System.clearProperty("rehab.pipeline.batch-size");
        System.clearProperty("rehab.profile");
    }

    @Test
    void testDefaultProfileMatchesDocumentedDefaults() {
        RehabConfiguration config = new RehabConfiguration(RehabConfiguration.DEFAULT_PROFILE);

        assertEquals(RehabConfiguration.StoreType.MEMORY, config.getStoreConfig().getType());

        PipelineConfig pipeline = config.getPipelineConfig();
        assertEquals(10, pipeline.getConcurrency());
        assertEquals(100, pipeline.getBatchSize());
        assertEquals(Duration.ofMillis(50), pipeline.getBatchTimeout());
        assertEquals(1000, pipeline.getQueueCapacity());
        assertEquals(Duration.ofSeconds(5), pipeline.getApplyTimeout());
        assertEquals(5, pipeline.getMaxAttempts());
        assertEquals(Duration.ofMillis(10), pipeline.getInitialBackoff());
        assertEquals(Duration.ofSeconds(1), pipeline.getMaxBackoff());
        assertEquals(2.0, pipeline.getBackoffMultiplier());

        assertEquals(500, config.getProjectionConfig().getRebuildPageSize());
        assertEquals(50, config.getProjectionConfig().getQualitySampleWindow());
        assertTrue(config.getCircuitBreakerConfig().isEnabled());
        assertEquals(10000, config.getHealthCheckConfig().getLagThreshold());
    }

    @Test
    void testProfileFileOverridesDefaults() {
        RehabConfiguration config = new RehabConfiguration(TEST_PROFILE);

        assertEquals(TEST_PROFILE, config.getProfile());
        assertEquals(4, config.getPipelineConfig().getConcurrency());
        assertEquals(25, config.getPipelineConfig().getBatchSize());
        assertEquals(Duration.ofMillis(200), config.getPipelineConfig().getCatchUpInterval());
        assertEquals(20, config.getProjectionConfig().getQualitySampleWindow());
        assertEquals(50, config.getHealthCheckConfig().getLagThreshold());
        assertEquals("rehab-test", config.getMetricsConfig().getInstanceId());
        // untouched by the profile
        assertEquals(1000, config.getPipelineConfig().getQueueCapacity());
    }

    @Test
    void testOverridesWinOverProfileAndSystemPropertiesWinOverAll() {
        Properties overrides = new Properties();
        overrides.setProperty("rehab.pipeline.batch-size", "40");
        overrides.setProperty("rehab.pipeline.max-attempts", "2");

        RehabConfiguration withOverrides = new RehabConfiguration(TEST_PROFILE, overrides);
        assertEquals(40, withOverrides.getPipelineConfig().getBatchSize());
        assertEquals(2, withOverrides.getPipelineConfig().getMaxAttempts());

        System.setProperty("rehab.pipeline.batch-size", "60");
        RehabConfiguration withSystemProperty = new RehabConfiguration(TEST_PROFILE, overrides);
        assertEquals(60, withSystemProperty.getPipelineConfig().getBatchSize());
        assertEquals(2, withSystemProperty.getPipelineConfig().getMaxAttempts());
    }

    @Test
    void testActiveProfileFromSystemProperty() {
        System.setProperty("rehab.profile", TEST_PROFILE);

        RehabConfiguration config = new RehabConfiguration();

        assertEquals(TEST_PROFILE, config.getProfile());
        assertEquals(4, config.getPipelineConfig().getConcurrency());
    }

    @Test
    void testEnvironmentVariablesMapOntoKnownKeys() {
        Properties props = new Properties();
        props.setProperty("rehab.pipeline.batch-size", "100");
        props.setProperty("rehab.health-check.lag-threshold", "10000");

        RehabConfiguration.applyEnvironment(props, Map.of(
            "REHAB_PIPELINE_BATCH_SIZE", "7",
            "REHAB_HEALTH_CHECK_LAG_THRESHOLD", "3",
            "REHAB_CUSTOM_FLAG", "on",
            "REHAB_PROFILE", "ignored",
            "PATH", "/usr/bin"));

        assertEquals("7", props.getProperty("rehab.pipeline.batch-size"));
        assertEquals("3", props.getProperty("rehab.health-check.lag-threshold"));
        assertEquals("on", props.getProperty("rehab.custom.flag"));
        assertNull(props.getProperty("rehab.profile"));
        assertNull(props.getProperty("path"));
    }

    @Test
    void testTypedGettersFallBackOnInvalidValues() {
        RehabConfiguration config = new RehabConfiguration(TEST_PROFILE);

        assertEquals(1000, config.getInt("rehab.test.invalid.int", 1000));
        assertEquals(9999L, config.getLong("non.existent.property", 9999L));
        assertEquals("fallback", config.getString("non.existent.property", "fallback"));
        assertThrows(IllegalArgumentException.class, () -> config.getString("non.existent.property"));
    }

    @Test
    void testDurationsAcceptIsoAndMilliseconds() {
        Properties overrides = new Properties();
        overrides.setProperty("rehab.pipeline.batch-timeout", "75");
        overrides.setProperty("rehab.pipeline.apply-timeout", "PT2S");
        overrides.setProperty("rehab.pipeline.max-backoff", "soon");

        RehabConfiguration config = new RehabConfiguration(RehabConfiguration.DEFAULT_PROFILE, overrides);

        assertEquals(Duration.ofMillis(75), config.getPipelineConfig().getBatchTimeout());
        assertEquals(Duration.ofSeconds(2), config.getPipelineConfig().getApplyTimeout());
        assertEquals(Duration.ofSeconds(1), config.getPipelineConfig().getMaxBackoff());
    }

    @Test
    void testValidationReportsEveryError() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> new RehabConfiguration("invalid"));

        String message = error.getMessage();
        assertTrue(message.contains("Store type"), message);
        assertTrue(message.contains("Pipeline concurrency"), message);
        assertTrue(message.contains("Projection rebuild page size"), message);
        assertTrue(message.contains("Circuit breaker failure threshold"), message);
    }

    @Test
    void testPostgresStoreRequiresConnectionSettings() {
        Properties overrides = new Properties();
        overrides.setProperty("rehab.store.type", "postgres");
        overrides.setProperty("rehab.database.host", "");
        overrides.setProperty("rehab.database.port", "70000");

        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> new RehabConfiguration(RehabConfiguration.DEFAULT_PROFILE, overrides));

        assertTrue(error.getMessage().contains("Database host is required"));
        assertTrue(error.getMessage().contains("Database port must be between 1 and 65535"));
    }

    @Test
    void testStoreConfigBuildsVertxOptions() {
        Properties overrides = new Properties();
        overrides.setProperty("rehab.store.type", "postgres");
        overrides.setProperty("rehab.database.host", "db.internal");
        overrides.setProperty("rehab.database.port", "5433");
        overrides.setProperty("rehab.database.pool.max-size", "8");

        RehabConfiguration.StoreConfig store =
            new RehabConfiguration(RehabConfiguration.DEFAULT_PROFILE, overrides).getStoreConfig();

        assertEquals(RehabConfiguration.StoreType.POSTGRES, store.getType());
        assertEquals("db.internal", store.toConnectOptions().getHost());
        assertEquals(5433, store.toConnectOptions().getPort());
        assertEquals(8, store.toPoolOptions().getMaxSize());
        assertFalse(store.toString().contains("password"));
    }
}
