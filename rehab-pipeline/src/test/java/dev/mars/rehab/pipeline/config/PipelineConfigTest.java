package dev.mars.rehab.pipeline.config;

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

import dev.mars.rehab.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PipelineConfigTest {

    @Test
    void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertEquals(10, config.getConcurrency());
        assertEquals(100, config.getBatchSize());
        assertEquals(Duration.ofMillis(50), config.getBatchTimeout());
        assertEquals(1000, config.getQueueCapacity());
        assertEquals(Duration.ofSeconds(5), config.getApplyTimeout());
        assertEquals(5, config.getMaxAttempts());
        assertEquals(10, config.getApplyThreads());
        assertEquals(Duration.ofSeconds(1), config.getCatchUpInterval());
    }

    @Test
    void testBackoffGrowsExponentiallyUpToCap() {
        PipelineConfig config = PipelineConfig.defaults();

        assertEquals(Duration.ofMillis(10), config.backoffFor(1));
        assertEquals(Duration.ofMillis(20), config.backoffFor(2));
        assertEquals(Duration.ofMillis(80), config.backoffFor(4));
        assertEquals(Duration.ofSeconds(1), config.backoffFor(8));
        assertEquals(Duration.ofSeconds(1), config.backoffFor(30));
    }

    @Test
    void testRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().concurrency(0).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().queueCapacity(-1).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().backoffMultiplier(0.5).build());
    }
}
