package dev.mars.rehab.pipeline.resilience;

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

import dev.mars.rehab.api.error.ConcurrencyConflictException;
import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.pipeline.config.BreakerConfig;
import dev.mars.rehab.test.categories.TestCategories;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class CircuitBreakerManagerTest {

    @Test
    void testOpensAfterTransientFailures() {
        CircuitBreakerManager manager = new CircuitBreakerManager(
            new BreakerConfig(true, 3, Duration.ofMinutes(1), 10, 50.0), new SimpleMeterRegistry());

        for (int i = 0; i < 3; i++) {
            assertThrows(StorageUnavailableException.class, () -> manager.executeStoreOperation("read", () -> {
                throw new StorageUnavailableException("database down");
            }));
        }

        assertThrows(CallNotPermittedException.class, () -> manager.executeStoreOperation("read", () -> 1));
        assertEquals("OPEN", manager.getMetrics("stream-store-read").getState());

        manager.reset("stream-store-read");
        assertEquals(1, manager.executeStoreOperation("read", () -> 1));
    }

    @Test
    void testNonRetryableErrorsDoNotCount() {
        assertFalse(CircuitBreakerManager.isTransient(new ConcurrencyConflictException("p-1", 5, 6)));
        assertTrue(CircuitBreakerManager.isTransient(
            new CompletionException(new StorageUnavailableException("timeout"))));
        assertTrue(CircuitBreakerManager.isTransient(new IllegalStateException("unexpected")));
    }

    @Test
    void testDisabledManagerPassesThrough() {
        CircuitBreakerManager manager = new CircuitBreakerManager(BreakerConfig.disabled(), null);

        assertEquals("ok", manager.executeStoreOperation("read", () -> "ok"));
        assertNull(manager.getCircuitBreaker("anything"));
        assertFalse(manager.getMetrics("stream-store-read").isEnabled());
    }
}
