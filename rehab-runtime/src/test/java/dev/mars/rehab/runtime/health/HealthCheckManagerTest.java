package dev.mars.rehab.runtime.health;

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


import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.pipeline.ProjectionPipeline;
import dev.mars.rehab.pipeline.config.BreakerConfig;
import dev.mars.rehab.pipeline.config.PipelineConfig;
import dev.mars.rehab.pipeline.deadletter.InMemoryDeadLetterQueue;
import dev.mars.rehab.pipeline.metrics.PipelineMetrics;
import dev.mars.rehab.pipeline.resilience.CircuitBreakerManager;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class HealthCheckManagerTest {

    private HealthCheckManager manager;

    @BeforeEach
    void setUp() {
        manager = new HealthCheckManager(Duration.ofSeconds(30), Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void testOverallStatusAggregatesComponents() {
        manager.registerHealthCheck("a", () -> HealthStatus.healthy("a"));
        manager.registerHealthCheck("b", () -> HealthStatus.healthy("b", Map.of("k", 1)));
        assertEquals(OverallHealthStatus.State.UP, manager.checkNow().getStatus());
        assertTrue(manager.isHealthy());

        manager.registerHealthCheck("c", () -> HealthStatus.degraded("c", "slow", Map.of()));
        OverallHealthStatus degraded = manager.checkNow();
        assertEquals(OverallHealthStatus.State.DEGRADED, degraded.getStatus());
        assertEquals(2, degraded.getHealthyCount());
        assertEquals(1, degraded.getDegradedCount());
        assertFalse(manager.isHealthy());

        manager.registerHealthCheck("d", () -> HealthStatus.unhealthy("d", "gone"));
        assertEquals(OverallHealthStatus.State.DOWN, manager.checkNow().getStatus());
    }

    @Test
    void testThrowingAndSlowChecksAreUnhealthy() {
        manager.registerHealthCheck("throws", () -> {
            throw new IllegalStateException("boom");
        });
        manager.registerHealthCheck("slow", () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return HealthStatus.healthy("slow");
        });

        OverallHealthStatus status = manager.checkNow();

        assertEquals(OverallHealthStatus.State.DOWN, status.getStatus());
        assertTrue(manager.getHealthStatus("throws").getMessage().contains("boom"));
        assertEquals("Health check timed out", manager.getHealthStatus("slow").getMessage());
    }

    @Test
    void testProjectionLagStatusNamesFurthestBehindProjector() {
        Map<String, Long> lag = new LinkedHashMap<>();
        lag.put("adherence", 0L);
        lag.put("quality", 12L);
        lag.put("work_queue", 4L);

        HealthStatus degraded = HealthStatus.projectionLag(RehabHealthChecks.PROJECTION_LAG, lag, 10);
        assertTrue(degraded.isDegraded());
        assertEquals("Projector quality is 12 event(s) behind", degraded.getMessage());
        assertEquals(Optional.of("quality"), degraded.getLaggingProjector());
        assertEquals(4L, degraded.getProjectorLag("work_queue").getAsLong());
        assertTrue(degraded.getProjectorLag("patient_summary").isEmpty());
        assertEquals(12L, degraded.getDetails().get("max_lag"));
        assertEquals(List.of("adherence", "quality", "work_queue"), List.copyOf(degraded.getProjectorLag().keySet()));

        HealthStatus healthy = HealthStatus.projectionLag(RehabHealthChecks.PROJECTION_LAG, lag, 12);
        assertTrue(healthy.isHealthy());
        assertNull(healthy.getMessage());
        assertEquals(Optional.of("quality"), healthy.getLaggingProjector());

        HealthStatus idle = HealthStatus.projectionLag(RehabHealthChecks.PROJECTION_LAG, Map.of("adherence", 0L), 0);
        assertTrue(idle.isHealthy());
        assertTrue(idle.getLaggingProjector().isEmpty());
        assertTrue(HealthStatus.healthy("a").getProjectorLag().isEmpty());
    }

    @Test
    void testStartAndStop() {
        manager.registerHealthCheck("a", () -> HealthStatus.healthy("a"));

        manager.start();
        assertTrue(manager.isRunning());
        manager.stop();
        assertFalse(manager.isRunning());
    }

    @Test
    void testRestartResumesPeriodicChecks() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        try (HealthCheckManager periodic = new HealthCheckManager(Duration.ofMillis(20), Duration.ofMillis(200))) {
            periodic.registerHealthCheck("counted", () -> {
                runs.incrementAndGet();
                return HealthStatus.healthy("counted");
            });

            periodic.start();
            awaitRuns(runs, 1);
            periodic.stop();

            int afterStop = runs.get();
            periodic.start();
            assertTrue(periodic.isRunning());
            awaitRuns(runs, afterStop + 2);
            assertTrue(periodic.isHealthy());
        }
    }

    @Test
    void testRuntimeChecks() {
        InMemoryStreamStore store = new InMemoryStreamStore();
        InMemoryDeadLetterQueue deadLetters = new InMemoryDeadLetterQueue();
        ProjectionPipeline pipeline = new ProjectionPipeline(store, List.of(), deadLetters,
            PipelineConfig.builder().concurrency(1).build(),
            new CircuitBreakerManager(BreakerConfig.disabled(), null), new PipelineMetrics("health-test"));
        try {
            Event event = store.append("p-1", EventFixtures.rep("squat", 1, 75.0), null, ExpectedVersion.ANY).join();
            assertEquals(1, event.getStreamVersion());

            HealthStatus storeStatus = RehabHealthChecks.streamStore(store, Duration.ofSeconds(1)).check();
            assertTrue(storeStatus.isHealthy());
            assertEquals(1L, storeStatus.getDetails().get("events"));

            assertTrue(RehabHealthChecks.pipelineRunning(pipeline).check().isUnhealthy());
            pipeline.start();
            assertTrue(RehabHealthChecks.pipelineRunning(pipeline).check().isHealthy());

            assertTrue(RehabHealthChecks.deadLetters(deadLetters, 0).check().isHealthy());
            deadLetters.record("quality", "p-1", 1, 1, 5, "timeout");
            assertTrue(RehabHealthChecks.deadLetters(deadLetters, 0).check().isDegraded());
            assertTrue(RehabHealthChecks.deadLetters(deadLetters, 1).check().isHealthy());

            HealthStatus lag = RehabHealthChecks.projectionLag(pipeline, 0).check();
            assertTrue(lag.isHealthy());
            assertTrue(lag.getProjectorLag().isEmpty());

            store.close();
            assertTrue(RehabHealthChecks.streamStore(store, Duration.ofSeconds(1)).check().isUnhealthy());
        } finally {
            pipeline.close();
            store.close();
        }
    }

    private static void awaitRuns(AtomicInteger runs, int atLeast) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (runs.get() < atLeast) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + atLeast + " health check run(s), saw " + runs.get());
            }
            Thread.sleep(10);
        }
    }
}
