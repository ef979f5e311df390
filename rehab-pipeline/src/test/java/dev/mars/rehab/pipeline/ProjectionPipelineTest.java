package dev.mars.rehab.pipeline;

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

import dev.mars.rehab.api.deadletter.DeadLetterEntry;
import dev.mars.rehab.api.error.InvalidQueryException;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.projection.ProjectionStatus;
import dev.mars.rehab.api.projection.RebuildHandle;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.eventstore.checkpoint.InMemoryCheckpointStore;
import dev.mars.rehab.pipeline.config.BreakerConfig;
import dev.mars.rehab.pipeline.config.PipelineConfig;
import dev.mars.rehab.pipeline.deadletter.InMemoryDeadLetterQueue;
import dev.mars.rehab.pipeline.metrics.PipelineMetrics;
import dev.mars.rehab.pipeline.resilience.CircuitBreakerManager;
import dev.mars.rehab.projections.ProjectorContext;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ProjectionPipelineTest {

    private InMemoryStreamStore store;
    private InMemoryDeadLetterQueue deadLetters;
    private PipelineMetrics metrics;
    private ProjectorContext context;
    private ProjectionPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryStreamStore();
        deadLetters = new InMemoryDeadLetterQueue();
        metrics = new PipelineMetrics("test");
        context = ProjectorContext.builder()
            .streamStore(store)
            .checkpointStore(new InMemoryCheckpointStore())
            .rebuildExecutor(Runnable::run)
            .build();
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        store.close();
    }

    @Test
    void testDeliversEveryEventInStreamOrder() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        pipeline = pipeline(config().build(), projector);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        metrics.bindTo(registry);
        pipeline.start();

        List<Thread> writers = new ArrayList<>();
        for (int w = 0; w < 3; w++) {
            String subjectId = "p-" + w;
            int count = 17 + w * 5;
            Thread writer = new Thread(() -> appendReps(subjectId, count));
            writers.add(writer);
            writer.start();
        }
        for (Thread writer : writers) {
            writer.join();
        }

        for (int w = 0; w < 3; w++) {
            String subjectId = "p-" + w;
            long tail = 17 + w * 5;
            awaitCondition(subjectId + " caught up", () -> projector.checkpoint(subjectId) == tail);
            assertEquals(LongStream.rangeClosed(1, tail).boxed().collect(Collectors.toList()),
                projector.versions(subjectId));
        }
        assertEquals(0, deadLetters.count());
        assertTrue(registry.get("rehab.pipeline.batches.applied").counter().count() > 0);
        awaitCondition("lag drained", () -> registry.get("rehab.projection.lag").gauge().value() == 0.0);
        assertTrue(pipeline.status("recording").isCaughtUp());
    }

    @Test
    void testEventsAppendedBeforeStartAreCaughtUp() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        appendReps("p-1", 12);

        pipeline = pipeline(config().build(), projector);
        pipeline.start();

        awaitCondition("catch-up", () -> projector.checkpoint("p-1") == 12);
    }

    @Test
    void testRetryThenSucceedAppliesExactlyOnce() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        projector.failNext(3);
        pipeline = pipeline(config().batchSize(10).maxAttempts(4).build(), projector);
        pipeline.start();

        appendReps("p-1", 3);

        awaitCondition("applied after retries", () -> projector.checkpoint("p-1") == 3);
        assertEquals(List.of(1L, 2L, 3L), projector.versions("p-1"));
        assertEquals(0, deadLetters.count());
        assertEquals(3, metrics.getBatchesRetried());
        assertEquals(0, metrics.getBatchesDeadLettered());
    }

    @Test
    void testExhaustedRetriesDeadLetterWithoutBlockingOtherSubjects() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        projector.poison("poison");
        pipeline = pipeline(config().concurrency(1).batchSize(10).build(), projector);
        pipeline.start();

        appendReps("poison", 3);
        appendReps("healthy", 8);

        awaitCondition("dead letter", () -> deadLetters.count("recording") >= 1);
        awaitCondition("healthy subject applied", () -> projector.checkpoint("healthy") == 8);
        awaitCondition("poisoned range skipped", () -> projector.checkpoint("poison") == 3);

        DeadLetterEntry entry = deadLetters.entries("recording").get(0);
        assertEquals("poison", entry.getSubjectId());
        assertEquals(1, entry.getFromVersion());
        assertEquals(3, entry.getAttempts());
        assertTrue(entry.getReason().contains("poisoned subject"));
        assertEquals(List.of(), projector.versions("poison"));
        long deadLettered = deadLetters.count("recording");

        projector.cure("poison");
        appendReps("healthy", 4);
        appendReps("poison", 2);
        awaitCondition("healthy keeps flowing", () -> projector.checkpoint("healthy") == 12);
        awaitCondition("later poison batches apply", () -> projector.checkpoint("poison") == 5);
        assertEquals(List.of(4L, 5L), projector.versions("poison"));
        ProjectionStatus status = pipeline.status("recording");
        assertEquals(deadLettered, status.getDeadLetters());
        assertEquals(0, status.getLag());

        RebuildHandle redrive = pipeline.rebuild("recording", "poison");
        redrive.completion().get(5, TimeUnit.SECONDS);
        assertEquals(LongStream.rangeClosed(1, 5).boxed().collect(Collectors.toList()), projector.versions("poison"));

        appendReps("poison", 1);
        awaitCondition("redriven subject flows again", () -> projector.checkpoint("poison") == 6);
        assertEquals(LongStream.rangeClosed(1, 6).boxed().collect(Collectors.toList()), projector.versions("poison"));
        assertEquals(deadLettered, deadLetters.count());
    }

    @Test
    void testBatchesAfterDeadLetterApplyForSameSubject() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        projector.failNext(3);
        pipeline = pipeline(config().concurrency(1).build(), projector);
        pipeline.start();

        appendReps("p-1", 5);
        awaitCondition("dead letter", () -> deadLetters.count("recording") == 1);
        DeadLetterEntry entry = deadLetters.entries("recording").get(0);
        assertEquals(1, entry.getFromVersion());

        appendReps("p-1", 5);
        awaitCondition("later batches applied", () -> projector.checkpoint("p-1") == 10);
        assertEquals(LongStream.rangeClosed(entry.getToVersion() + 1, 10).boxed().collect(Collectors.toList()),
            projector.versions("p-1"));
        assertEquals(1, deadLetters.count());
        assertEquals(1, metrics.getBatchesDeadLettered());
    }

    @Test
    void testRestartAfterStopResumesDelivery() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        pipeline = pipeline(config().build(), projector);
        pipeline.start();
        appendReps("p-1", 4);
        awaitCondition("delivery before stop", () -> projector.checkpoint("p-1") == 4);

        pipeline.stop();
        assertFalse(pipeline.isRunning());
        appendReps("p-1", 3);
        assertEquals(4, projector.checkpoint("p-1"));

        pipeline.start();
        assertTrue(pipeline.isRunning());
        awaitCondition("catch-up after restart", () -> projector.checkpoint("p-1") == 7);
        appendReps("p-1", 2);
        awaitCondition("live delivery after restart", () -> projector.checkpoint("p-1") == 9);
        assertEquals(LongStream.rangeClosed(1, 9).boxed().collect(Collectors.toList()), projector.versions("p-1"));
    }

    @Test
    void testFullLaneDoesNotHoldBackOtherLanes() throws Exception {
        RecordingProjector slow = new RecordingProjector("slow", context);
        RecordingProjector fast = new RecordingProjector("fast", context);
        CountDownLatch release = new CountDownLatch(1);
        slow.stall("a", release);
        pipeline = pipeline(config().queueCapacity(5).batchSize(5).applyTimeout(Duration.ofSeconds(20)).build(),
            slow, fast);
        pipeline.start();

        try {
            appendReps("a", 30);
            appendReps("b", 10);

            awaitCondition("fast projector drained a", () -> fast.checkpoint("a") == 30);
            awaitCondition("slow projector drained b", () -> slow.checkpoint("b") == 10);
            assertEquals(0, slow.checkpoint("a"));
            assertTrue(pipeline.pendingEvents("slow", "a") <= 5);
        } finally {
            release.countDown();
        }

        awaitCondition("slow projector drained a", () -> slow.checkpoint("a") == 30);
        assertEquals(0, deadLetters.count());
    }

    @Test
    void testSupervisorRestartsDeadWorker() throws Exception {
        RecordingProjector projector = new RecordingProjector("recording", context);
        pipeline = pipeline(config().concurrency(1).build(), projector);
        pipeline.start();
        appendReps("p-1", 3);
        awaitCondition("initial delivery", () -> projector.checkpoint("p-1") == 3);

        Thread original = pipeline.workerThread(0);
        original.interrupt();
        original.join(5000);

        awaitCondition("worker restarted", () -> pipeline.getWorkerRestarts() >= 1
            && pipeline.workerThread(0) != original && pipeline.workerThread(0).isAlive());

        appendReps("p-1", 4);
        awaitCondition("delivery after restart", () -> projector.checkpoint("p-1") == 7);
        assertEquals(LongStream.rangeClosed(1, 7).boxed().collect(Collectors.toList()), projector.versions("p-1"));
    }

    @Test
    void testUnknownProjectionIsRejected() {
        pipeline = pipeline(config().build(), new RecordingProjector("recording", context));

        assertThrows(InvalidQueryException.class, () -> pipeline.status("nope"));
        assertThrows(InvalidQueryException.class, () -> pipeline.rebuild("nope", null));
    }

    private ProjectionPipeline pipeline(PipelineConfig config, RecordingProjector... projectors) {
        return new ProjectionPipeline(store, List.of(projectors), deadLetters, config,
            new CircuitBreakerManager(BreakerConfig.defaults(), null), metrics);
    }

    private static PipelineConfig.Builder config() {
        return PipelineConfig.builder()
            .concurrency(2)
            .batchSize(5)
            .batchTimeout(Duration.ofMillis(10))
            .queueCapacity(20)
            .applyThreads(4)
            .applyTimeout(Duration.ofSeconds(2))
            .maxAttempts(3)
            .initialBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(20))
            .catchUpInterval(Duration.ofMillis(100));
    }

    private void appendReps(String subjectId, int count) {
        for (int i = 0; i < count; i++) {
            EventBody rep = EventFixtures.rep("squat", i + 1, 70 + (i % 20));
            store.append(subjectId, rep, null, ExpectedVersion.ANY).join();
        }
    }

    static void awaitCondition(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(15);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }
}
