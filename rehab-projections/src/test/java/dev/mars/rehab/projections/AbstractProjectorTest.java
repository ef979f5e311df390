package dev.mars.rehab.projections;

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

import dev.mars.rehab.api.checkpoint.Checkpoint;
import dev.mars.rehab.api.error.ProjectorFailureException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.projection.ApplyPhase;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.api.projection.RebuildHandle;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.eventstore.checkpoint.InMemoryCheckpointStore;
import dev.mars.rehab.projections.adherence.AdherenceProjector;
import dev.mars.rehab.projections.adherence.AdherenceView;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Apply, checkpoint and rebuild behaviour shared by every projector, exercised through the adherence projector.
 */
@Tag(TestCategories.CORE)
class AbstractProjectorTest {

    private static final String SUBJECT = "patient-1";

    private InMemoryStreamStore store;
    private FlakyCheckpointStore checkpoints;
    private QueuedExecutor rebuilds;
    private AdherenceProjector projector;

    @BeforeEach
    void setUp() {
        store = new InMemoryStreamStore(Clock.fixed(EventFixtures.BASE_TIME, ZoneOffset.UTC));
        checkpoints = new FlakyCheckpointStore();
        rebuilds = new QueuedExecutor();
        projector = new AdherenceProjector(ProjectorContext.builder()
            .streamStore(store)
            .checkpointStore(checkpoints)
            .rebuildExecutor(rebuilds)
            .clock(Clock.fixed(EventFixtures.BASE_TIME, ZoneOffset.UTC))
            .rebuildPageSize(2)
            .build());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void testApplyAdvancesCheckpointAndPhase() {
        assertEquals(ApplyPhase.IDLE, projector.phase(SUBJECT));

        projector.applyBatch(SUBJECT, append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1)));

        assertEquals(2, projector.checkpoint(SUBJECT));
        assertEquals(2, checkpoints.lastAppliedVersion(AdherenceProjector.ID, SUBJECT));
        assertEquals(ApplyPhase.CHECKPOINTED, projector.phase(SUBJECT));
        assertTrue(projector.subjects().contains(SUBJECT));
    }

    @Test
    void testSkipMovesCheckpointWithoutFolding() {
        List<Event> events = append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1),
            EventFixtures.completedSession("s-3", "squat", 2));
        projector.applyBatch(SUBJECT, events.subList(0, 1));

        assertTrue(projector.skip(SUBJECT, 2, 2));
        assertEquals(2, projector.checkpoint(SUBJECT));
        assertEquals(2, checkpoints.lastAppliedVersion(AdherenceProjector.ID, SUBJECT));
        assertEquals(1, query().getSessionsCompleted());

        projector.applyBatch(SUBJECT, events.subList(2, 3));
        assertEquals(3, projector.checkpoint(SUBJECT));
        assertEquals(2, query().getSessionsCompleted());

        assertFalse(projector.skip(SUBJECT, 1, 2), "range already behind the checkpoint");
        assertFalse(projector.skip(SUBJECT, 6, 8), "range leaves a gap");
        assertEquals(3, projector.checkpoint(SUBJECT));
    }

    @Test
    void testReapplyingSameBatchIsIdempotent() {
        List<Event> batch = append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.session("s-2", "squat", ExerciseSession.Status.ABANDONED, 1));

        projector.applyBatch(SUBJECT, batch);
        AdherenceView once = query();
        projector.applyBatch(SUBJECT, batch);
        projector.applyBatch(SUBJECT, batch.subList(1, 2));

        assertEquals(once, query());
        assertEquals(2, projector.checkpoint(SUBJECT));
    }

    @Test
    void testOverlappingBatchAppliesOnlyNewEvents() {
        List<Event> events = append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1),
            EventFixtures.completedSession("s-3", "squat", 2));

        projector.applyBatch(SUBJECT, events.subList(0, 2));
        projector.applyBatch(SUBJECT, events);

        assertEquals(3, projector.checkpoint(SUBJECT));
        assertEquals(3, query().getSessionsCompleted());
    }

    @Test
    void testVersionGapIsRejectedWithoutChange() {
        List<Event> events = append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1),
            EventFixtures.completedSession("s-3", "squat", 2));
        projector.applyBatch(SUBJECT, events.subList(0, 1));

        ProjectorFailureException e = assertThrows(ProjectorFailureException.class,
            () -> projector.applyBatch(SUBJECT, events.subList(2, 3)));

        assertEquals(AdherenceProjector.ID, e.getProjectorId());
        assertEquals(1, projector.checkpoint(SUBJECT));
        assertEquals(1, query().getSessionsCompleted());
        assertEquals(ApplyPhase.CHECKPOINTED, projector.phase(SUBJECT));
    }

    @Test
    void testFailedCheckpointSaveLeavesViewUntouched() {
        List<Event> events = append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1));
        projector.applyBatch(SUBJECT, events.subList(0, 1));
        AdherenceView before = query();

        checkpoints.failSaves.set(true);
        assertThrows(ProjectorFailureException.class, () -> projector.applyBatch(SUBJECT, events.subList(1, 2)));

        assertEquals(before, query());
        assertEquals(1, projector.checkpoint(SUBJECT));

        checkpoints.failSaves.set(false);
        projector.applyBatch(SUBJECT, events.subList(1, 2));
        assertEquals(2, query().getSessionsCompleted());
    }

    @Test
    void testRebuildMatchesLiveView() throws Exception {
        List<Event> events = append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "lunge", 1),
            EventFixtures.rep("squat", 1, 80),
            EventFixtures.session("s-3", "squat", ExerciseSession.Status.ABANDONED, 3),
            EventFixtures.completedSession("s-4", "squat", 4));
        projector.applyBatch(SUBJECT, events);
        AdherenceView live = query();

        RebuildHandle handle = projector.rebuild(SUBJECT);
        assertEquals(RebuildHandle.State.RUNNING, handle.state());
        rebuilds.runAll();

        handle.completion().get(5, TimeUnit.SECONDS);
        assertEquals(RebuildHandle.State.COMPLETED, handle.state());
        assertEquals(5, handle.totalEvents());
        assertEquals(5, handle.eventsProcessed());
        assertEquals(live, query());
        assertEquals(5, projector.checkpoint(SUBJECT));
    }

    @Test
    void testRebuildCatchesUpWithEventsNotYetApplied() throws Exception {
        projector.applyBatch(SUBJECT, append(EventFixtures.completedSession("s-1", "squat", 0)));
        append(EventFixtures.completedSession("s-2", "squat", 1));

        RebuildHandle handle = projector.rebuildAll();
        rebuilds.runAll();
        handle.completion().get(5, TimeUnit.SECONDS);

        assertEquals(2, projector.checkpoint(SUBJECT));
        assertEquals(2, query().getSessionsCompleted());
        assertTrue(handle.subjectId().isEmpty());
    }

    @Test
    void testCancelledRebuildLeavesViewUntouched() {
        projector.applyBatch(SUBJECT, append(
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1)));
        AdherenceView before = query();

        RebuildHandle handle = projector.rebuild(SUBJECT);
        assertTrue(handle.cancel());
        rebuilds.runAll();

        assertEquals(RebuildHandle.State.CANCELLED, handle.state());
        CompletionException e = assertThrows(CompletionException.class, () -> handle.completion().join());
        assertInstanceOf(CancellationException.class, e.getCause());
        assertFalse(handle.cancel());
        assertEquals(before, query());
        assertEquals(2, projector.checkpoint(SUBJECT));
    }

    @Test
    void testStaleCheckpointsAreClearedOnStartup() {
        InMemoryCheckpointStore durable = new InMemoryCheckpointStore();
        durable.save(new Checkpoint(AdherenceProjector.ID, SUBJECT, 7, EventFixtures.BASE_TIME));

        AdherenceProjector fresh = new AdherenceProjector(ProjectorContext.builder()
            .streamStore(store)
            .checkpointStore(durable)
            .rebuildExecutor(Runnable::run)
            .build());

        assertEquals(0, fresh.checkpoint(SUBJECT));
        assertTrue(durable.loadAll(AdherenceProjector.ID).isEmpty());
    }

    private AdherenceView query() {
        return projector.query(ProjectionFilters.subject(SUBJECT));
    }

    private List<Event> append(EventBody... bodies) {
        long from = store.tailVersion(SUBJECT).join() + 1;
        for (EventBody body : bodies) {
            store.append(SUBJECT, body, null, ExpectedVersion.ANY).join();
        }
        return store.read(SUBJECT, ReadOptions.from(from)).join();
    }

    private static final class FlakyCheckpointStore extends InMemoryCheckpointStore {
        private final AtomicBoolean failSaves = new AtomicBoolean();

        @Override
        public void save(Checkpoint checkpoint) {
            if (failSaves.get()) {
                throw new IllegalStateException("checkpoint store offline");
            }
            super.save(checkpoint);
        }
    }

    private static final class QueuedExecutor implements Executor {
        private final Deque<Runnable> queue = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            queue.add(command);
        }

        void runAll() {
            while (!queue.isEmpty()) {
                queue.poll().run();
            }
        }
    }
}
