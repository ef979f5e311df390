package dev.mars.rehab.projections.adherence;

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

import dev.mars.rehab.api.error.InvalidQueryException;
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.eventstore.checkpoint.InMemoryCheckpointStore;
import dev.mars.rehab.projections.ProjectorContext;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class AdherenceProjectorTest {

    private AdherenceProjector projector;

    @BeforeEach
    void setUp() {
        projector = new AdherenceProjector(ProjectorContext.builder()
            .streamStore(new InMemoryStreamStore())
            .checkpointStore(new InMemoryCheckpointStore())
            .rebuildExecutor(Runnable::run)
            .build());
    }

    @Test
    void testAdherenceRateAndStreaks() {
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            EventFixtures.session("s-1", "squat", ExerciseSession.Status.STARTED, 0),
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "squat", 1),
            EventFixtures.completedSession("s-3", "lunge", 2),
            EventFixtures.completedSession("s-4", "squat", 4),
            EventFixtures.session("s-5", "squat", ExerciseSession.Status.ABANDONED, 5),
            EventFixtures.session("s-6", "lunge", ExerciseSession.Status.STARTED, 6)));

        AdherenceView view = projector.query(ProjectionFilters.subject("p-1"));

        assertEquals(6, view.getSessionsTotal());
        assertEquals(4, view.getSessionsCompleted());
        assertEquals(1, view.getSessionsAbandoned());
        assertEquals(1, view.getSessionsInProgress());
        assertEquals(4.0 / 6.0, view.getAdherenceRate(), 1e-9);
        assertEquals(4, view.getActiveDays());
        assertEquals(3, view.getLongestStreakDays());
        assertEquals(1, view.getCurrentStreakDays());
        assertEquals(40 + 4 + 4, view.getRepsCompleted());
        assertEquals(60, view.getRepsPlanned());
        assertEquals(EventFixtures.BASE_TIME.plus(Duration.ofDays(6)), view.getLastSessionAt());
        assertEquals("adherence", view.projection());
    }

    @Test
    void testExerciseFilterNarrowsScope() {
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.completedSession("s-2", "lunge", 1),
            EventFixtures.session("s-3", "lunge", ExerciseSession.Status.ABANDONED, 2)));

        AdherenceView lunge = projector.query(ProjectionFilters.builder()
            .subjectId("p-1").exerciseId("lunge").build());

        assertEquals("lunge", lunge.getExerciseId());
        assertEquals(2, lunge.getSessionsTotal());
        assertEquals(0.5, lunge.getAdherenceRate(), 1e-9);
        assertEquals(1, lunge.getCurrentStreakDays());
    }

    @Test
    void testUnknownSubjectHasEmptyView() {
        AdherenceView view = projector.query(ProjectionFilters.subject("nobody"));

        assertEquals(0, view.getSessionsTotal());
        assertEquals(0.0, view.getAdherenceRate());
        assertNull(view.getLastSessionAt());
        assertEquals(0.0, view.getRepCompletionRate());
    }

    @Test
    void testMissingSubjectIsInvalidQuery() {
        assertThrows(InvalidQueryException.class, () -> projector.query(ProjectionFilters.of(Map.of())));
    }

    @Test
    void testStreaksOverConsecutiveDays() {
        LocalDate d = LocalDate.of(2026, 3, 2);
        TreeSet<LocalDate> days = new TreeSet<>(List.of(d, d.plusDays(1), d.plusDays(3), d.plusDays(4), d.plusDays(5)));

        int[] streaks = AdherenceProjector.streaks(days);

        assertEquals(3, streaks[0]);
        assertEquals(3, streaks[1]);
        assertArrayEquals(new int[] {0, 0}, AdherenceProjector.streaks(new TreeSet<>()));
    }
}
