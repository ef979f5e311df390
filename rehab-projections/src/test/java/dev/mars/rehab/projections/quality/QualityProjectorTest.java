package dev.mars.rehab.projections.quality;

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
import dev.mars.rehab.api.events.RepObservation;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.eventstore.checkpoint.InMemoryCheckpointStore;
import dev.mars.rehab.projections.ProjectorContext;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class QualityProjectorTest {

    private QualityProjector projector;

    @BeforeEach
    void setUp() {
        projector = new QualityProjector(ProjectorContext.builder()
            .streamStore(new InMemoryStreamStore())
            .checkpointStore(new InMemoryCheckpointStore())
            .rebuildExecutor(Runnable::run)
            .qualitySampleWindow(4)
            .build());
    }

    @Test
    void testAggregatesAndImprovingTrend() {
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            EventFixtures.rep("squat", 1, 40),
            EventFixtures.rep("squat", 2, 60),
            EventFixtures.rep("squat", 3, 62),
            EventFixtures.rep("squat", 4, 70),
            EventFixtures.rep("squat", 5, 75)));

        QualityView view = projector.query(ProjectionFilters.subject("p-1"));

        assertEquals(5, view.getRepCount());
        assertEquals(61.4, view.getMeanFormScore(), 1e-9);
        assertEquals(40.0, view.getMinFormScore());
        assertEquals(75.0, view.getMaxFormScore());
        assertEquals(List.of(60.0, 62.0, 70.0, 75.0), view.getRecentScores());
        assertEquals(QualityView.Trend.IMPROVING, view.getTrend());
    }

    @Test
    void testDecliningAndStableTrends() {
        assertEquals(QualityView.Trend.DECLINING, QualityProjector.trend(List.of(90.0, 88.0, 70.0, 72.0)));
        assertEquals(QualityView.Trend.STABLE, QualityProjector.trend(List.of(80.0, 82.0, 78.0, 84.0)));
        assertEquals(QualityView.Trend.STABLE, QualityProjector.trend(List.of(55.0)));
    }

    @Test
    void testDecliningSubjectsAcrossStreams() {
        projector.applyBatch("p-2", EventFixtures.stream("p-2", 1,
            EventFixtures.rep("squat", 1, 90),
            EventFixtures.rep("squat", 2, 88),
            EventFixtures.rep("squat", 3, 70),
            EventFixtures.rep("squat", 4, 72)));
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            EventFixtures.rep("lunge", 1, 85),
            EventFixtures.rep("lunge", 2, 60)));
        projector.applyBatch("p-3", EventFixtures.stream("p-3", 1,
            EventFixtures.rep("squat", 1, 60),
            EventFixtures.rep("squat", 2, 75)));
        projector.applyBatch("p-4", EventFixtures.stream("p-4", 1, EventFixtures.pain("squat", 3)));

        assertEquals(List.of("p-1", "p-2"), projector.decliningSubjects());
    }

    @Test
    void testAnomaliesConfidenceAndTopIssues() {
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            new RepObservation(null, "squat", 1, 50.0, 0.3, null, true, List.of("knee_valgus", "depth")),
            new RepObservation(null, "squat", 2, 55.0, 0.9, null, false, List.of("knee_valgus")),
            new RepObservation(null, "squat", 3, 60.0, 0.4, null, true, List.of("tempo", "depth", "knee_valgus")),
            new RepObservation(null, "squat", 4, 65.0, 0.8, null, false, List.of("back_angle")),
            new RepObservation(null, "lunge", 1, null, 0.2, null, true, List.of("balance"))));

        QualityView view = projector.query(ProjectionFilters.subject("p-1"));

        assertEquals(4, view.getRepCount());
        assertEquals(2, view.getAnomalyCount());
        assertEquals(2, view.getLowConfidenceCount());
        assertEquals(List.of("knee_valgus", "depth", "back_angle"), view.getTopIssues());
    }

    @Test
    void testExerciseFilter() {
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            EventFixtures.rep("squat", 1, 80),
            EventFixtures.rep("lunge", 1, 50),
            EventFixtures.rep("lunge", 2, 70)));

        QualityView lunge = projector.query(ProjectionFilters.builder().subjectId("p-1").exerciseId("lunge").build());
        QualityView missing = projector.query(ProjectionFilters.builder().subjectId("p-1").exerciseId("plank").build());

        assertEquals(2, lunge.getRepCount());
        assertEquals(60.0, lunge.getMeanFormScore(), 1e-9);
        assertEquals(QualityView.Trend.IMPROVING, lunge.getTrend());
        assertEquals(0, missing.getRepCount());
        assertNull(missing.getMinFormScore());
        assertEquals(QualityView.Trend.STABLE, missing.getTrend());
    }

    @Test
    void testMissingSubjectIsInvalidQuery() {
        assertThrows(InvalidQueryException.class, () -> projector.query(ProjectionFilters.of(Map.of("exercise_id", "squat"))));
    }
}
