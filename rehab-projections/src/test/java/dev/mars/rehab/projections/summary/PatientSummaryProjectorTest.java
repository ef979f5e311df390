package dev.mars.rehab.projections.summary;

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
import dev.mars.rehab.api.events.Alert;
import dev.mars.rehab.api.events.Consent;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.events.Severity;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.eventstore.checkpoint.InMemoryCheckpointStore;
import dev.mars.rehab.projections.ProjectorContext;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PatientSummaryProjectorTest {

    private static final Instant NOW = EventFixtures.BASE_TIME.plus(Duration.ofDays(3));

    private PatientSummaryProjector projector;

    @BeforeEach
    void setUp() {
        projector = new PatientSummaryProjector(ProjectorContext.builder()
            .streamStore(new InMemoryStreamStore())
            .checkpointStore(new InMemoryCheckpointStore())
            .rebuildExecutor(Runnable::run)
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build());
    }

    @Test
    void testSummaryTotals() {
        Consent expired = new Consent("c-2", Consent.Type.RESEARCH, Consent.Status.GRANTED, null,
            NOW.minus(Duration.ofHours(1)), null, null);
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            EventFixtures.dataConsent("c-1"),
            expired,
            EventFixtures.completedSession("s-1", "squat", 0),
            EventFixtures.session("s-2", "squat", ExerciseSession.Status.ABANDONED, 1),
            EventFixtures.rep("squat", 1, 70),
            EventFixtures.rep("squat", 2, 80),
            EventFixtures.pain("squat", 3),
            EventFixtures.pain("squat", 7)));

        PatientSummaryView view = projector.query(ProjectionFilters.subject("p-1"));

        assertEquals(2, view.getTotal(EventKind.EXERCISE_SESSION));
        assertEquals(2, view.getTotal(EventKind.CONSENT));
        assertEquals(0, view.getTotal(EventKind.ALERT));
        assertEquals(1, view.getSessionsCompleted());
        assertEquals(2, view.getRepCount());
        assertEquals(75.0, view.getAverageFormScore(), 1e-9);
        assertEquals(2, view.getPainReports());
        assertEquals(1, view.getHighPainReports());
        assertEquals(5.0, view.getAveragePain(), 1e-9);
        assertEquals(7, view.getLatestPain());
        assertEquals(List.of("c-1"), view.getActiveConsents());
        assertEquals(EventFixtures.BASE_TIME.plusSeconds(8), view.getLastActivity());
        assertEquals(RiskLevel.HIGH, view.getRiskLevel());
    }

    @Test
    void testRiskFollowsOpenAlerts() {
        Alert critical = EventFixtures.alert("a-1", Severity.CRITICAL, 0);
        projector.applyBatch("p-1", EventFixtures.stream("p-1", 1,
            critical,
            EventFixtures.alert("a-2", Severity.LOW, 1)));
        assertEquals(RiskLevel.CRITICAL, projector.query(ProjectionFilters.subject("p-1")).getRiskLevel());

        projector.applyBatch("p-1", EventFixtures.stream("p-1", 3, critical.withStatus(Alert.Status.RESOLVED)));
        PatientSummaryView view = projector.query(ProjectionFilters.subject("p-1"));

        assertEquals(1, view.getOpenAlerts());
        assertEquals(RiskLevel.MEDIUM, view.getRiskLevel());
    }

    @Test
    void testRiskLevelRules() {
        assertEquals(RiskLevel.LOW, PatientSummaryProjector.riskLevel(List.of(), null, null));
        assertEquals(RiskLevel.LOW, PatientSummaryProjector.riskLevel(List.of(), 2, 3.5));
        assertEquals(RiskLevel.MEDIUM, PatientSummaryProjector.riskLevel(List.of(), 2, 4.0));
        assertEquals(RiskLevel.HIGH, PatientSummaryProjector.riskLevel(List.of(Severity.LOW, Severity.HIGH), 1, 1.0));
        assertEquals(RiskLevel.CRITICAL, PatientSummaryProjector.riskLevel(List.of(), 9, 9.0));
    }

    @Test
    void testUnknownSubjectIsLowRisk() {
        PatientSummaryView view = projector.query(ProjectionFilters.subject("nobody"));

        assertEquals(RiskLevel.LOW, view.getRiskLevel());
        assertEquals(0, view.getTotal(EventKind.FEEDBACK));
        assertNull(view.getAverageFormScore());
    }

    @Test
    void testMissingSubjectIsInvalidQuery() {
        assertThrows(InvalidQueryException.class,
            () -> projector.query(ProjectionFilters.therapist(EventFixtures.THERAPIST)));
    }
}
