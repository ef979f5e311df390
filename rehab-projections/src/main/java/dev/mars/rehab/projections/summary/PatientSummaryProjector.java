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

import dev.mars.rehab.api.events.Alert;
import dev.mars.rehab.api.events.Consent;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventBodyVisitor;
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.events.Feedback;
import dev.mars.rehab.api.events.RepObservation;
import dev.mars.rehab.api.events.Severity;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.projections.AbstractProjector;
import dev.mars.rehab.projections.ProjectorContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Projects every event kind into a per-subject clinical summary.
 *
 * <p>Risk level, first match wins:</p>
 * <ol>
 *   <li>CRITICAL: an open CRITICAL alert, or latest pain {@code >= 9};</li>
 *   <li>HIGH: an open HIGH alert, or latest pain {@code >= 7};</li>
 *   <li>MEDIUM: any open alert, or average pain {@code >= 4};</li>
 *   <li>LOW otherwise.</li>
 * </ol>
 * Consents are listed as active when granted and unexpired at query time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class PatientSummaryProjector extends AbstractProjector<PatientSummaryState> {

    public static final String ID = "patient_summary";
    public static final int HIGH_PAIN = 7;

    public PatientSummaryProjector(ProjectorContext context) {
        super(ID, context);
    }

    @Override
    protected PatientSummaryState initialState(String subjectId) {
        return new PatientSummaryState();
    }

    @Override
    protected PatientSummaryState copyState(PatientSummaryState state) {
        return state.copy();
    }

    @Override
    protected void fold(PatientSummaryState state, Event event) {
        state.totals.merge(event.getKind(), 1L, Long::sum);
        Instant recordedAt = event.getMeta().getRecordedAt();
        if (recordedAt != null && (state.lastActivity == null || recordedAt.isAfter(state.lastActivity))) {
            state.lastActivity = recordedAt;
        }
        event.getBody().accept(new SummaryFold(state));
    }

    @Override
    public PatientSummaryView query(ProjectionFilters filters) {
        String subjectId = filters.require(ProjectionFilters.SUBJECT_ID);
        PatientSummaryState state = installedState(subjectId);
        if (state == null) {
            return new PatientSummaryView(subjectId, Map.of(), 0, 0, null, 0, 0, null, null, 0, List.of(), null,
                RiskLevel.LOW);
        }

        Instant now = clock().instant();
        List<String> activeConsents = new ArrayList<>();
        state.consents.forEach((id, consent) -> {
            if (consent.isActiveAt(now)) {
                activeConsents.add(id);
            }
        });
        Double averageForm = state.scoredReps == 0 ? null : state.formScoreSum / state.scoredReps;
        Double averagePain = state.painReports == 0 ? null : (double) state.painSum / state.painReports;

        return new PatientSummaryView(subjectId, state.totals, state.completedSessions.size(), state.repCount,
            averageForm, state.painReports, state.highPainReports, averagePain, state.latestPain,
            state.openAlerts.size(), activeConsents, state.lastActivity,
            riskLevel(state.openAlerts.values(), state.latestPain, averagePain));
    }

    static RiskLevel riskLevel(Iterable<Severity> openAlerts, Integer latestPain, Double averagePain) {
        Severity worst = null;
        for (Severity severity : openAlerts) {
            if (worst == null || severity.isAtLeast(worst)) {
                worst = severity;
            }
        }
        int latest = latestPain != null ? latestPain : 0;
        if (worst == Severity.CRITICAL || latest >= 9) {
            return RiskLevel.CRITICAL;
        }
        if (worst == Severity.HIGH || latest >= HIGH_PAIN) {
            return RiskLevel.HIGH;
        }
        if (worst != null || (averagePain != null && averagePain >= 4.0)) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static final class SummaryFold implements EventBodyVisitor<Void> {

        private final PatientSummaryState state;

        SummaryFold(PatientSummaryState state) {
            this.state = state;
        }

        @Override
        public Void visitExerciseSession(ExerciseSession session) {
            if (session.isCompleted() && session.getSessionId() != null) {
                state.completedSessions.add(session.getSessionId());
            }
            return null;
        }

        @Override
        public Void visitRepObservation(RepObservation rep) {
            state.repCount++;
            if (rep.getFormScore() != null) {
                state.scoredReps++;
                state.formScoreSum += rep.getFormScore();
            }
            return null;
        }

        @Override
        public Void visitFeedback(Feedback feedback) {
            Integer pain = feedback.getPainLevel();
            if (pain != null) {
                state.painReports++;
                state.painSum += pain;
                state.latestPain = pain;
                if (pain >= HIGH_PAIN) {
                    state.highPainReports++;
                }
            }
            return null;
        }

        @Override
        public Void visitAlert(Alert alert) {
            if (alert.getStatus() == Alert.Status.RESOLVED) {
                state.openAlerts.remove(alert.getAlertId());
            } else {
                state.openAlerts.put(alert.getAlertId(), alert.getSeverity());
            }
            return null;
        }

        @Override
        public Void visitConsent(Consent consent) {
            state.consents.put(consent.getConsentId(), consent);
            return null;
        }
    }
}
