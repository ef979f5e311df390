package dev.mars.rehab.eventstore.validation;

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

import dev.mars.rehab.api.consent.ConsentRegistry;
import dev.mars.rehab.api.error.RehabException;
import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.api.events.Alert;
import dev.mars.rehab.api.events.Consent;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.events.EventBodyVisitor;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.EventMetadata;
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.events.Feedback;
import dev.mars.rehab.api.events.RepObservation;
import dev.mars.rehab.api.validation.ValidationResult;
import dev.mars.rehab.api.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates an event before it is appended.
 *
 * <p>Every rule is checked and all violations are reported together. The validator
 * never reads the stream; the only external lookup is the consent gate, which asks
 * the {@link ConsentRegistry} whether the consent referenced by a PHI event is
 * active.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class EventValidator {

    private static final Logger logger = LoggerFactory.getLogger(EventValidator.class);

    private static final int MAX_ID_LENGTH = 255;

    private final ConsentRegistry consentRegistry;

    public EventValidator(ConsentRegistry consentRegistry) {
        this.consentRegistry = Objects.requireNonNull(consentRegistry, "consentRegistry cannot be null");
    }

    /**
     * @throws StorageUnavailableException if the consent registry cannot be consulted
     */
    public ValidationResult validate(String subjectId, EventKind kind, EventBody body, EventMetadata meta) {
        List<Violation> violations = new ArrayList<>();

        if (subjectId == null || subjectId.isBlank()) {
            violations.add(Violation.of("subject_id", "is required"));
        } else if (subjectId.length() > MAX_ID_LENGTH) {
            violations.add(Violation.of("subject_id", "must be at most " + MAX_ID_LENGTH + " characters"));
        }

        if (kind == null) {
            violations.add(Violation.of("kind", "is required"));
        }
        if (body == null) {
            violations.add(Violation.of("body", "is required"));
        } else if (kind != null && body.kind() != kind) {
            violations.add(Violation.of("body", "is a " + body.kind() + " but the event kind is " + kind));
        } else {
            violations.addAll(body.accept(new BodyRules()));
        }

        violations.addAll(checkConsentGate(subjectId, meta));

        ValidationResult result = ValidationResult.of(violations);
        if (!result.isValid()) {
            logger.debug("Validation of {} for {} found {} violation(s)", kind, subjectId, violations.size());
        }
        return result;
    }

    private List<Violation> checkConsentGate(String subjectId, EventMetadata meta) {
        if (meta == null || !meta.isPhi()) {
            return List.of();
        }
        String consentId = meta.getConsentId();
        if (consentId == null || consentId.isBlank()) {
            return List.of(Violation.of("meta.consent_id", "is required for PHI events"));
        }
        boolean active;
        try {
            active = consentRegistry.isConsentActive(consentId, subjectId);
        } catch (RehabException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageUnavailableException("Consent registry lookup failed for " + consentId, e);
        }
        return active ? List.of() : List.of(Violation.of("meta.consent_id",
            "consent " + consentId + " is not active for subject " + subjectId));
    }

    /**
     * Field rules per kind.
     */
    private static final class BodyRules implements EventBodyVisitor<List<Violation>> {

        @Override
        public List<Violation> visitExerciseSession(ExerciseSession session) {
            List<Violation> v = new ArrayList<>();
            required(v, "session_id", session.getSessionId());
            required(v, "exercise_id", session.getExerciseId());
            nonNegative(v, "duration_seconds", session.getDurationSeconds());
            nonNegative(v, "reps_planned", session.getRepsPlanned());
            nonNegative(v, "reps", session.getReps());
            if (session.getStartedAt() != null && session.getEndedAt() != null
                    && session.getEndedAt().isBefore(session.getStartedAt())) {
                v.add(Violation.of("ended_at", "must not be before started_at"));
            }
            return v;
        }

        @Override
        public List<Violation> visitRepObservation(RepObservation observation) {
            List<Violation> v = new ArrayList<>();
            required(v, "exercise_id", observation.getExerciseId());
            if (observation.getFormScore() == null) {
                v.add(Violation.of("form_score", "is required"));
            } else {
                inRange(v, "form_score", observation.getFormScore(), 0, 100);
            }
            inRange(v, "confidence", observation.getConfidence(), 0, 1);
            if (observation.getRepNumber() != null && observation.getRepNumber() < 1) {
                v.add(Violation.of("rep_number", "must be >= 1"));
            }
            if (observation.getDurationMs() != null && observation.getDurationMs() < 0) {
                v.add(Violation.of("duration_ms", "must be >= 0"));
            }
            return v;
        }

        @Override
        public List<Violation> visitFeedback(Feedback feedback) {
            List<Violation> v = new ArrayList<>();
            if (feedback.getFeedbackType() == null) {
                v.add(Violation.of("feedback_type", "is required"));
            }
            if (feedback.getSource() == null) {
                v.add(Violation.of("source", "is required"));
            }
            required(v, "content", feedback.getContent());
            if (feedback.getPainLevel() != null) {
                inRange(v, "pain_level", feedback.getPainLevel(), 0, 10);
            } else if (feedback.getFeedbackType() == Feedback.Type.PAIN_SCALE) {
                v.add(Violation.of("pain_level", "is required for PAIN_SCALE feedback"));
            }
            return v;
        }

        @Override
        public List<Violation> visitAlert(Alert alert) {
            List<Violation> v = new ArrayList<>();
            required(v, "alert_id", alert.getAlertId());
            if (alert.getAlertType() == null) {
                v.add(Violation.of("alert_type", "is required"));
            }
            if (alert.getSeverity() == null) {
                v.add(Violation.of("severity", "is required"));
            }
            return v;
        }

        @Override
        public List<Violation> visitConsent(Consent consent) {
            List<Violation> v = new ArrayList<>();
            required(v, "consent_id", consent.getConsentId());
            if (consent.getConsentType() == null) {
                v.add(Violation.of("consent_type", "is required"));
            }
            if (consent.getConsentType() == Consent.Type.SHARING && consent.getTherapistIds().isEmpty()) {
                v.add(Violation.of("therapist_ids", "must list at least one therapist for SHARING consent"));
            }
            if (consent.getTherapistIds().stream().anyMatch(id -> id == null || id.isBlank())) {
                v.add(Violation.of("therapist_ids", "must not contain blank ids"));
            }
            return v;
        }

        private static void required(List<Violation> v, String field, String value) {
            if (value == null || value.isBlank()) {
                v.add(Violation.of(field, "is required"));
            }
        }

        private static void nonNegative(List<Violation> v, String field, Integer value) {
            if (value != null && value < 0) {
                v.add(Violation.of(field, "must be >= 0"));
            }
        }

        private static void inRange(List<Violation> v, String field, Number value, double min, double max) {
            if (value == null) {
                return;
            }
            double d = value.doubleValue();
            if (Double.isNaN(d) || d < min || d > max) {
                v.add(Violation.of(field, "must be between " + format(min) + " and " + format(max)));
            }
        }

        private static String format(double bound) {
            return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
        }
    }
}
