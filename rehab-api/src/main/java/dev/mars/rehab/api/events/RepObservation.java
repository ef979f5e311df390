package dev.mars.rehab.api.events;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A single repetition observed by the edge pose-estimation model.
 *
 * <p>{@code form_score} is on a 0-100 scale; {@code confidence} is the model's own
 * confidence in that score on a 0-1 scale.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class RepObservation extends EventBody {

    @JsonProperty("session_id")
    private final String sessionId;
    @JsonProperty("exercise_id")
    private final String exerciseId;
    @JsonProperty("rep_number")
    private final Integer repNumber;
    @JsonProperty("form_score")
    private final Double formScore;
    @JsonProperty("confidence")
    private final Double confidence;
    @JsonProperty("duration_ms")
    private final Long durationMs;
    @JsonProperty("anomaly_detected")
    private final boolean anomalyDetected;
    @JsonProperty("issues")
    private final List<String> issues;

    @JsonCreator
    public RepObservation(@JsonProperty("session_id") String sessionId,
                          @JsonProperty("exercise_id") String exerciseId,
                          @JsonProperty("rep_number") Integer repNumber,
                          @JsonProperty("form_score") Double formScore,
                          @JsonProperty("confidence") Double confidence,
                          @JsonProperty("duration_ms") Long durationMs,
                          @JsonProperty("anomaly_detected") Boolean anomalyDetected,
                          @JsonProperty("issues") List<String> issues) {
        this.sessionId = sessionId;
        this.exerciseId = exerciseId;
        this.repNumber = repNumber;
        this.formScore = formScore;
        this.confidence = confidence != null ? confidence : 1.0;
        this.durationMs = durationMs;
        this.anomalyDetected = anomalyDetected != null && anomalyDetected;
        this.issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static RepObservation of(String exerciseId, double formScore) {
        return new RepObservation(null, exerciseId, null, formScore, null, null, null, null);
    }

    @Override
    public EventKind kind() {
        return EventKind.REP_OBSERVATION;
    }

    @Override
    public <R> R accept(EventBodyVisitor<R> visitor) {
        return visitor.visitRepObservation(this);
    }

    public String getSessionId() { return sessionId; }
    public String getExerciseId() { return exerciseId; }
    public Integer getRepNumber() { return repNumber; }
    public Double getFormScore() { return formScore; }
    public Double getConfidence() { return confidence; }
    public Long getDurationMs() { return durationMs; }
    public boolean isAnomalyDetected() { return anomalyDetected; }
    public List<String> getIssues() { return issues; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RepObservation that = (RepObservation) o;
        return anomalyDetected == that.anomalyDetected &&
               Objects.equals(sessionId, that.sessionId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               Objects.equals(repNumber, that.repNumber) &&
               Objects.equals(formScore, that.formScore) &&
               Objects.equals(confidence, that.confidence) &&
               Objects.equals(durationMs, that.durationMs) &&
               Objects.equals(issues, that.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, exerciseId, repNumber, formScore, confidence, durationMs,
            anomalyDetected, issues);
    }

    @Override
    public String toString() {
        return "RepObservation{" +
                "exerciseId='" + exerciseId + '\'' +
                ", repNumber=" + repNumber +
                ", formScore=" + formScore +
                ", confidence=" + confidence +
                '}';
    }
}
