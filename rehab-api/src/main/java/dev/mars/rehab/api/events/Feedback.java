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

import java.util.Objects;

/**
 * Feedback given to or by a patient: automated coaching, self-reported pain or
 * difficulty, or a therapist note.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class Feedback extends EventBody {

    public enum Type {
        COACHING,
        PAIN_SCALE,
        DIFFICULTY,
        MOTIVATION,
        COMPLETION
    }

    public enum Source {
        SYSTEM,
        PATIENT,
        THERAPIST
    }

    @JsonProperty("feedback_id")
    private final String feedbackId;
    @JsonProperty("session_id")
    private final String sessionId;
    @JsonProperty("exercise_id")
    private final String exerciseId;
    @JsonProperty("feedback_type")
    private final Type feedbackType;
    @JsonProperty("source")
    private final Source source;
    @JsonProperty("content")
    private final String content;
    @JsonProperty("severity")
    private final Severity severity;
    @JsonProperty("pain_level")
    private final Integer painLevel;
    @JsonProperty("acknowledged")
    private final boolean acknowledged;

    @JsonCreator
    public Feedback(@JsonProperty("feedback_id") String feedbackId,
                    @JsonProperty("session_id") String sessionId,
                    @JsonProperty("exercise_id") String exerciseId,
                    @JsonProperty("feedback_type") Type feedbackType,
                    @JsonProperty("source") Source source,
                    @JsonProperty("content") String content,
                    @JsonProperty("severity") Severity severity,
                    @JsonProperty("pain_level") Integer painLevel,
                    @JsonProperty("acknowledged") Boolean acknowledged) {
        this.feedbackId = feedbackId;
        this.sessionId = sessionId;
        this.exerciseId = exerciseId;
        this.feedbackType = feedbackType;
        this.source = source;
        this.content = content;
        this.severity = severity != null ? severity : Severity.LOW;
        this.painLevel = painLevel;
        this.acknowledged = acknowledged != null && acknowledged;
    }

    public static Feedback painReport(String exerciseId, int painLevel) {
        return new Feedback(null, null, exerciseId, Type.PAIN_SCALE, Source.PATIENT,
            "Pain reported: " + painLevel, painLevel >= 7 ? Severity.HIGH : Severity.LOW, painLevel, false);
    }

    @Override
    public EventKind kind() {
        return EventKind.FEEDBACK;
    }

    @Override
    public <R> R accept(EventBodyVisitor<R> visitor) {
        return visitor.visitFeedback(this);
    }

    public String getFeedbackId() { return feedbackId; }
    public String getSessionId() { return sessionId; }
    public String getExerciseId() { return exerciseId; }
    public Type getFeedbackType() { return feedbackType; }
    public Source getSource() { return source; }
    public String getContent() { return content; }
    public Severity getSeverity() { return severity; }
    public Integer getPainLevel() { return painLevel; }
    public boolean isAcknowledged() { return acknowledged; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Feedback that = (Feedback) o;
        return acknowledged == that.acknowledged &&
               Objects.equals(feedbackId, that.feedbackId) &&
               Objects.equals(sessionId, that.sessionId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               feedbackType == that.feedbackType &&
               source == that.source &&
               Objects.equals(content, that.content) &&
               severity == that.severity &&
               Objects.equals(painLevel, that.painLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feedbackId, sessionId, exerciseId, feedbackType, source, content, severity,
            painLevel, acknowledged);
    }

    @Override
    public String toString() {
        return "Feedback{" +
                "feedbackType=" + feedbackType +
                ", source=" + source +
                ", severity=" + severity +
                ", painLevel=" + painLevel +
                '}';
    }
}
