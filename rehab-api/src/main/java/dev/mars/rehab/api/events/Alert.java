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

import java.time.Instant;
import java.util.Objects;

/**
 * A clinical alert that needs therapist attention.
 *
 * <p>Alerts are identified by {@code alert_id}. Logging the same id again with a
 * different {@link Status} moves the alert through its lifecycle; a
 * {@link Status#RESOLVED} alert leaves the therapist work queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class Alert extends EventBody {

    public enum Type {
        MISSED_SESSIONS,
        POOR_FORM,
        PAIN_REPORTED,
        NO_PROGRESS,
        DEVICE_ISSUE,
        CUSTOM
    }

    public enum Status {
        OPEN,
        ACKNOWLEDGED,
        RESOLVED
    }

    @JsonProperty("alert_id")
    private final String alertId;
    @JsonProperty("alert_type")
    private final Type alertType;
    @JsonProperty("severity")
    private final Severity severity;
    @JsonProperty("therapist_id")
    private final String therapistId;
    @JsonProperty("exercise_id")
    private final String exerciseId;
    @JsonProperty("message")
    private final String message;
    @JsonProperty("triggered_at")
    private final Instant triggeredAt;
    @JsonProperty("status")
    private final Status status;

    @JsonCreator
    public Alert(@JsonProperty("alert_id") String alertId,
                 @JsonProperty("alert_type") Type alertType,
                 @JsonProperty("severity") Severity severity,
                 @JsonProperty("therapist_id") String therapistId,
                 @JsonProperty("exercise_id") String exerciseId,
                 @JsonProperty("message") String message,
                 @JsonProperty("triggered_at") Instant triggeredAt,
                 @JsonProperty("status") Status status) {
        this.alertId = alertId;
        this.alertType = alertType;
        this.severity = severity;
        this.therapistId = therapistId;
        this.exerciseId = exerciseId;
        this.message = message;
        this.triggeredAt = triggeredAt;
        this.status = status != null ? status : Status.OPEN;
    }

    public static Alert open(String alertId, Type type, Severity severity, String therapistId, Instant triggeredAt) {
        return new Alert(alertId, type, severity, therapistId, null, null, triggeredAt, Status.OPEN);
    }

    public Alert withStatus(Status newStatus) {
        return new Alert(alertId, alertType, severity, therapistId, exerciseId, message, triggeredAt, newStatus);
    }

    @Override
    public EventKind kind() {
        return EventKind.ALERT;
    }

    @Override
    public <R> R accept(EventBodyVisitor<R> visitor) {
        return visitor.visitAlert(this);
    }

    public String getAlertId() { return alertId; }
    public Type getAlertType() { return alertType; }
    public Severity getSeverity() { return severity; }
    public String getTherapistId() { return therapistId; }
    public String getExerciseId() { return exerciseId; }
    public String getMessage() { return message; }
    public Instant getTriggeredAt() { return triggeredAt; }
    public Status getStatus() { return status; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alert that = (Alert) o;
        return Objects.equals(alertId, that.alertId) &&
               alertType == that.alertType &&
               severity == that.severity &&
               Objects.equals(therapistId, that.therapistId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               Objects.equals(message, that.message) &&
               Objects.equals(triggeredAt, that.triggeredAt) &&
               status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, alertType, severity, therapistId, exerciseId, message, triggeredAt, status);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", alertType=" + alertType +
                ", severity=" + severity +
                ", status=" + status +
                '}';
    }
}
