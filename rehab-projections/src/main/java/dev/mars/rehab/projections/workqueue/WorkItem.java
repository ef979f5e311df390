package dev.mars.rehab.projections.workqueue;

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
import dev.mars.rehab.api.events.Severity;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One open alert waiting for a therapist.
 */
public final class WorkItem {

    /**
     * Most severe first, then oldest, then subject and alert id.
     */
    public static final Comparator<WorkItem> QUEUE_ORDER =
        Comparator.comparing(WorkItem::getSeverity, Comparator.reverseOrder())
            .thenComparing(WorkItem::getTriggeredAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(WorkItem::getSubjectId)
            .thenComparing(WorkItem::getAlertId);

    private final String subjectId;
    private final String alertId;
    private final Alert.Type alertType;
    private final Severity severity;
    private final String therapistId;
    private final String exerciseId;
    private final String message;
    private final Instant triggeredAt;
    private final boolean acknowledged;

    WorkItem(String subjectId, Alert alert) {
        this.subjectId = subjectId;
        this.alertId = alert.getAlertId();
        this.alertType = alert.getAlertType();
        this.severity = alert.getSeverity();
        this.therapistId = alert.getTherapistId();
        this.exerciseId = alert.getExerciseId();
        this.message = alert.getMessage();
        this.triggeredAt = alert.getTriggeredAt();
        this.acknowledged = alert.getStatus() == Alert.Status.ACKNOWLEDGED;
    }

    public String getSubjectId() { return subjectId; }
    public String getAlertId() { return alertId; }
    public Alert.Type getAlertType() { return alertType; }
    public Severity getSeverity() { return severity; }
    public String getTherapistId() { return therapistId; }
    public String getExerciseId() { return exerciseId; }
    public String getMessage() { return message; }
    public Instant getTriggeredAt() { return triggeredAt; }
    public boolean isAcknowledged() { return acknowledged; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkItem that = (WorkItem) o;
        return acknowledged == that.acknowledged &&
               subjectId.equals(that.subjectId) &&
               alertId.equals(that.alertId) &&
               alertType == that.alertType &&
               severity == that.severity &&
               Objects.equals(therapistId, that.therapistId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               Objects.equals(message, that.message) &&
               Objects.equals(triggeredAt, that.triggeredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, alertId, severity, triggeredAt, acknowledged);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "subjectId='" + subjectId + '\'' +
                ", alertId='" + alertId + '\'' +
                ", severity=" + severity +
                ", triggeredAt=" + triggeredAt +
                ", acknowledged=" + acknowledged +
                '}';
    }
}
