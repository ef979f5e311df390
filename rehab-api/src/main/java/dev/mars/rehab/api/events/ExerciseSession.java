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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * An exercise session performed by a patient.
 *
 * <p>Sessions are normally logged once they finish, so a missing {@code status}
 * means {@link Status#COMPLETED}. A session that is logged when it starts and again
 * when it ends shares its {@code session_id} across both events.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class ExerciseSession extends EventBody {

    public enum Status {
        STARTED,
        COMPLETED,
        ABANDONED
    }

    @JsonProperty("session_id")
    private final String sessionId;
    @JsonProperty("exercise_id")
    private final String exerciseId;
    @JsonProperty("exercise_name")
    private final String exerciseName;
    @JsonProperty("started_at")
    private final Instant startedAt;
    @JsonProperty("ended_at")
    private final Instant endedAt;
    @JsonProperty("duration_seconds")
    private final Integer durationSeconds;
    @JsonProperty("reps_planned")
    private final Integer repsPlanned;
    @JsonProperty("reps")
    private final Integer reps;
    @JsonProperty("status")
    private final Status status;
    @JsonProperty("therapist_id")
    private final String therapistId;
    @JsonProperty("device_type")
    private final String deviceType;
    @JsonProperty("app_version")
    private final String appVersion;

    @JsonCreator
    public ExerciseSession(@JsonProperty("session_id") String sessionId,
                           @JsonProperty("exercise_id") String exerciseId,
                           @JsonProperty("exercise_name") String exerciseName,
                           @JsonProperty("started_at") Instant startedAt,
                           @JsonProperty("ended_at") Instant endedAt,
                           @JsonProperty("duration_seconds") Integer durationSeconds,
                           @JsonProperty("reps_planned") Integer repsPlanned,
                           @JsonProperty("reps") Integer reps,
                           @JsonProperty("status") Status status,
                           @JsonProperty("therapist_id") String therapistId,
                           @JsonProperty("device_type") String deviceType,
                           @JsonProperty("app_version") String appVersion) {
        this.sessionId = sessionId;
        this.exerciseId = exerciseId;
        this.exerciseName = exerciseName;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.durationSeconds = durationSeconds;
        this.repsPlanned = repsPlanned;
        this.reps = reps != null ? reps : 0;
        this.status = status != null ? status : Status.COMPLETED;
        this.therapistId = therapistId;
        this.deviceType = deviceType;
        this.appVersion = appVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EventKind kind() {
        return EventKind.EXERCISE_SESSION;
    }

    @Override
    public <R> R accept(EventBodyVisitor<R> visitor) {
        return visitor.visitExerciseSession(this);
    }

    public String getSessionId() { return sessionId; }
    public String getExerciseId() { return exerciseId; }
    public String getExerciseName() { return exerciseName; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public Integer getDurationSeconds() { return durationSeconds; }
    public Integer getRepsPlanned() { return repsPlanned; }
    public Integer getReps() { return reps; }
    public Status getStatus() { return status; }
    public String getTherapistId() { return therapistId; }
    public String getDeviceType() { return deviceType; }
    public String getAppVersion() { return appVersion; }

    @JsonIgnore
    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExerciseSession that = (ExerciseSession) o;
        return Objects.equals(sessionId, that.sessionId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               Objects.equals(exerciseName, that.exerciseName) &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(endedAt, that.endedAt) &&
               Objects.equals(durationSeconds, that.durationSeconds) &&
               Objects.equals(repsPlanned, that.repsPlanned) &&
               Objects.equals(reps, that.reps) &&
               status == that.status &&
               Objects.equals(therapistId, that.therapistId) &&
               Objects.equals(deviceType, that.deviceType) &&
               Objects.equals(appVersion, that.appVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, exerciseId, exerciseName, startedAt, endedAt, durationSeconds,
            repsPlanned, reps, status, therapistId, deviceType, appVersion);
    }

    @Override
    public String toString() {
        return "ExerciseSession{" +
                "sessionId='" + sessionId + '\'' +
                ", exerciseId='" + exerciseId + '\'' +
                ", status=" + status +
                ", reps=" + reps +
                '}';
    }

    public static class Builder {
        private String sessionId;
        private String exerciseId;
        private String exerciseName;
        private Instant startedAt;
        private Instant endedAt;
        private Integer durationSeconds;
        private Integer repsPlanned;
        private Integer reps;
        private Status status;
        private String therapistId;
        private String deviceType;
        private String appVersion;

        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder exerciseId(String exerciseId) { this.exerciseId = exerciseId; return this; }
        public Builder exerciseName(String exerciseName) { this.exerciseName = exerciseName; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder endedAt(Instant endedAt) { this.endedAt = endedAt; return this; }
        public Builder durationSeconds(Integer durationSeconds) { this.durationSeconds = durationSeconds; return this; }
        public Builder repsPlanned(Integer repsPlanned) { this.repsPlanned = repsPlanned; return this; }
        public Builder reps(Integer reps) { this.reps = reps; return this; }
        public Builder status(Status status) { this.status = status; return this; }
        public Builder therapistId(String therapistId) { this.therapistId = therapistId; return this; }
        public Builder deviceType(String deviceType) { this.deviceType = deviceType; return this; }
        public Builder appVersion(String appVersion) { this.appVersion = appVersion; return this; }

        public ExerciseSession build() {
            return new ExerciseSession(sessionId, exerciseId, exerciseName, startedAt, endedAt,
                durationSeconds, repsPlanned, reps, status, therapistId, deviceType, appVersion);
        }
    }
}
