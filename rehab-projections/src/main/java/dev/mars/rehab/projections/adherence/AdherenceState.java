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

import dev.mars.rehab.api.events.ExerciseSession;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-subject adherence state: the latest known record of every session, keyed by session id.
 */
public final class AdherenceState {

    private final Map<String, SessionRecord> sessions;

    AdherenceState() {
        this.sessions = new LinkedHashMap<>();
    }

    private AdherenceState(Map<String, SessionRecord> sessions) {
        this.sessions = new LinkedHashMap<>(sessions);
    }

    AdherenceState copy() {
        return new AdherenceState(sessions);
    }

    void record(SessionRecord record) {
        sessions.put(record.getSessionId(), record);
    }

    public Collection<SessionRecord> getSessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return sessions.equals(((AdherenceState) o).sessions);
    }

    @Override
    public int hashCode() {
        return sessions.hashCode();
    }

    /**
     * Immutable summary of one session as last reported.
     */
    public static final class SessionRecord {
        private final String sessionId;
        private final String exerciseId;
        private final ExerciseSession.Status status;
        private final int reps;
        private final int repsPlanned;
        private final Instant at;
        private final LocalDate day;

        SessionRecord(String sessionId, String exerciseId, ExerciseSession.Status status, int reps, int repsPlanned,
                      Instant at, LocalDate day) {
            this.sessionId = sessionId;
            this.exerciseId = exerciseId;
            this.status = status;
            this.reps = reps;
            this.repsPlanned = repsPlanned;
            this.at = at;
            this.day = day;
        }

        public String getSessionId() { return sessionId; }
        public String getExerciseId() { return exerciseId; }
        public ExerciseSession.Status getStatus() { return status; }
        public int getReps() { return reps; }
        public int getRepsPlanned() { return repsPlanned; }
        public Instant getAt() { return at; }
        public LocalDate getDay() { return day; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            SessionRecord that = (SessionRecord) o;
            return reps == that.reps &&
                   repsPlanned == that.repsPlanned &&
                   sessionId.equals(that.sessionId) &&
                   Objects.equals(exerciseId, that.exerciseId) &&
                   status == that.status &&
                   Objects.equals(at, that.at) &&
                   Objects.equals(day, that.day);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sessionId, exerciseId, status, reps, repsPlanned, at, day);
        }
    }
}
