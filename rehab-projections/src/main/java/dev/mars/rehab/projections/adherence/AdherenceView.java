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

import dev.mars.rehab.api.projection.ProjectionView;

import java.time.Instant;
import java.util.Objects;

/**
 * Exercise adherence of one subject, optionally narrowed to one exercise.
 */
public final class AdherenceView implements ProjectionView {

    private final String subjectId;
    private final String exerciseId;
    private final int sessionsTotal;
    private final int sessionsCompleted;
    private final int sessionsAbandoned;
    private final int sessionsInProgress;
    private final double adherenceRate;
    private final int repsCompleted;
    private final int repsPlanned;
    private final Instant lastSessionAt;
    private final int activeDays;
    private final int currentStreakDays;
    private final int longestStreakDays;

    AdherenceView(String subjectId, String exerciseId, int sessionsTotal, int sessionsCompleted, int sessionsAbandoned,
                  int sessionsInProgress, double adherenceRate, int repsCompleted, int repsPlanned,
                  Instant lastSessionAt, int activeDays, int currentStreakDays, int longestStreakDays) {
        this.subjectId = subjectId;
        this.exerciseId = exerciseId;
        this.sessionsTotal = sessionsTotal;
        this.sessionsCompleted = sessionsCompleted;
        this.sessionsAbandoned = sessionsAbandoned;
        this.sessionsInProgress = sessionsInProgress;
        this.adherenceRate = adherenceRate;
        this.repsCompleted = repsCompleted;
        this.repsPlanned = repsPlanned;
        this.lastSessionAt = lastSessionAt;
        this.activeDays = activeDays;
        this.currentStreakDays = currentStreakDays;
        this.longestStreakDays = longestStreakDays;
    }

    @Override
    public String projection() {
        return AdherenceProjector.ID;
    }

    public String getSubjectId() { return subjectId; }
    public String getExerciseId() { return exerciseId; }
    public int getSessionsTotal() { return sessionsTotal; }
    public int getSessionsCompleted() { return sessionsCompleted; }
    public int getSessionsAbandoned() { return sessionsAbandoned; }
    public int getSessionsInProgress() { return sessionsInProgress; }
    public double getAdherenceRate() { return adherenceRate; }
    public int getRepsCompleted() { return repsCompleted; }
    public int getRepsPlanned() { return repsPlanned; }
    public Instant getLastSessionAt() { return lastSessionAt; }
    public int getActiveDays() { return activeDays; }
    public int getCurrentStreakDays() { return currentStreakDays; }
    public int getLongestStreakDays() { return longestStreakDays; }

    public double getRepCompletionRate() {
        return repsPlanned == 0 ? 0.0 : (double) repsCompleted / repsPlanned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AdherenceView that = (AdherenceView) o;
        return sessionsTotal == that.sessionsTotal &&
               sessionsCompleted == that.sessionsCompleted &&
               sessionsAbandoned == that.sessionsAbandoned &&
               sessionsInProgress == that.sessionsInProgress &&
               Double.compare(adherenceRate, that.adherenceRate) == 0 &&
               repsCompleted == that.repsCompleted &&
               repsPlanned == that.repsPlanned &&
               activeDays == that.activeDays &&
               currentStreakDays == that.currentStreakDays &&
               longestStreakDays == that.longestStreakDays &&
               subjectId.equals(that.subjectId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               Objects.equals(lastSessionAt, that.lastSessionAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, exerciseId, sessionsTotal, sessionsCompleted, adherenceRate, lastSessionAt);
    }

    @Override
    public String toString() {
        return "AdherenceView{" +
                "subjectId='" + subjectId + '\'' +
                ", exerciseId='" + exerciseId + '\'' +
                ", sessions=" + sessionsCompleted + "/" + sessionsTotal +
                ", adherenceRate=" + adherenceRate +
                ", currentStreakDays=" + currentStreakDays +
                '}';
    }
}
