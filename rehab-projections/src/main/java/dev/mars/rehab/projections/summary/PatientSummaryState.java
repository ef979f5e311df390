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

import dev.mars.rehab.api.events.Consent;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.Severity;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Running per-subject totals behind the patient summary.
 */
public final class PatientSummaryState {

    final Map<EventKind, Long> totals;
    final Set<String> completedSessions;
    final Map<String, Severity> openAlerts;
    final Map<String, Consent> consents;
    long repCount;
    long scoredReps;
    double formScoreSum;
    int painReports;
    int highPainReports;
    long painSum;
    Integer latestPain;
    Instant lastActivity;

    PatientSummaryState() {
        this.totals = new EnumMap<>(EventKind.class);
        this.completedSessions = new LinkedHashSet<>();
        this.openAlerts = new LinkedHashMap<>();
        this.consents = new LinkedHashMap<>();
    }

    private PatientSummaryState(PatientSummaryState other) {
        this.totals = new EnumMap<>(other.totals);
        this.completedSessions = new LinkedHashSet<>(other.completedSessions);
        this.openAlerts = new LinkedHashMap<>(other.openAlerts);
        this.consents = new LinkedHashMap<>(other.consents);
        this.repCount = other.repCount;
        this.scoredReps = other.scoredReps;
        this.formScoreSum = other.formScoreSum;
        this.painReports = other.painReports;
        this.highPainReports = other.highPainReports;
        this.painSum = other.painSum;
        this.latestPain = other.latestPain;
        this.lastActivity = other.lastActivity;
    }

    PatientSummaryState copy() {
        return new PatientSummaryState(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatientSummaryState that = (PatientSummaryState) o;
        return repCount == that.repCount &&
               scoredReps == that.scoredReps &&
               Double.compare(formScoreSum, that.formScoreSum) == 0 &&
               painReports == that.painReports &&
               highPainReports == that.highPainReports &&
               painSum == that.painSum &&
               totals.equals(that.totals) &&
               completedSessions.equals(that.completedSessions) &&
               openAlerts.equals(that.openAlerts) &&
               consents.equals(that.consents) &&
               Objects.equals(latestPain, that.latestPain) &&
               Objects.equals(lastActivity, that.lastActivity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totals, completedSessions, openAlerts, repCount, painReports, latestPain, lastActivity);
    }
}
