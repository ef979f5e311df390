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

import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.projection.ProjectionView;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Clinical overview of one subject.
 */
public final class PatientSummaryView implements ProjectionView {

    private final String subjectId;
    private final Map<EventKind, Long> totals;
    private final int sessionsCompleted;
    private final long repCount;
    private final Double averageFormScore;
    private final int painReports;
    private final int highPainReports;
    private final Double averagePain;
    private final Integer latestPain;
    private final int openAlerts;
    private final List<String> activeConsents;
    private final Instant lastActivity;
    private final RiskLevel riskLevel;

    PatientSummaryView(String subjectId, Map<EventKind, Long> totals, int sessionsCompleted, long repCount,
                       Double averageFormScore, int painReports, int highPainReports, Double averagePain,
                       Integer latestPain, int openAlerts, List<String> activeConsents, Instant lastActivity,
                       RiskLevel riskLevel) {
        this.subjectId = subjectId;
        this.totals = Collections.unmodifiableMap(totals.isEmpty() ? new EnumMap<>(EventKind.class) : new EnumMap<>(totals));
        this.sessionsCompleted = sessionsCompleted;
        this.repCount = repCount;
        this.averageFormScore = averageFormScore;
        this.painReports = painReports;
        this.highPainReports = highPainReports;
        this.averagePain = averagePain;
        this.latestPain = latestPain;
        this.openAlerts = openAlerts;
        this.activeConsents = List.copyOf(activeConsents);
        this.lastActivity = lastActivity;
        this.riskLevel = riskLevel;
    }

    @Override
    public String projection() {
        return PatientSummaryProjector.ID;
    }

    public String getSubjectId() { return subjectId; }
    public Map<EventKind, Long> getTotals() { return totals; }
    public int getSessionsCompleted() { return sessionsCompleted; }
    public long getRepCount() { return repCount; }
    public Double getAverageFormScore() { return averageFormScore; }
    public int getPainReports() { return painReports; }
    public int getHighPainReports() { return highPainReports; }
    public Double getAveragePain() { return averagePain; }
    public Integer getLatestPain() { return latestPain; }
    public int getOpenAlerts() { return openAlerts; }
    public List<String> getActiveConsents() { return activeConsents; }
    public Instant getLastActivity() { return lastActivity; }
    public RiskLevel getRiskLevel() { return riskLevel; }

    public long getTotal(EventKind kind) {
        return totals.getOrDefault(kind, 0L);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatientSummaryView that = (PatientSummaryView) o;
        return sessionsCompleted == that.sessionsCompleted &&
               repCount == that.repCount &&
               painReports == that.painReports &&
               highPainReports == that.highPainReports &&
               openAlerts == that.openAlerts &&
               subjectId.equals(that.subjectId) &&
               totals.equals(that.totals) &&
               Objects.equals(averageFormScore, that.averageFormScore) &&
               Objects.equals(averagePain, that.averagePain) &&
               Objects.equals(latestPain, that.latestPain) &&
               activeConsents.equals(that.activeConsents) &&
               Objects.equals(lastActivity, that.lastActivity) &&
               riskLevel == that.riskLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, totals, sessionsCompleted, repCount, openAlerts, riskLevel);
    }

    @Override
    public String toString() {
        return "PatientSummaryView{" +
                "subjectId='" + subjectId + '\'' +
                ", totals=" + totals +
                ", sessionsCompleted=" + sessionsCompleted +
                ", openAlerts=" + openAlerts +
                ", riskLevel=" + riskLevel +
                '}';
    }
}
