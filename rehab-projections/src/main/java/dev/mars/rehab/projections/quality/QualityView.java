package dev.mars.rehab.projections.quality;

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

import java.util.List;
import java.util.Objects;

/**
 * Form quality of one subject, across all exercises or for one.
 */
public final class QualityView implements ProjectionView {

    public enum Trend {
        IMPROVING,
        STABLE,
        DECLINING
    }

    private final String subjectId;
    private final String exerciseId;
    private final long repCount;
    private final double meanFormScore;
    private final Double minFormScore;
    private final Double maxFormScore;
    private final List<Double> recentScores;
    private final Trend trend;
    private final int anomalyCount;
    private final int lowConfidenceCount;
    private final List<String> topIssues;

    QualityView(String subjectId, String exerciseId, long repCount, double meanFormScore, Double minFormScore,
                Double maxFormScore, List<Double> recentScores, Trend trend, int anomalyCount,
                int lowConfidenceCount, List<String> topIssues) {
        this.subjectId = subjectId;
        this.exerciseId = exerciseId;
        this.repCount = repCount;
        this.meanFormScore = meanFormScore;
        this.minFormScore = minFormScore;
        this.maxFormScore = maxFormScore;
        this.recentScores = List.copyOf(recentScores);
        this.trend = trend;
        this.anomalyCount = anomalyCount;
        this.lowConfidenceCount = lowConfidenceCount;
        this.topIssues = List.copyOf(topIssues);
    }

    @Override
    public String projection() {
        return QualityProjector.ID;
    }

    public String getSubjectId() { return subjectId; }
    public String getExerciseId() { return exerciseId; }
    public long getRepCount() { return repCount; }
    public double getMeanFormScore() { return meanFormScore; }
    public Double getMinFormScore() { return minFormScore; }
    public Double getMaxFormScore() { return maxFormScore; }
    public List<Double> getRecentScores() { return recentScores; }
    public Trend getTrend() { return trend; }
    public int getAnomalyCount() { return anomalyCount; }
    public int getLowConfidenceCount() { return lowConfidenceCount; }
    public List<String> getTopIssues() { return topIssues; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QualityView that = (QualityView) o;
        return repCount == that.repCount &&
               Double.compare(meanFormScore, that.meanFormScore) == 0 &&
               anomalyCount == that.anomalyCount &&
               lowConfidenceCount == that.lowConfidenceCount &&
               subjectId.equals(that.subjectId) &&
               Objects.equals(exerciseId, that.exerciseId) &&
               Objects.equals(minFormScore, that.minFormScore) &&
               Objects.equals(maxFormScore, that.maxFormScore) &&
               recentScores.equals(that.recentScores) &&
               trend == that.trend &&
               topIssues.equals(that.topIssues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, exerciseId, repCount, meanFormScore, trend, topIssues);
    }

    @Override
    public String toString() {
        return "QualityView{" +
                "subjectId='" + subjectId + '\'' +
                ", exerciseId='" + exerciseId + '\'' +
                ", repCount=" + repCount +
                ", meanFormScore=" + meanFormScore +
                ", trend=" + trend +
                ", topIssues=" + topIssues +
                '}';
    }
}
