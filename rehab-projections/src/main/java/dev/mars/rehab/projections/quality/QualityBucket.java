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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Running form-quality aggregates for one exercise, or for all exercises of a subject.
 */
public final class QualityBucket {

    private final int window;
    private final ArrayDeque<Double> samples;
    private final Map<String, Integer> issueCounts;
    private long count;
    private double sum;
    private double min = Double.NaN;
    private double max = Double.NaN;
    private int anomalies;
    private int lowConfidence;

    QualityBucket(int window) {
        this.window = window;
        this.samples = new ArrayDeque<>(window);
        this.issueCounts = new TreeMap<>();
    }

    private QualityBucket(QualityBucket other) {
        this.window = other.window;
        this.samples = new ArrayDeque<>(other.samples);
        this.issueCounts = new TreeMap<>(other.issueCounts);
        this.count = other.count;
        this.sum = other.sum;
        this.min = other.min;
        this.max = other.max;
        this.anomalies = other.anomalies;
        this.lowConfidence = other.lowConfidence;
    }

    QualityBucket copy() {
        return new QualityBucket(this);
    }

    void add(double formScore, Double confidence, boolean anomaly, List<String> issues) {
        if (samples.size() == window) {
            samples.removeFirst();
        }
        samples.addLast(formScore);
        count++;
        sum += formScore;
        min = count == 1 ? formScore : Math.min(min, formScore);
        max = count == 1 ? formScore : Math.max(max, formScore);
        if (anomaly) {
            anomalies++;
        }
        if (confidence != null && confidence < QualityProjector.LOW_CONFIDENCE_THRESHOLD) {
            lowConfidence++;
        }
        for (String issue : issues) {
            issueCounts.merge(issue, 1, Integer::sum);
        }
    }

    public List<Double> getSamples() {
        return Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public long getCount() { return count; }
    public double getMean() { return count == 0 ? 0.0 : sum / count; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public int getAnomalies() { return anomalies; }
    public int getLowConfidence() { return lowConfidence; }

    public Map<String, Integer> getIssueCounts() {
        return Collections.unmodifiableMap(issueCounts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QualityBucket that = (QualityBucket) o;
        return window == that.window &&
               count == that.count &&
               Double.compare(sum, that.sum) == 0 &&
               Double.compare(min, that.min) == 0 &&
               Double.compare(max, that.max) == 0 &&
               anomalies == that.anomalies &&
               lowConfidence == that.lowConfidence &&
               getSamples().equals(that.getSamples()) &&
               issueCounts.equals(that.issueCounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(window, count, sum, anomalies, lowConfidence, issueCounts);
    }
}
