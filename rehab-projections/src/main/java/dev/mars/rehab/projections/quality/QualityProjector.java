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

import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.RepObservation;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.projections.AbstractProjector;
import dev.mars.rehab.projections.ProjectorContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects rep observations into form-quality aggregates.
 *
 * <p>The trend compares the mean of the older half of the recent sample window with
 * the mean of the newer half; a difference beyond {@value #TREND_THRESHOLD} points
 * is IMPROVING or DECLINING, anything else (including fewer than two samples) is
 * STABLE. Observations without a form score are not counted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class QualityProjector extends AbstractProjector<QualityState> {

    public static final String ID = "quality";
    public static final double TREND_THRESHOLD = 5.0;
    public static final double LOW_CONFIDENCE_THRESHOLD = 0.5;
    public static final int TOP_ISSUES = 3;

    private final int sampleWindow;

    public QualityProjector(ProjectorContext context) {
        super(ID, context);
        this.sampleWindow = context.getQualitySampleWindow();
    }

    @Override
    protected QualityState initialState(String subjectId) {
        return new QualityState(sampleWindow);
    }

    @Override
    protected QualityState copyState(QualityState state) {
        return state.copy();
    }

    @Override
    protected void fold(QualityState state, Event event) {
        if (event.getKind() != EventKind.REP_OBSERVATION) {
            return;
        }
        RepObservation rep = event.getBody(RepObservation.class);
        if (rep.getFormScore() == null) {
            return;
        }
        double score = rep.getFormScore();
        state.getOverall().add(score, rep.getConfidence(), rep.isAnomalyDetected(), rep.getIssues());
        state.bucketFor(rep.getExerciseId()).add(score, rep.getConfidence(), rep.isAnomalyDetected(), rep.getIssues());
    }

    @Override
    public QualityView query(ProjectionFilters filters) {
        String subjectId = filters.require(ProjectionFilters.SUBJECT_ID);
        Optional<String> exerciseId = filters.get(ProjectionFilters.EXERCISE_ID);
        QualityState state = installedState(subjectId);

        Optional<QualityBucket> bucket = Optional.empty();
        if (state != null) {
            bucket = exerciseId.isPresent() ? state.getExercise(exerciseId.get()) : Optional.of(state.getOverall());
        }
        if (bucket.isEmpty() || bucket.get().getCount() == 0) {
            return new QualityView(subjectId, exerciseId.orElse(null), 0, 0.0, null, null,
                List.of(), QualityView.Trend.STABLE, 0, 0, List.of());
        }

        QualityBucket b = bucket.get();
        return new QualityView(subjectId, exerciseId.orElse(null), b.getCount(), b.getMean(), b.getMin(), b.getMax(),
            b.getSamples(), trend(b.getSamples()), b.getAnomalies(), b.getLowConfidence(), topIssues(b.getIssueCounts()));
    }

    /**
     * Subjects whose overall form quality is trending down, in id order.
     */
    public List<String> decliningSubjects() {
        List<String> declining = new ArrayList<>();
        for (Map.Entry<String, QualityState> entry : installedStates().entrySet()) {
            QualityBucket overall = entry.getValue().getOverall();
            if (overall.getCount() > 0 && trend(overall.getSamples()) == QualityView.Trend.DECLINING) {
                declining.add(entry.getKey());
            }
        }
        Collections.sort(declining);
        return declining;
    }

    static QualityView.Trend trend(List<Double> samples) {
        if (samples.size() < 2) {
            return QualityView.Trend.STABLE;
        }
        int half = samples.size() / 2;
        double older = mean(samples.subList(0, half));
        double newer = mean(samples.subList(half, samples.size()));
        double delta = newer - older;
        if (delta > TREND_THRESHOLD) {
            return QualityView.Trend.IMPROVING;
        }
        if (delta < -TREND_THRESHOLD) {
            return QualityView.Trend.DECLINING;
        }
        return QualityView.Trend.STABLE;
    }

    // Most frequent first, ties broken by name.
    static List<String> topIssues(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));
        List<String> top = new ArrayList<>();
        for (int i = 0; i < Math.min(TOP_ISSUES, entries.size()); i++) {
            top.add(entries.get(i).getKey());
        }
        return top;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
