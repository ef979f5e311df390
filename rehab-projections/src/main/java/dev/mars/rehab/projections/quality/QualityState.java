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

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-subject quality state: one bucket per exercise plus one across all exercises.
 */
public final class QualityState {

    private final int window;
    private final QualityBucket overall;
    private final Map<String, QualityBucket> byExercise;

    QualityState(int window) {
        this.window = window;
        this.overall = new QualityBucket(window);
        this.byExercise = new TreeMap<>();
    }

    private QualityState(QualityState other) {
        this.window = other.window;
        this.overall = other.overall.copy();
        this.byExercise = new TreeMap<>();
        other.byExercise.forEach((exercise, bucket) -> byExercise.put(exercise, bucket.copy()));
    }

    QualityState copy() {
        return new QualityState(this);
    }

    QualityBucket bucketFor(String exerciseId) {
        return byExercise.computeIfAbsent(exerciseId, e -> new QualityBucket(window));
    }

    public QualityBucket getOverall() {
        return overall;
    }

    public Optional<QualityBucket> getExercise(String exerciseId) {
        return Optional.ofNullable(byExercise.get(exerciseId));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QualityState that = (QualityState) o;
        return overall.equals(that.overall) && byExercise.equals(that.byExercise);
    }

    @Override
    public int hashCode() {
        return 31 * overall.hashCode() + byExercise.hashCode();
    }
}
