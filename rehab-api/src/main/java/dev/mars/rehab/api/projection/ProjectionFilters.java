package dev.mars.rehab.api.projection;

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

import dev.mars.rehab.api.error.InvalidQueryException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Query filters passed to a projector, keyed by snake case names such as
 * {@code subject_id}, {@code therapist_id}, {@code exercise_id} or {@code limit}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public final class ProjectionFilters {

    public static final String SUBJECT_ID = "subject_id";
    public static final String THERAPIST_ID = "therapist_id";
    public static final String EXERCISE_ID = "exercise_id";
    public static final String LIMIT = "limit";

    private final Map<String, String> values;

    private ProjectionFilters(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    public static ProjectionFilters of(Map<String, String> values) {
        return new ProjectionFilters(values != null ? values : Map.of());
    }

    public static ProjectionFilters subject(String subjectId) {
        return builder().subjectId(subjectId).build();
    }

    public static ProjectionFilters therapist(String therapistId) {
        return builder().therapistId(therapistId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(String name) {
        String value = values.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    /**
     * @throws InvalidQueryException if the filter is missing or blank
     */
    public String require(String name) {
        return get(name).orElseThrow(() -> new InvalidQueryException("Missing required filter: " + name));
    }

    /**
     * @throws InvalidQueryException if the filter is present but not a positive integer
     */
    public Optional<Integer> getPositiveInt(String name) {
        Optional<String> raw = get(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            int value = Integer.parseInt(raw.get());
            if (value <= 0) {
                throw new InvalidQueryException("Filter " + name + " must be positive, was " + value);
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("Filter " + name + " is not an integer: " + raw.get());
        }
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ProjectionFilters" + values;
    }

    public static class Builder {
        private final Map<String, String> values = new HashMap<>();

        public Builder subjectId(String subjectId) { return put(SUBJECT_ID, subjectId); }
        public Builder therapistId(String therapistId) { return put(THERAPIST_ID, therapistId); }
        public Builder exerciseId(String exerciseId) { return put(EXERCISE_ID, exerciseId); }
        public Builder limit(int limit) { return put(LIMIT, Integer.toString(limit)); }

        public Builder put(String name, String value) {
            if (value != null) {
                values.put(name, value);
            }
            return this;
        }

        public ProjectionFilters build() {
            return new ProjectionFilters(values);
        }
    }
}
