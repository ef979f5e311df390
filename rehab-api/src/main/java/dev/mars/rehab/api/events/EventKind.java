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

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of event kinds a subject stream may contain.
 *
 * <p>Every kind has a stable wire name used for persistence and by the ingestion API.
 * Code that needs kind-specific behaviour should either switch over this enum with a
 * switch expression (the compiler rejects a non-exhaustive one) or implement
 * {@link EventBodyVisitor}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public enum EventKind {
    EXERCISE_SESSION("ExerciseSession", ExerciseSession.class),
    REP_OBSERVATION("RepObservation", RepObservation.class),
    FEEDBACK("Feedback", Feedback.class),
    ALERT("Alert", Alert.class),
    CONSENT("Consent", Consent.class);

    private final String wireName;
    private final Class<? extends EventBody> bodyType;

    EventKind(String wireName, Class<? extends EventBody> bodyType) {
        this.wireName = wireName;
        this.bodyType = bodyType;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends EventBody> getBodyType() {
        return bodyType;
    }

    /**
     * Resolves a kind from its wire name ({@code ExerciseSession}), its enum name
     * ({@code EXERCISE_SESSION}) or its snake case form ({@code exercise_session}).
     */
    public static Optional<EventKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(trimmed) || kind.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
