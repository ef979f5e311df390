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

/**
 * Exhaustive dispatch over the five event body types.
 *
 * <p>Adding a kind adds a method here, which breaks every implementation until it
 * handles the new kind.</p>
 *
 * @param <R> result type of the visit
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface EventBodyVisitor<R> {

    R visitExerciseSession(ExerciseSession session);

    R visitRepObservation(RepObservation observation);

    R visitFeedback(Feedback feedback);

    R visitAlert(Alert alert);

    R visitConsent(Consent consent);
}
