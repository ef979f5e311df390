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
import dev.mars.rehab.api.error.ProjectorFailureException;
import dev.mars.rehab.api.events.Event;

import java.util.List;
import java.util.Set;

/**
 * Folds subject streams into a queryable materialized view.
 *
 * <p>Views are pure functions of the event sequence, so replaying a stream from the
 * start produces the same view as applying it live. Application is idempotent:
 * events at or below the subject's checkpoint are skipped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public interface Projector {

    /**
     * Stable projector id, also used as the projection name in queries.
     */
    String id();

    /**
     * Applies a batch of one subject's events in increasing version order. The view
     * change and the new checkpoint become visible together or not at all.
     *
     * @throws ProjectorFailureException if the batch could not be applied; nothing
     *         has changed in that case
     */
    void applyBatch(String subjectId, List<Event> events);

    /**
     * Moves the subject's checkpoint past a range that could not be applied, without
     * folding it into the view. Has no effect unless the checkpoint lies inside
     * {@code [fromVersion - 1, toVersion)}.
     *
     * @return true if the checkpoint moved to {@code toVersion}
     */
    boolean skip(String subjectId, long fromVersion, long toVersion);

    /**
     * @return the last applied version for the subject, 0 if none
     */
    long checkpoint(String subjectId);

    ApplyPhase phase(String subjectId);

    /**
     * @return the subjects this projector holds state for
     */
    Set<String> subjects();

    /**
     * Replays one subject's stream into a shadow view and swaps it in.
     */
    RebuildHandle rebuild(String subjectId);

    /**
     * Replays every known stream into a fresh view and swaps it in.
     */
    RebuildHandle rebuildAll();

    /**
     * @throws InvalidQueryException if a required filter is missing or malformed
     */
    ProjectionView query(ProjectionFilters filters);
}
