package dev.mars.rehab.projections.adherence;

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
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.projections.AbstractProjector;
import dev.mars.rehab.projections.ProjectorContext;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Projects exercise sessions into adherence figures.
 *
 * <p>Formulas, over the sessions in scope (all, or those of one exercise), each
 * counted once by {@code session_id} with its latest status:</p>
 * <ul>
 *   <li>adherence rate = completed / total sessions, 0 when there are none;</li>
 *   <li>active days = distinct UTC days with a completed session, the day being
 *       taken from {@code started_at}, else {@code ended_at}, else the time the
 *       event was recorded;</li>
 *   <li>longest streak = longest run of consecutive active days; current streak =
 *       the run ending on the latest active day.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class AdherenceProjector extends AbstractProjector<AdherenceState> {

    public static final String ID = "adherence";

    public AdherenceProjector(ProjectorContext context) {
        super(ID, context);
    }

    @Override
    protected AdherenceState initialState(String subjectId) {
        return new AdherenceState();
    }

    @Override
    protected AdherenceState copyState(AdherenceState state) {
        return state.copy();
    }

    @Override
    protected void fold(AdherenceState state, Event event) {
        if (event.getKind() != EventKind.EXERCISE_SESSION) {
            return;
        }
        ExerciseSession session = event.getBody(ExerciseSession.class);
        Instant at = firstNonNull(session.getStartedAt(), session.getEndedAt(), event.getMeta().getRecordedAt());
        String sessionId = session.getSessionId() != null ? session.getSessionId() : event.getEventId().toString();
        state.record(new AdherenceState.SessionRecord(
            sessionId,
            session.getExerciseId(),
            session.getStatus(),
            session.getReps() != null ? session.getReps() : 0,
            session.getRepsPlanned() != null ? session.getRepsPlanned() : 0,
            at,
            at != null ? LocalDate.ofInstant(at, ZoneOffset.UTC) : null));
    }

    @Override
    public AdherenceView query(ProjectionFilters filters) {
        String subjectId = filters.require(ProjectionFilters.SUBJECT_ID);
        Optional<String> exerciseId = filters.get(ProjectionFilters.EXERCISE_ID);
        AdherenceState state = installedState(subjectId);

        List<AdherenceState.SessionRecord> inScope = new ArrayList<>();
        if (state != null) {
            for (AdherenceState.SessionRecord record : state.getSessions()) {
                if (exerciseId.isEmpty() || exerciseId.get().equals(record.getExerciseId())) {
                    inScope.add(record);
                }
            }
        }

        int completed = 0;
        int abandoned = 0;
        int inProgress = 0;
        int reps = 0;
        int planned = 0;
        Instant last = null;
        TreeSet<LocalDate> activeDays = new TreeSet<>();
        for (AdherenceState.SessionRecord record : inScope) {
            switch (record.getStatus()) {
                case COMPLETED -> {
                    completed++;
                    if (record.getDay() != null) {
                        activeDays.add(record.getDay());
                    }
                }
                case ABANDONED -> abandoned++;
                case STARTED -> inProgress++;
            }
            reps += record.getReps();
            planned += record.getRepsPlanned();
            if (record.getAt() != null && (last == null || record.getAt().isAfter(last))) {
                last = record.getAt();
            }
        }

        int[] streaks = streaks(activeDays);
        double rate = inScope.isEmpty() ? 0.0 : (double) completed / inScope.size();
        return new AdherenceView(subjectId, exerciseId.orElse(null), inScope.size(), completed, abandoned, inProgress,
            rate, reps, planned, last, activeDays.size(), streaks[0], streaks[1]);
    }

    /**
     * @return {current, longest} runs of consecutive days
     */
    static int[] streaks(TreeSet<LocalDate> days) {
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate day : days) {
            run = previous != null && previous.plusDays(1).equals(day) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        return new int[] {run, longest};
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
