package dev.mars.rehab.projections.workqueue;

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

import dev.mars.rehab.api.events.Alert;
import dev.mars.rehab.api.events.Consent;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.ExerciseSession;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.projections.AbstractProjector;
import dev.mars.rehab.projections.ProjectorContext;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projects alerts into per-therapist work queues.
 *
 * <p>An alert is assigned to its own {@code therapist_id}; without one, to the
 * therapist of the subject's latest session, and failing that to every therapist
 * of the subject's active sharing consents. Resolved alerts leave the queue,
 * acknowledged ones stay flagged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class WorkQueueProjector extends AbstractProjector<WorkQueueState> {

    public static final String ID = "work_queue";

    public WorkQueueProjector(ProjectorContext context) {
        super(ID, context);
    }

    @Override
    protected WorkQueueState initialState(String subjectId) {
        return new WorkQueueState();
    }

    @Override
    protected WorkQueueState copyState(WorkQueueState state) {
        return state.copy();
    }

    @Override
    protected void fold(WorkQueueState state, Event event) {
        switch (event.getKind()) {
            case ALERT -> {
                Alert alert = event.getBody(Alert.class);
                if (alert.getStatus() == Alert.Status.RESOLVED) {
                    state.removeAlert(alert.getAlertId());
                } else {
                    state.putAlert(new WorkItem(event.getSubjectId(), alert));
                }
            }
            case EXERCISE_SESSION -> {
                String therapist = event.getBody(ExerciseSession.class).getTherapistId();
                if (therapist != null) {
                    state.setSessionTherapist(therapist);
                }
            }
            case CONSENT -> {
                Consent consent = event.getBody(Consent.class);
                if (consent.getConsentType() == Consent.Type.SHARING) {
                    state.putSharingConsent(consent);
                }
            }
            default -> {
                // no effect on the queue
            }
        }
    }

    @Override
    public WorkQueueView query(ProjectionFilters filters) {
        String therapistId = filters.require(ProjectionFilters.THERAPIST_ID);
        int limit = filters.getPositiveInt(ProjectionFilters.LIMIT).orElse(Integer.MAX_VALUE);

        List<WorkItem> assigned = assignedTo(therapistId, clock().instant());
        assigned.sort(WorkItem.QUEUE_ORDER);
        List<WorkItem> items = assigned.size() > limit ? assigned.subList(0, limit) : assigned;
        return new WorkQueueView(therapistId, items, assigned.size());
    }

    /**
     * Open alerts of the therapist triggered more than {@code overdueAfter} ago, oldest first.
     * Alerts without a trigger time are never overdue.
     */
    public List<WorkItem> overdue(String therapistId, Duration overdueAfter) {
        Objects.requireNonNull(therapistId, "therapistId cannot be null");
        Instant now = clock().instant();
        Instant cutoff = now.minus(overdueAfter);
        List<WorkItem> overdue = new ArrayList<>();
        for (WorkItem item : assignedTo(therapistId, now)) {
            if (item.getTriggeredAt() != null && item.getTriggeredAt().isBefore(cutoff)) {
                overdue.add(item);
            }
        }
        overdue.sort(Comparator.comparing(WorkItem::getTriggeredAt).thenComparing(WorkItem.QUEUE_ORDER));
        return overdue;
    }

    private List<WorkItem> assignedTo(String therapistId, Instant now) {
        List<WorkItem> assigned = new ArrayList<>();
        for (Map.Entry<String, WorkQueueState> entry : installedStates().entrySet()) {
            WorkQueueState state = entry.getValue();
            for (WorkItem item : state.getOpenAlerts()) {
                if (isAssigned(item, state, therapistId, now)) {
                    assigned.add(item);
                }
            }
        }
        return assigned;
    }

    private static boolean isAssigned(WorkItem item, WorkQueueState state, String therapistId, Instant now) {
        if (item.getTherapistId() != null) {
            return item.getTherapistId().equals(therapistId);
        }
        if (state.getSessionTherapist() != null) {
            return state.getSessionTherapist().equals(therapistId);
        }
        return state.sharingTherapistsAt(now).contains(therapistId);
    }
}
