package dev.mars.rehab.runtime.report;

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


import dev.mars.rehab.api.events.Severity;
import dev.mars.rehab.projections.workqueue.WorkItem;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a therapist's open work: the head of the queue, the alerts left open
 * past the overdue threshold and the patients whose form quality is falling.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class TherapistDashboard {

    private final String therapistId;
    private final int pendingTasks;
    private final List<WorkItem> workQueue;
    private final List<WorkItem> overdueItems;
    private final List<String> decliningSubjects;

    public TherapistDashboard(String therapistId, int pendingTasks, List<WorkItem> workQueue,
                              List<WorkItem> overdueItems, List<String> decliningSubjects) {
        this.therapistId = Objects.requireNonNull(therapistId, "therapistId cannot be null");
        this.pendingTasks = pendingTasks;
        this.workQueue = List.copyOf(workQueue);
        this.overdueItems = List.copyOf(overdueItems);
        this.decliningSubjects = List.copyOf(decliningSubjects);
    }

    public String getTherapistId() { return therapistId; }

    /** Open alerts assigned to the therapist, including those beyond the queue shown. */
    public int getPendingTasks() { return pendingTasks; }

    public int getOverdueTasks() { return overdueItems.size(); }

    /** High or critical alerts among the queue shown. */
    public long getHighPriorityAlerts() {
        return workQueue.stream().filter(item -> item.getSeverity().isAtLeast(Severity.HIGH)).count();
    }

    public int getPatientsAtRisk() { return decliningSubjects.size(); }

    public List<WorkItem> getWorkQueue() { return workQueue; }

    /** The oldest overdue alerts, at most five. */
    public List<WorkItem> getRecentAlerts() {
        return overdueItems.size() > 5 ? overdueItems.subList(0, 5) : overdueItems;
    }

    public List<String> getDecliningSubjects() { return decliningSubjects; }

    @Override
    public String toString() {
        return "TherapistDashboard{" +
            "therapistId='" + therapistId + '\'' +
            ", pendingTasks=" + pendingTasks +
            ", overdueTasks=" + overdueItems.size() +
            ", patientsAtRisk=" + decliningSubjects.size() +
            '}';
    }
}
