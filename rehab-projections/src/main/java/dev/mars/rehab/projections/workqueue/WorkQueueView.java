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

import dev.mars.rehab.api.projection.ProjectionView;

import java.util.List;
import java.util.Objects;

/**
 * A therapist's queue of open alerts, already ordered and limited.
 */
public final class WorkQueueView implements ProjectionView {

    private final String therapistId;
    private final List<WorkItem> items;
    private final int totalOpen;

    WorkQueueView(String therapistId, List<WorkItem> items, int totalOpen) {
        this.therapistId = therapistId;
        this.items = List.copyOf(items);
        this.totalOpen = totalOpen;
    }

    @Override
    public String projection() {
        return WorkQueueProjector.ID;
    }

    public String getTherapistId() { return therapistId; }
    public List<WorkItem> getItems() { return items; }

    /**
     * @return open alerts assigned to the therapist before any limit was applied
     */
    public int getTotalOpen() { return totalOpen; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkQueueView that = (WorkQueueView) o;
        return totalOpen == that.totalOpen && therapistId.equals(that.therapistId) && items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(therapistId, items, totalOpen);
    }

    @Override
    public String toString() {
        return "WorkQueueView{therapistId='" + therapistId + "', items=" + items.size() + ", totalOpen=" + totalOpen + '}';
    }
}
