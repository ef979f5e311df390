package dev.mars.rehab.pipeline;

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
import dev.mars.rehab.api.projection.Projector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Delivery state of one (projector, subject) pair.
 *
 * <p>{@code emitted} is the last stream version handed to the batcher. Every event
 * between the projector's checkpoint and {@code emitted} is either buffered or in a
 * batch queued on {@code tail}; together they count against the lane capacity.</p>
 */
final class ProjectorLane {

    private final Projector projector;
    private final String subjectId;
    private final List<Event> buffer = new ArrayList<>();
    private long emitted;
    private int unapplied;
    private boolean starved;
    private ScheduledFuture<?> flushTimer;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    ProjectorLane(Projector projector, String subjectId) {
        this.projector = projector;
        this.subjectId = subjectId;
        this.emitted = projector.checkpoint(subjectId);
    }

    Projector projector() {
        return projector;
    }

    String projectorId() {
        return projector.id();
    }

    String subjectId() {
        return subjectId;
    }

    synchronized long emitted() {
        return emitted;
    }

    synchronized int unapplied() {
        return unapplied;
    }

    /**
     * @return free capacity; when there is none the lane is flagged so that the
     *         next release re-signals the subject
     */
    synchronized int reserve(int capacity) {
        int room = capacity - unapplied;
        if (room <= 0) {
            starved = true;
        }
        return room;
    }

    /**
     * Buffers events that continue the lane exactly. Stale reads (the cursor moved
     * while the store was read) are dropped.
     *
     * @return a full batch to dispatch, or null
     */
    synchronized List<Event> accept(List<Event> events, int batchSize) {
        if (events.isEmpty() || events.get(0).getStreamVersion() != emitted + 1) {
            return null;
        }
        buffer.addAll(events);
        emitted = events.get(events.size() - 1).getStreamVersion();
        unapplied += events.size();
        return buffer.size() >= batchSize ? drainLocked() : null;
    }

    synchronized List<Event> drain() {
        return drainLocked();
    }

    synchronized void armFlushTimer(Supplier<ScheduledFuture<?>> timer) {
        if (!buffer.isEmpty() && flushTimer == null) {
            flushTimer = timer.get();
        }
    }

    /**
     * Queues a delivery behind every earlier batch of this lane. A failed earlier
     * delivery does not stop later ones.
     */
    synchronized CompletableFuture<Void> enqueue(Function<Void, CompletableFuture<Void>> delivery) {
        tail = tail.<Void>handle((ignored, error) -> null).thenCompose(delivery);
        return tail;
    }

    /**
     * @return true if the subject should be re-signalled because pumping stopped on capacity
     */
    synchronized boolean release(int events) {
        unapplied = Math.max(0, unapplied - events);
        if (starved) {
            starved = false;
            return true;
        }
        return false;
    }

    /**
     * Drops buffered events and continues the lane from the projector's checkpoint.
     */
    synchronized void resume(long checkpoint) {
        discardBuffer();
        emitted = checkpoint;
    }

    private void discardBuffer() {
        unapplied = Math.max(0, unapplied - buffer.size());
        buffer.clear();
        cancelTimer();
    }

    private List<Event> drainLocked() {
        cancelTimer();
        if (buffer.isEmpty()) {
            return List.of();
        }
        List<Event> batch = new ArrayList<>(buffer);
        buffer.clear();
        return batch;
    }

    private void cancelTimer() {
        if (flushTimer != null) {
            flushTimer.cancel(false);
            flushTimer = null;
        }
    }

    @Override
    public synchronized String toString() {
        return "ProjectorLane{" + projector.id() + "/" + subjectId +
                ", emitted=" + emitted +
                ", unapplied=" + unapplied +
                '}';
    }
}
