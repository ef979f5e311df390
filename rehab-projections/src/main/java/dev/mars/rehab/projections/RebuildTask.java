package dev.mars.rehab.projections;

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

import dev.mars.rehab.api.projection.RebuildHandle;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Progress and outcome of one rebuild run by {@link AbstractProjector}.
 *
 * <p>Cancellation is honoured until the rebuild starts installing its result;
 * from then on {@link #cancel()} returns false and the rebuild completes.</p>
 */
final class RebuildTask implements RebuildHandle {

    private final String projectorId;
    private final String subjectId;
    private final AtomicLong processed = new AtomicLong();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private volatile long total;
    private State state = State.RUNNING;
    private boolean committing;

    RebuildTask(String projectorId, String subjectId) {
        this.projectorId = projectorId;
        this.subjectId = subjectId;
    }

    @Override
    public String projectorId() {
        return projectorId;
    }

    @Override
    public Optional<String> subjectId() {
        return Optional.ofNullable(subjectId);
    }

    @Override
    public synchronized State state() {
        return state;
    }

    @Override
    public long eventsProcessed() {
        return processed.get();
    }

    @Override
    public long totalEvents() {
        return total;
    }

    @Override
    public synchronized boolean cancel() {
        if (state != State.RUNNING || committing) {
            return false;
        }
        state = State.CANCELLED;
        completion.completeExceptionally(new CancellationException("Rebuild of " + describe() + " cancelled"));
        return true;
    }

    @Override
    public CompletableFuture<Void> completion() {
        return completion;
    }

    synchronized boolean isCancelled() {
        return state == State.CANCELLED;
    }

    void setTotal(long total) {
        this.total = total;
    }

    void recordProcessed() {
        processed.incrementAndGet();
    }

    /**
     * @return false if the rebuild was cancelled and must not be installed
     */
    synchronized boolean beginCommit() {
        if (state != State.RUNNING) {
            return false;
        }
        committing = true;
        return true;
    }

    synchronized void complete() {
        state = State.COMPLETED;
        completion.complete(null);
    }

    synchronized void fail(Throwable cause) {
        if (state == State.CANCELLED) {
            return;
        }
        state = State.FAILED;
        completion.completeExceptionally(cause);
    }

    String describe() {
        return projectorId + (subjectId != null ? "/" + subjectId : "/*");
    }

    @Override
    public String toString() {
        return "RebuildTask{" + describe() + ", state=" + state() + ", processed=" + processed.get() + "/" + total + '}';
    }
}
