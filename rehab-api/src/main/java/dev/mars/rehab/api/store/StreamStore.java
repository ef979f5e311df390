package dev.mars.rehab.api.store;

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

import dev.mars.rehab.api.error.ConcurrencyConflictException;
import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.events.EventMetadata;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only store of per-subject event streams.
 *
 * <p>Each subject owns one stream whose versions run 1..N without gaps. Events are
 * never changed or removed once appended. There is no order across subjects, and
 * appends to different subjects never contend with each other.</p>
 *
 * <p>All operations are asynchronous. Failures complete the returned future
 * exceptionally with {@link ConcurrencyConflictException} or
 * {@link StorageUnavailableException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public interface StreamStore extends AutoCloseable {

    /**
     * Appends one event to the subject's stream, assigning its event id and the next
     * stream version.
     *
     * @param subjectId the stream owner
     * @param body the validated event body
     * @param meta envelope metadata
     * @param expectedVersion the tail version the caller expects
     * @return the persisted event
     */
    CompletableFuture<Event> append(String subjectId, EventBody body, EventMetadata meta,
                                    ExpectedVersion expectedVersion);

    /**
     * Reads events in version order starting at {@code options.getFromVersion()}
     * inclusive. A missing stream, or a start beyond the tail, reads as empty.
     */
    CompletableFuture<List<Event>> read(String subjectId, ReadOptions options);

    /**
     * @return the current tail version, 0 for a stream that does not exist
     */
    CompletableFuture<Long> tailVersion(String subjectId);

    /**
     * @return ids of all subjects that have at least one event
     */
    CompletableFuture<Set<String>> subjects();

    CompletableFuture<StreamStatistics> statistics();

    /**
     * Registers a listener called after every successful append.
     */
    void addAppendListener(AppendListener listener);

    void removeAppendListener(AppendListener listener);

    /**
     * A lazy cursor over the subject's stream from {@code fromVersion} inclusive.
     */
    default EventCursor cursor(String subjectId, long fromVersion, int pageSize) {
        return new EventCursor(this, subjectId, fromVersion, pageSize);
    }

    @Override
    void close();
}
