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

import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.api.events.Event;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;

/**
 * A lazy, finite sequence over one subject stream that fetches events a page at a time.
 *
 * <p>Each call to {@link #iterator()} starts again from the original version, so a
 * cursor can be iterated more than once. Iteration ends at the tail observed when
 * the last page was fetched; events appended later are picked up only if the
 * iteration has not yet reached the end.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public final class EventCursor implements Iterable<Event> {

    private final StreamStore store;
    private final String subjectId;
    private final long fromVersion;
    private final int pageSize;

    public EventCursor(StreamStore store, String subjectId, long fromVersion, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0, was " + pageSize);
        }
        this.store = store;
        this.subjectId = subjectId;
        this.fromVersion = Math.max(1, fromVersion);
        this.pageSize = pageSize;
    }

    public String getSubjectId() {
        return subjectId;
    }

    /**
     * @throws StorageUnavailableException from {@code hasNext()} if a page cannot be read
     */
    @Override
    public Iterator<Event> iterator() {
        return new PagingIterator();
    }

    private final class PagingIterator implements Iterator<Event> {
        private long nextVersion = fromVersion;
        private List<Event> page = List.of();
        private int index;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (index < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = fetch(nextVersion);
            index = 0;
            if (page.size() < pageSize) {
                exhausted = true;
            }
            return !page.isEmpty();
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more events in stream " + subjectId);
            }
            Event event = page.get(index++);
            nextVersion = event.getStreamVersion() + 1;
            return event;
        }
    }

    private List<Event> fetch(long version) {
        try {
            return store.read(subjectId, ReadOptions.of(version, pageSize)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StorageUnavailableException("Failed to read stream " + subjectId, cause);
        }
    }
}
