package dev.mars.rehab.eventstore;

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
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.EventMetadata;
import dev.mars.rehab.api.store.AppendListener;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStatistics;
import dev.mars.rehab.api.store.StreamStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Stream store held in memory.
 *
 * <p>Every subject stream has its own read/write lock, so appends to different
 * subjects never contend while appends to the same subject are serialized through
 * the version check. Futures are returned already completed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class InMemoryStreamStore implements StreamStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStreamStore.class);

    private final Map<String, SubjectStream> streams = new ConcurrentHashMap<>();
    private final AppendListeners listeners = new AppendListeners();
    private final Clock clock;
    private volatile boolean closed = false;

    public InMemoryStreamStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStreamStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        logger.info("Created in-memory stream store");
    }

    @Override
    public CompletableFuture<Event> append(String subjectId, EventBody body, EventMetadata meta,
                                           ExpectedVersion expectedVersion) {
        try {
            checkOpen();
            Objects.requireNonNull(subjectId, "subjectId cannot be null");
            Objects.requireNonNull(body, "body cannot be null");
            ExpectedVersion expected = expectedVersion != null ? expectedVersion : ExpectedVersion.ANY;
            EventMetadata stamped = (meta != null ? meta : EventMetadata.defaults()).withRecordedAtIfAbsent(clock.instant());

            SubjectStream stream = streams.computeIfAbsent(subjectId, id -> new SubjectStream());
            Event event;
            stream.lock.writeLock().lock();
            try {
                long tail = stream.events.size();
                if (!expected.matches(tail)) {
                    logger.debug("Rejected append to {}: expected {} but tail is {}", subjectId, expected, tail);
                    throw new ConcurrencyConflictException(subjectId, expected.getVersion(), tail);
                }
                event = new Event(UUID.randomUUID(), subjectId, body, stamped, tail + 1);
                stream.events.add(event);
            } finally {
                stream.lock.writeLock().unlock();
            }

            logger.debug("Appended {} to {} at version {}", event.getKind(), subjectId, event.getStreamVersion());
            listeners.notifyAppended(event);
            return CompletableFuture.completedFuture(event);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<List<Event>> read(String subjectId, ReadOptions options) {
        try {
            checkOpen();
            ReadOptions range = options != null ? options : ReadOptions.all();
            SubjectStream stream = streams.get(subjectId);
            if (stream == null) {
                return CompletableFuture.completedFuture(List.of());
            }
            stream.lock.readLock().lock();
            try {
                int size = stream.events.size();
                long from = range.getFromVersion() - 1;
                if (from >= size) {
                    return CompletableFuture.completedFuture(List.of());
                }
                int to = (int) Math.min(size, from + range.getLimit());
                return CompletableFuture.completedFuture(List.copyOf(stream.events.subList((int) from, to)));
            } finally {
                stream.lock.readLock().unlock();
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Long> tailVersion(String subjectId) {
        try {
            checkOpen();
            SubjectStream stream = streams.get(subjectId);
            return CompletableFuture.completedFuture(stream == null ? 0L : stream.size());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Set<String>> subjects() {
        try {
            checkOpen();
            Set<String> subjects = streams.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
            return CompletableFuture.completedFuture(subjects);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<StreamStatistics> statistics() {
        try {
            checkOpen();
            long subjects = 0;
            long total = 0;
            Map<EventKind, Long> byKind = new EnumMap<>(EventKind.class);
            for (SubjectStream stream : streams.values()) {
                List<Event> snapshot = stream.snapshot();
                if (snapshot.isEmpty()) {
                    continue;
                }
                subjects++;
                total += snapshot.size();
                for (Event event : snapshot) {
                    byKind.merge(event.getKind(), 1L, Long::sum);
                }
            }
            return CompletableFuture.completedFuture(new StreamStatistics(subjects, total, byKind));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void addAppendListener(AppendListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeAppendListener(AppendListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            listeners.clear();
            logger.info("Closed in-memory stream store ({} streams)", streams.size());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new StorageUnavailableException("Stream store is closed");
        }
    }

    private static final class SubjectStream {
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private final List<Event> events = new ArrayList<>();

        long size() {
            lock.readLock().lock();
            try {
                return events.size();
            } finally {
                lock.readLock().unlock();
            }
        }

        List<Event> snapshot() {
            lock.readLock().lock();
            try {
                return List.copyOf(events);
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
