package dev.mars.rehab.pipeline.deadletter;

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

import dev.mars.rehab.api.deadletter.DeadLetterEntry;
import dev.mars.rehab.api.deadletter.DeadLetterQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dead letter queue that logs every failed batch and keeps it in memory for inspection.
 *
 * <p>Only identifiers and versions are logged; event bodies may carry PHI.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryDeadLetterQueue.class);

    private final Clock clock;
    private final List<DeadLetterEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicLong eventsAffected = new AtomicLong(0);
    private final AtomicReference<Instant> lastRecordedTime = new AtomicReference<>();

    public InMemoryDeadLetterQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryDeadLetterQueue(Clock clock) {
        this.clock = clock;
        logger.info("Created in-memory dead letter queue");
    }

    @Override
    public DeadLetterEntry record(String projectorId, String subjectId, long fromVersion, long toVersion,
                                  int attempts, String reason) {
        Instant now = clock.instant();
        DeadLetterEntry entry = new DeadLetterEntry(nextId.getAndIncrement(), projectorId, subjectId,
            fromVersion, toVersion, attempts, reason, now);
        entries.add(entry);
        eventsAffected.addAndGet(entry.getEventCount());
        lastRecordedTime.set(now);

        logger.error("DEAD LETTER [{}]: subject {} versions {}..{} failed after {} attempts",
            projectorId, subjectId, fromVersion, toVersion, attempts);
        logger.error("  Reason: {}", reason);
        return entry;
    }

    @Override
    public List<DeadLetterEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public List<DeadLetterEntry> entries(String projectorId) {
        List<DeadLetterEntry> matching = new ArrayList<>();
        for (DeadLetterEntry entry : entries) {
            if (entry.getProjectorId().equals(projectorId)) {
                matching.add(entry);
            }
        }
        return matching;
    }

    @Override
    public long count() {
        return entries.size();
    }

    @Override
    public long count(String projectorId) {
        return entries.stream().filter(e -> e.getProjectorId().equals(projectorId)).count();
    }

    @Override
    public DeadLetterMetrics getMetrics() {
        return new DeadLetterMetrics(entries.size(), eventsAffected.get(), lastRecordedTime.get());
    }

    @Override
    public void close() {
        logger.info("Closing in-memory dead letter queue with {} entries", entries.size());
    }
}
