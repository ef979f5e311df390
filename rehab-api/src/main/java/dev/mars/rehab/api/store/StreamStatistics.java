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

import dev.mars.rehab.api.events.EventKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts over all streams in a store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public final class StreamStatistics {

    private final long subjectCount;
    private final long eventCount;
    private final Map<EventKind, Long> eventsByKind;

    public StreamStatistics(long subjectCount, long eventCount, Map<EventKind, Long> eventsByKind) {
        this.subjectCount = subjectCount;
        this.eventCount = eventCount;
        Map<EventKind, Long> copy = new EnumMap<>(EventKind.class);
        copy.putAll(eventsByKind);
        this.eventsByKind = Collections.unmodifiableMap(copy);
    }

    public long getSubjectCount() {
        return subjectCount;
    }

    public long getEventCount() {
        return eventCount;
    }

    public Map<EventKind, Long> getEventsByKind() {
        return eventsByKind;
    }

    public long getEventCount(EventKind kind) {
        return eventsByKind.getOrDefault(kind, 0L);
    }

    @Override
    public String toString() {
        return "StreamStatistics{" +
                "subjectCount=" + subjectCount +
                ", eventCount=" + eventCount +
                ", eventsByKind=" + eventsByKind +
                '}';
    }
}
