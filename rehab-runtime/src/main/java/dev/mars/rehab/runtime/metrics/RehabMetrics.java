package dev.mars.rehab.runtime.metrics;

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
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Ingestion metrics: accepted, rejected and conflicting appends.
 *
 * <p>Counters carry an {@code instance} tag and, where the kind is known, a
 * {@code kind} tag with the event's wire name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class RehabMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(RehabMetrics.class);

    static final String EVENTS_APPENDED = "rehab.events.appended";
    static final String EVENTS_REJECTED = "rehab.events.rejected";
    static final String EVENTS_CONFLICTS = "rehab.events.conflicts";

    private final String instanceId;
    private final AtomicLong eventsAppended = new AtomicLong(0);
    private final AtomicLong eventsRejected = new AtomicLong(0);
    private final AtomicLong conflicts = new AtomicLong(0);
    private volatile MeterRegistry registry;

    public RehabMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Counter.builder(EVENTS_CONFLICTS)
            .description("Appends rejected because the expected version did not match")
            .tag("instance", instanceId)
            .register(registry);
        this.registry = registry;
        logger.info("Ingestion metrics registered for instance: {}", instanceId);
    }

    public void recordAppended(EventKind kind) {
        eventsAppended.incrementAndGet();
        increment(EVENTS_APPENDED, "Events appended to subject streams", kind);
    }

    public void recordRejected(EventKind kind) {
        eventsRejected.incrementAndGet();
        increment(EVENTS_REJECTED, "Events rejected by validation", kind);
    }

    public void recordConflict() {
        conflicts.incrementAndGet();
        MeterRegistry bound = registry;
        if (bound != null) {
            Counter.builder(EVENTS_CONFLICTS)
                .tag("instance", instanceId)
                .register(bound)
                .increment();
        }
    }

    private void increment(String name, String description, EventKind kind) {
        MeterRegistry bound = registry;
        if (bound == null) {
            return;
        }
        Counter.builder(name)
            .description(description)
            .tag("instance", instanceId)
            .tag("kind", kind != null ? kind.getWireName() : "unknown")
            .register(bound)
            .increment();
    }

    public long getEventsAppended() { return eventsAppended.get(); }
    public long getEventsRejected() { return eventsRejected.get(); }
    public long getConflicts() { return conflicts.get(); }
    public String getInstanceId() { return instanceId; }

    /**
     * Point-in-time copy of the ingestion counters.
     */
    public MetricsSummary getSummary() {
        return new MetricsSummary(eventsAppended.get(), eventsRejected.get(), conflicts.get());
    }

    public static class MetricsSummary {
        private final long eventsAppended;
        private final long eventsRejected;
        private final long conflicts;

        public MetricsSummary(long eventsAppended, long eventsRejected, long conflicts) {
            this.eventsAppended = eventsAppended;
            this.eventsRejected = eventsRejected;
            this.conflicts = conflicts;
        }

        public long getEventsAppended() { return eventsAppended; }
        public long getEventsRejected() { return eventsRejected; }
        public long getConflicts() { return conflicts; }

        @Override
        public String toString() {
            return "MetricsSummary{" +
                    "eventsAppended=" + eventsAppended +
                    ", eventsRejected=" + eventsRejected +
                    ", conflicts=" + conflicts +
                    '}';
        }
    }
}
