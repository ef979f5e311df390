package dev.mars.rehab.api.deadletter;

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

import java.time.Instant;
import java.util.List;

/**
 * Keeps projection batches that could not be applied after all retries.
 *
 * <p>Recording an entry never blocks the pipeline. Entries stay available for
 * inspection; redriving one means rebuilding the affected subject for that projector.</p>
 */
public interface DeadLetterQueue extends AutoCloseable {

    /**
     * Records a failed batch and assigns it an id.
     */
    DeadLetterEntry record(String projectorId, String subjectId, long fromVersion, long toVersion,
                           int attempts, String reason);

    List<DeadLetterEntry> entries();

    List<DeadLetterEntry> entries(String projectorId);

    long count();

    long count(String projectorId);

    DeadLetterMetrics getMetrics();

    @Override
    void close();

    /**
     * Metrics for dead letter operations.
     */
    class DeadLetterMetrics {
        private final long totalRecorded;
        private final long eventsAffected;
        private final Instant lastRecordedTime;

        public DeadLetterMetrics(long totalRecorded, long eventsAffected, Instant lastRecordedTime) {
            this.totalRecorded = totalRecorded;
            this.eventsAffected = eventsAffected;
            this.lastRecordedTime = lastRecordedTime;
        }

        public long getTotalRecorded() { return totalRecorded; }
        public long getEventsAffected() { return eventsAffected; }
        public Instant getLastRecordedTime() { return lastRecordedTime; }

        @Override
        public String toString() {
            return String.format("DeadLetterMetrics{recorded=%d, eventsAffected=%d, last=%s}",
                totalRecorded, eventsAffected, lastRecordedTime);
        }
    }
}
