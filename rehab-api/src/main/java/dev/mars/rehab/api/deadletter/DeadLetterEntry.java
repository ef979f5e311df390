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
import java.util.Objects;

/**
 * A projection batch that exhausted its retries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public final class DeadLetterEntry {

    private final long id;
    private final String projectorId;
    private final String subjectId;
    private final long fromVersion;
    private final long toVersion;
    private final int attempts;
    private final String reason;
    private final Instant failedAt;

    public DeadLetterEntry(long id, String projectorId, String subjectId, long fromVersion, long toVersion,
                           int attempts, String reason, Instant failedAt) {
        this.id = id;
        this.projectorId = Objects.requireNonNull(projectorId, "projectorId cannot be null");
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId cannot be null");
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
        this.attempts = attempts;
        this.reason = reason;
        this.failedAt = failedAt;
    }

    public long getId() { return id; }
    public String getProjectorId() { return projectorId; }
    public String getSubjectId() { return subjectId; }
    public long getFromVersion() { return fromVersion; }
    public long getToVersion() { return toVersion; }
    public int getAttempts() { return attempts; }
    public String getReason() { return reason; }
    public Instant getFailedAt() { return failedAt; }

    public int getEventCount() {
        return (int) (toVersion - fromVersion + 1);
    }

    @Override
    public String toString() {
        return "DeadLetterEntry{" +
                "id=" + id +
                ", projectorId='" + projectorId + '\'' +
                ", subjectId='" + subjectId + '\'' +
                ", versions=" + fromVersion + ".." + toVersion +
                ", attempts=" + attempts +
                ", reason='" + reason + '\'' +
                '}';
    }
}
