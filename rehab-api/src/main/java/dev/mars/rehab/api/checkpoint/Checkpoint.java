package dev.mars.rehab.api.checkpoint;

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
 * The highest stream version a projector has applied for one subject.
 */
public final class Checkpoint {

    private final String projectorId;
    private final String subjectId;
    private final long lastAppliedVersion;
    private final Instant updatedAt;

    public Checkpoint(String projectorId, String subjectId, long lastAppliedVersion, Instant updatedAt) {
        this.projectorId = Objects.requireNonNull(projectorId, "projectorId cannot be null");
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId cannot be null");
        if (lastAppliedVersion < 0) {
            throw new IllegalArgumentException("lastAppliedVersion must be >= 0, was " + lastAppliedVersion);
        }
        this.lastAppliedVersion = lastAppliedVersion;
        this.updatedAt = updatedAt;
    }

    public String getProjectorId() {
        return projectorId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public long getLastAppliedVersion() {
        return lastAppliedVersion;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Checkpoint that = (Checkpoint) o;
        return lastAppliedVersion == that.lastAppliedVersion &&
               projectorId.equals(that.projectorId) &&
               subjectId.equals(that.subjectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectorId, subjectId, lastAppliedVersion);
    }

    @Override
    public String toString() {
        return "Checkpoint{" + projectorId + '/' + subjectId + '@' + lastAppliedVersion + '}';
    }
}
