package dev.mars.rehab.api.error;

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

/**
 * Thrown when an append carries an expected version that no longer matches the
 * stream tail. The stream is unchanged; the caller may re-read and retry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class ConcurrencyConflictException extends RehabException {

    private final String subjectId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String subjectId, long expectedVersion, long actualVersion) {
        super(ErrorCode.CONFLICT, String.format(
            "Concurrency conflict on stream %s: expected version %d but was %d",
            subjectId, expectedVersion, actualVersion));
        this.subjectId = subjectId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
