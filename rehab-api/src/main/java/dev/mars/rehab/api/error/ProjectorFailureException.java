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
 * A projector could not apply a batch of events.
 *
 * <p>Carries the projector id, the subject and the version range of the batch so
 * the failure can be recorded and redriven.</p>
 */
public class ProjectorFailureException extends RehabException {

    private final String projectorId;
    private final String subjectId;
    private final long fromVersion;
    private final long toVersion;

    public ProjectorFailureException(String projectorId, String subjectId, long fromVersion, long toVersion,
                                     String message, Throwable cause) {
        super(ErrorCode.PROJECTOR_FAILURE, String.format("Projector %s failed on %s [%d..%d]: %s",
            projectorId, subjectId, fromVersion, toVersion, message), cause);
        this.projectorId = projectorId;
        this.subjectId = subjectId;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public String getProjectorId() {
        return projectorId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public long getFromVersion() {
        return fromVersion;
    }

    public long getToVersion() {
        return toVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
