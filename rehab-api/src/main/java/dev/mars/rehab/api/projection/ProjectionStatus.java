package dev.mars.rehab.api.projection;

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
 * Monitoring snapshot for one projector.
 *
 * <p>{@code lag} is the largest difference between a stream tail and the
 * projector's checkpoint for that subject; {@code maxLagSubject} names the subject
 * it was seen on, or {@code null} when the projector is fully caught up.</p>
 */
public final class ProjectionStatus {

    private final String projectorId;
    private final long lag;
    private final String maxLagSubject;
    private final long deadLetters;
    private final int subjects;

    public ProjectionStatus(String projectorId, long lag, String maxLagSubject, long deadLetters, int subjects) {
        this.projectorId = projectorId;
        this.lag = lag;
        this.maxLagSubject = maxLagSubject;
        this.deadLetters = deadLetters;
        this.subjects = subjects;
    }

    public String getProjectorId() { return projectorId; }
    public long getLag() { return lag; }
    public String getMaxLagSubject() { return maxLagSubject; }
    public long getDeadLetters() { return deadLetters; }
    public int getSubjects() { return subjects; }

    public boolean isCaughtUp() {
        return lag == 0;
    }

    @Override
    public String toString() {
        return "ProjectionStatus{" +
                "projectorId='" + projectorId + '\'' +
                ", lag=" + lag +
                ", maxLagSubject='" + maxLagSubject + '\'' +
                ", deadLetters=" + deadLetters +
                ", subjects=" + subjects +
                '}';
    }
}
