package dev.mars.rehab.api.events;

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

import java.util.Objects;
import java.util.UUID;

/**
 * An event as persisted in a subject stream.
 *
 * <p>Instances are created by a {@code StreamStore} on append, which assigns the
 * event id and the stream version. The stream version is gapless and starts at 1
 * for each subject.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class Event {

    private final UUID eventId;
    private final String subjectId;
    private final EventBody body;
    private final EventMetadata meta;
    private final long streamVersion;

    public Event(UUID eventId, String subjectId, EventBody body, EventMetadata meta, long streamVersion) {
        this.eventId = Objects.requireNonNull(eventId, "eventId cannot be null");
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId cannot be null");
        this.body = Objects.requireNonNull(body, "body cannot be null");
        this.meta = meta != null ? meta : EventMetadata.defaults();
        if (streamVersion < 1) {
            throw new IllegalArgumentException("streamVersion must be >= 1, was " + streamVersion);
        }
        this.streamVersion = streamVersion;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public EventKind getKind() {
        return body.kind();
    }

    public EventBody getBody() {
        return body;
    }

    /**
     * Returns the body cast to the expected type.
     *
     * @throws ClassCastException if the body is of a different kind
     */
    public <T extends EventBody> T getBody(Class<T> type) {
        return type.cast(body);
    }

    public EventMetadata getMeta() {
        return meta;
    }

    public long getStreamVersion() {
        return streamVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return streamVersion == event.streamVersion &&
               eventId.equals(event.eventId) &&
               subjectId.equals(event.subjectId) &&
               body.equals(event.body) &&
               meta.equals(event.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, subjectId, streamVersion);
    }

    @Override
    public String toString() {
        return "Event{" +
                "eventId=" + eventId +
                ", subjectId='" + subjectId + '\'' +
                ", kind=" + body.kind() +
                ", streamVersion=" + streamVersion +
                '}';
    }
}
