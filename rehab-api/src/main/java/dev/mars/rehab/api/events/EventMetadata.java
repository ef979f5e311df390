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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Envelope metadata carried alongside an event body.
 *
 * <p>{@code phi} marks protected health information; such events need an active
 * consent referenced by {@code consentId}. {@code headers} is an opaque string map
 * passed through unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class EventMetadata {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("phi")
    private final boolean phi;
    @JsonProperty("consent_id")
    private final String consentId;
    @JsonProperty("version")
    private final String version;
    @JsonProperty("recorded_at")
    private final Instant recordedAt;
    @JsonProperty("source")
    private final String source;
    @JsonProperty("headers")
    private final Map<String, String> headers;

    @JsonCreator
    public EventMetadata(@JsonProperty("phi") Boolean phi,
                         @JsonProperty("consent_id") String consentId,
                         @JsonProperty("version") String version,
                         @JsonProperty("recorded_at") Instant recordedAt,
                         @JsonProperty("source") String source,
                         @JsonProperty("headers") Map<String, String> headers) {
        this.phi = phi != null && phi;
        this.consentId = consentId;
        this.version = version != null ? version : CURRENT_SCHEMA_VERSION;
        this.recordedAt = recordedAt;
        this.source = source;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    /**
     * Metadata for a non-PHI event recorded now.
     */
    public static EventMetadata defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy with {@code recordedAt} set if it was missing.
     */
    public EventMetadata withRecordedAtIfAbsent(Instant now) {
        if (recordedAt != null) {
            return this;
        }
        return new EventMetadata(phi, consentId, version, now, source, headers);
    }

    public boolean isPhi() { return phi; }
    public String getConsentId() { return consentId; }
    public String getVersion() { return version; }
    public Instant getRecordedAt() { return recordedAt; }
    public String getSource() { return source; }
    public Map<String, String> getHeaders() { return headers; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventMetadata that = (EventMetadata) o;
        return phi == that.phi &&
               Objects.equals(consentId, that.consentId) &&
               Objects.equals(version, that.version) &&
               Objects.equals(recordedAt, that.recordedAt) &&
               Objects.equals(source, that.source) &&
               Objects.equals(headers, that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phi, consentId, version, recordedAt, source, headers);
    }

    @Override
    public String toString() {
        return "EventMetadata{" +
                "phi=" + phi +
                ", consentId='" + consentId + '\'' +
                ", version='" + version + '\'' +
                ", recordedAt=" + recordedAt +
                ", source='" + source + '\'' +
                '}';
    }

    public static class Builder {
        private boolean phi;
        private String consentId;
        private String version;
        private Instant recordedAt;
        private String source;
        private final Map<String, String> headers = new HashMap<>();

        public Builder phi(boolean phi) { this.phi = phi; return this; }
        public Builder consentId(String consentId) { this.consentId = consentId; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder recordedAt(Instant recordedAt) { this.recordedAt = recordedAt; return this; }
        public Builder source(String source) { this.source = source; return this; }

        public Builder header(String key, String value) {
            this.headers.put(key, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public EventMetadata build() {
            return new EventMetadata(phi, consentId, version, recordedAt, source, headers);
        }
    }
}
