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
import java.util.List;
import java.util.Objects;

/**
 * A patient consent record for data collection, sharing or research.
 *
 * <p>A consent is active while its status is {@link Status#GRANTED} and it has not
 * expired. Logging the same {@code consent_id} as {@link Status#REVOKED} withdraws it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class Consent extends EventBody {

    public enum Type {
        DATA_COLLECTION,
        SHARING,
        RESEARCH,
        MARKETING,
        VIDEO_RECORDING
    }

    public enum Status {
        GRANTED,
        REVOKED,
        EXPIRED,
        PENDING
    }

    @JsonProperty("consent_id")
    private final String consentId;
    @JsonProperty("consent_type")
    private final Type consentType;
    @JsonProperty("status")
    private final Status status;
    @JsonProperty("granted_by")
    private final String grantedBy;
    @JsonProperty("expires_at")
    private final Instant expiresAt;
    @JsonProperty("therapist_ids")
    private final List<String> therapistIds;
    @JsonProperty("consent_version")
    private final String consentVersion;

    @JsonCreator
    public Consent(@JsonProperty("consent_id") String consentId,
                   @JsonProperty("consent_type") Type consentType,
                   @JsonProperty("status") Status status,
                   @JsonProperty("granted_by") String grantedBy,
                   @JsonProperty("expires_at") Instant expiresAt,
                   @JsonProperty("therapist_ids") List<String> therapistIds,
                   @JsonProperty("consent_version") String consentVersion) {
        this.consentId = consentId;
        this.consentType = consentType;
        this.status = status != null ? status : Status.GRANTED;
        this.grantedBy = grantedBy;
        this.expiresAt = expiresAt;
        this.therapistIds = therapistIds != null ? List.copyOf(therapistIds) : List.of();
        this.consentVersion = consentVersion != null ? consentVersion : "1.0";
    }

    public static Consent granted(String consentId, Type type) {
        return new Consent(consentId, type, Status.GRANTED, null, null, null, null);
    }

    public static Consent sharing(String consentId, List<String> therapistIds) {
        return new Consent(consentId, Type.SHARING, Status.GRANTED, null, null, therapistIds, null);
    }

    /**
     * Whether this record, taken on its own, grants consent at the given instant.
     */
    public boolean isActiveAt(Instant instant) {
        return status == Status.GRANTED && (expiresAt == null || instant.isBefore(expiresAt));
    }

    @Override
    public EventKind kind() {
        return EventKind.CONSENT;
    }

    @Override
    public <R> R accept(EventBodyVisitor<R> visitor) {
        return visitor.visitConsent(this);
    }

    public String getConsentId() { return consentId; }
    public Type getConsentType() { return consentType; }
    public Status getStatus() { return status; }
    public String getGrantedBy() { return grantedBy; }
    public Instant getExpiresAt() { return expiresAt; }
    public List<String> getTherapistIds() { return therapistIds; }
    public String getConsentVersion() { return consentVersion; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Consent that = (Consent) o;
        return Objects.equals(consentId, that.consentId) &&
               consentType == that.consentType &&
               status == that.status &&
               Objects.equals(grantedBy, that.grantedBy) &&
               Objects.equals(expiresAt, that.expiresAt) &&
               Objects.equals(therapistIds, that.therapistIds) &&
               Objects.equals(consentVersion, that.consentVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(consentId, consentType, status, grantedBy, expiresAt, therapistIds, consentVersion);
    }

    @Override
    public String toString() {
        return "Consent{" +
                "consentId='" + consentId + '\'' +
                ", consentType=" + consentType +
                ", status=" + status +
                '}';
    }
}
