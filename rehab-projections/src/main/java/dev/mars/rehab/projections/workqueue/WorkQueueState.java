package dev.mars.rehab.projections.workqueue;

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

import dev.mars.rehab.api.events.Consent;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-subject work queue state: open alerts and the therapists the subject is assigned to.
 */
public final class WorkQueueState {

    private final Map<String, WorkItem> openAlerts;
    private final Map<String, Consent> sharingConsents;
    private String sessionTherapist;

    WorkQueueState() {
        this.openAlerts = new LinkedHashMap<>();
        this.sharingConsents = new LinkedHashMap<>();
    }

    private WorkQueueState(WorkQueueState other) {
        this.openAlerts = new LinkedHashMap<>(other.openAlerts);
        this.sharingConsents = new LinkedHashMap<>(other.sharingConsents);
        this.sessionTherapist = other.sessionTherapist;
    }

    WorkQueueState copy() {
        return new WorkQueueState(this);
    }

    void putAlert(WorkItem item) {
        openAlerts.put(item.getAlertId(), item);
    }

    void removeAlert(String alertId) {
        openAlerts.remove(alertId);
    }

    void putSharingConsent(Consent consent) {
        sharingConsents.put(consent.getConsentId(), consent);
    }

    void setSessionTherapist(String therapistId) {
        this.sessionTherapist = therapistId;
    }

    public Collection<WorkItem> getOpenAlerts() {
        return Collections.unmodifiableCollection(openAlerts.values());
    }

    public String getSessionTherapist() {
        return sessionTherapist;
    }

    /**
     * Therapists named by sharing consents still active at {@code now}.
     */
    public Set<String> sharingTherapistsAt(Instant now) {
        Set<String> therapists = new LinkedHashSet<>();
        for (Consent consent : sharingConsents.values()) {
            if (consent.isActiveAt(now)) {
                therapists.addAll(consent.getTherapistIds());
            }
        }
        return therapists;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkQueueState that = (WorkQueueState) o;
        return openAlerts.equals(that.openAlerts) &&
               sharingConsents.equals(that.sharingConsents) &&
               Objects.equals(sessionTherapist, that.sessionTherapist);
    }

    @Override
    public int hashCode() {
        return Objects.hash(openAlerts, sharingConsents, sessionTherapist);
    }
}
