package dev.mars.rehab.eventstore.consent;

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

import dev.mars.rehab.api.consent.ConsentRegistry;
import dev.mars.rehab.api.events.Consent;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.store.AppendListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Consent registry kept current from the event log.
 *
 * <p>Registered as an {@link AppendListener}, it records the latest state of every
 * {@code Consent} event by consent id. Grants can also be registered directly,
 * for consents captured outside the tracking core. A consent is active while its
 * latest state is {@code GRANTED} and it has not expired.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class InMemoryConsentRegistry implements ConsentRegistry, AppendListener {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryConsentRegistry.class);

    private final Map<String, ConsentRecord> consents = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConsentRegistry() {
        this(Clock.systemUTC());
    }

    public InMemoryConsentRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public boolean isConsentActive(String consentId, String subjectId) {
        if (consentId == null || subjectId == null) {
            return false;
        }
        ConsentRecord record = consents.get(consentId);
        return record != null && record.subjectId.equals(subjectId) && record.consent.isActiveAt(clock.instant());
    }

    /**
     * Records a consent that was granted outside the event log. A later consent
     * event with the same id replaces it.
     */
    public void register(String subjectId, Consent consent) {
        apply(subjectId, consent, 0);
    }

    public void revoke(String consentId) {
        consents.computeIfPresent(consentId, (id, record) -> new ConsentRecord(record.subjectId,
            new Consent(id, record.consent.getConsentType(), Consent.Status.REVOKED, record.consent.getGrantedBy(),
                record.consent.getExpiresAt(), record.consent.getTherapistIds(), record.consent.getConsentVersion()),
            record.version));
        logger.info("Revoked consent {}", consentId);
    }

    public Optional<String> subjectOf(String consentId) {
        ConsentRecord record = consents.get(consentId);
        return record == null ? Optional.empty() : Optional.of(record.subjectId);
    }

    @Override
    public void onAppended(Event event) {
        if (event.getKind() != EventKind.CONSENT) {
            return;
        }
        apply(event.getSubjectId(), event.getBody(Consent.class), event.getStreamVersion());
    }

    public int size() {
        return consents.size();
    }

    private void apply(String subjectId, Consent consent, long version) {
        consents.merge(consent.getConsentId(), new ConsentRecord(subjectId, consent, version), (current, update) -> {
            if (!current.subjectId.equals(update.subjectId)) {
                logger.warn("Ignoring consent {} from subject {}, it belongs to subject {}", consent.getConsentId(),
                    update.subjectId, current.subjectId);
                return current;
            }
            return current.version > update.version ? current : update;
        });
        logger.debug("Consent {} of {} is now {}", consent.getConsentId(), subjectId, consent.getStatus());
    }

    private static final class ConsentRecord {
        private final String subjectId;
        private final Consent consent;
        private final long version;

        ConsentRecord(String subjectId, Consent consent, long version) {
            this.subjectId = subjectId;
            this.consent = consent;
            this.version = version;
        }
    }
}
