package dev.mars.rehab.runtime.report;

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


import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.projections.adherence.AdherenceView;
import dev.mars.rehab.projections.quality.QualityView;
import dev.mars.rehab.projections.summary.PatientSummaryView;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A patient's adherence, form quality and clinical summary, with their latest events.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class PatientProgressReport {

    private final String subjectId;
    private final AdherenceView adherence;
    private final QualityView quality;
    private final PatientSummaryView summary;
    private final List<Event> recentEvents;
    private final Instant generatedAt;

    public PatientProgressReport(String subjectId, AdherenceView adherence, QualityView quality,
                                 PatientSummaryView summary, List<Event> recentEvents, Instant generatedAt) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId cannot be null");
        this.adherence = Objects.requireNonNull(adherence, "adherence cannot be null");
        this.quality = Objects.requireNonNull(quality, "quality cannot be null");
        this.summary = Objects.requireNonNull(summary, "summary cannot be null");
        this.recentEvents = List.copyOf(recentEvents);
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt cannot be null");
    }

    public String getSubjectId() { return subjectId; }
    public AdherenceView getAdherence() { return adherence; }
    public QualityView getQuality() { return quality; }
    public PatientSummaryView getSummary() { return summary; }

    /** The latest events of the stream, oldest first. */
    public List<Event> getRecentEvents() { return recentEvents; }
    public Instant getGeneratedAt() { return generatedAt; }

    @Override
    public String toString() {
        return "PatientProgressReport{" +
            "subjectId='" + subjectId + '\'' +
            ", recentEvents=" + recentEvents.size() +
            ", generatedAt=" + generatedAt +
            '}';
    }
}
