package dev.mars.rehab.runtime;

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


import dev.mars.rehab.api.error.ConcurrencyConflictException;
import dev.mars.rehab.api.error.InvalidEventException;
import dev.mars.rehab.api.error.InvalidQueryException;
import dev.mars.rehab.api.error.RehabException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.EventMetadata;
import dev.mars.rehab.api.projection.ProjectionFilters;
import dev.mars.rehab.api.projection.ProjectionStatus;
import dev.mars.rehab.api.projection.ProjectionView;
import dev.mars.rehab.api.projection.Projector;
import dev.mars.rehab.api.projection.RebuildHandle;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStore;
import dev.mars.rehab.api.validation.Violation;
import dev.mars.rehab.eventstore.codec.EventJsonCodec;
import dev.mars.rehab.eventstore.validation.EventValidator;
import dev.mars.rehab.pipeline.ProjectionPipeline;
import dev.mars.rehab.projections.adherence.AdherenceProjector;
import dev.mars.rehab.projections.adherence.AdherenceView;
import dev.mars.rehab.projections.quality.QualityProjector;
import dev.mars.rehab.projections.quality.QualityView;
import dev.mars.rehab.projections.summary.PatientSummaryProjector;
import dev.mars.rehab.projections.summary.PatientSummaryView;
import dev.mars.rehab.projections.workqueue.WorkItem;
import dev.mars.rehab.projections.workqueue.WorkQueueProjector;
import dev.mars.rehab.projections.workqueue.WorkQueueView;
import dev.mars.rehab.runtime.metrics.RehabMetrics;
import dev.mars.rehab.runtime.report.PatientProgressReport;
import dev.mars.rehab.runtime.report.TherapistDashboard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for recording and reading clinical activity.
 *
 * <p>Writes are validated, then appended with an optional expected version.
 * Conflicts are reported to the caller and never retried here. Projections are
 * read from the views the pipeline maintains and may trail the streams.
 *
 * <p>Every asynchronous method completes exceptionally with a {@link RehabException}:
 * {@link InvalidEventException}, {@link ConcurrencyConflictException} or
 * {@link dev.mars.rehab.api.error.StorageUnavailableException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class RehabTrackingFacade {
    private static final Logger logger = LoggerFactory.getLogger(RehabTrackingFacade.class);

    /** Open alerts older than this are overdue on the therapist dashboard. */
    public static final Duration OVERDUE_AFTER = Duration.ofHours(24);
    public static final int DASHBOARD_QUEUE_LIMIT = 10;
    public static final int RECENT_EVENTS = 10;

    private final StreamStore streamStore;
    private final EventJsonCodec codec;
    private final EventValidator validator;
    private final ProjectionPipeline pipeline;
    private final RehabMetrics metrics;
    private final Clock clock;
    private final int readPageSize;

    /**
     * @param readPageSize events fetched per store read when a stream is scanned page by page
     */
    public RehabTrackingFacade(StreamStore streamStore, EventJsonCodec codec, EventValidator validator,
                               ProjectionPipeline pipeline, RehabMetrics metrics, Clock clock, int readPageSize) {
        this.streamStore = Objects.requireNonNull(streamStore, "streamStore cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.validator = Objects.requireNonNull(validator, "validator cannot be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (readPageSize <= 0) {
            throw new IllegalArgumentException("readPageSize must be > 0, was " + readPageSize);
        }
        this.readPageSize = readPageSize;
    }

    public CompletableFuture<Event> logEvent(String subjectId, EventKind kind, Map<String, ?> attrs) {
        return logEvent(subjectId, kind, attrs, null, null);
    }

    public CompletableFuture<Event> logEvent(String subjectId, EventKind kind, Map<String, ?> attrs,
                                             Map<String, ?> meta) {
        return logEvent(subjectId, kind, attrs, meta, null);
    }

    /**
     * Validates and appends one event.
     *
     * @param subjectId the stream to append to
     * @param kind the event kind
     * @param attrs body attributes keyed by their snake case names
     * @param meta metadata attributes ({@code phi}, {@code consent_id}, ...), may be null
     * @param expectedVersion the tail version the caller last saw, or null to append unconditionally
     * @return the persisted event with its assigned id and stream version
     */
    public CompletableFuture<Event> logEvent(String subjectId, EventKind kind, Map<String, ?> attrs,
                                             Map<String, ?> meta, Long expectedVersion) {
        EventBody body;
        EventMetadata metadata;
        ExpectedVersion expected;
        try {
            if (kind == null) {
                throw new InvalidEventException(List.of(Violation.of("kind", "is required")));
            }
            body = codec.toBody(kind, attrs);
            metadata = codec.toMetadata(meta);
            expected = toExpectedVersion(expectedVersion);
            validator.validate(subjectId, kind, body, metadata).throwIfInvalid();
        } catch (InvalidEventException e) {
            metrics.recordRejected(kind);
            logger.warn("Rejected {} event for subject {}: {} violation(s)", kind, subjectId, e.getViolations().size());
            return CompletableFuture.failedFuture(e);
        } catch (RehabException e) {
            return CompletableFuture.failedFuture(e);
        }

        return streamStore.append(subjectId, body, metadata, expected)
            .whenComplete((event, error) -> {
                if (error == null) {
                    metrics.recordAppended(kind);
                    logger.debug("Appended {} for subject {} at version {}", kind, subjectId, event.getStreamVersion());
                } else if (unwrap(error) instanceof ConcurrencyConflictException) {
                    metrics.recordConflict();
                    logger.debug("Version conflict appending {} for subject {}: {}", kind, subjectId, unwrap(error).getMessage());
                } else {
                    logger.warn("Failed to append {} for subject {}: {}", kind, subjectId, unwrap(error).getMessage());
                }
            });
    }

    /**
     * Same as {@link #logEvent(String, EventKind, Map, Map, Long)} with the kind given by
     * name ({@code ExerciseSession}, {@code EXERCISE_SESSION} or {@code exercise_session}).
     */
    public CompletableFuture<Event> logEvent(String subjectId, String kind, Map<String, ?> attrs,
                                             Map<String, ?> meta, Long expectedVersion) {
        EventKind resolved = EventKind.fromName(kind).orElse(null);
        if (resolved == null && kind != null && !kind.isBlank()) {
            metrics.recordRejected(null);
            return CompletableFuture.failedFuture(new InvalidEventException(
                List.of(Violation.of("kind", "unknown event kind '" + kind + "'"))));
        }
        return logEvent(subjectId, resolved, attrs, meta, expectedVersion);
    }

    public CompletableFuture<List<Event>> readStream(String subjectId, ReadOptions options) {
        return streamStore.read(subjectId, options != null ? options : ReadOptions.all());
    }

    /**
     * Reads the subject's events of one kind, in version order. The limit applies to
     * the filtered result; the stream is read a page at a time and reading stops once
     * the limit is reached.
     */
    public CompletableFuture<List<Event>> readStreamByKind(String subjectId, EventKind kind, ReadOptions options) {
        Objects.requireNonNull(kind, "kind cannot be null");
        ReadOptions effective = options != null ? options : ReadOptions.all();
        return collectByKind(subjectId, kind, effective.getFromVersion(), effective.getLimit(), new ArrayList<>());
    }

    private CompletableFuture<List<Event>> collectByKind(String subjectId, EventKind kind, long fromVersion,
                                                         int limit, List<Event> found) {
        return streamStore.read(subjectId, ReadOptions.of(fromVersion, readPageSize))
            .thenCompose(page -> {
                for (Event event : page) {
                    if (event.getKind() == kind) {
                        found.add(event);
                        if (found.size() >= limit) {
                            return CompletableFuture.completedFuture(found);
                        }
                    }
                }
                if (page.size() < readPageSize) {
                    return CompletableFuture.completedFuture(found);
                }
                long next = page.get(page.size() - 1).getStreamVersion() + 1;
                return collectByKind(subjectId, kind, next, limit, found);
            });
    }

    public CompletableFuture<Long> streamVersion(String subjectId) {
        return streamStore.tailVersion(subjectId);
    }

    /**
     * Queries a projection by name: {@code adherence}, {@code quality}, {@code work_queue}
     * or {@code patient_summary}.
     *
     * @throws InvalidQueryException for an unknown name or a missing or malformed filter
     */
    public ProjectionView project(String name, ProjectionFilters filters) {
        Projector projector = pipeline.projector(name)
            .orElseThrow(() -> new InvalidQueryException("Unknown projection: " + name));
        return projector.query(filters != null ? filters : ProjectionFilters.of(Map.of()));
    }

    /**
     * Rebuilds a projection for one subject, or for all subjects when {@code subjectId}
     * is null. Also redrives dead-lettered batches of that subject.
     *
     * @throws InvalidQueryException for an unknown name
     */
    public RebuildHandle rebuild(String name, String subjectId) {
        logger.info("Rebuild requested for projection {} ({})", name, subjectId == null ? "all subjects" : subjectId);
        return pipeline.rebuild(name, subjectId);
    }

    public List<ProjectionStatus> projectionStatus() {
        return pipeline.status();
    }

    /**
     * The therapist's queue (first {@value #DASHBOARD_QUEUE_LIMIT} items), their alerts
     * open for longer than {@link #OVERDUE_AFTER}, and every patient whose form quality
     * is declining.
     */
    public TherapistDashboard getTherapistDashboard(String therapistId) {
        if (therapistId == null || therapistId.isBlank()) {
            throw new InvalidQueryException("Missing required filter: " + ProjectionFilters.THERAPIST_ID);
        }
        WorkQueueProjector workQueue = projector(WorkQueueProjector.ID, WorkQueueProjector.class);
        WorkQueueView queue = workQueue.query(ProjectionFilters.builder()
            .therapistId(therapistId)
            .limit(DASHBOARD_QUEUE_LIMIT)
            .build());
        List<WorkItem> overdue = workQueue.overdue(therapistId, OVERDUE_AFTER);
        List<String> declining = projector(QualityProjector.ID, QualityProjector.class).decliningSubjects();

        TherapistDashboard dashboard = new TherapistDashboard(therapistId, queue.getTotalOpen(), queue.getItems(),
            overdue, declining);
        logger.debug("Built dashboard for therapist {}: {}", therapistId, dashboard);
        return dashboard;
    }

    /**
     * Adherence, quality and clinical summary of one patient, with the last
     * {@value #RECENT_EVENTS} events of their stream.
     */
    public CompletableFuture<PatientProgressReport> getPatientProgressReport(String subjectId) {
        ProjectionFilters filters;
        AdherenceView adherence;
        QualityView quality;
        PatientSummaryView summary;
        try {
            filters = ProjectionFilters.subject(subjectId);
            adherence = projector(AdherenceProjector.ID, AdherenceProjector.class).query(filters);
            quality = projector(QualityProjector.ID, QualityProjector.class).query(filters);
            summary = projector(PatientSummaryProjector.ID, PatientSummaryProjector.class).query(filters);
        } catch (RehabException e) {
            return CompletableFuture.failedFuture(e);
        }

        return streamStore.tailVersion(subjectId)
            .thenCompose(tail -> tail == 0
                ? CompletableFuture.completedFuture(List.<Event>of())
                : streamStore.read(subjectId, ReadOptions.of(Math.max(1, tail - RECENT_EVENTS + 1), RECENT_EVENTS)))
            .thenApply(recent -> new PatientProgressReport(subjectId, adherence, quality, summary, recent,
                clock.instant()));
    }

    private <P extends Projector> P projector(String projectorId, Class<P> type) {
        Projector projector = pipeline.projector(projectorId)
            .orElseThrow(() -> new InvalidQueryException("Unknown projection: " + projectorId));
        if (!type.isInstance(projector)) {
            throw new InvalidQueryException("Projection " + projectorId + " is not a " + type.getSimpleName());
        }
        return type.cast(projector);
    }

    private static ExpectedVersion toExpectedVersion(Long expectedVersion) {
        if (expectedVersion != null && expectedVersion < 0) {
            throw new InvalidEventException(List.of(Violation.of("expected_version", "must be >= 0")));
        }
        return ExpectedVersion.ofNullable(expectedVersion);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
