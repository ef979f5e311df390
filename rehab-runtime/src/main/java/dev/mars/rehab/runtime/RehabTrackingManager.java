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


import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.rehab.api.checkpoint.CheckpointStore;
import dev.mars.rehab.api.deadletter.DeadLetterQueue;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.projection.ProjectionStatus;
import dev.mars.rehab.api.projection.Projector;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStore;
import dev.mars.rehab.eventstore.InMemoryStreamStore;
import dev.mars.rehab.eventstore.PgStreamStore;
import dev.mars.rehab.eventstore.checkpoint.InMemoryCheckpointStore;
import dev.mars.rehab.eventstore.codec.EventJsonCodec;
import dev.mars.rehab.eventstore.consent.InMemoryConsentRegistry;
import dev.mars.rehab.eventstore.validation.EventValidator;
import dev.mars.rehab.pipeline.ProjectionPipeline;
import dev.mars.rehab.pipeline.deadletter.InMemoryDeadLetterQueue;
import dev.mars.rehab.pipeline.metrics.PipelineMetrics;
import dev.mars.rehab.pipeline.resilience.CircuitBreakerManager;
import dev.mars.rehab.projections.ProjectorContext;
import dev.mars.rehab.projections.adherence.AdherenceProjector;
import dev.mars.rehab.projections.quality.QualityProjector;
import dev.mars.rehab.projections.summary.PatientSummaryProjector;
import dev.mars.rehab.projections.workqueue.WorkQueueProjector;
import dev.mars.rehab.runtime.config.RehabConfiguration;
import dev.mars.rehab.runtime.health.HealthCheckManager;
import dev.mars.rehab.runtime.health.OverallHealthStatus;
import dev.mars.rehab.runtime.health.RehabHealthChecks;
import dev.mars.rehab.runtime.metrics.RehabMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composition root of the tracking runtime.
 *
 * <p>Builds the stream store selected by configuration, the consent registry, the
 * validator, the four projectors, the dead letter queue, the circuit breaker, the
 * projection pipeline, metrics and health checks, and exposes them through a
 * {@link RehabTrackingFacade}. {@link #start()} prepares the store, restores consent
 * state from the log and starts delivery; {@link #close()} releases everything the
 * manager created.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class RehabTrackingManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RehabTrackingManager.class);

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final RehabConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final boolean meterRegistryOwnedByManager;
    private final StreamStore streamStore;
    private final boolean streamStoreOwnedByManager;
    private final EventJsonCodec codec;
    private final InMemoryConsentRegistry consentRegistry;
    private final EventValidator validator;
    private final CheckpointStore checkpointStore;
    private final ExecutorService rebuildExecutor;
    private final List<Projector> projectors;
    private final DeadLetterQueue deadLetterQueue;
    private final CircuitBreakerManager circuitBreakerManager;
    private final PipelineMetrics pipelineMetrics;
    private final RehabMetrics metrics;
    private final ProjectionPipeline pipeline;
    private final HealthCheckManager healthCheckManager;
    private final RehabTrackingFacade facade;
    private volatile boolean started = false;

    public RehabTrackingManager() {
        this(new RehabConfiguration());
    }

    public RehabTrackingManager(String profile) {
        this(new RehabConfiguration(profile));
    }

    public RehabTrackingManager(RehabConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), true, null, Clock.systemUTC());
    }

    public RehabTrackingManager(RehabConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, false, null, Clock.systemUTC());
    }

    /**
     * Uses a stream store owned by the caller instead of the one configured; the
     * store is not closed with the manager.
     */
    public RehabTrackingManager(RehabConfiguration configuration, MeterRegistry meterRegistry,
                                StreamStore streamStore, Clock clock) {
        this(configuration, meterRegistry, false, streamStore, clock);
    }

    private RehabTrackingManager(RehabConfiguration configuration, MeterRegistry meterRegistry,
                                 boolean meterRegistryOwnedByManager, StreamStore externalStore, Clock clock) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;
        this.meterRegistryOwnedByManager = meterRegistryOwnedByManager;

        logger.info("Initializing RehabTrack manager with profile: {}", configuration.getProfile());

        ObjectMapper objectMapper = EventJsonCodec.createDefaultObjectMapper();
        this.codec = new EventJsonCodec(objectMapper);

        RehabConfiguration.StoreConfig storeConfig = configuration.getStoreConfig();
        if (externalStore != null) {
            this.streamStore = externalStore;
            this.streamStoreOwnedByManager = false;
            logger.info("Using provided stream store {} (external ownership)", externalStore.getClass().getSimpleName());
        } else {
            this.streamStore = createStreamStore(storeConfig, codec, clock);
            this.streamStoreOwnedByManager = true;
        }

        this.consentRegistry = new InMemoryConsentRegistry(clock);
        streamStore.addAppendListener(consentRegistry);
        this.validator = new EventValidator(consentRegistry);

        RehabConfiguration.ProjectionConfig projectionConfig = configuration.getProjectionConfig();
        this.checkpointStore = new InMemoryCheckpointStore();
        this.rebuildExecutor = Executors.newFixedThreadPool(projectionConfig.getRebuildThreads(),
            daemonThreads("rehab-rebuild-"));
        ProjectorContext context = ProjectorContext.builder()
            .streamStore(streamStore)
            .checkpointStore(checkpointStore)
            .rebuildExecutor(rebuildExecutor)
            .clock(clock)
            .rebuildPageSize(projectionConfig.getRebuildPageSize())
            .qualitySampleWindow(projectionConfig.getQualitySampleWindow())
            .build();
        this.projectors = List.of(
            new AdherenceProjector(context),
            new QualityProjector(context),
            new WorkQueueProjector(context),
            new PatientSummaryProjector(context));

        RehabConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        this.deadLetterQueue = new InMemoryDeadLetterQueue(clock);
        this.circuitBreakerManager = new CircuitBreakerManager(configuration.getCircuitBreakerConfig(), meterRegistry);
        this.pipelineMetrics = new PipelineMetrics(metricsConfig.getInstanceId());
        this.metrics = new RehabMetrics(metricsConfig.getInstanceId());
        if (metricsConfig.isEnabled()) {
            pipelineMetrics.bindTo(meterRegistry);
            metrics.bindTo(meterRegistry);
        }

        this.pipeline = new ProjectionPipeline(streamStore, projectors, deadLetterQueue,
            configuration.getPipelineConfig(), circuitBreakerManager, pipelineMetrics);
        this.facade = new RehabTrackingFacade(streamStore, codec, validator, pipeline, metrics, clock,
            projectionConfig.getRebuildPageSize());

        RehabConfiguration.HealthCheckConfig healthConfig = configuration.getHealthCheckConfig();
        this.healthCheckManager = new HealthCheckManager(healthConfig.getInterval(), healthConfig.getTimeout());
        healthCheckManager.registerHealthCheck(RehabHealthChecks.STREAM_STORE,
            RehabHealthChecks.streamStore(streamStore, healthConfig.getTimeout()));
        healthCheckManager.registerHealthCheck(RehabHealthChecks.PIPELINE,
            RehabHealthChecks.pipelineRunning(pipeline));
        healthCheckManager.registerHealthCheck(RehabHealthChecks.DEAD_LETTERS,
            RehabHealthChecks.deadLetters(deadLetterQueue, healthConfig.getDeadLetterThreshold()));
        healthCheckManager.registerHealthCheck(RehabHealthChecks.PROJECTION_LAG,
            RehabHealthChecks.projectionLag(pipeline, healthConfig.getLagThreshold()));

        logger.info("RehabTrack manager initialized: store={}, projectors={}",
            streamStore.getClass().getSimpleName(), projectors.size());
    }

    private static StreamStore createStreamStore(RehabConfiguration.StoreConfig storeConfig, EventJsonCodec codec,
                                                 Clock clock) {
        switch (storeConfig.getType()) {
            case POSTGRES:
                logger.info("Creating PostgreSQL stream store: {}", storeConfig);
                return PgStreamStore.create(storeConfig.toConnectOptions(), storeConfig.toPoolOptions(), codec);
            case MEMORY:
            default:
                logger.info("Creating in-memory stream store");
                return new InMemoryStreamStore(clock);
        }
    }

    /**
     * Prepares the store, restores consent state and starts projection delivery and
     * health checks.
     *
     * @throws IllegalStateException if the store cannot be prepared
     */
    public synchronized void start() {
        if (started) {
            logger.warn("RehabTrack manager is already started");
            return;
        }
        logger.info("Starting RehabTrack manager...");

        if (streamStore instanceof PgStreamStore && configuration.getStoreConfig().isInitializeSchema()) {
            await(((PgStreamStore) streamStore).initializeSchema(), "initialize stream store schema");
        }
        restoreConsents();

        pipeline.start();
        if (configuration.getHealthCheckConfig().isEnabled()) {
            healthCheckManager.start();
        }
        started = true;
        logger.info("RehabTrack manager started successfully");
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        logger.info("Stopping RehabTrack manager...");
        healthCheckManager.stop();
        pipeline.stop();
        started = false;
        logger.info("RehabTrack manager stopped");
    }

    @Override
    public void close() {
        stop();
        healthCheckManager.close();
        pipeline.close();
        rebuildExecutor.shutdownNow();
        deadLetterQueue.close();
        streamStore.removeAppendListener(consentRegistry);
        if (streamStoreOwnedByManager) {
            streamStore.close();
        }
        if (meterRegistryOwnedByManager) {
            meterRegistry.close();
        }
        logger.info("RehabTrack manager closed");
    }

    /**
     * Consent events already in the log are replayed into the registry so the
     * consent gate sees grants made before a restart.
     */
    private void restoreConsents() {
        Set<String> subjects = await(streamStore.subjects(), "list subjects");
        int restored = 0;
        for (String subjectId : subjects) {
            List<Event> events = await(streamStore.read(subjectId, ReadOptions.all()), "read stream " + subjectId);
            for (Event event : events) {
                if (event.getKind() == EventKind.CONSENT) {
                    consentRegistry.onAppended(event);
                    restored++;
                }
            }
        }
        if (restored > 0) {
            logger.info("Restored {} consent event(s) from {} subject stream(s)", restored, subjects.size());
        }
    }

    private static <T> T await(CompletableFuture<T> future, String what) {
        try {
            return future.get(STARTUP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while trying to " + what, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to " + what, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out trying to " + what, e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isHealthy() {
        return healthCheckManager.isHealthy();
    }

    public SystemStatus getSystemStatus() {
        return new SystemStatus(
            started,
            configuration.getProfile(),
            healthCheckManager.getOverallHealth(),
            metrics.getSummary(),
            pipeline.status(),
            deadLetterQueue.count()
        );
    }

    public RehabTrackingFacade getFacade() { return facade; }
    public RehabConfiguration getConfiguration() { return configuration; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public StreamStore getStreamStore() { return streamStore; }
    public EventJsonCodec getCodec() { return codec; }
    public InMemoryConsentRegistry getConsentRegistry() { return consentRegistry; }
    public ProjectionPipeline getPipeline() { return pipeline; }
    public DeadLetterQueue getDeadLetterQueue() { return deadLetterQueue; }
    public CircuitBreakerManager getCircuitBreakerManager() { return circuitBreakerManager; }
    public HealthCheckManager getHealthCheckManager() { return healthCheckManager; }
    public RehabMetrics getMetrics() { return metrics; }
    public PipelineMetrics getPipelineMetrics() { return pipelineMetrics; }

    /**
     * System status data class.
     */
    public static class SystemStatus {
        private final boolean started;
        private final String profile;
        private final OverallHealthStatus healthStatus;
        private final RehabMetrics.MetricsSummary metricsSummary;
        private final List<ProjectionStatus> projections;
        private final long deadLetters;

        public SystemStatus(boolean started, String profile, OverallHealthStatus healthStatus,
                            RehabMetrics.MetricsSummary metricsSummary, List<ProjectionStatus> projections,
                            long deadLetters) {
            this.started = started;
            this.profile = profile;
            this.healthStatus = healthStatus;
            this.metricsSummary = metricsSummary;
            this.projections = List.copyOf(projections);
            this.deadLetters = deadLetters;
        }

        public boolean isStarted() { return started; }
        public String getProfile() { return profile; }
        public OverallHealthStatus getHealthStatus() { return healthStatus; }
        public RehabMetrics.MetricsSummary getMetricsSummary() { return metricsSummary; }
        public List<ProjectionStatus> getProjections() { return projections; }
        public long getDeadLetters() { return deadLetters; }

        @Override
        public String toString() {
            return "SystemStatus{" +
                    "started=" + started +
                    ", profile='" + profile + '\'' +
                    ", health=" + (healthStatus != null ? healthStatus.getStatus() : "unknown") +
                    ", eventsAppended=" + (metricsSummary != null ? metricsSummary.getEventsAppended() : 0) +
                    ", deadLetters=" + deadLetters +
                    '}';
        }
    }
}
