package dev.mars.rehab.pipeline.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Metrics for the projection pipeline.
 *
 * <p>Totals are kept whether or not the binder has been bound to a registry, so
 * health checks and tests can read them directly.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class PipelineMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(PipelineMetrics.class);

    private final String instanceId;
    private final Map<String, Supplier<Number>> lagSources = new ConcurrentHashMap<>();
    private final AtomicLong batchesApplied = new AtomicLong(0);
    private final AtomicLong batchesRetried = new AtomicLong(0);
    private final AtomicLong batchesDeadLettered = new AtomicLong(0);
    private volatile MeterRegistry registry;

    private Counter appliedCounter;
    private Counter retriedCounter;
    private Counter deadLetteredCounter;

    public PipelineMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        appliedCounter = Counter.builder("rehab.pipeline.batches.applied")
            .description("Total number of batches applied to projectors")
            .tag("instance", instanceId)
            .register(registry);

        retriedCounter = Counter.builder("rehab.pipeline.batches.retried")
            .description("Total number of batch retry attempts")
            .tag("instance", instanceId)
            .register(registry);

        deadLetteredCounter = Counter.builder("rehab.pipeline.batches.dead_lettered")
            .description("Total number of batches sent to the dead letter queue")
            .tag("instance", instanceId)
            .register(registry);

        lagSources.forEach((projectorId, lag) -> registerLagGauge(registry, projectorId, lag));
        this.registry = registry;

        logger.info("Pipeline metrics registered for instance: {}", instanceId);
    }

    /**
     * Publishes {@code rehab.projection.lag} for a projector, now or once the binder is bound.
     */
    public void trackLag(String projectorId, Supplier<Number> lag) {
        lagSources.put(projectorId, lag);
        MeterRegistry bound = registry;
        if (bound != null) {
            registerLagGauge(bound, projectorId, lag);
        }
    }

    public void recordBatchApplied(String projectorId, int events, Duration applyTime) {
        batchesApplied.incrementAndGet();
        if (appliedCounter != null) {
            appliedCounter.increment();
        }
        MeterRegistry bound = registry;
        if (bound != null) {
            Timer.builder("rehab.pipeline.apply.time")
                .description("Time taken to apply one batch")
                .tag("instance", instanceId)
                .tag("projector", projectorId)
                .register(bound)
                .record(applyTime);
            Counter.builder("rehab.pipeline.events.applied")
                .tag("instance", instanceId)
                .tag("projector", projectorId)
                .register(bound)
                .increment(events);
        }
    }

    public void recordBatchRetried(String projectorId) {
        batchesRetried.incrementAndGet();
        if (retriedCounter != null) {
            retriedCounter.increment();
        }
    }

    public void recordBatchDeadLettered(String projectorId) {
        batchesDeadLettered.incrementAndGet();
        if (deadLetteredCounter != null) {
            deadLetteredCounter.increment();
        }
    }

    public long getBatchesApplied() { return batchesApplied.get(); }
    public long getBatchesRetried() { return batchesRetried.get(); }
    public long getBatchesDeadLettered() { return batchesDeadLettered.get(); }
    public String getInstanceId() { return instanceId; }

    private void registerLagGauge(MeterRegistry registry, String projectorId, Supplier<Number> lag) {
        Gauge.builder("rehab.projection.lag", lag)
            .description("Events appended but not yet applied by the projector")
            .tag("instance", instanceId)
            .tag("projector", projectorId)
            .register(registry);
    }
}
