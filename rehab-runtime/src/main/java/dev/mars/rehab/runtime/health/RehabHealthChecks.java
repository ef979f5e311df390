package dev.mars.rehab.runtime.health;

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


import dev.mars.rehab.api.deadletter.DeadLetterQueue;
import dev.mars.rehab.api.projection.ProjectionStatus;
import dev.mars.rehab.api.store.StreamStatistics;
import dev.mars.rehab.api.store.StreamStore;
import dev.mars.rehab.pipeline.ProjectionPipeline;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The checks registered by the tracking runtime.
 */
public final class RehabHealthChecks {

    public static final String STREAM_STORE = "stream-store";
    public static final String PIPELINE = "projection-pipeline";
    public static final String DEAD_LETTERS = "dead-letters";
    public static final String PROJECTION_LAG = "projection-lag";

    private RehabHealthChecks() {
    }

    /**
     * UNHEALTHY when the store cannot produce its statistics within {@code timeout}.
     */
    public static HealthCheck streamStore(StreamStore store, Duration timeout) {
        return () -> {
            try {
                StreamStatistics stats = store.statistics().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("subjects", stats.getSubjectCount());
                details.put("events", stats.getEventCount());
                return HealthStatus.healthy(STREAM_STORE, details);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HealthStatus.unhealthy(STREAM_STORE, "Interrupted while reading store statistics");
            } catch (ExecutionException e) {
                return HealthStatus.unhealthy(STREAM_STORE, "Stream store unavailable: " + e.getCause().getMessage());
            } catch (TimeoutException e) {
                return HealthStatus.unhealthy(STREAM_STORE, "Stream store did not respond within " + timeout);
            }
        };
    }

    public static HealthCheck pipelineRunning(ProjectionPipeline pipeline) {
        return () -> {
            if (!pipeline.isRunning()) {
                return HealthStatus.unhealthy(PIPELINE, "Projection pipeline is not running");
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("projectors", pipeline.projectors().size());
            details.put("worker_restarts", pipeline.getWorkerRestarts());
            return HealthStatus.healthy(PIPELINE, details);
        };
    }

    /**
     * DEGRADED once more than {@code threshold} batches have been dead-lettered.
     */
    public static HealthCheck deadLetters(DeadLetterQueue deadLetterQueue, long threshold) {
        return () -> {
            long count = deadLetterQueue.count();
            Map<String, Object> details = Map.of("dead_letters", count, "threshold", threshold);
            if (count > threshold) {
                return HealthStatus.degraded(DEAD_LETTERS, count + " batch(es) dead-lettered", details);
            }
            return HealthStatus.healthy(DEAD_LETTERS, details);
        };
    }

    /**
     * DEGRADED when any projector lags its streams by more than {@code threshold} events.
     */
    public static HealthCheck projectionLag(ProjectionPipeline pipeline, long threshold) {
        return () -> {
            Map<String, Long> lagByProjector = new LinkedHashMap<>();
            for (ProjectionStatus status : pipeline.status()) {
                lagByProjector.put(status.getProjectorId(), status.getLag());
            }
            return HealthStatus.projectionLag(PROJECTION_LAG, lagByProjector, threshold);
        };
    }
}
