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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs registered health checks periodically and keeps the latest result of each.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class HealthCheckManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckManager.class);

    private final Duration checkInterval;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final Map<String, HealthCheck> healthChecks = new ConcurrentHashMap<>();
    private final Map<String, HealthStatus> lastResults = new ConcurrentHashMap<>();
    private ScheduledFuture<?> scheduledChecks;
    private volatile boolean running = false;

    /**
     * @param checkInterval how often to run the checks once started
     * @param timeout how long a single check may take before it is reported UNHEALTHY
     */
    public HealthCheckManager(Duration checkInterval, Duration timeout) {
        this.checkInterval = checkInterval;
        this.timeout = timeout;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "rehab-health-check");
            t.setDaemon(true);
            return t;
        });
    }

    public void registerHealthCheck(String name, HealthCheck healthCheck) {
        healthChecks.put(name, healthCheck);
        logger.info("Registered health check: {}", name);
    }

    public synchronized void start() {
        if (running) {
            logger.warn("Health check manager is already running");
            return;
        }
        running = true;
        scheduledChecks = scheduler.scheduleAtFixedRate(this::performHealthChecks,
            0, checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Health check manager started, interval: {}", checkInterval);
    }

    /**
     * Stops the periodic checks. The manager can be started again; the last results are kept.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (scheduledChecks != null) {
            scheduledChecks.cancel(false);
            scheduledChecks = null;
        }
        logger.info("Health check manager stopped");
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs every check now and returns the aggregate. Not usable after {@link #close()}.
     */
    public OverallHealthStatus checkNow() {
        performHealthChecks();
        return getOverallHealth();
    }

    private void performHealthChecks() {
        logger.debug("Performing health checks");

        for (Map.Entry<String, HealthCheck> entry : healthChecks.entrySet()) {
            String name = entry.getKey();
            HealthCheck check = entry.getValue();

            CompletableFuture<HealthStatus> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return check.check();
                } catch (RuntimeException e) {
                    logger.warn("Health check failed: {} - {}", name, e.getMessage(), e);
                    return HealthStatus.unhealthy(name, "Health check threw exception: " + e.getMessage());
                }
            }, scheduler);

            try {
                HealthStatus status = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                lastResults.put(name, status);
                if (status.isUnhealthy()) {
                    logger.warn("Health check failed: {} - {}", name, status.getMessage());
                } else if (status.isDegraded()) {
                    logger.info("Health check degraded: {} - {}", name, status.getMessage());
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                lastResults.put(name, HealthStatus.unhealthy(name, "Health check timed out"));
                logger.warn("Health check timed out: {}", name);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastResults.put(name, HealthStatus.unhealthy(name, "Health check interrupted"));
                return;
            } catch (ExecutionException e) {
                lastResults.put(name, HealthStatus.unhealthy(name, "Health check error: " + e.getCause().getMessage()));
                logger.warn("Health check error: {}", name, e.getCause());
            }
        }
    }

    public OverallHealthStatus getOverallHealth() {
        return OverallHealthStatus.of(new LinkedHashMap<>(lastResults), Instant.now());
    }

    public HealthStatus getHealthStatus(String checkName) {
        return lastResults.get(checkName);
    }

    public boolean isHealthy() {
        return lastResults.values().stream().allMatch(HealthStatus::isHealthy);
    }

    public boolean isRunning() {
        return running;
    }
}
