package dev.mars.rehab.pipeline.resilience;

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

import dev.mars.rehab.api.error.RehabException;
import dev.mars.rehab.pipeline.config.BreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Manages circuit breakers guarding stream store access.
 *
 * <p>Only transient failures count against a breaker: {@link RehabException}s that are
 * not retryable (conflicts, invalid input) pass through without being recorded.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class CircuitBreakerManager {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers;
    private final boolean enabled;

    public CircuitBreakerManager(BreakerConfig config, MeterRegistry meterRegistry) {
        this.enabled = config.isEnabled();
        this.circuitBreakers = new ConcurrentHashMap<>();

        if (enabled) {
            CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold((float) config.getFailureRateThreshold())
                .waitDurationInOpenState(config.getWaitDuration())
                .slidingWindowSize(config.getRingBufferSize())
                .minimumNumberOfCalls(config.getFailureThreshold())
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(CircuitBreakerManager::isTransient)
                .build();

            this.circuitBreakerRegistry = CircuitBreakerRegistry.of(cbConfig);

            if (meterRegistry != null) {
                TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry)
                    .bindTo(meterRegistry);
            }

            logger.info("Circuit breaker manager initialized with config: {}", config);
        } else {
            this.circuitBreakerRegistry = null;
            logger.info("Circuit breaker is disabled");
        }
    }

    /**
     * Gets or creates a circuit breaker for the specified operation, or null when disabled.
     */
    public CircuitBreaker getCircuitBreaker(String name) {
        if (!enabled) {
            return null;
        }

        return circuitBreakers.computeIfAbsent(name, key -> {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(key);

            cb.getEventPublisher()
                .onStateTransition(event ->
                    logger.info("Circuit breaker '{}' state transition: {} -> {}",
                        key, event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()))
                .onFailureRateExceeded(event ->
                    logger.warn("Circuit breaker '{}' failure rate exceeded: {}%",
                        key, event.getFailureRate()))
                .onCallNotPermitted(event ->
                    logger.debug("Circuit breaker '{}' call not permitted", key));

            logger.info("Created circuit breaker: {}", key);
            return cb;
        });
    }

    /**
     * Executes a supplier with circuit breaker protection.
     *
     * @throws io.github.resilience4j.circuitbreaker.CallNotPermittedException if the breaker is open
     */
    public <T> T executeSupplier(String circuitBreakerName, Supplier<T> supplier) {
        if (!enabled) {
            return supplier.get();
        }

        CircuitBreaker circuitBreaker = getCircuitBreaker(circuitBreakerName);
        return CircuitBreaker.decorateSupplier(circuitBreaker, supplier).get();
    }

    /**
     * Stream store operation circuit breaker.
     */
    public <T> T executeStoreOperation(String operation, Supplier<T> supplier) {
        return executeSupplier("stream-store-" + operation, supplier);
    }

    public CircuitBreakerMetrics getMetrics(String name) {
        if (!enabled) {
            return CircuitBreakerMetrics.disabled();
        }

        CircuitBreaker cb = circuitBreakers.get(name);
        if (cb == null) {
            return CircuitBreakerMetrics.notFound();
        }

        CircuitBreaker.Metrics metrics = cb.getMetrics();
        return new CircuitBreakerMetrics(
            cb.getState().toString(),
            metrics.getNumberOfSuccessfulCalls(),
            metrics.getNumberOfFailedCalls(),
            metrics.getFailureRate(),
            metrics.getNumberOfNotPermittedCalls()
        );
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Resets a circuit breaker to closed state.
     */
    public void reset(String name) {
        if (!enabled) {
            return;
        }

        CircuitBreaker cb = circuitBreakers.get(name);
        if (cb != null) {
            cb.reset();
            logger.info("Reset circuit breaker: {}", name);
        }
    }

    static boolean isTransient(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RehabException) {
            return ((RehabException) cause).isRetryable();
        }
        return true;
    }

    /**
     * Circuit breaker metrics data class.
     */
    public static class CircuitBreakerMetrics {
        private final String state;
        private final long successfulCalls;
        private final long failedCalls;
        private final float failureRate;
        private final long notPermittedCalls;
        private final boolean enabled;

        public CircuitBreakerMetrics(String state, long successfulCalls, long failedCalls,
                                     float failureRate, long notPermittedCalls) {
            this.state = state;
            this.successfulCalls = successfulCalls;
            this.failedCalls = failedCalls;
            this.failureRate = failureRate;
            this.notPermittedCalls = notPermittedCalls;
            this.enabled = true;
        }

        private CircuitBreakerMetrics(boolean enabled) {
            this.enabled = enabled;
            this.state = enabled ? "UNKNOWN" : "DISABLED";
            this.successfulCalls = 0;
            this.failedCalls = 0;
            this.failureRate = 0;
            this.notPermittedCalls = 0;
        }

        public static CircuitBreakerMetrics disabled() {
            return new CircuitBreakerMetrics(false);
        }

        public static CircuitBreakerMetrics notFound() {
            return new CircuitBreakerMetrics(true);
        }

        public String getState() { return state; }
        public long getSuccessfulCalls() { return successfulCalls; }
        public long getFailedCalls() { return failedCalls; }
        public float getFailureRate() { return failureRate; }
        public long getNotPermittedCalls() { return notPermittedCalls; }
        public boolean isEnabled() { return enabled; }

        @Override
        public String toString() {
            return "CircuitBreakerMetrics{" +
                    "state='" + state + '\'' +
                    ", successfulCalls=" + successfulCalls +
                    ", failedCalls=" + failedCalls +
                    ", failureRate=" + failureRate +
                    ", notPermittedCalls=" + notPermittedCalls +
                    ", enabled=" + enabled +
                    '}';
        }
    }
}
