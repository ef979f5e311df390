package dev.mars.rehab.pipeline.config;

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

import java.time.Duration;

/**
 * Tuning of the projection pipeline: partitioning, batching, backpressure and retry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public final class PipelineConfig {

    private final int concurrency;
    private final int batchSize;
    private final Duration batchTimeout;
    private final int queueCapacity;
    private final Duration applyTimeout;
    private final int applyThreads;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double backoffMultiplier;
    private final Duration catchUpInterval;

    private PipelineConfig(Builder builder) {
        this.concurrency = requirePositive(builder.concurrency, "concurrency");
        this.batchSize = requirePositive(builder.batchSize, "batchSize");
        this.batchTimeout = builder.batchTimeout;
        this.queueCapacity = requirePositive(builder.queueCapacity, "queueCapacity");
        this.applyTimeout = builder.applyTimeout;
        this.applyThreads = builder.applyThreads > 0 ? builder.applyThreads : builder.concurrency;
        this.maxAttempts = requirePositive(builder.maxAttempts, "maxAttempts");
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        if (builder.backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, was " + builder.backoffMultiplier);
        }
        this.backoffMultiplier = builder.backoffMultiplier;
        this.catchUpInterval = builder.catchUpInterval;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getConcurrency() { return concurrency; }
    public int getBatchSize() { return batchSize; }
    public Duration getBatchTimeout() { return batchTimeout; }
    public int getQueueCapacity() { return queueCapacity; }
    public Duration getApplyTimeout() { return applyTimeout; }
    public int getApplyThreads() { return applyThreads; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public Duration getCatchUpInterval() { return catchUpInterval; }

    /**
     * Delay before retry number {@code retry} (1-based): {@code initialBackoff * multiplier^(retry-1)},
     * capped at {@code maxBackoff}.
     */
    public Duration backoffFor(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, retry - 1));
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, was " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "concurrency=" + concurrency +
                ", batchSize=" + batchSize +
                ", batchTimeout=" + batchTimeout +
                ", queueCapacity=" + queueCapacity +
                ", applyTimeout=" + applyTimeout +
                ", applyThreads=" + applyThreads +
                ", maxAttempts=" + maxAttempts +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                ", backoffMultiplier=" + backoffMultiplier +
                ", catchUpInterval=" + catchUpInterval +
                '}';
    }

    public static class Builder {
        private int concurrency = 10;
        private int batchSize = 100;
        private Duration batchTimeout = Duration.ofMillis(50);
        private int queueCapacity = 1000;
        private Duration applyTimeout = Duration.ofSeconds(5);
        private int applyThreads;
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(10);
        private Duration maxBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration catchUpInterval = Duration.ofSeconds(1);

        public Builder concurrency(int concurrency) { this.concurrency = concurrency; return this; }
        public Builder batchSize(int batchSize) { this.batchSize = batchSize; return this; }
        public Builder batchTimeout(Duration batchTimeout) { this.batchTimeout = batchTimeout; return this; }
        public Builder queueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; return this; }
        public Builder applyTimeout(Duration applyTimeout) { this.applyTimeout = applyTimeout; return this; }
        public Builder applyThreads(int applyThreads) { this.applyThreads = applyThreads; return this; }
        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder initialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; return this; }
        public Builder maxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; return this; }
        public Builder backoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; return this; }
        public Builder catchUpInterval(Duration catchUpInterval) { this.catchUpInterval = catchUpInterval; return this; }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
