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
 * Circuit breaker settings for stream store access.
 */
public final class BreakerConfig {

    private final boolean enabled;
    private final int failureThreshold;
    private final Duration waitDuration;
    private final int ringBufferSize;
    private final double failureRateThreshold;

    public BreakerConfig(boolean enabled, int failureThreshold, Duration waitDuration,
                         int ringBufferSize, double failureRateThreshold) {
        this.enabled = enabled;
        this.failureThreshold = failureThreshold;
        this.waitDuration = waitDuration;
        this.ringBufferSize = ringBufferSize;
        this.failureRateThreshold = failureRateThreshold;
    }

    public static BreakerConfig defaults() {
        return new BreakerConfig(true, 5, Duration.ofSeconds(30), 100, 50.0);
    }

    public static BreakerConfig disabled() {
        return new BreakerConfig(false, 5, Duration.ofSeconds(30), 100, 50.0);
    }

    public boolean isEnabled() { return enabled; }
    public int getFailureThreshold() { return failureThreshold; }
    public Duration getWaitDuration() { return waitDuration; }
    public int getRingBufferSize() { return ringBufferSize; }
    public double getFailureRateThreshold() { return failureRateThreshold; }

    @Override
    public String toString() {
        return "BreakerConfig{" +
                "enabled=" + enabled +
                ", failureThreshold=" + failureThreshold +
                ", waitDuration=" + waitDuration +
                ", ringBufferSize=" + ringBufferSize +
                ", failureRateThreshold=" + failureRateThreshold +
                '}';
    }
}
