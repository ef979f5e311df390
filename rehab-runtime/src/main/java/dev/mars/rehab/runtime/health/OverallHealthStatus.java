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


import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of the latest result of every registered check.
 *
 * <p>{@code UP} when every check is healthy, {@code DOWN} when any is unhealthy,
 * {@code DEGRADED} otherwise.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class OverallHealthStatus {
    public enum State {
        UP, DEGRADED, DOWN
    }

    private final State status;
    private final Map<String, HealthStatus> components;
    private final Instant timestamp;

    public OverallHealthStatus(State status, Map<String, HealthStatus> components, Instant timestamp) {
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.components = Map.copyOf(Objects.requireNonNull(components, "Components cannot be null"));
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    static OverallHealthStatus of(Map<String, HealthStatus> components, Instant timestamp) {
        State state = State.UP;
        for (HealthStatus component : components.values()) {
            if (component.isUnhealthy()) {
                state = State.DOWN;
                break;
            }
            if (component.isDegraded()) {
                state = State.DEGRADED;
            }
        }
        return new OverallHealthStatus(state, components, timestamp);
    }

    public State getStatus() { return status; }
    public Map<String, HealthStatus> getComponents() { return components; }
    public Instant getTimestamp() { return timestamp; }

    public boolean isHealthy() {
        return status == State.UP;
    }

    public long getHealthyCount() {
        return components.values().stream().filter(HealthStatus::isHealthy).count();
    }

    public long getDegradedCount() {
        return components.values().stream().filter(HealthStatus::isDegraded).count();
    }

    public long getUnhealthyCount() {
        return components.values().stream().filter(HealthStatus::isUnhealthy).count();
    }

    @Override
    public String toString() {
        return "OverallHealthStatus{" +
                "status=" + status +
                ", components=" + components.size() +
                ", healthy=" + getHealthyCount() +
                ", degraded=" + getDegradedCount() +
                ", unhealthy=" + getUnhealthyCount() +
                ", timestamp=" + timestamp +
                '}';
    }
}
