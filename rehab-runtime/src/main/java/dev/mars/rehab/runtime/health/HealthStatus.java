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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Result of one health check. Statuses of the projection lag check also carry how far
 * each projector trails its streams.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public final class HealthStatus {
    public enum Status {
        HEALTHY, DEGRADED, UNHEALTHY
    }

    private final String component;
    private final Status status;
    private final String message;
    private final Map<String, Object> details;
    private final Map<String, Long> projectorLag;
    private final Instant checkedAt;

    private HealthStatus(String component, Status status, String message, Map<String, Object> details,
                         Map<String, Long> projectorLag) {
        this.component = Objects.requireNonNull(component, "Component cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.message = message;
        this.details = details != null ? Map.copyOf(details) : Collections.emptyMap();
        this.projectorLag = projectorLag != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(projectorLag))
            : Collections.emptyMap();
        this.checkedAt = Instant.now();
    }

    public static HealthStatus healthy(String component) {
        return new HealthStatus(component, Status.HEALTHY, null, null, null);
    }

    public static HealthStatus healthy(String component, Map<String, Object> details) {
        return new HealthStatus(component, Status.HEALTHY, null, details, null);
    }

    public static HealthStatus degraded(String component, String message, Map<String, Object> details) {
        return new HealthStatus(component, Status.DEGRADED, message, details, null);
    }

    public static HealthStatus unhealthy(String component, String message) {
        return new HealthStatus(component, Status.UNHEALTHY, message, null, null);
    }

    /**
     * DEGRADED naming the furthest-behind projector when its lag exceeds {@code threshold},
     * HEALTHY otherwise.
     *
     * @param lagByProjector events each projector still has to apply, in projector order
     */
    public static HealthStatus projectionLag(String component, Map<String, Long> lagByProjector, long threshold) {
        String worst = null;
        long worstLag = 0;
        for (Map.Entry<String, Long> entry : lagByProjector.entrySet()) {
            if (entry.getValue() > worstLag) {
                worstLag = entry.getValue();
                worst = entry.getKey();
            }
        }
        Map<String, Object> details = Map.of("max_lag", worstLag, "threshold", threshold);
        if (worstLag > threshold) {
            return new HealthStatus(component, Status.DEGRADED,
                "Projector " + worst + " is " + worstLag + " event(s) behind", details, lagByProjector);
        }
        return new HealthStatus(component, Status.HEALTHY, null, details, lagByProjector);
    }

    public String getComponent() { return component; }
    public Status getStatus() { return status; }
    public String getMessage() { return message; }
    public Map<String, Object> getDetails() { return details; }
    public Instant getCheckedAt() { return checkedAt; }

    /** Lag per projector id; empty unless this is a projection lag status. */
    public Map<String, Long> getProjectorLag() { return projectorLag; }

    public OptionalLong getProjectorLag(String projectorId) {
        Long lag = projectorLag.get(projectorId);
        return lag != null ? OptionalLong.of(lag) : OptionalLong.empty();
    }

    /** The projector furthest behind, if any projector lags at all. */
    public Optional<String> getLaggingProjector() {
        String worst = null;
        long worstLag = 0;
        for (Map.Entry<String, Long> entry : projectorLag.entrySet()) {
            if (entry.getValue() > worstLag) {
                worstLag = entry.getValue();
                worst = entry.getKey();
            }
        }
        return Optional.ofNullable(worst);
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isUnhealthy() {
        return status == Status.UNHEALTHY;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(component).append(' ').append(status);
        if (message != null) {
            sb.append(" (").append(message).append(')');
        }
        if (!projectorLag.isEmpty()) {
            sb.append(" lag=").append(projectorLag);
        } else if (!details.isEmpty()) {
            sb.append(' ').append(details);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HealthStatus that = (HealthStatus) o;
        return Objects.equals(component, that.component) &&
               status == that.status &&
               Objects.equals(message, that.message) &&
               Objects.equals(details, that.details) &&
               Objects.equals(projectorLag, that.projectorLag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(component, status, message, details, projectorLag);
    }
}
