package com.hellblazer.luciferase.pool.health;

import java.util.Objects;

/**
 * A health classification with the metrics that produced it.
 *
 * @param source how the state came about; {@link Source#RESET} marks an operator reset out of unhealthy
 */
public record HealthState(HealthStatus status, HealthMetrics metrics, long timestamp, Source source) {

    public enum Source {
        INITIAL,
        SAMPLE,
        RESET
    }

    public HealthState {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(source, "source");
    }

    public static HealthState initial(long timestamp) {
        return new HealthState(HealthStatus.HEALTHY, HealthMetrics.empty(), timestamp, Source.INITIAL);
    }

    public static HealthState sample(HealthStatus status, HealthMetrics metrics, long timestamp) {
        return new HealthState(status, metrics, timestamp, Source.SAMPLE);
    }
}
