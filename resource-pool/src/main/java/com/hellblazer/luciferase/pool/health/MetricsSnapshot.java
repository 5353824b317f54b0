package com.hellblazer.luciferase.pool.health;

import java.util.Objects;

/**
 * Raw metrics collected at one instant, as handed to a {@link HealthMonitor}.
 */
public record MetricsSnapshot(MemoryMetrics memory, PerformanceMetrics performance, ErrorMetrics errors,
                              long timestamp) {

    public MetricsSnapshot {
        Objects.requireNonNull(memory, "memory");
        Objects.requireNonNull(performance, "performance");
        Objects.requireNonNull(errors, "errors");
    }

    /**
     * The sample fed to the state machine: mean latency, throughput and error rate.
     */
    public HealthMetrics toHealthMetrics() {
        return HealthMetrics.builder()
                            .responseTime(performance.averageLatency())
                            .throughput(performance.throughput())
                            .errorRate(errors.errorRate())
                            .build();
    }
}
