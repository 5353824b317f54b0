package com.hellblazer.luciferase.pool.health;

import java.util.List;

/**
 * @param latencies  recent operation latencies in milliseconds
 * @param throughput operations per second
 */
public record PerformanceMetrics(List<Double> latencies, double throughput, long timestamp) {

    public PerformanceMetrics {
        latencies = List.copyOf(latencies);
    }

    public double averageLatency() {
        return latencies.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
