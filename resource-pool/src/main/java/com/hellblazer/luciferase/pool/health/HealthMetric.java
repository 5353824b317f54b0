package com.hellblazer.luciferase.pool.health;

/**
 * Metrics a health sample may carry.
 */
public enum HealthMetric {
    RESPONSE_TIME("responseTime"),
    THROUGHPUT("throughput"),
    ERROR_RATE("errorRate"),
    UTILIZATION("utilization");

    private final String label;

    HealthMetric(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
