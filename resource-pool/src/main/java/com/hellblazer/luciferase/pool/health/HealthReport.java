package com.hellblazer.luciferase.pool.health;

import java.util.List;

/**
 * Result of one {@link HealthMonitor#check} call.
 */
public record HealthReport(HealthState state, double aggregateScore, MetricValidationResult memory,
                           MetricValidationResult performance, MetricValidationResult errors,
                           List<String> violations, List<String> recommendations) {

    public HealthReport {
        violations = List.copyOf(violations);
        recommendations = List.copyOf(recommendations);
    }

    public HealthStatus status() {
        return state.status();
    }

    @Override
    public String toString() {
        return String.format("HealthReport[status=%s, score=%.2f, violations=%d, recommendations=%d]",
            state.status(), aggregateScore, violations.size(), recommendations.size());
    }
}
