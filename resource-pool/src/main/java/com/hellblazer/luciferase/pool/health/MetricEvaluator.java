package com.hellblazer.luciferase.pool.health;

import java.util.List;

/**
 * Stateless scoring of raw metrics against threshold bands.
 */
public interface MetricEvaluator {

    MetricValidationResult evaluateMemoryHealth(MemoryMetrics metrics);

    MetricValidationResult evaluatePerformanceHealth(PerformanceMetrics metrics);

    MetricValidationResult evaluateErrorHealth(ErrorMetrics metrics);

    /**
     * Mean score of the results; 1.0 when there are none.
     */
    double getAggregateScore(List<MetricValidationResult> results);

    MetricValidationResult evaluateThreshold(double value, MetricThresholds thresholds, String metricName);
}
