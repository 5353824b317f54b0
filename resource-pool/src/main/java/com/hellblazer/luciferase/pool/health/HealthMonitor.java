package com.hellblazer.luciferase.pool.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Scores raw application metrics and drives a {@link HealthStateManager} with the result.
 */
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final MetricEvaluator evaluator;
    private final HealthStateManager stateManager;

    public HealthMonitor(ThresholdConfig thresholds, RecoveryConfig recovery) {
        this(new HealthMetricEvaluator(thresholds), new HealthStateManager(thresholds, recovery));
    }

    public HealthMonitor(MetricEvaluator evaluator, HealthStateManager stateManager) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager");
    }

    public HealthReport check(MetricsSnapshot snapshot) {
        var memory = evaluator.evaluateMemoryHealth(snapshot.memory());
        var performance = evaluator.evaluatePerformanceHealth(snapshot.performance());
        var errors = evaluator.evaluateErrorHealth(snapshot.errors());
        double score = evaluator.getAggregateScore(List.of(memory, performance, errors));

        var state = stateManager.evaluate(snapshot.toHealthMetrics(), snapshot.timestamp());

        var violations = new ArrayList<String>();
        var recommendations = new LinkedHashSet<String>();
        for (var result : List.of(memory, performance, errors)) {
            violations.addAll(result.violations());
            recommendations.addAll(result.recommendations());
        }
        var report = new HealthReport(state, score, memory, performance, errors, violations,
                                      new ArrayList<>(recommendations));
        log.debug("Health check: {}", report);
        return report;
    }

    public HealthState getCurrentState() {
        return stateManager.getCurrentState();
    }

    public HealthStateManager getStateManager() {
        return stateManager;
    }
}
