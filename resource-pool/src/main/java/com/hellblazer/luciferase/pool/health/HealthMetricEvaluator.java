package com.hellblazer.luciferase.pool.health;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link MetricEvaluator}.
 *
 * <p>A single value scores 0.2 past critical, 0.6 past warning, 0.8 when merely above 110% of the
 * recovery bound (below 1/1.1 of it for lower-is-worse metrics) and 1.0 otherwise.
 * Memory health weights heap 0.6 and cache 0.4; performance health weights average latency 0.4,
 * throughput 0.3 and latency spikes 0.3.
 */
public class HealthMetricEvaluator implements MetricEvaluator {

    static final double CRITICAL_SCORE = 0.2;
    static final double WARNING_SCORE = 0.6;
    static final double MONITOR_SCORE = 0.8;
    static final double RECOVERY_MARGIN = 1.1;

    private final ThresholdConfig thresholds;

    public HealthMetricEvaluator(ThresholdConfig thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    @Override
    public MetricValidationResult evaluateMemoryHealth(MemoryMetrics metrics) {
        var heap = evaluateThreshold(metrics.heapUsageRatio(), thresholds.getHeapUsage(), "Heap usage");
        var cache = evaluateThreshold(metrics.cacheUtilization(), thresholds.getCacheUtilization(),
                                      "Cache utilization");
        double score = heap.score() * 0.6 + cache.score() * 0.4;
        return MetricValidationResult.of(score, concat(heap.violations(), cache.violations()),
                                         concat(heap.recommendations(), cache.recommendations()));
    }

    @Override
    public MetricValidationResult evaluatePerformanceHealth(PerformanceMetrics metrics) {
        double mean = metrics.averageLatency();
        var latency = evaluateThreshold(mean, thresholds.getLatency(), "Average latency");
        var throughput = evaluateThreshold(metrics.throughput(), thresholds.getThroughput(), "Throughput");
        double spikeScore = spikeScore(metrics.latencies(), mean);

        double score = latency.score() * 0.4 + throughput.score() * 0.3 + spikeScore * 0.3;
        var violations = concat(latency.violations(), throughput.violations());
        var recommendations = concat(latency.recommendations(), throughput.recommendations());
        if (spikeScore < MONITOR_SCORE) {
            violations.add("High latency variance detected");
            recommendations.add("Investigate potential resource contention");
            recommendations.add("Monitor system load patterns");
            recommendations.add("Review concurrent operations");
        }
        return MetricValidationResult.of(score, violations, recommendations);
    }

    @Override
    public MetricValidationResult evaluateErrorHealth(ErrorMetrics metrics) {
        var result = evaluateThreshold(metrics.errorRate(), thresholds.getErrorRate(), "Error rate");
        if (result.score() < MONITOR_SCORE) {
            return result.withRecommendations(List.of("Review error patterns and frequencies",
                                                      "Check error handling mechanisms",
                                                      "Add backoff for retryable failures"));
        }
        return result;
    }

    @Override
    public double getAggregateScore(List<MetricValidationResult> results) {
        return results.stream().mapToDouble(MetricValidationResult::score).average().orElse(1.0);
    }

    @Override
    public MetricValidationResult evaluateThreshold(double value, MetricThresholds bands, String metricName) {
        var violations = new ArrayList<String>();
        var recommendations = new ArrayList<String>();
        double score = 1.0;
        if (bands.isCritical(value)) {
            score = CRITICAL_SCORE;
            violations.add(metricName + " exceeds critical threshold: " + value);
            recommendations.add("Immediate action required: " + metricName + " is at a critical level");
        } else if (bands.isWarning(value)) {
            score = WARNING_SCORE;
            violations.add(metricName + " exceeds warning threshold: " + value);
            recommendations.add("Monitor " + metricName + ": approaching critical levels");
        } else if (outsideRecoveryMargin(value, bands)) {
            score = MONITOR_SCORE;
            recommendations.add("Continue monitoring " + metricName + " for stability");
        }
        return MetricValidationResult.of(score, violations, recommendations);
    }

    private static boolean outsideRecoveryMargin(double value, MetricThresholds bands) {
        return bands.polarity() == MetricPolarity.HIGHER_IS_WORSE
               ? value > bands.recovery() * RECOVERY_MARGIN
               : value < bands.recovery() / RECOVERY_MARGIN;
    }

    /**
     * 1.0 with fewer than three samples, otherwise {@code max(0, 1 - 5 * spikeRatio)} where spikes lie more
     * than two standard deviations from the mean.
     */
    static double spikeScore(List<Double> latencies, double mean) {
        if (latencies.size() < 3) {
            return 1.0;
        }
        double variance = latencies.stream().mapToDouble(l -> (l - mean) * (l - mean)).sum() / latencies.size();
        double twoSigma = 2 * Math.sqrt(variance);
        long spikes = latencies.stream().filter(l -> Math.abs(l - mean) > twoSigma).count();
        double spikeRatio = (double) spikes / latencies.size();
        return Math.max(0.0, 1.0 - spikeRatio * 5);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        var result = new ArrayList<String>(a.size() + b.size());
        result.addAll(a);
        result.addAll(b);
        return result;
    }
}
