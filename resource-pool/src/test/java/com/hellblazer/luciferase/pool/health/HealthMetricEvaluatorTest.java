package com.hellblazer.luciferase.pool.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for metric scoring
 */
public class HealthMetricEvaluatorTest {

    private static final double DELTA = 1e-9;

    private ThresholdConfig thresholds;
    private HealthMetricEvaluator evaluator;

    @BeforeEach
    void setUp() {
        thresholds = ThresholdConfig.defaultConfig();
        evaluator = new HealthMetricEvaluator(thresholds);
    }

    @Test
    void testThresholdBandsForHigherIsWorse() {
        var latency = thresholds.getLatency();

        var critical = evaluator.evaluateThreshold(50, latency, "Latency");
        assertEquals(0.2, critical.score(), DELTA);
        assertFalse(critical.valid());
        assertEquals(List.of("Latency exceeds critical threshold: 50.0"), critical.violations());
        assertEquals(List.of("Immediate action required: Latency is at a critical level"),
                     critical.recommendations());

        var warning = evaluator.evaluateThreshold(35, latency, "Latency");
        assertEquals(0.6, warning.score(), DELTA);
        assertEquals(List.of("Latency exceeds warning threshold: 35.0"), warning.violations());
        assertEquals(List.of("Monitor Latency: approaching critical levels"), warning.recommendations());

        // Between 110% of recovery (27.5) and warning
        var monitor = evaluator.evaluateThreshold(28, latency, "Latency");
        assertEquals(0.8, monitor.score(), DELTA);
        assertTrue(monitor.valid());
        assertTrue(monitor.violations().isEmpty());
        assertEquals(List.of("Continue monitoring Latency for stability"), monitor.recommendations());

        var healthy = evaluator.evaluateThreshold(20, latency, "Latency");
        assertEquals(1.0, healthy.score(), DELTA);
        assertTrue(healthy.recommendations().isEmpty());
    }

    @Test
    void testThroughputLowValuesAreWorse() {
        var throughput = thresholds.getThroughput();
        assertEquals(0.2, evaluator.evaluateThreshold(25, throughput, "Throughput").score(), DELTA);
        assertEquals(0.6, evaluator.evaluateThreshold(50, throughput, "Throughput").score(), DELTA);
        assertEquals(1.0, evaluator.evaluateThreshold(70, throughput, "Throughput").score(), DELTA);
        assertEquals(1.0, evaluator.evaluateThreshold(500, throughput, "Throughput").score(), DELTA);
    }

    @Test
    void testMemoryHealthWeightsHeapAndCache() {
        var result = evaluator.evaluateMemoryHealth(new MemoryMetrics(70, 100, 0.5, 0));
        assertEquals(0.6 * 0.6 + 0.4 * 1.0, result.score(), DELTA);
        assertFalse(result.valid());
        assertEquals(1, result.violations().size());
        assertTrue(result.violations().get(0).startsWith("Heap usage exceeds warning threshold"));

        var healthy = evaluator.evaluateMemoryHealth(new MemoryMetrics(10, 100, 0.2, 0));
        assertEquals(1.0, healthy.score(), DELTA);
        assertTrue(healthy.valid());
    }

    @Test
    void testZeroHeapLimitCountsAsEmpty() {
        var result = evaluator.evaluateMemoryHealth(new MemoryMetrics(100, 0, 0.0, 0));
        assertEquals(1.0, result.score(), DELTA);
    }

    @Test
    void testLatencySpikesLowerPerformanceScore() {
        var latencies = List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 100.0);
        var result = evaluator.evaluatePerformanceHealth(new PerformanceMetrics(latencies, 80, 0));

        // mean 19 is healthy, throughput is healthy, one spike in ten scores 0.5
        assertEquals(0.4 + 0.3 + 0.3 * 0.5, result.score(), DELTA);
        assertTrue(result.valid());
        assertEquals(List.of("High latency variance detected"), result.violations());
        assertTrue(result.recommendations().contains("Investigate potential resource contention"));
        assertTrue(result.recommendations().contains("Monitor system load patterns"));
        assertTrue(result.recommendations().contains("Review concurrent operations"));
    }

    @Test
    void testSpikeScore() {
        assertEquals(1.0, HealthMetricEvaluator.spikeScore(List.of(1.0, 100.0), 50.5), DELTA);
        assertEquals(1.0, HealthMetricEvaluator.spikeScore(Collections.nCopies(20, 5.0), 5.0), DELTA);
        assertEquals(0.5, HealthMetricEvaluator.spikeScore(
            List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 100.0), 19.0), DELTA);
    }

    @Test
    void testSteadyPerformanceIsHealthy() {
        var result = evaluator.evaluatePerformanceHealth(new PerformanceMetrics(List.of(12.0, 14.0, 13.0), 90, 0));
        assertEquals(1.0, result.score(), DELTA);
        assertTrue(result.violations().isEmpty());
    }

    @Test
    void testErrorHealthAddsRecommendations() {
        var result = evaluator.evaluateErrorHealth(new ErrorMetrics(5, 100, 0));
        assertEquals(0.6, result.score(), DELTA);
        assertTrue(result.recommendations().contains("Review error patterns and frequencies"));
        assertTrue(result.recommendations().contains("Check error handling mechanisms"));
        assertEquals(4, result.recommendations().size());

        var clean = evaluator.evaluateErrorHealth(new ErrorMetrics(0, 0, 0));
        assertEquals(1.0, clean.score(), DELTA);
        assertTrue(clean.recommendations().isEmpty());
    }

    @Test
    void testAggregateScore() {
        assertEquals(1.0, evaluator.getAggregateScore(List.of()), DELTA);
        var low = MetricValidationResult.of(0.2, List.of(), List.of());
        var mid = MetricValidationResult.of(0.6, List.of(), List.of());
        assertEquals(0.4, evaluator.getAggregateScore(List.of(low, mid)), DELTA);
    }

    @Test
    void testNegativeErrorCountsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ErrorMetrics(-1, 10, 0));
    }
}
