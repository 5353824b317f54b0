package com.hellblazer.luciferase.pool.health;

import java.util.Objects;

/**
 * Per-metric-family threshold bands used by the evaluator and the state machine guards.
 */
public class ThresholdConfig {

    private final MetricThresholds heapUsage;
    private final MetricThresholds cacheUtilization;
    private final MetricThresholds latency;
    private final MetricThresholds throughput;
    private final MetricThresholds errorRate;
    private final MetricThresholds utilization;

    private ThresholdConfig(Builder builder) {
        this.heapUsage = builder.heapUsage;
        this.cacheUtilization = builder.cacheUtilization;
        this.latency = builder.latency;
        this.throughput = builder.throughput;
        this.errorRate = builder.errorRate;
        this.utilization = builder.utilization;

        if (throughput.polarity() != MetricPolarity.LOWER_IS_WORSE) {
            throw new IllegalArgumentException("Throughput thresholds must be lower-is-worse");
        }
        for (var bands : new MetricThresholds[] { heapUsage, cacheUtilization, latency, errorRate, utilization }) {
            if (bands.polarity() != MetricPolarity.HIGHER_IS_WORSE) {
                throw new IllegalArgumentException("Only throughput thresholds may be lower-is-worse");
            }
        }
    }

    /**
     * Bands tuned for an interactive service: latency in milliseconds, throughput in operations per second.
     */
    public static ThresholdConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with these bands.
     */
    public Builder toBuilder() {
        return new Builder().withHeapUsage(heapUsage)
                            .withCacheUtilization(cacheUtilization)
                            .withLatency(latency)
                            .withThroughput(throughput)
                            .withErrorRate(errorRate)
                            .withUtilization(utilization);
    }

    public MetricThresholds getHeapUsage() { return heapUsage; }
    public MetricThresholds getCacheUtilization() { return cacheUtilization; }
    public MetricThresholds getLatency() { return latency; }
    public MetricThresholds getThroughput() { return throughput; }
    public MetricThresholds getErrorRate() { return errorRate; }
    public MetricThresholds getUtilization() { return utilization; }

    /**
     * Bands for a metric carried by health samples.
     */
    public MetricThresholds forMetric(HealthMetric metric) {
        return switch (metric) {
            case RESPONSE_TIME -> latency;
            case THROUGHPUT -> throughput;
            case ERROR_RATE -> errorRate;
            case UTILIZATION -> utilization;
        };
    }

    public static class Builder {
        private MetricThresholds heapUsage = MetricThresholds.higherIsWorse(0.65, 0.80, 0.60);
        private MetricThresholds cacheUtilization = MetricThresholds.higherIsWorse(0.75, 0.85, 0.70);
        private MetricThresholds latency = MetricThresholds.higherIsWorse(30, 45, 25);
        private MetricThresholds throughput = MetricThresholds.lowerIsWorse(55, 30, 60);
        private MetricThresholds errorRate = MetricThresholds.higherIsWorse(0.03, 0.08, 0.02);
        private MetricThresholds utilization = MetricThresholds.higherIsWorse(0.7, 0.9, 0.56);

        public Builder withHeapUsage(MetricThresholds thresholds) {
            this.heapUsage = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder withCacheUtilization(MetricThresholds thresholds) {
            this.cacheUtilization = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder withLatency(MetricThresholds thresholds) {
            this.latency = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder withThroughput(MetricThresholds thresholds) {
            this.throughput = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder withErrorRate(MetricThresholds thresholds) {
            this.errorRate = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder withUtilization(MetricThresholds thresholds) {
            this.utilization = Objects.requireNonNull(thresholds);
            return this;
        }

        public ThresholdConfig build() {
            return new ThresholdConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("ThresholdConfig[heap=%s, cache=%s, latency=%s, throughput=%s, errorRate=%s, utilization=%s]",
            heapUsage, cacheUtilization, latency, throughput, errorRate, utilization);
    }
}
