package com.hellblazer.luciferase.pool.pool;

import com.hellblazer.luciferase.pool.health.MetricThresholds;
import com.hellblazer.luciferase.pool.health.RecoveryConfig;
import com.hellblazer.luciferase.pool.health.ThresholdConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link ResourcePoolManager}: capacity, cache, timers, health thresholds and
 * recovery rules.
 */
public class PoolConfiguration {

    private final int minPoolSize;
    private final int maxPoolSize;
    private final int cacheMaxSize;
    private final Duration cleanupInterval;
    private final Duration resourceTimeout;
    private final Duration healthCheckInterval;
    private final double warningThreshold;   // utilization fraction
    private final double criticalThreshold;  // utilization fraction
    private final double utilizationRecoveryThreshold;
    private final ThresholdConfig thresholds;
    private final RecoveryConfig recovery;
    private final int historyCapacity;

    private PoolConfiguration(Builder builder) {
        this.minPoolSize = builder.minPoolSize;
        this.maxPoolSize = builder.maxPoolSize;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cleanupInterval = builder.cleanupInterval;
        this.resourceTimeout = builder.resourceTimeout;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.warningThreshold = builder.warningThreshold;
        this.criticalThreshold = builder.criticalThreshold;
        this.utilizationRecoveryThreshold = builder.utilizationRecoveryThreshold != null
                                            ? builder.utilizationRecoveryThreshold
                                            : builder.warningThreshold * 0.8;
        this.recovery = builder.recovery;
        this.historyCapacity = builder.historyCapacity;

        validate();

        this.thresholds = builder.thresholds.toBuilder()
                                            .withUtilization(MetricThresholds.higherIsWorse(
                                                warningThreshold, criticalThreshold,
                                                utilizationRecoveryThreshold))
                                            .build();
    }

    private void validate() {
        if (maxPoolSize <= 0) {
            throw new IllegalArgumentException("Max pool size must be positive");
        }
        if (minPoolSize < 0 || minPoolSize > maxPoolSize) {
            throw new IllegalArgumentException("Min pool size must be between 0 and max pool size");
        }
        if (cacheMaxSize < 0) {
            throw new IllegalArgumentException("Cache size cannot be negative");
        }
        requirePositive(cleanupInterval, "Cleanup interval");
        requirePositive(resourceTimeout, "Resource timeout");
        requirePositive(healthCheckInterval, "Health check interval");
        if (warningThreshold <= 0 || warningThreshold >= criticalThreshold || criticalThreshold > 1.0) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 < warning < critical <= 1");
        }
        if (utilizationRecoveryThreshold <= 0 || utilizationRecoveryThreshold >= warningThreshold) {
            throw new IllegalArgumentException("Utilization recovery threshold must be between 0 and warning threshold");
        }
        if (historyCapacity < recovery.requiredHistoryDepth()) {
            throw new IllegalArgumentException(
                "History capacity must be at least " + recovery.requiredHistoryDepth());
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Creates a default configuration suitable for most applications.
     */
    public static PoolConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Creates a small configuration for tests: immediate recovery evidence, short timers.
     */
    public static PoolConfiguration minimalConfig() {
        return new Builder()
            .withMinPoolSize(0)
            .withMaxPoolSize(10)
            .withCacheMaxSize(5)
            .withCleanupInterval(Duration.ofMillis(50))
            .withResourceTimeout(Duration.ofMillis(100))
            .withHealthCheckInterval(Duration.ofMillis(100))
            .withWarningThreshold(0.7)
            .withCriticalThreshold(0.9)
            .withRecovery(RecoveryConfig.immediate())
            .build();
    }

    /**
     * Creates a configuration for production services: larger pool, stricter recovery.
     */
    public static PoolConfiguration productionConfig() {
        return new Builder()
            .withMinPoolSize(50)
            .withMaxPoolSize(5000)
            .withCacheMaxSize(500)
            .withCleanupInterval(Duration.ofSeconds(30))
            .withResourceTimeout(Duration.ofMinutes(2))
            .withHealthCheckInterval(Duration.ofSeconds(1))
            .withWarningThreshold(0.75)
            .withCriticalThreshold(0.9)
            .withRecovery(new RecoveryConfig(5, 3, 0.67, Duration.ofMillis(1500)))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public int getMinPoolSize() { return minPoolSize; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public int getCacheMaxSize() { return cacheMaxSize; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public Duration getResourceTimeout() { return resourceTimeout; }
    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public double getWarningThreshold() { return warningThreshold; }
    public double getCriticalThreshold() { return criticalThreshold; }
    public double getUtilizationRecoveryThreshold() { return utilizationRecoveryThreshold; }
    public RecoveryConfig getRecovery() { return recovery; }
    public int getHistoryCapacity() { return historyCapacity; }

    /**
     * Threshold bands with the utilization family taken from this configuration's warning, critical
     * and recovery thresholds.
     */
    public ThresholdConfig getThresholds() { return thresholds; }

    public static class Builder {
        private int minPoolSize = 10;
        private int maxPoolSize = 1000;
        private int cacheMaxSize = 100;
        private Duration cleanupInterval = Duration.ofSeconds(60);
        private Duration resourceTimeout = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(1);
        private double warningThreshold = 0.7;
        private double criticalThreshold = 0.9;
        private Double utilizationRecoveryThreshold;
        private ThresholdConfig thresholds = ThresholdConfig.defaultConfig();
        private RecoveryConfig recovery = RecoveryConfig.defaultConfig();
        private int historyCapacity = 100;

        public Builder withMinPoolSize(int size) {
            this.minPoolSize = size;
            return this;
        }

        public Builder withMaxPoolSize(int size) {
            this.maxPoolSize = size;
            return this;
        }

        public Builder withCacheMaxSize(int size) {
            this.cacheMaxSize = size;
            return this;
        }

        public Builder withCleanupInterval(Duration interval) {
            this.cleanupInterval = Objects.requireNonNull(interval);
            return this;
        }

        public Builder withResourceTimeout(Duration timeout) {
            this.resourceTimeout = Objects.requireNonNull(timeout);
            return this;
        }

        public Builder withHealthCheckInterval(Duration interval) {
            this.healthCheckInterval = Objects.requireNonNull(interval);
            return this;
        }

        public Builder withWarningThreshold(double fraction) {
            this.warningThreshold = fraction;
            return this;
        }

        public Builder withCriticalThreshold(double fraction) {
            this.criticalThreshold = fraction;
            return this;
        }

        public Builder withUtilizationRecoveryThreshold(double fraction) {
            this.utilizationRecoveryThreshold = fraction;
            return this;
        }

        public Builder withThresholds(ThresholdConfig thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder withRecovery(RecoveryConfig recovery) {
            this.recovery = Objects.requireNonNull(recovery);
            return this;
        }

        public Builder withHistoryCapacity(int capacity) {
            this.historyCapacity = capacity;
            return this;
        }

        public PoolConfiguration build() {
            return new PoolConfiguration(this);
        }
    }

    @Override
    public String toString() {
        return String.format(
            "PoolConfiguration[size=%d..%d, cache=%d, cleanup=%d ms, timeout=%d ms, thresholds=(%.0f%%, %.0f%%)]",
            minPoolSize,
            maxPoolSize,
            cacheMaxSize,
            cleanupInterval.toMillis(),
            resourceTimeout.toMillis(),
            warningThreshold * 100,
            criticalThreshold * 100
        );
    }
}
