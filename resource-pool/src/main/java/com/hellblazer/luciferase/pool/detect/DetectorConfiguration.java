package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;

import java.time.Duration;
import java.util.Objects;

/**
 * Sampling period and per-category utilization thresholds for a {@link SystemResourceDetector}.
 */
public class DetectorConfiguration {

    /**
     * Warning and critical utilization for one category, in percent.
     */
    public record UtilizationThresholds(double warning, double critical) {

        public UtilizationThresholds {
            if (warning <= 0 || critical > 100 || warning >= critical) {
                throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 < warning < critical <= 100, got " + warning + "/" + critical);
            }
        }

        public HealthLevel classify(double utilizationPercent) {
            if (utilizationPercent >= critical) {
                return HealthLevel.CRITICAL;
            }
            if (utilizationPercent >= warning) {
                return HealthLevel.WARNING;
            }
            return HealthLevel.HEALTHY;
        }
    }

    private final Duration updateInterval;
    private final UtilizationThresholds memory;
    private final UtilizationThresholds cpu;
    private final UtilizationThresholds disk;

    private DetectorConfiguration(Builder builder) {
        this.updateInterval = builder.updateInterval;
        this.memory = builder.memory;
        this.cpu = builder.cpu;
        this.disk = builder.disk;

        if (updateInterval.isZero() || updateInterval.isNegative()) {
            throw new IllegalArgumentException("Update interval must be positive");
        }
    }

    public static DetectorConfiguration defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getUpdateInterval() { return updateInterval; }
    public UtilizationThresholds getMemoryThresholds() { return memory; }
    public UtilizationThresholds getCpuThresholds() { return cpu; }
    public UtilizationThresholds getDiskThresholds() { return disk; }

    public UtilizationThresholds thresholdsFor(ResourceCategory category) {
        return switch (category) {
            case MEMORY -> memory;
            case CPU -> cpu;
            case DISK -> disk;
            case DETECTOR -> throw new IllegalArgumentException("No utilization thresholds for " + category);
        };
    }

    public static class Builder {
        private Duration updateInterval = Duration.ofSeconds(1);
        private UtilizationThresholds memory = new UtilizationThresholds(80, 90);
        private UtilizationThresholds cpu = new UtilizationThresholds(80, 90);
        private UtilizationThresholds disk = new UtilizationThresholds(85, 95);

        public Builder withUpdateInterval(Duration interval) {
            this.updateInterval = Objects.requireNonNull(interval);
            return this;
        }

        public Builder withMemoryThresholds(double warning, double critical) {
            this.memory = new UtilizationThresholds(warning, critical);
            return this;
        }

        public Builder withCpuThresholds(double warning, double critical) {
            this.cpu = new UtilizationThresholds(warning, critical);
            return this;
        }

        public Builder withDiskThresholds(double warning, double critical) {
            this.disk = new UtilizationThresholds(warning, critical);
            return this;
        }

        public DetectorConfiguration build() {
            return new DetectorConfiguration(this);
        }
    }

    @Override
    public String toString() {
        return String.format("DetectorConfiguration[interval=%d ms, memory=%s, cpu=%s, disk=%s]",
            updateInterval.toMillis(), memory, cpu, disk);
    }
}
