package com.hellblazer.luciferase.pool.health;

import java.util.Objects;

/**
 * Warning, critical and recovery bounds for one metric. Recovery is the most forgiving bound and lies
 * strictly inside warning; warning is no worse than critical.
 */
public record MetricThresholds(double warning, double critical, double recovery, MetricPolarity polarity) {

    public MetricThresholds {
        Objects.requireNonNull(polarity, "polarity");
        if (Double.isNaN(warning) || Double.isNaN(critical) || Double.isNaN(recovery)) {
            throw new IllegalArgumentException("Thresholds must be numbers");
        }
        if (!polarity.isBetter(recovery, warning)) {
            throw new IllegalArgumentException(
                "Recovery bound " + recovery + " must be strictly inside warning bound " + warning);
        }
        if (!polarity.isNoWorse(warning, critical)) {
            throw new IllegalArgumentException(
                "Warning bound " + warning + " must not be worse than critical bound " + critical);
        }
    }

    public static MetricThresholds higherIsWorse(double warning, double critical, double recovery) {
        return new MetricThresholds(warning, critical, recovery, MetricPolarity.HIGHER_IS_WORSE);
    }

    public static MetricThresholds lowerIsWorse(double warning, double critical, double recovery) {
        return new MetricThresholds(warning, critical, recovery, MetricPolarity.LOWER_IS_WORSE);
    }

    public boolean isCritical(double value) {
        return polarity.crosses(value, critical);
    }

    public boolean isWarning(double value) {
        return polarity.crosses(value, warning);
    }

    public boolean isWithinRecovery(double value) {
        return polarity.within(value, recovery);
    }
}
