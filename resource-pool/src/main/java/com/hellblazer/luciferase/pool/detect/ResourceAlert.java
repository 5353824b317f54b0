package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;

/**
 * Raised when a category crosses its warning or critical utilization, or when sampling fails.
 *
 * @param current   observed utilization in percent (NaN for detector failures)
 * @param threshold the threshold crossed, in percent (NaN for detector failures)
 */
public record ResourceAlert(ResourceCategory category, HealthLevel severity, String message, double current,
                            double threshold, long timestamp) {

    public static ResourceAlert detectorFailure(String message, long timestamp) {
        return new ResourceAlert(ResourceCategory.DETECTOR, HealthLevel.WARNING, message, Double.NaN, Double.NaN,
                                 timestamp);
    }
}
