package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;

/**
 * @param availableAmount free memory in bytes
 */
public record MemoryAvailability(boolean isAvailable, double utilizationPercent, long availableAmount,
                                 HealthLevel status) {
}
