package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;

/**
 * @param availableSpace usable disk space in bytes
 */
public record DiskAvailability(boolean isAvailable, double utilizationPercent, long availableSpace,
                               HealthLevel status) {
}
