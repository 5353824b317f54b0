package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;

public record CpuAvailability(boolean isAvailable, double utilizationPercent, int availableCores,
                              HealthLevel status) {
}
