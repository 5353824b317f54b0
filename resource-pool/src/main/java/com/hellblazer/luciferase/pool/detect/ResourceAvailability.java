package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;

import java.util.Objects;

/**
 * Point-in-time view of system resource availability. {@code status} is the worst of the category levels.
 */
public record ResourceAvailability(HealthLevel status, MemoryAvailability memory, CpuAvailability cpu,
                                   DiskAvailability disk, long timestamp) {

    public ResourceAvailability {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(memory, "memory");
        Objects.requireNonNull(cpu, "cpu");
        Objects.requireNonNull(disk, "disk");
    }

    /**
     * Highest utilization across memory, cpu and disk, in percent.
     */
    public double maxUtilizationPercent() {
        return Math.max(memory.utilizationPercent(), Math.max(cpu.utilizationPercent(), disk.utilizationPercent()));
    }
}
