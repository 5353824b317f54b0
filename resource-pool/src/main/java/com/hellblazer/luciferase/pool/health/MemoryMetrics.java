package com.hellblazer.luciferase.pool.health;

/**
 * @param heapUsage        bytes in use
 * @param heapLimit        bytes available to the heap
 * @param cacheUtilization cache fill ratio in [0, 1]
 */
public record MemoryMetrics(long heapUsage, long heapLimit, double cacheUtilization, long timestamp) {

    public double heapUsageRatio() {
        return heapLimit > 0 ? (double) heapUsage / heapLimit : 0.0;
    }
}
