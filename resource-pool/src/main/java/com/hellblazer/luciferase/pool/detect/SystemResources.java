package com.hellblazer.luciferase.pool.detect;

/**
 * Raw totals from one sample of the host.
 *
 * @param cpuUtilizationPercent cpu busy percentage across all cores
 */
public record SystemResources(long totalMemory, long freeMemory, int cores, double cpuUtilizationPercent,
                              long totalDisk, long freeDisk, long timestamp) {

    public long usedMemory() {
        return totalMemory - freeMemory;
    }

    public long usedDisk() {
        return totalDisk - freeDisk;
    }

    public double memoryUtilizationPercent() {
        return totalMemory > 0 ? usedMemory() * 100.0 / totalMemory : 0.0;
    }

    public double diskUtilizationPercent() {
        return totalDisk > 0 ? usedDisk() * 100.0 / totalDisk : 0.0;
    }
}
