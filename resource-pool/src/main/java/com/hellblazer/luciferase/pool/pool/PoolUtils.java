package com.hellblazer.luciferase.pool.pool;

/**
 * Shared helpers for requirement bucketing and report formatting.
 */
public final class PoolUtils {

    /**
     * Round up to the nearest power of 2. Requirements are bucketed this way so that nearby
     * requests share a cached lease shape.
     *
     * @param value value to round, 0 stays 0
     * @return next power of 2 >= value
     */
    public static long roundUpToPowerOf2(long value) {
        if (value <= 0) {
            return 0;
        }
        if (value == 1) {
            return 1;
        }
        long highest = Long.highestOneBit(value - 1) << 1;
        return highest <= 0 ? Long.MAX_VALUE : highest;
    }

    /**
     * Bucket for a cpu requirement in percent: the requirement rounded up to whole percent, then to a power of 2.
     */
    public static long cpuBucket(double percent) {
        return roundUpToPowerOf2((long) Math.ceil(percent));
    }

    /**
     * Cores needed for a cpu requirement in percent of one core.
     */
    public static int coresFor(double percent) {
        return (int) Math.ceil(percent / 100.0);
    }

    /**
     * Format bytes for human-readable display.
     *
     * @param bytes Number of bytes
     * @return Formatted string (e.g., "1.5 MB", "512 KB")
     */
    public static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024) return String.format("%.1f MB", bytes / (1024.0 * 1024));
        return String.format("%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }

    private PoolUtils() {
    }
}
