package com.hellblazer.luciferase.pool.pool;

/**
 * Allocation counters for a pool.
 */
public interface PoolStatistics {

    /**
     * Successful allocations, from the cache or the full path.
     */
    long getAllocations();

    long getCacheHits();

    long getCacheMisses();

    /**
     * Allocations rejected for exhaustion or validation.
     */
    long getFailures();

    long getReleases();

    long getExpirations();

    int getActiveLeases();

    int getCachedShapes();

    /**
     * Mean time spent inside {@code allocate} for successful calls, microseconds.
     */
    double getAverageAllocationMicros();

    /**
     * Cache hit rate as a ratio (0.0 to 1.0) over cache lookups.
     */
    default double getHitRate() {
        long lookups = getCacheHits() + getCacheMisses();
        return lookups > 0 ? (double) getCacheHits() / lookups : 0.0;
    }

    default String formatStatistics() {
        return String.format(
            "ResourcePool[allocations=%d, hits=%d, misses=%d, hitRate=%.1f%%, failures=%d, releases=%d, expired=%d, active=%d, shapes=%d, avg=%.1fus]",
            getAllocations(),
            getCacheHits(),
            getCacheMisses(),
            getHitRate() * 100,
            getFailures(),
            getReleases(),
            getExpirations(),
            getActiveLeases(),
            getCachedShapes(),
            getAverageAllocationMicros()
        );
    }

    /**
     * Immutable copy of the counters at one instant.
     */
    record Snapshot(long getAllocations, long getCacheHits, long getCacheMisses, long getFailures,
                    long getReleases, long getExpirations, int getActiveLeases, int getCachedShapes,
                    double getAverageAllocationMicros) implements PoolStatistics {

        @Override
        public String toString() {
            return formatStatistics();
        }
    }
}
