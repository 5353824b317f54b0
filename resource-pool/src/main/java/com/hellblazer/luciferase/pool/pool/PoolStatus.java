package com.hellblazer.luciferase.pool.pool;

import com.hellblazer.luciferase.pool.health.HealthLevel;

/**
 * Result of {@link ResourcePoolManager#monitor()}.
 *
 * @param health       last accepted health classification
 * @param utilization  active leases divided by the maximum pool size
 * @param lastUpdated  time of the last health sample, epoch milliseconds
 */
public record PoolStatus(HealthLevel health, double utilization, int activeLeases, int maxPoolSize,
                         long lastUpdated) {
}
