package com.hellblazer.luciferase.pool.health;

/**
 * Coarse health classification reported by the detector and by {@code ResourcePoolManager.monitor()}.
 */
public enum HealthLevel {
    HEALTHY,
    WARNING,
    CRITICAL;

    public boolean isWorseThan(HealthLevel other) {
        return ordinal() > other.ordinal();
    }

    public static HealthLevel worst(HealthLevel a, HealthLevel b) {
        return a.isWorseThan(b) ? a : b;
    }

    /**
     * Map a state machine status onto the reported level: degraded reads as warning, unhealthy as critical.
     */
    public static HealthLevel of(HealthStatus status) {
        return switch (status) {
            case HEALTHY -> HEALTHY;
            case DEGRADED -> WARNING;
            case UNHEALTHY -> CRITICAL;
        };
    }
}
