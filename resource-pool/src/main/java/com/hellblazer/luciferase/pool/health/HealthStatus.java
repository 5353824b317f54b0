package com.hellblazer.luciferase.pool.health;

/**
 * States of the health state machine, ordered from best to worst.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public boolean isWorseThan(HealthStatus other) {
        return ordinal() > other.ordinal();
    }

    public boolean isBetterThan(HealthStatus other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Number of steps between two states; a legal transition is exactly one step.
     */
    public int distance(HealthStatus other) {
        return Math.abs(ordinal() - other.ordinal());
    }

    /**
     * The state one step from this one in the direction of {@code target}, or {@code target} itself when adjacent.
     */
    public HealthStatus stepToward(HealthStatus target) {
        if (distance(target) <= 1) {
            return target;
        }
        return DEGRADED;
    }
}
