package com.hellblazer.luciferase.pool.health;

/**
 * Direction in which a metric gets worse.
 */
public enum MetricPolarity {
    /** Latency, error rate, utilization. */
    HIGHER_IS_WORSE,
    /** Throughput. */
    LOWER_IS_WORSE;

    /**
     * Whether {@code value} is at or past {@code bound} in the bad direction.
     */
    public boolean crosses(double value, double bound) {
        return this == HIGHER_IS_WORSE ? value >= bound : value <= bound;
    }

    /**
     * Whether {@code value} is at or inside {@code bound} in the good direction.
     */
    public boolean within(double value, double bound) {
        return this == HIGHER_IS_WORSE ? value <= bound : value >= bound;
    }

    public boolean isBetter(double candidate, double reference) {
        return this == HIGHER_IS_WORSE ? candidate < reference : candidate > reference;
    }

    public boolean isNoWorse(double candidate, double reference) {
        return this == HIGHER_IS_WORSE ? candidate <= reference : candidate >= reference;
    }
}
