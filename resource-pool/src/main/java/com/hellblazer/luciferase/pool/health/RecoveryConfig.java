package com.hellblazer.luciferase.pool.health;

import java.time.Duration;
import java.util.Objects;

/**
 * How much sustained evidence the state machine needs before moving toward healthy.
 *
 * @param minHealthySamples   consecutive non-critical, non-worsening samples needed to leave unhealthy
 * @param validationWindow    samples (the proposed one included) inspected before returning to healthy
 * @param requiredSuccessRate fraction of the validation window that must sit inside the recovery bounds
 * @param cooldownPeriod      minimum time since the last accepted transition before moving toward healthy
 */
public record RecoveryConfig(int minHealthySamples, int validationWindow, double requiredSuccessRate,
                             Duration cooldownPeriod) {

    public RecoveryConfig {
        Objects.requireNonNull(cooldownPeriod, "cooldownPeriod");
        if (minHealthySamples < 1) {
            throw new IllegalArgumentException("minHealthySamples must be at least 1");
        }
        if (validationWindow < 1) {
            throw new IllegalArgumentException("validationWindow must be at least 1");
        }
        if (requiredSuccessRate <= 0 || requiredSuccessRate > 1) {
            throw new IllegalArgumentException("requiredSuccessRate must be in (0, 1]");
        }
        if (cooldownPeriod.isNegative()) {
            throw new IllegalArgumentException("cooldownPeriod cannot be negative");
        }
    }

    public static RecoveryConfig defaultConfig() {
        return new RecoveryConfig(3, 1, 1.0, Duration.ZERO);
    }

    /**
     * Single-sample evidence, no cooldown. Used where every sample is already an aggregate.
     */
    public static RecoveryConfig immediate() {
        return new RecoveryConfig(1, 1, 1.0, Duration.ZERO);
    }

    /**
     * History depth needed by the guards.
     */
    public int requiredHistoryDepth() {
        return Math.max(2, Math.max(minHealthySamples, validationWindow));
    }
}
