package com.hellblazer.luciferase.pool.health;

import java.util.List;

/**
 * A requested health transition failed one or more guards. Thrown only by
 * {@link HealthStateManager#transition(HealthState, String)}; sampled transitions are rejected silently.
 */
public class GuardRejectedException extends RuntimeException {

    private final HealthStatus from;
    private final HealthStatus to;
    private final List<String> reasons;

    public GuardRejectedException(HealthStatus from, HealthStatus to, List<String> reasons) {
        super("Transition " + from + " -> " + to + " rejected: " + String.join("; ", reasons));
        this.from = from;
        this.to = to;
        this.reasons = List.copyOf(reasons);
    }

    public HealthStatus getFrom() {
        return from;
    }

    public HealthStatus getTo() {
        return to;
    }

    public List<String> getReasons() {
        return reasons;
    }
}
