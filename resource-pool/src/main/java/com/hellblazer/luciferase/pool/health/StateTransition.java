package com.hellblazer.luciferase.pool.health;

/**
 * An accepted change of health status.
 */
public record StateTransition(HealthStatus from, HealthStatus to, long timestamp, String reason) {
}
