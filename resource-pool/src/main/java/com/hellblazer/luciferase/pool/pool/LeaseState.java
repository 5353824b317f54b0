package com.hellblazer.luciferase.pool.pool;

/**
 * Lifecycle of a lease. ACTIVE to RELEASED and ACTIVE to STALE are the only transitions; both targets are terminal.
 */
public enum LeaseState {
    ACTIVE,
    RELEASED,
    STALE
}
