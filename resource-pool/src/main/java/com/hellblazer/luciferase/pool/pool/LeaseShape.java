package com.hellblazer.luciferase.pool.pool;

/**
 * Reusable template for leases with one fingerprint: the outcome of the full admission path,
 * kept so equivalent requests skip it.
 *
 * @param createdAt when the shape was first admitted, epoch milliseconds
 */
public record LeaseShape(RequirementFingerprint fingerprint, long createdAt) {
}
