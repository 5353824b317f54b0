package com.hellblazer.luciferase.pool.test.lifecycle;

import com.hellblazer.luciferase.pool.pool.ResourceType;

/**
 * Metadata of one leaked lease.
 *
 * @param leaseId   lease id
 * @param requestId id of the request that obtained the lease
 * @param type      resource type of the lease
 * @param age       age of the lease in milliseconds when the report was made
 */
public record LeaseInfo(String leaseId, String requestId, ResourceType type, long age) {

    public LeaseInfo {
        if (leaseId == null || type == null) {
            throw new IllegalArgumentException("leaseId and type must not be null");
        }
    }
}
