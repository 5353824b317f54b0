package com.hellblazer.luciferase.pool.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lease handle issued by a {@link ResourcePoolManager}. Owned by the pool; callers only hand it back to
 * {@link ResourcePoolManager#release(Resource)}. Every lease has a fresh id.
 */
public final class Resource {
    private static final Logger log = LoggerFactory.getLogger(Resource.class);

    private final String id;
    private final String poolId;
    private final String requestId;
    private final ResourceType type;
    private final Priority priority;
    private final ResourceRequirements requirements;
    private final RequirementFingerprint fingerprint;
    private final long allocatedAt;
    private final long expiresAt;
    private final boolean fromCache;
    private final AtomicReference<LeaseState> state = new AtomicReference<>(LeaseState.ACTIVE);

    Resource(String poolId, ResourceRequest request, RequirementFingerprint fingerprint, long allocatedAt,
             long expiresAt, boolean fromCache) {
        this.id = UUID.randomUUID().toString();
        this.poolId = poolId;
        this.requestId = request.getId();
        this.type = request.getType();
        this.priority = request.getPriority();
        this.requirements = request.getRequirements();
        this.fingerprint = fingerprint;
        this.allocatedAt = allocatedAt;
        this.expiresAt = expiresAt;
        this.fromCache = fromCache;
    }

    public String getId() { return id; }
    public String getRequestId() { return requestId; }
    public ResourceType getType() { return type; }
    public Priority getPriority() { return priority; }
    public ResourceRequirements getRequirements() { return requirements; }
    public RequirementFingerprint getFingerprint() { return fingerprint; }
    public long getAllocatedAt() { return allocatedAt; }
    public long getExpiresAt() { return expiresAt; }

    /**
     * Whether the lease was reissued from a cached shape rather than the full admission path.
     */
    public boolean isFromCache() {
        return fromCache;
    }

    public LeaseState getState() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == LeaseState.ACTIVE;
    }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }

    /**
     * Age of this lease in milliseconds at {@code now}.
     */
    public long getAgeMillis(long now) {
        return Math.max(0, now - allocatedAt);
    }

    String getPoolId() {
        return poolId;
    }

    boolean markReleased() {
        return transition(LeaseState.RELEASED);
    }

    boolean markStale() {
        return transition(LeaseState.STALE);
    }

    private boolean transition(LeaseState target) {
        if (state.compareAndSet(LeaseState.ACTIVE, target)) {
            log.trace("Lease {} -> {}", id, target);
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("Resource[id=%s, request=%s, type=%s, state=%s, expiresAt=%d]",
            id, requestId, type, state.get(), expiresAt);
    }
}
