package com.hellblazer.luciferase.pool.error;

/**
 * Error kinds raised by the pool, with the status they map to at the service edge.
 */
public enum PoolErrorCode {
    VALIDATION_ERROR(400, false),
    POOL_EXHAUSTED(503, true),
    RESOURCE_STALE(404, false);

    private final int status;
    private final boolean retryable;

    PoolErrorCode(int status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Whether a caller may retry the operation after backing off.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
