package com.hellblazer.luciferase.pool.error;

import java.util.Map;

/**
 * The lease expired before it was released. The holder exceeded its timeout or stopped responding.
 */
public class StaleResourceException extends ResourcePoolException {

    public static final String MESSAGE = "Resource is stale";

    public StaleResourceException(Map<String, String> context) {
        super(PoolErrorCode.RESOURCE_STALE, MESSAGE, context);
    }
}
