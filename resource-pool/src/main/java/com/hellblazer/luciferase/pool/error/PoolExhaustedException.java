package com.hellblazer.luciferase.pool.error;

import java.util.Map;

/**
 * No capacity for the request right now. Callers back off and retry.
 */
public class PoolExhaustedException extends ResourcePoolException {

    public PoolExhaustedException(String message, Map<String, String> context) {
        super(PoolErrorCode.POOL_EXHAUSTED, message, context);
    }
}
