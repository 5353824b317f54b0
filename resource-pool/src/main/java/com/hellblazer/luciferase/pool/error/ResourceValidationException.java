package com.hellblazer.luciferase.pool.error;

import java.util.Map;

/**
 * Malformed request or misuse of a lease handle. Not retryable.
 */
public class ResourceValidationException extends ResourcePoolException {

    public ResourceValidationException(String message, Map<String, String> context) {
        super(PoolErrorCode.VALIDATION_ERROR, message, context);
    }
}
