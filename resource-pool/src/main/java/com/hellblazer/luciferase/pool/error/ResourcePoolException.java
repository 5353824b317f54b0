package com.hellblazer.luciferase.pool.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base exception for pool failures. Carries a {@link PoolErrorCode} and an immutable context map
 * naming the offending resource or request and any threshold involved.
 */
public class ResourcePoolException extends RuntimeException {

    private final PoolErrorCode code;
    private final Map<String, String> context;

    public ResourcePoolException(PoolErrorCode code, String message, Map<String, String> context) {
        this(code, message, context, null);
    }

    public ResourcePoolException(PoolErrorCode code, String message, Map<String, String> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public PoolErrorCode getCode() {
        return code;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    @Override
    public String toString() {
        return String.format("%s[code=%s, message=%s, context=%s]",
            getClass().getSimpleName(), code, getMessage(), context);
    }
}
