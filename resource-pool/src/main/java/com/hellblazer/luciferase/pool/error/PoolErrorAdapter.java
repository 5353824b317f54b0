package com.hellblazer.luciferase.pool.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Translates pool and health failures into {@link ErrorEnvelope}s for callers outside the library.
 */
public final class PoolErrorAdapter {
    private static final Logger log = LoggerFactory.getLogger(PoolErrorAdapter.class);

    public static final int INTERNAL_STATUS = 500;
    public static final String INTERNAL_CODE = "INTERNAL_ERROR";

    private PoolErrorAdapter() {
    }

    public static ErrorEnvelope toEnvelope(Throwable error) {
        if (error instanceof ResourcePoolException poolError) {
            var code = poolError.getCode();
            return new ErrorEnvelope(code.getStatus(), code.name(), format(code.name(), poolError));
        }
        log.debug("Translating unexpected error", error);
        var message = error == null ? "Unknown error" : error.getMessage();
        return new ErrorEnvelope(INTERNAL_STATUS, INTERNAL_CODE,
                                 "[" + INTERNAL_CODE + "] " + (message == null ? error.getClass().getName() : message));
    }

    private static String format(String code, ResourcePoolException error) {
        var sb = new StringBuilder();
        sb.append('[').append(code).append("] ").append(error.getMessage());
        if (!error.getContext().isEmpty()) {
            sb.append(" (")
              .append(new TreeMap<>(error.getContext()).entrySet()
                                                      .stream()
                                                      .map(e -> e.getKey() + ": " + e.getValue())
                                                      .collect(Collectors.joining(", ")))
              .append(')');
        }
        return sb.toString();
    }
}
