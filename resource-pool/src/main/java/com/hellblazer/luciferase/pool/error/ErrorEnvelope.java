package com.hellblazer.luciferase.pool.error;

/**
 * Generic error shape returned at the service edge.
 *
 * @param status  HTTP-style status code
 * @param code    error code name, {@code INTERNAL_ERROR} for unknown failures
 * @param message message including the code and the context as {@code key: value} pairs
 */
public record ErrorEnvelope(int status, String code, String message) {
}
