package com.hellblazer.luciferase.pool.detect;

/**
 * Sampling the host failed.
 */
public class ResourceDetectionException extends RuntimeException {

    public ResourceDetectionException(String message) {
        super(message);
    }

    public ResourceDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
