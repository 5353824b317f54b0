package com.hellblazer.luciferase.pool.health;

public record ErrorMetrics(long errorCount, long totalOperations, long timestamp) {

    public ErrorMetrics {
        if (errorCount < 0 || totalOperations < 0) {
            throw new IllegalArgumentException("Counts cannot be negative");
        }
    }

    public double errorRate() {
        return totalOperations > 0 ? (double) errorCount / totalOperations : 0.0;
    }
}
