package com.hellblazer.luciferase.pool.detect;

/**
 * Categories of system resources sampled by a {@link ResourceDetector}. {@link #DETECTOR} tags alerts
 * about the detector itself failing.
 */
public enum ResourceCategory {
    MEMORY("memory"),
    CPU("cpu"),
    DISK("disk"),
    DETECTOR("detector");

    private final String label;

    ResourceCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
