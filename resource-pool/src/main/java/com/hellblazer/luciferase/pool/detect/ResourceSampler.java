package com.hellblazer.luciferase.pool.detect;

/**
 * Source of raw resource totals.
 */
@FunctionalInterface
public interface ResourceSampler {

    /**
     * @param timestamp time to stamp the sample with, in epoch milliseconds
     * @throws ResourceDetectionException if the host cannot be sampled
     */
    SystemResources sample(long timestamp);
}
