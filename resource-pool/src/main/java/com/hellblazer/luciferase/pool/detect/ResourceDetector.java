package com.hellblazer.luciferase.pool.detect;

import java.util.function.Consumer;

/**
 * Periodically samples system resource availability and raises alerts on threshold crossings.
 * Pure data source: it knows nothing about pooling.
 */
public interface ResourceDetector extends AutoCloseable {

    /**
     * Take an initial sample and start periodic sampling.
     */
    void start();

    /**
     * Stop periodic sampling. The last sample stays readable.
     */
    void stop();

    /**
     * Stop sampling and drop listeners. Idempotent.
     */
    void dispose();

    /**
     * Availability derived from the most recent sample, sampling first if none exists yet.
     *
     * @throws ResourceDetectionException if a sample is needed and cannot be taken
     */
    ResourceAvailability getAvailability();

    /**
     * Take a fresh sample now and return the availability derived from it.
     *
     * @throws ResourceDetectionException if the sample cannot be taken
     */
    ResourceAvailability refresh();

    /**
     * Raw totals of the most recent sample, sampling first if none exists yet.
     */
    SystemResources getCurrentResources();

    void addUpdateListener(Consumer<ResourceAvailability> listener);

    void addAlertListener(Consumer<ResourceAlert> listener);

    void removeUpdateListener(Consumer<ResourceAvailability> listener);

    void removeAlertListener(Consumer<ResourceAlert> listener);

    @Override
    default void close() {
        dispose();
    }
}
