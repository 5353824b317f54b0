package com.hellblazer.luciferase.pool.health;

import java.util.List;
import java.util.Optional;

/**
 * Bounded record of health samples and accepted transitions. Samples are kept in timestamp order.
 */
public class StateHistory {

    private final SampleRing<HealthState> samples;
    private final SampleRing<StateTransition> transitions;
    private final Object writeLock = new Object();

    public StateHistory(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("History capacity must be at least 2");
        }
        this.samples = new SampleRing<>(capacity);
        this.transitions = new SampleRing<>(capacity);
    }

    /**
     * @throws IllegalArgumentException if the sample is older than the latest one
     */
    public void record(HealthState sample) {
        synchronized (writeLock) {
            checkTimestamp(sample.timestamp());
            samples.add(sample);
        }
    }

    public void recordTransition(StateTransition transition) {
        transitions.add(transition);
    }

    /**
     * Throws if a sample taken at {@code timestamp} would break timestamp order.
     */
    public void checkTimestamp(long timestamp) {
        var last = samples.last();
        if (last.isPresent() && timestamp < last.get().timestamp()) {
            throw new IllegalArgumentException(
                "Sample timestamp " + timestamp + " precedes latest sample " + last.get().timestamp());
        }
    }

    /**
     * The last {@code window} samples, most recent last.
     */
    public List<HealthState> getRecentSamples(int window) {
        return samples.lastN(window);
    }

    public Optional<HealthState> lastSample() {
        return samples.last();
    }

    public List<HealthState> getSamples() {
        return samples.toList();
    }

    public List<StateTransition> getTransitions() {
        return transitions.toList();
    }

    public Optional<StateTransition> lastTransition() {
        return transitions.last();
    }

    public int getCapacity() {
        return samples.capacity();
    }

    public int sampleCount() {
        return samples.size();
    }
}
