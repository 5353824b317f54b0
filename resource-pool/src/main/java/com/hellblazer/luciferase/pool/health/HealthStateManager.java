package com.hellblazer.luciferase.pool.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Guarded health state machine.
 *
 * <p>Writers ({@link #evaluate}, {@link #transition}, {@link #reset}) are serialized by a lock;
 * {@link #getCurrentState()} is a lock-free read of the last accepted state. A rejected transition
 * leaves the state untouched.
 */
public class HealthStateManager {
    private static final Logger log = LoggerFactory.getLogger(HealthStateManager.class);

    private final ThresholdConfig thresholds;
    private final StateHistory history;
    private final RecoveryValidator validator;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Consumer<StateTransition>> transitionListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong rejectedTransitions = new AtomicLong(0);

    private volatile HealthState currentState;

    public HealthStateManager(ThresholdConfig thresholds, RecoveryConfig recovery) {
        this(thresholds, recovery, Math.max(100, recovery.requiredHistoryDepth()), 0L);
    }

    public HealthStateManager(ThresholdConfig thresholds, RecoveryConfig recovery, int historyCapacity,
                              long startTimestamp) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.history = new StateHistory(historyCapacity);
        this.validator = new RecoveryValidator(thresholds, recovery, history);
        this.currentState = HealthState.initial(startTimestamp);
    }

    public HealthState getCurrentState() {
        return currentState;
    }

    public HealthStatus getCurrentStatus() {
        return currentState.status();
    }

    public StateHistory getHistory() {
        return history;
    }

    public ThresholdConfig getThresholds() {
        return thresholds;
    }

    public long getRejectedTransitionCount() {
        return rejectedTransitions.get();
    }

    public void addGuardCondition(GuardCondition condition) {
        validator.addGuardCondition(condition);
    }

    public void addTransitionListener(Consumer<StateTransition> listener) {
        transitionListeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Whether moving from {@code from} to {@code to} would pass every guard right now.
     */
    public boolean canTransition(HealthState from, HealthState to) {
        return validator.validate(from, to).accepted();
    }

    /**
     * Classify a sample by its own metrics: any critical crossing is unhealthy, any warning crossing degraded.
     */
    public HealthStatus classify(HealthMetrics metrics) {
        if (validator.anyCrossing(metrics, true)) {
            return HealthStatus.UNHEALTHY;
        }
        if (validator.anyCrossing(metrics, false)) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Feed one sample through the state machine.
     *
     * <p>The sample is classified, the proposal is limited to one step from the current status, and the
     * guards decide. The sample is appended to the history with the resulting status either way.
     *
     * @return the state after the sample
     * @throws IllegalArgumentException if {@code timestamp} precedes the latest sample
     */
    public HealthState evaluate(HealthMetrics metrics, long timestamp) {
        Objects.requireNonNull(metrics, "metrics");
        lock.lock();
        try {
            history.checkTimestamp(timestamp);
            var from = currentState;
            var classified = classify(metrics);
            var proposed = from.status().stepToward(classified);
            var candidate = HealthState.sample(proposed, metrics, timestamp);

            HealthState result;
            StateTransition transition = null;
            if (proposed == from.status()) {
                result = candidate;
            } else {
                var validation = validator.validate(from, candidate);
                if (validation.accepted()) {
                    result = candidate;
                    transition = new StateTransition(from.status(), proposed, timestamp,
                                                     describe(classified, metrics));
                } else {
                    rejectedTransitions.incrementAndGet();
                    log.debug("Health transition {} -> {} rejected: {}", from.status(), proposed,
                              validation.failedReasons());
                    result = HealthState.sample(from.status(), metrics, timestamp);
                }
            }
            commit(result, transition);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Request a transition directly.
     *
     * @throws GuardRejectedException if any guard rejects; nothing is mutated in that case
     */
    public void transition(HealthState to, String reason) {
        Objects.requireNonNull(to, "to");
        lock.lock();
        try {
            history.checkTimestamp(to.timestamp());
            var from = currentState;
            StateTransition transition = null;
            if (to.status() != from.status()) {
                var validation = validator.validate(from, to);
                if (!validation.accepted()) {
                    rejectedTransitions.incrementAndGet();
                    log.debug("Health transition {} -> {} rejected: {}", from.status(), to.status(),
                              validation.failedReasons());
                    throw new GuardRejectedException(from.status(), to.status(), validation.failedReasons());
                }
                transition = new StateTransition(from.status(), to.status(), to.timestamp(), reason);
            }
            commit(to, transition);
        } finally {
            lock.unlock();
        }
    }

    public void transition(HealthState to) {
        transition(to, "requested");
    }

    /**
     * Explicit operator reset out of unhealthy into degraded, keeping the latest metrics.
     *
     * @throws IllegalStateException  if the machine is not unhealthy
     * @throws GuardRejectedException if a user guard rejects the reset
     */
    public void reset(String reason, long timestamp) {
        lock.lock();
        try {
            var from = currentState;
            if (from.status() != HealthStatus.UNHEALTHY) {
                throw new IllegalStateException("Reset is only valid from UNHEALTHY, current status is " + from.status());
            }
            var to = new HealthState(HealthStatus.DEGRADED, from.metrics(), timestamp, HealthState.Source.RESET);
            transition(to, "reset: " + reason);
        } finally {
            lock.unlock();
        }
    }

    private void commit(HealthState state, StateTransition transition) {
        history.record(state);
        currentState = state;
        if (transition != null) {
            history.recordTransition(transition);
            log.info("Health transition {} -> {} at {}: {}", transition.from(), transition.to(),
                     transition.timestamp(), transition.reason());
            for (var listener : transitionListeners) {
                try {
                    listener.accept(transition);
                } catch (RuntimeException e) {
                    log.error("Transition listener failed", e);
                }
            }
        }
    }

    private String describe(HealthStatus classified, HealthMetrics metrics) {
        var crossings = new ArrayList<String>();
        for (var metric : metrics.present()) {
            var bands = thresholds.forMetric(metric);
            double value = metrics.get(metric).getAsDouble();
            if (bands.isCritical(value)) {
                crossings.add(metric.getLabel() + "=" + value + " past critical " + bands.critical());
            } else if (bands.isWarning(value)) {
                crossings.add(metric.getLabel() + "=" + value + " past warning " + bands.warning());
            }
        }
        return crossings.isEmpty() ? "sample classified " + classified : String.join(", ", crossings);
    }
}
