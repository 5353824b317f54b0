package com.hellblazer.luciferase.pool.pool;

import com.hellblazer.luciferase.pool.detect.ResourceAlert;
import com.hellblazer.luciferase.pool.health.StateTransition;

/**
 * Listener interface for pool lifecycle events. Callbacks run on the thread that caused the event
 * and must not block.
 */
public interface PoolLifecycleListener {

    default void onAllocated(Resource lease) {
    }

    default void onReleased(Resource lease) {
    }

    /**
     * Called when the cleanup sweep, a late release or disposal marks a lease stale.
     */
    default void onExpired(Resource lease) {
    }

    default void onHealthTransition(StateTransition transition) {
    }

    default void onAlert(ResourceAlert alert) {
    }
}
