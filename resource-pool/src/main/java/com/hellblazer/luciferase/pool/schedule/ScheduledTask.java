package com.hellblazer.luciferase.pool.schedule;

/**
 * Handle to a periodic task registered with a {@link TaskScheduler}.
 */
public interface ScheduledTask {

    /**
     * Stop future runs of the task. Idempotent; a run already in progress completes.
     */
    void cancel();

    boolean isCancelled();

    String getName();
}
