package com.hellblazer.luciferase.pool.schedule;

import java.time.Duration;

/**
 * Timer abstraction owned by a pool or detector instance.
 * Production code uses {@link ExecutorTaskScheduler}; tests drive a virtual clock instead.
 */
public interface TaskScheduler {

    /**
     * Run a task periodically, first run one period from now.
     *
     * @param name   name used in logs
     * @param task   the task; an exception thrown by one run is logged and does not cancel later runs
     * @param period the period between runs, must be positive
     * @return handle used to cancel the task
     * @throws IllegalStateException if the scheduler has been shut down
     */
    ScheduledTask scheduleAtFixedRate(String name, Runnable task, Duration period);

    /**
     * Current time in epoch milliseconds as seen by this scheduler.
     */
    long currentTimeMillis();

    /**
     * Cancel every task. No task fires after this returns.
     */
    void shutdown();

    boolean isShutdown();
}
