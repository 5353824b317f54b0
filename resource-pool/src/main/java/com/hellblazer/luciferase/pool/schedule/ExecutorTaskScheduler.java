package com.hellblazer.luciferase.pool.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} backed by a single daemon {@link ScheduledExecutorService} and the system clock.
 * Runs of the same task never overlap: the executor has one thread.
 */
public class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final ScheduledExecutorService executor;
    private volatile boolean shutdown = false;

    public ExecutorTaskScheduler() {
        this("pool-scheduler-" + INSTANCES.incrementAndGet());
    }

    public ExecutorTaskScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(String name, Runnable task, Duration period) {
        Objects.requireNonNull(task, "task");
        if (shutdown) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be positive");
        }
        long millis = period.toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> runGuarded(name, task), millis, millis,
                                                                 TimeUnit.MILLISECONDS);
        log.debug("Scheduled task {} every {} ms", name, millis);
        return new FutureTask(name, future);
    }

    private static void runGuarded(String name, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task {} failed", name, t);
        }
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        executor.shutdownNow();
        log.debug("Scheduler shut down");
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    private static final class FutureTask implements ScheduledTask {
        private final String name;
        private final ScheduledFuture<?> future;

        FutureTask(String name, ScheduledFuture<?> future) {
            this.name = name;
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public String getName() {
            return name;
        }
    }
}
