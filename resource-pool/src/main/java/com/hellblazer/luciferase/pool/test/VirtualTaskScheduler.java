package com.hellblazer.luciferase.pool.test;

import com.hellblazer.luciferase.pool.schedule.ScheduledTask;
import com.hellblazer.luciferase.pool.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deterministic {@link TaskScheduler} driven by a manual clock.
 *
 * Time only moves when {@link #advance(Duration)} is called. Due tasks fire on the caller's
 * thread in time order (ties in registration order), with the clock set to each run's due time.
 * Cancelled tasks and tasks of a shut down scheduler never fire.
 *
 * <pre>
 * var scheduler = new VirtualTaskScheduler();
 * var pool = new ResourcePoolManager(config, detector, scheduler);
 * scheduler.advance(Duration.ofMillis(150));
 * </pre>
 */
public class VirtualTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(VirtualTaskScheduler.class);

    private final List<VirtualTask> tasks = new CopyOnWriteArrayList<>();
    private volatile long now;
    private volatile boolean shutdown = false;
    private long sequence = 0;

    public VirtualTaskScheduler() {
        this(0L);
    }

    public VirtualTaskScheduler(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public synchronized ScheduledTask scheduleAtFixedRate(String name, Runnable task, Duration period) {
        Objects.requireNonNull(task, "task");
        if (shutdown) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be positive");
        }
        var virtualTask = new VirtualTask(name, task, period.toMillis(), now + period.toMillis(), sequence++);
        tasks.add(virtualTask);
        return virtualTask;
    }

    /**
     * Move the clock forward, running every task that falls due on the way.
     *
     * @param duration how far to move, must not be negative
     * @return the number of task runs performed
     */
    public synchronized int advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot move time backwards");
        }
        long target = now + duration.toMillis();
        int runs = 0;
        while (!shutdown) {
            var next = tasks.stream()
                            .filter(t -> !t.cancelled)
                            .filter(t -> t.nextRun <= target)
                            .min(Comparator.comparingLong((VirtualTask t) -> t.nextRun)
                                           .thenComparingLong(t -> t.order));
            if (next.isEmpty()) {
                break;
            }
            var task = next.get();
            now = task.nextRun;
            task.nextRun += task.periodMillis;
            runs++;
            try {
                task.runnable.run();
            } catch (RuntimeException e) {
                log.error("Virtual task {} failed", task.name, e);
            }
        }
        now = target;
        tasks.removeIf(t -> t.cancelled);
        return runs;
    }

    public int advanceMillis(long millis) {
        return advance(Duration.ofMillis(millis));
    }

    /**
     * Number of tasks that are still scheduled.
     */
    public int getPendingTaskCount() {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    @Override
    public long currentTimeMillis() {
        return now;
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        tasks.forEach(VirtualTask::cancel);
        tasks.clear();
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    private static final class VirtualTask implements ScheduledTask {
        final String name;
        final Runnable runnable;
        final long periodMillis;
        final long order;
        long nextRun;
        volatile boolean cancelled = false;

        VirtualTask(String name, Runnable runnable, long periodMillis, long nextRun, long order) {
            this.name = name;
            this.runnable = runnable;
            this.periodMillis = periodMillis;
            this.nextRun = nextRun;
            this.order = order;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public String getName() {
            return name;
        }
    }
}
