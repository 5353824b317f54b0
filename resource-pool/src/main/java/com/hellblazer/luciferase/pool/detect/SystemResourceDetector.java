package com.hellblazer.luciferase.pool.detect;

import com.hellblazer.luciferase.pool.health.HealthLevel;
import com.hellblazer.luciferase.pool.schedule.ScheduledTask;
import com.hellblazer.luciferase.pool.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * {@link ResourceDetector} that samples through a {@link ResourceSampler} on its own scheduled task.
 */
public class SystemResourceDetector implements ResourceDetector {
    private static final Logger log = LoggerFactory.getLogger(SystemResourceDetector.class);

    private final DetectorConfiguration config;
    private final ResourceSampler sampler;
    private final TaskScheduler scheduler;
    private final List<Consumer<ResourceAvailability>> updateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ResourceAlert>> alertListeners = new CopyOnWriteArrayList<>();
    private final Object sampleLock = new Object();

    private volatile SystemResources currentResources;
    private volatile ResourceAvailability currentAvailability;
    private volatile ScheduledTask updateTask;
    private volatile boolean disposed = false;

    public SystemResourceDetector(DetectorConfiguration config, TaskScheduler scheduler) {
        this(config, new JvmResourceSampler(), scheduler);
    }

    public SystemResourceDetector(DetectorConfiguration config, ResourceSampler sampler, TaskScheduler scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public synchronized void start() {
        ensureNotDisposed();
        if (updateTask != null) {
            return;
        }
        try {
            refresh();
        } catch (ResourceDetectionException e) {
            log.warn("Initial resource sample failed: {}", e.getMessage());
            emitAlert(ResourceAlert.detectorFailure(e.getMessage(), scheduler.currentTimeMillis()));
        }
        updateTask = scheduler.scheduleAtFixedRate("resource-detector", this::scheduledSample,
                                                   config.getUpdateInterval());
        log.debug("Started resource detection with {}", config);
    }

    @Override
    public synchronized void stop() {
        var task = updateTask;
        if (task != null) {
            task.cancel();
            updateTask = null;
            log.debug("Stopped resource detection");
        }
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        stop();
        disposed = true;
        updateListeners.clear();
        alertListeners.clear();
    }

    public boolean isRunning() {
        return updateTask != null;
    }

    @Override
    public ResourceAvailability getAvailability() {
        var availability = currentAvailability;
        return availability != null ? availability : refresh();
    }

    @Override
    public SystemResources getCurrentResources() {
        var resources = currentResources;
        if (resources == null) {
            refresh();
            resources = currentResources;
        }
        return resources;
    }

    @Override
    public ResourceAvailability refresh() {
        SystemResources resources;
        ResourceAvailability availability;
        synchronized (sampleLock) {
            try {
                resources = sampler.sample(scheduler.currentTimeMillis());
            } catch (ResourceDetectionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ResourceDetectionException("Resource sampling failed", e);
            }
            availability = toAvailability(resources);
            currentResources = resources;
            currentAvailability = availability;
        }
        checkThresholds(resources);
        for (var listener : updateListeners) {
            try {
                listener.accept(availability);
            } catch (RuntimeException e) {
                log.error("Update listener failed", e);
            }
        }
        return availability;
    }

    private void scheduledSample() {
        try {
            refresh();
        } catch (ResourceDetectionException e) {
            log.warn("Resource sample failed: {}", e.getMessage());
            emitAlert(ResourceAlert.detectorFailure(e.getMessage(), scheduler.currentTimeMillis()));
        }
    }

    ResourceAvailability toAvailability(SystemResources resources) {
        double memoryPercent = resources.memoryUtilizationPercent();
        double cpuPercent = resources.cpuUtilizationPercent();
        double diskPercent = resources.diskUtilizationPercent();

        var memoryLevel = config.getMemoryThresholds().classify(memoryPercent);
        var cpuLevel = config.getCpuThresholds().classify(cpuPercent);
        var diskLevel = config.getDiskThresholds().classify(diskPercent);

        var memory = new MemoryAvailability(memoryLevel != HealthLevel.CRITICAL, memoryPercent,
                                            resources.freeMemory(), memoryLevel);
        var cpu = new CpuAvailability(cpuLevel != HealthLevel.CRITICAL, cpuPercent, resources.cores(), cpuLevel);
        var disk = new DiskAvailability(diskLevel != HealthLevel.CRITICAL, diskPercent, resources.freeDisk(),
                                        diskLevel);
        var overall = HealthLevel.worst(memoryLevel, HealthLevel.worst(cpuLevel, diskLevel));
        return new ResourceAvailability(overall, memory, cpu, disk, resources.timestamp());
    }

    private void checkThresholds(SystemResources resources) {
        checkThreshold(ResourceCategory.MEMORY, resources.memoryUtilizationPercent(), resources.timestamp());
        checkThreshold(ResourceCategory.CPU, resources.cpuUtilizationPercent(), resources.timestamp());
        checkThreshold(ResourceCategory.DISK, resources.diskUtilizationPercent(), resources.timestamp());
    }

    private void checkThreshold(ResourceCategory category, double current, long timestamp) {
        var thresholds = config.thresholdsFor(category);
        var level = thresholds.classify(current);
        switch (level) {
            case CRITICAL -> emitAlert(new ResourceAlert(category, level,
                                                         category.getLabel() + " usage exceeded critical threshold",
                                                         current, thresholds.critical(), timestamp));
            case WARNING -> emitAlert(new ResourceAlert(category, level,
                                                        category.getLabel() + " usage exceeded warning threshold",
                                                        current, thresholds.warning(), timestamp));
            default -> {
            }
        }
    }

    private void emitAlert(ResourceAlert alert) {
        log.debug("Resource alert: {}", alert);
        for (var listener : alertListeners) {
            try {
                listener.accept(alert);
            } catch (RuntimeException e) {
                log.error("Alert listener failed", e);
            }
        }
    }

    @Override
    public void addUpdateListener(Consumer<ResourceAvailability> listener) {
        updateListeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void addAlertListener(Consumer<ResourceAlert> listener) {
        alertListeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void removeUpdateListener(Consumer<ResourceAvailability> listener) {
        updateListeners.remove(listener);
    }

    @Override
    public void removeAlertListener(Consumer<ResourceAlert> listener) {
        alertListeners.remove(listener);
    }

    private void ensureNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("Resource detector is disposed");
        }
    }
}
