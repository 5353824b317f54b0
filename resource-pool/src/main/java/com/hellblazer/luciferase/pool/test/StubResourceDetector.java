package com.hellblazer.luciferase.pool.test;

import com.hellblazer.luciferase.pool.detect.CpuAvailability;
import com.hellblazer.luciferase.pool.detect.DetectorConfiguration;
import com.hellblazer.luciferase.pool.detect.DiskAvailability;
import com.hellblazer.luciferase.pool.detect.MemoryAvailability;
import com.hellblazer.luciferase.pool.detect.ResourceAlert;
import com.hellblazer.luciferase.pool.detect.ResourceAvailability;
import com.hellblazer.luciferase.pool.detect.ResourceDetectionException;
import com.hellblazer.luciferase.pool.detect.ResourceDetector;
import com.hellblazer.luciferase.pool.detect.SystemResources;
import com.hellblazer.luciferase.pool.health.HealthLevel;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scripted {@link ResourceDetector} for tests: returns whatever availability it was last given and can
 * be told to fail.
 */
public class StubResourceDetector implements ResourceDetector {

    public static final long TOTAL_MEMORY = 16L * 1024 * 1024 * 1024;
    public static final int CORES = 8;
    public static final long TOTAL_DISK = 1_000_000_000_000L;

    private static final DetectorConfiguration LEVELS = DetectorConfiguration.defaultConfig();

    private final List<Consumer<ResourceAvailability>> updateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ResourceAlert>> alertListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger refreshCount = new AtomicInteger();

    private volatile ResourceAvailability availability = availability(0, 0, 0L);
    private volatile RuntimeException failure;
    private volatile boolean started = false;
    private volatile boolean disposed = false;

    /**
     * Availability with the given memory and cpu utilization, disk at 50%, classified with the default
     * detector thresholds.
     */
    public static ResourceAvailability availability(double memoryPercent, double cpuPercent, long timestamp) {
        var memoryLevel = LEVELS.getMemoryThresholds().classify(memoryPercent);
        var cpuLevel = LEVELS.getCpuThresholds().classify(cpuPercent);
        long freeMemory = (long) (TOTAL_MEMORY * (1 - memoryPercent / 100.0));
        int freeCores = (int) Math.floor(CORES * (1 - cpuPercent / 100.0));
        var memory = new MemoryAvailability(memoryLevel != HealthLevel.CRITICAL, memoryPercent, freeMemory,
                                            memoryLevel);
        var cpu = new CpuAvailability(cpuLevel != HealthLevel.CRITICAL, cpuPercent, freeCores, cpuLevel);
        var disk = new DiskAvailability(true, 50.0, TOTAL_DISK / 2, HealthLevel.HEALTHY);
        return new ResourceAvailability(HealthLevel.worst(memoryLevel, cpuLevel), memory, cpu, disk, timestamp);
    }

    /**
     * Set memory and cpu utilization to the same percentage.
     */
    public void setUtilization(double percent) {
        setAvailability(availability(percent, percent, availability.timestamp()));
    }

    public void setAvailability(ResourceAvailability availability) {
        this.availability = Objects.requireNonNull(availability);
    }

    /**
     * Make every subsequent read throw a {@link ResourceDetectionException} until {@link #clearFailure()}.
     */
    public void failWith(String message) {
        this.failure = new ResourceDetectionException(message);
    }

    public void clearFailure() {
        this.failure = null;
    }

    public void emitAlert(ResourceAlert alert) {
        alertListeners.forEach(l -> l.accept(alert));
    }

    public int getRefreshCount() {
        return refreshCount.get();
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        started = false;
    }

    @Override
    public void dispose() {
        stop();
        disposed = true;
        updateListeners.clear();
        alertListeners.clear();
    }

    @Override
    public ResourceAvailability getAvailability() {
        var error = failure;
        if (error != null) {
            throw error;
        }
        return availability;
    }

    @Override
    public ResourceAvailability refresh() {
        refreshCount.incrementAndGet();
        var current = getAvailability();
        updateListeners.forEach(l -> l.accept(current));
        return current;
    }

    @Override
    public SystemResources getCurrentResources() {
        var current = getAvailability();
        return new SystemResources(TOTAL_MEMORY, current.memory().availableAmount(), CORES,
                                   current.cpu().utilizationPercent(), TOTAL_DISK, current.disk().availableSpace(),
                                   current.timestamp());
    }

    @Override
    public void addUpdateListener(Consumer<ResourceAvailability> listener) {
        updateListeners.add(listener);
    }

    @Override
    public void addAlertListener(Consumer<ResourceAlert> listener) {
        alertListeners.add(listener);
    }

    @Override
    public void removeUpdateListener(Consumer<ResourceAvailability> listener) {
        updateListeners.remove(listener);
    }

    @Override
    public void removeAlertListener(Consumer<ResourceAlert> listener) {
        alertListeners.remove(listener);
    }

    public int getUpdateListenerCount() {
        return updateListeners.size();
    }

    public int getAlertListenerCount() {
        return alertListeners.size();
    }
}
