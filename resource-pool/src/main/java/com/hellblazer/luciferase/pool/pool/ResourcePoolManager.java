package com.hellblazer.luciferase.pool.pool;

import com.hellblazer.luciferase.pool.detect.ResourceAlert;
import com.hellblazer.luciferase.pool.detect.ResourceAvailability;
import com.hellblazer.luciferase.pool.detect.ResourceDetector;
import com.hellblazer.luciferase.pool.error.PoolExhaustedException;
import com.hellblazer.luciferase.pool.error.ResourcePoolException;
import com.hellblazer.luciferase.pool.error.ResourceValidationException;
import com.hellblazer.luciferase.pool.error.StaleResourceException;
import com.hellblazer.luciferase.pool.health.HealthLevel;
import com.hellblazer.luciferase.pool.health.HealthMetrics;
import com.hellblazer.luciferase.pool.health.HealthStateManager;
import com.hellblazer.luciferase.pool.health.StateTransition;
import com.hellblazer.luciferase.pool.schedule.ExecutorTaskScheduler;
import com.hellblazer.luciferase.pool.schedule.ScheduledTask;
import com.hellblazer.luciferase.pool.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Leases bounded capacity to concurrent callers and tracks system health.
 *
 * <p>The active-lease count and the shape cache are only touched under one lock per pool, so two
 * callers can never both take the last slot. Health is a single-writer value: the health task and
 * {@link #forceUpdate()} write it under a separate lock and {@link #monitor()} reads it without locking.
 * A cleanup task expires leases whose timeout has passed and trims idle cached shapes.
 *
 * <p>Timers come from the {@link TaskScheduler} given at construction; {@link #dispose()} cancels them.
 */
public class ResourcePoolManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourcePoolManager.class);

    private final String poolId = UUID.randomUUID().toString();
    private final PoolConfiguration config;
    private final ResourceDetector detector;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;
    private final HealthStateManager stateManager;
    private final LeaseTracker tracker = new LeaseTracker();
    private final LeaseShapeCache cache;
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock healthLock = new ReentrantLock();
    private final List<PoolLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    // Statistics
    private final AtomicLong allocations = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong releases = new AtomicLong(0);
    private final AtomicLong allocationNanos = new AtomicLong(0);
    private final AtomicLong admissionAttempts = new AtomicLong(0);
    private final AtomicLong admissionFailures = new AtomicLong(0);
    private long lastSampledAttempts = 0;
    private long lastSampledFailures = 0;

    private final ScheduledTask cleanupTask;
    private final ScheduledTask healthTask;
    private final Consumer<ResourceAlert> alertForwarder = this::fireAlert;

    private volatile HealthLevel health = HealthLevel.HEALTHY;
    private volatile long healthUpdated;
    private volatile ResourceAvailability lastAvailability;
    private volatile boolean disposed = false;

    /**
     * Create a pool with its own scheduler thread, shut down on {@link #dispose()}.
     */
    public ResourcePoolManager(PoolConfiguration config, ResourceDetector detector) {
        this(config, detector, new ExecutorTaskScheduler("resource-pool"), true);
    }

    /**
     * Create a pool on a shared scheduler. {@link #dispose()} cancels this pool's tasks only.
     */
    public ResourcePoolManager(PoolConfiguration config, ResourceDetector detector, TaskScheduler scheduler) {
        this(config, detector, scheduler, false);
    }

    private ResourcePoolManager(PoolConfiguration config, ResourceDetector detector, TaskScheduler scheduler,
                                boolean ownsScheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.cache = new LeaseShapeCache(config.getCacheMaxSize());
        this.healthUpdated = scheduler.currentTimeMillis();
        this.stateManager = new HealthStateManager(config.getThresholds(), config.getRecovery(),
                                                   config.getHistoryCapacity(), healthUpdated);
        stateManager.addTransitionListener(this::fireHealthTransition);
        detector.addAlertListener(alertForwarder);

        sampleHealth(false);

        this.cleanupTask = scheduler.scheduleAtFixedRate("pool-cleanup", this::runCleanup,
                                                         config.getCleanupInterval());
        this.healthTask = scheduler.scheduleAtFixedRate("pool-health", () -> sampleHealth(false),
                                                        config.getHealthCheckInterval());
        log.debug("Created resource pool {} with {}", poolId, config);
    }

    /**
     * Lease capacity for a request.
     *
     * @throws ResourceValidationException if the request is malformed
     * @throws PoolExhaustedException      if no capacity is available; retry with backoff
     * @throws IllegalStateException       if the pool is disposed
     */
    public Resource allocate(ResourceRequest request) {
        ensureNotDisposed();
        long start = System.nanoTime();
        try {
            validate(request);
        } catch (ResourceValidationException e) {
            failures.incrementAndGet();
            throw e;
        }

        admissionAttempts.incrementAndGet();
        var fingerprint = RequirementFingerprint.of(request);
        Resource lease;
        lock.lock();
        try {
            ensureNotDisposed();
            long now = scheduler.currentTimeMillis();
            int active = tracker.getActiveCount();
            if (active >= config.getMaxPoolSize()) {
                throw exhausted("Resource pool exhausted", request, active);
            }
            checkSystemCapacity(request);

            var shape = cache.get(fingerprint, now);
            boolean hit = shape.isPresent();
            if (!hit) {
                cache.put(new LeaseShape(fingerprint, now), now);
            }
            long timeout = request.getRequirements().timeout().orElse(config.getResourceTimeout().toMillis());
            lease = new Resource(poolId, request, fingerprint, now, expiryOf(now, timeout), hit);
            tracker.register(lease);
        } catch (ResourcePoolException e) {
            failures.incrementAndGet();
            admissionFailures.incrementAndGet();
            throw e;
        } finally {
            lock.unlock();
        }

        allocations.incrementAndGet();
        allocationNanos.addAndGet(System.nanoTime() - start);
        log.trace("Allocated {} for request {} (cached shape: {})", lease.getId(), request.getId(),
                  lease.isFromCache());
        fire(l -> l.onAllocated(lease));
        return lease;
    }

    /**
     * Return a lease to the pool.
     *
     * @throws StaleResourceException      if the lease expired before this call
     * @throws ResourceValidationException if the lease is unknown to this pool or already released
     * @throws IllegalStateException       if the pool is disposed
     */
    public void release(Resource resource) {
        ensureNotDisposed();
        if (resource == null) {
            throw new ResourceValidationException("Resource must not be null", Map.of());
        }
        var context = leaseContext(resource);
        boolean expiredNow = false;
        lock.lock();
        try {
            ensureNotDisposed();
            if (!poolId.equals(resource.getPoolId())) {
                throw new ResourceValidationException("Resource is not managed by this pool", context);
            }
            switch (resource.getState()) {
                case RELEASED -> throw new ResourceValidationException("Resource already released", context);
                case STALE -> throw new StaleResourceException(context);
                default -> {
                }
            }
            long now = scheduler.currentTimeMillis();
            if (resource.isExpired(now)) {
                // the timeout passed before the sweep got to it; the sweep's outcome applies
                if (resource.markStale()) {
                    tracker.expire(resource);
                }
                expiredNow = true;
            } else if (resource.markReleased() && tracker.release(resource)) {
                cache.put(new LeaseShape(resource.getFingerprint(), now), now);
                releases.incrementAndGet();
            } else {
                throw new ResourceValidationException("Resource is not active", context);
            }
        } finally {
            lock.unlock();
        }

        if (expiredNow) {
            log.warn("Release of expired lease {} for request {}", resource.getId(), resource.getRequestId());
            fire(l -> l.onExpired(resource));
            throw new StaleResourceException(context);
        }
        log.trace("Released {}", resource.getId());
        fire(l -> l.onReleased(resource));
    }

    /**
     * Current health and utilization. Does not sample; reads cached state only.
     */
    public PoolStatus monitor() {
        int active = tracker.getActiveCount();
        return new PoolStatus(health, (double) active / config.getMaxPoolSize(), active, config.getMaxPoolSize(),
                              healthUpdated);
    }

    /**
     * Re-sample the detector now and feed the result through the health state machine.
     */
    public void forceUpdate() {
        ensureNotDisposed();
        sampleHealth(true);
    }

    /**
     * Expire leases past their timeout and trim idle cached shapes. Runs on the cleanup timer.
     *
     * @return the number of leases expired
     */
    public int runCleanup() {
        if (disposed) {
            return 0;
        }
        List<Resource> expired = new ArrayList<>();
        int evicted;
        lock.lock();
        try {
            long now = scheduler.currentTimeMillis();
            for (var lease : tracker.findExpired(now)) {
                if (lease.markStale() && tracker.expire(lease)) {
                    expired.add(lease);
                }
            }
            evicted = cache.evictIdle(now, config.getResourceTimeout().toMillis(), config.getMinPoolSize());
        } finally {
            lock.unlock();
        }
        if (!expired.isEmpty() || evicted > 0) {
            log.info("Cleanup expired {} leases and evicted {} idle shapes", expired.size(), evicted);
        }
        for (var lease : expired) {
            fire(l -> l.onExpired(lease));
        }
        return expired.size();
    }

    private void sampleHealth(boolean fresh) {
        if (disposed) {
            return;
        }
        healthLock.lock();
        try {
            ResourceAvailability availability;
            try {
                availability = fresh ? detector.refresh() : detector.getAvailability();
            } catch (RuntimeException e) {
                log.warn("Resource detector failed, keeping health {}: {}", health, e.getMessage());
                fireAlert(ResourceAlert.detectorFailure("Resource detection failed: " + e.getMessage(),
                                                        scheduler.currentTimeMillis()));
                return;
            }
            lastAvailability = availability;
            long now = Math.max(scheduler.currentTimeMillis(),
                                stateManager.getHistory().lastSample().map(s -> s.timestamp()).orElse(0L));
            var state = stateManager.evaluate(toHealthMetrics(availability), now);
            health = HealthLevel.of(state.status());
            healthUpdated = now;
        } finally {
            healthLock.unlock();
        }
    }

    /**
     * The pool's health sample: utilization is the highest of memory, cpu and pool utilization, raised to
     * the configured threshold when the detector itself reports warning or critical; error rate is the
     * share of admissions rejected since the previous sample.
     */
    HealthMetrics toHealthMetrics(ResourceAvailability availability) {
        double poolUtilization = (double) tracker.getActiveCount() / config.getMaxPoolSize();
        double utilization = Math.max(poolUtilization, Math.max(availability.memory().utilizationPercent(),
                                                                availability.cpu().utilizationPercent()) / 100.0);
        utilization = switch (availability.status()) {
            case CRITICAL -> Math.max(utilization, config.getCriticalThreshold());
            case WARNING -> Math.max(utilization, config.getWarningThreshold());
            case HEALTHY -> utilization;
        };

        long attempts = admissionAttempts.get();
        long failed = admissionFailures.get();
        long attemptDelta = attempts - lastSampledAttempts;
        long failedDelta = failed - lastSampledFailures;
        lastSampledAttempts = attempts;
        lastSampledFailures = failed;
        double errorRate = attemptDelta > 0 ? (double) failedDelta / attemptDelta : 0.0;

        return HealthMetrics.builder().utilization(utilization).errorRate(errorRate).build();
    }

    private void checkSystemCapacity(ResourceRequest request) {
        var availability = lastAvailability;
        if (health != HealthLevel.CRITICAL || availability == null) {
            return;
        }
        var requirements = request.getRequirements();
        boolean memoryShort = requirements.memoryBytes().isPresent()
                              && (!availability.memory().isAvailable()
                                  || availability.memory().availableAmount() < requirements.memoryBytes().getAsLong());
        boolean cpuShort = requirements.cpuPercent().isPresent()
                           && (!availability.cpu().isAvailable()
                               || availability.cpu().availableCores()
                                  < PoolUtils.coresFor(requirements.cpuPercent().getAsDouble()));
        if (memoryShort || cpuShort) {
            var context = new LinkedHashMap<String, String>();
            context.put("requestId", request.getId());
            context.put("health", health.name());
            context.put("availableMemory", Long.toString(availability.memory().availableAmount()));
            context.put("availableCores", Integer.toString(availability.cpu().availableCores()));
            log.warn("Rejecting request {}: system resources exhausted", request.getId());
            throw new PoolExhaustedException("System resources exhausted", context);
        }
    }

    private void validate(ResourceRequest request) {
        if (request == null) {
            throw new ResourceValidationException("Request must not be null", Map.of());
        }
        var context = new LinkedHashMap<String, String>();
        context.put("requestId", String.valueOf(request.getId()));
        if (request.getId() == null || request.getId().isBlank()) {
            throw new ResourceValidationException("Request id must not be empty", context);
        }
        if (request.getType() == null) {
            throw new ResourceValidationException("Unknown resource type", context);
        }
        if (request.getPriority() == null) {
            throw new ResourceValidationException("Priority must be set", context);
        }
        var requirements = request.getRequirements();
        if (requirements == null) {
            throw new ResourceValidationException("Requirements must be set", context);
        }
        checkNonNegative(requirements.memory(), "memory", context);
        checkNonNegative(requirements.cpu(), "cpu", context);
        checkNonNegative(requirements.timeoutMs(), "timeoutMs", context);
        if (requirements.cpu() != null && (requirements.cpu().isNaN() || requirements.cpu().isInfinite())) {
            context.put("cpu", String.valueOf(requirements.cpu()));
            throw new ResourceValidationException("Requirement cpu must be finite", context);
        }
    }

    private static void checkNonNegative(Number value, String name, Map<String, String> context) {
        if (value != null && value.doubleValue() < 0) {
            context.put(name, value.toString());
            throw new ResourceValidationException("Requirement " + name + " must not be negative", context);
        }
    }

    private PoolExhaustedException exhausted(String message, ResourceRequest request, int active) {
        var context = new LinkedHashMap<String, String>();
        context.put("requestId", request.getId());
        context.put("activeLeases", Integer.toString(active));
        context.put("maxPoolSize", Integer.toString(config.getMaxPoolSize()));
        log.warn("Rejecting request {}: {} ({}/{})", request.getId(), message, active, config.getMaxPoolSize());
        return new PoolExhaustedException(message, context);
    }

    private static Map<String, String> leaseContext(Resource resource) {
        var context = new LinkedHashMap<String, String>();
        context.put("resourceId", resource.getId());
        context.put("requestId", resource.getRequestId());
        context.put("expiresAt", Long.toString(resource.getExpiresAt()));
        return context;
    }

    public void addListener(PoolLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(PoolLifecycleListener listener) {
        listeners.remove(listener);
    }

    private void fireHealthTransition(StateTransition transition) {
        fire(l -> l.onHealthTransition(transition));
    }

    private void fireAlert(ResourceAlert alert) {
        fire(l -> l.onAlert(alert));
    }

    private void fire(Consumer<PoolLifecycleListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Pool listener failed", e);
            }
        }
    }

    public PoolStatistics getStatistics() {
        lock.lock();
        try {
            long count = allocations.get();
            return new PoolStatistics.Snapshot(
                count,
                cache.getHits(),
                cache.getMisses(),
                failures.get(),
                releases.get(),
                tracker.getTotalExpired(),
                tracker.getActiveCount(),
                cache.size(),
                count > 0 ? allocationNanos.get() / 1000.0 / count : 0.0
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Generate a human-readable report of the pool.
     */
    public String generateReport() {
        var sb = new StringBuilder();
        var status = monitor();
        sb.append("=== Resource Pool Report ===\n");
        sb.append(config).append("\n");
        sb.append(String.format("Health: %s (updated %d)\n", status.health(), status.lastUpdated()));
        sb.append(String.format("Utilization: %.1f%% (%d/%d)\n", status.utilization() * 100,
                                status.activeLeases(), status.maxPoolSize()));
        sb.append(getStatistics().formatStatistics()).append("\n");
        sb.append(String.format("Rejected health transitions: %d\n", stateManager.getRejectedTransitionCount()));
        sb.append("\n");
        sb.append(tracker.generateReport(scheduler.currentTimeMillis()));
        return sb.toString();
    }

    public HealthStateManager getHealthStateManager() {
        return stateManager;
    }

    public LeaseTracker getTracker() {
        return tracker;
    }

    public PoolConfiguration getConfiguration() {
        return config;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Stop both timers, mark every active lease stale and clear the cache. Idempotent. The detector is
     * not disposed since it belongs to the caller, but this pool stops listening to it.
     */
    public void dispose() {
        List<Resource> drained;
        lock.lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            cleanupTask.cancel();
            healthTask.cancel();
            drained = tracker.drain();
            drained.forEach(Resource::markStale);
            cache.clear();
        } finally {
            lock.unlock();
        }
        detector.removeAlertListener(alertForwarder);
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        if (!drained.isEmpty()) {
            log.warn("Disposed pool with {} active leases", drained.size());
        }
        listeners.clear();
        log.debug("Disposed resource pool {}", poolId);
    }

    @Override
    public void close() {
        dispose();
    }

    /**
     * Lease expiry, saturating at {@code Long.MAX_VALUE} so a very long timeout never wraps into the past.
     */
    static long expiryOf(long now, long timeoutMs) {
        try {
            return Math.addExact(now, timeoutMs);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void ensureNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("Resource pool is disposed");
        }
    }
}
