package com.hellblazer.luciferase.pool.test.lifecycle;

import com.hellblazer.luciferase.pool.pool.ResourcePoolManager;
import com.hellblazer.luciferase.pool.pool.ResourceType;
import com.hellblazer.luciferase.pool.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class for lease lifecycle tests with snapshot/diff/assert operations.
 *
 * <pre>
 * &#64;Test
 * void testCallerReleasesEverything() {
 *     var before = captureSnapshot(pool, scheduler);
 *     runWorkload(pool);
 *     assertNoLeaks(diff(pool, before, captureSnapshot(pool, scheduler)));
 * }
 * </pre>
 */
public class PoolLifecycleTestSupport {
    private static final Logger log = LoggerFactory.getLogger(PoolLifecycleTestSupport.class);

    protected LeaseSnapshot captureSnapshot(ResourcePoolManager pool, TaskScheduler clock) {
        return LeaseSnapshot.capture(pool.getTracker(), clock.currentTimeMillis());
    }

    /**
     * Leases active after but not before.
     */
    protected LeakReport diff(ResourcePoolManager pool, LeaseSnapshot before, LeaseSnapshot after) {
        var tracker = pool.getTracker();
        Map<ResourceType, List<LeaseInfo>> leakedByType = new HashMap<>();
        for (var entry : after.getActiveLeasesByType().entrySet()) {
            var beforeIds = before.getActiveLeasesByType().getOrDefault(entry.getKey(), Set.of());
            var leaked = new ArrayList<LeaseInfo>();
            for (var id : entry.getValue()) {
                if (beforeIds.contains(id)) {
                    continue;
                }
                var lease = tracker.getLease(id);
                leaked.add(new LeaseInfo(id, lease != null ? lease.getRequestId() : null, entry.getKey(),
                                         lease != null ? lease.getAgeMillis(after.getTimestamp()) : 0));
            }
            if (!leaked.isEmpty()) {
                leakedByType.put(entry.getKey(), leaked);
            }
        }
        return new LeakReport(leakedByType, before, after);
    }

    /**
     * @throws AssertionError if the report shows any leak
     */
    protected void assertNoLeaks(LeakReport report) {
        if (report.hasLeaks()) {
            throw new AssertionError("Lease leaks detected:\n" + report);
        }
    }

    /**
     * Release every active lease of the pool, ignoring failures. For teardown after a failed test.
     *
     * @return the number of leases released
     */
    protected int forceRelease(ResourcePoolManager pool) {
        int released = 0;
        for (var lease : pool.getTracker().getActiveLeases()) {
            try {
                pool.release(lease);
                released++;
            } catch (RuntimeException e) {
                log.warn("Could not release lease {}: {}", lease.getId(), e.getMessage());
            }
        }
        return released;
    }
}
