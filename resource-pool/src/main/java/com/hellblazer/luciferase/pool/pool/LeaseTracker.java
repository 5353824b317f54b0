package com.hellblazer.luciferase.pool.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Registry of active leases with running totals. Reads are lock free; the pool serializes writes.
 */
public class LeaseTracker {
    private static final Logger log = LoggerFactory.getLogger(LeaseTracker.class);

    private final Map<String, Resource> activeLeases = new ConcurrentHashMap<>();
    private final AtomicLong totalAllocated = new AtomicLong(0);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong totalExpired = new AtomicLong(0);

    void register(Resource lease) {
        activeLeases.put(lease.getId(), lease);
        totalAllocated.incrementAndGet();
        log.trace("Registered lease: {}", lease);
    }

    /**
     * Remove a lease that was released by its holder.
     */
    boolean release(Resource lease) {
        if (activeLeases.remove(lease.getId(), lease)) {
            totalReleased.incrementAndGet();
            log.trace("Released lease: {}", lease);
            return true;
        }
        return false;
    }

    /**
     * Remove a lease that timed out.
     */
    boolean expire(Resource lease) {
        if (activeLeases.remove(lease.getId(), lease)) {
            totalExpired.incrementAndGet();
            log.trace("Expired lease: {}", lease);
            return true;
        }
        return false;
    }

    /**
     * Active leases whose expiry is at or before {@code now}, oldest expiry first.
     */
    List<Resource> findExpired(long now) {
        return activeLeases.values()
                           .stream()
                           .filter(l -> l.isExpired(now))
                           .sorted(Comparator.comparingLong(Resource::getExpiresAt))
                           .collect(Collectors.toList());
    }

    List<Resource> drain() {
        var all = new ArrayList<>(activeLeases.values());
        activeLeases.clear();
        return all;
    }

    public int getActiveCount() {
        return activeLeases.size();
    }

    public Resource getLease(String id) {
        return activeLeases.get(id);
    }

    public Set<String> getActiveLeaseIds() {
        return Set.copyOf(activeLeases.keySet());
    }

    public List<Resource> getActiveLeases() {
        return List.copyOf(activeLeases.values());
    }

    public long getTotalAllocated() {
        return totalAllocated.get();
    }

    public long getTotalReleased() {
        return totalReleased.get();
    }

    public long getTotalExpired() {
        return totalExpired.get();
    }

    /**
     * Generate a report of the tracked leases.
     */
    public String generateReport(long now) {
        var sb = new StringBuilder();
        sb.append("=== Lease Tracker Report ===\n");
        sb.append(String.format("Active leases: %d\n", getActiveCount()));
        sb.append(String.format("Total allocated: %d\n", getTotalAllocated()));
        sb.append(String.format("Total released: %d\n", getTotalReleased()));
        sb.append(String.format("Total expired: %d\n", getTotalExpired()));

        if (!activeLeases.isEmpty()) {
            sb.append("\nActive leases by type:\n");
            var byType = activeLeases.values()
                                     .stream()
                                     .collect(Collectors.groupingBy(Resource::getType, Collectors.counting()));
            byType.entrySet()
                  .stream()
                  .sorted(Map.Entry.comparingByKey())
                  .forEach(e -> sb.append(String.format("  %s: %d\n", e.getKey(), e.getValue())));

            var oldest = activeLeases.values().stream().max(Comparator.comparingLong(l -> l.getAgeMillis(now)));
            oldest.ifPresent(l -> sb.append(String.format("\nOldest lease: %s (age: %d ms)\n", l.getId(),
                                                          l.getAgeMillis(now))));
        }
        return sb.toString();
    }
}
