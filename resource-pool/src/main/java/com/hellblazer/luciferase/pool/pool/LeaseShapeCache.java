package com.hellblazer.luciferase.pool.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LRU cache of lease shapes keyed by requirement fingerprint. A maximum size of 0 disables it.
 *
 * <p>Not thread safe; the pool calls it under its allocation lock.
 */
public class LeaseShapeCache {
    private static final Logger log = LoggerFactory.getLogger(LeaseShapeCache.class);

    private static final class Entry {
        final LeaseShape shape;
        long lastUsed;

        Entry(LeaseShape shape, long lastUsed) {
            this.shape = shape;
            this.lastUsed = lastUsed;
        }
    }

    private final int maxSize;
    private final LinkedHashMap<RequirementFingerprint, Entry> entries;
    private long hits = 0;
    private long misses = 0;
    private long evictions = 0;

    public LeaseShapeCache(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("Cache size cannot be negative");
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<RequirementFingerprint, Entry> eldest) {
                if (size() > LeaseShapeCache.this.maxSize) {
                    evictions++;
                    log.trace("Evicted least recently used shape {}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    public boolean isEnabled() {
        return maxSize > 0;
    }

    /**
     * Look up a shape, counting a hit or a miss, and mark it used.
     */
    public Optional<LeaseShape> get(RequirementFingerprint fingerprint, long now) {
        if (!isEnabled()) {
            misses++;
            return Optional.empty();
        }
        var entry = entries.get(fingerprint);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        entry.lastUsed = now;
        return Optional.of(entry.shape);
    }

    /**
     * Insert or refresh a shape, evicting the least recently used one when full.
     */
    public void put(LeaseShape shape, long now) {
        if (!isEnabled()) {
            return;
        }
        var entry = entries.get(shape.fingerprint());
        if (entry != null) {
            entry.lastUsed = now;
        } else {
            entries.put(shape.fingerprint(), new Entry(shape, now));
        }
    }

    /**
     * Evict shapes unused for longer than {@code maxIdleMillis}, keeping the {@code keepWarm} most recently
     * used shapes regardless of age.
     *
     * @return number of shapes evicted
     */
    public int evictIdle(long now, long maxIdleMillis, int keepWarm) {
        int evictable = entries.size() - Math.max(0, keepWarm);
        if (evictable <= 0) {
            return 0;
        }
        // iteration order is least recently used first
        var toEvict = new ArrayList<RequirementFingerprint>();
        for (var e : entries.entrySet()) {
            if (toEvict.size() >= evictable) {
                break;
            }
            if (now - e.getValue().lastUsed > maxIdleMillis) {
                toEvict.add(e.getKey());
            }
        }
        toEvict.forEach(entries::remove);
        evictions += toEvict.size();
        return toEvict.size();
    }

    public boolean contains(RequirementFingerprint fingerprint) {
        return entries.containsKey(fingerprint);
    }

    public int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public void clear() {
        entries.clear();
    }
}
