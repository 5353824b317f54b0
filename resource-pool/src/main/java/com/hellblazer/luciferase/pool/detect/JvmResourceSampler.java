package com.hellblazer.luciferase.pool.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Samples the running JVM: heap usage for memory, system load average per core for cpu and the
 * file store holding {@code diskRoot} for disk.
 */
public class JvmResourceSampler implements ResourceSampler {
    private static final Logger log = LoggerFactory.getLogger(JvmResourceSampler.class);

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final Path diskRoot;

    public JvmResourceSampler() {
        this(Path.of("."));
    }

    public JvmResourceSampler(Path diskRoot) {
        this.diskRoot = diskRoot;
    }

    @Override
    public SystemResources sample(long timestamp) {
        var heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        long free = Math.max(0, max - heap.getUsed());

        int cores = osBean.getAvailableProcessors();
        double load = osBean.getSystemLoadAverage();
        // Load average is unavailable on some platforms
        double cpuPercent = load < 0 ? 0.0 : Math.min(100.0, load / cores * 100.0);

        long totalDisk;
        long freeDisk;
        try {
            var store = Files.getFileStore(diskRoot);
            totalDisk = store.getTotalSpace();
            freeDisk = store.getUsableSpace();
        } catch (IOException e) {
            throw new ResourceDetectionException("Unable to read file store for " + diskRoot, e);
        }

        log.trace("Sampled heap {}/{} bytes, load {}, disk {}/{}", heap.getUsed(), max, load, freeDisk, totalDisk);
        return new SystemResources(max, free, cores, cpuPercent, totalDisk, freeDisk, timestamp);
    }
}
