package com.hellblazer.luciferase.pool.pool;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PoolUtilsTest {

    @Test
    void testRoundUpToPowerOf2() {
        assertEquals(0, PoolUtils.roundUpToPowerOf2(0));
        assertEquals(0, PoolUtils.roundUpToPowerOf2(-5));
        assertEquals(1, PoolUtils.roundUpToPowerOf2(1));
        assertEquals(2, PoolUtils.roundUpToPowerOf2(2));
        assertEquals(4, PoolUtils.roundUpToPowerOf2(3));
        assertEquals(1024, PoolUtils.roundUpToPowerOf2(1000));
        assertEquals(1024, PoolUtils.roundUpToPowerOf2(1024));
        assertEquals(Long.MAX_VALUE, PoolUtils.roundUpToPowerOf2(Long.MAX_VALUE));
    }

    @Test
    void testCpuHelpers() {
        assertEquals(32, PoolUtils.cpuBucket(30.5));
        assertEquals(1, PoolUtils.coresFor(50));
        assertEquals(2, PoolUtils.coresFor(150));
        assertEquals(0, PoolUtils.coresFor(0));
    }

    @Test
    void testFormatBytes() {
        assertEquals("512 B", PoolUtils.formatBytes(512));
        assertEquals("1.5 KB", PoolUtils.formatBytes(1536));
        assertEquals("2.0 MB", PoolUtils.formatBytes(2 * 1024 * 1024));
        assertEquals("16.0 GB", PoolUtils.formatBytes(16L * 1024 * 1024 * 1024));
    }
}
