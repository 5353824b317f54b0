package com.hellblazer.luciferase.pool.health;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StateHistoryTest {

    private static HealthState sample(long timestamp) {
        return HealthState.sample(HealthStatus.HEALTHY, HealthMetrics.builder().utilization(0.1).build(), timestamp);
    }

    @Test
    void testRingKeepsMostRecent() {
        var ring = new SampleRing<Integer>(3);
        for (int i = 1; i <= 5; i++) {
            ring.add(i);
        }
        assertEquals(3, ring.size());
        assertEquals(3, ring.capacity());
        assertEquals(List.of(3, 4, 5), ring.toList());
        assertEquals(List.of(4, 5), ring.lastN(2));
        assertEquals(List.of(3, 4, 5), ring.lastN(10));
        assertEquals(5, ring.last().orElseThrow());
        assertTrue(ring.lastN(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ring.lastN(-1));

        ring.clear();
        assertEquals(0, ring.size());
        assertTrue(ring.last().isEmpty());
    }

    @Test
    void testRingRejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SampleRing<String>(0));
    }

    @Test
    void testHistoryRecordsInOrder() {
        var history = new StateHistory(4);
        for (int i = 0; i < 6; i++) {
            history.record(sample(i * 10L));
        }
        assertEquals(4, history.sampleCount());
        assertEquals(50, history.lastSample().orElseThrow().timestamp());

        var recent = history.getRecentSamples(2);
        assertEquals(40, recent.get(0).timestamp());
        assertEquals(50, recent.get(1).timestamp());
    }

    @Test
    void testHistoryRejectsOutOfOrderSamples() {
        var history = new StateHistory(4);
        history.record(sample(100));
        assertThrows(IllegalArgumentException.class, () -> history.record(sample(99)));
        assertThrows(IllegalArgumentException.class, () -> history.checkTimestamp(50));
        history.checkTimestamp(100);
        assertEquals(1, history.sampleCount());
    }

    @Test
    void testTransitionsAreKept() {
        var history = new StateHistory(2);
        assertTrue(history.lastTransition().isEmpty());
        history.recordTransition(new StateTransition(HealthStatus.HEALTHY, HealthStatus.DEGRADED, 1, "a"));
        history.recordTransition(new StateTransition(HealthStatus.DEGRADED, HealthStatus.HEALTHY, 2, "b"));
        history.recordTransition(new StateTransition(HealthStatus.HEALTHY, HealthStatus.DEGRADED, 3, "c"));

        assertEquals(2, history.getTransitions().size());
        assertEquals("c", history.lastTransition().orElseThrow().reason());
    }

    @Test
    void testMinimumCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new StateHistory(1));
    }
}
