package com.hellblazer.luciferase.pool.pool;

import com.hellblazer.luciferase.pool.detect.ResourceAlert;
import com.hellblazer.luciferase.pool.detect.ResourceCategory;
import com.hellblazer.luciferase.pool.health.HealthLevel;
import com.hellblazer.luciferase.pool.health.HealthStatus;
import com.hellblazer.luciferase.pool.health.RecoveryConfig;
import com.hellblazer.luciferase.pool.health.StateTransition;
import com.hellblazer.luciferase.pool.test.StubResourceDetector;
import com.hellblazer.luciferase.pool.test.VirtualTaskScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pool health as driven by the detector through the guarded state machine
 */
public class PoolHealthTransitionTest {

    private VirtualTaskScheduler scheduler;
    private StubResourceDetector detector;
    private ResourcePoolManager pool;
    private List<StateTransition> transitions;
    private List<ResourceAlert> alerts;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualTaskScheduler();
        detector = new StubResourceDetector();
        pool = new ResourcePoolManager(PoolConfiguration.minimalConfig(), detector, scheduler);
        transitions = new CopyOnWriteArrayList<>();
        alerts = new CopyOnWriteArrayList<>();
        pool.addListener(new PoolLifecycleListener() {
            @Override
            public void onHealthTransition(StateTransition transition) {
                transitions.add(transition);
            }

            @Override
            public void onAlert(ResourceAlert alert) {
                alerts.add(alert);
            }
        });
    }

    @AfterEach
    void tearDown() {
        pool.dispose();
    }

    private HealthLevel update(double utilizationPercent) {
        detector.setUtilization(utilizationPercent);
        pool.forceUpdate();
        return pool.monitor().health();
    }

    @Test
    void testHealthFollowsDetectorOneStepAtATime() {
        assertEquals(HealthLevel.HEALTHY, update(20));
        assertEquals(HealthLevel.WARNING, update(82));
        assertEquals(HealthLevel.CRITICAL, update(92));
        assertEquals(HealthLevel.WARNING, update(20));
        assertEquals(HealthLevel.HEALTHY, update(20));

        assertEquals(4, transitions.size());
        assertEquals(HealthStatus.HEALTHY, transitions.get(0).from());
        assertEquals(HealthStatus.DEGRADED, transitions.get(0).to());
        assertEquals(HealthStatus.UNHEALTHY, transitions.get(1).to());
        assertEquals(HealthStatus.DEGRADED, transitions.get(2).to());
        assertEquals(HealthStatus.HEALTHY, transitions.get(3).to());
        assertEquals(5, detector.getRefreshCount());
    }

    @Test
    void testSpikeFromHealthyStopsAtWarning() {
        assertEquals(HealthLevel.WARNING, update(95));
        assertEquals(HealthLevel.CRITICAL, update(95));
        for (var transition : transitions) {
            assertEquals(1, transition.from().distance(transition.to()));
        }
    }

    @Test
    void testHealthTimerSamplesWithoutForceUpdate() {
        detector.setUtilization(82);
        assertEquals(HealthLevel.HEALTHY, pool.monitor().health());

        scheduler.advanceMillis(100);
        assertEquals(HealthLevel.WARNING, pool.monitor().health());
        assertEquals(100, pool.monitor().lastUpdated());
        // The timer reads the cached availability
        assertEquals(0, detector.getRefreshCount());
    }

    @Test
    void testDetectorFailureKeepsHealthAndRaisesAlert() {
        assertEquals(HealthLevel.WARNING, update(85));

        detector.failWith("probe unavailable");
        pool.forceUpdate();
        assertEquals(HealthLevel.WARNING, pool.monitor().health());
        assertEquals(1, alerts.size());
        assertEquals(ResourceCategory.DETECTOR, alerts.get(0).category());
        assertTrue(alerts.get(0).message().contains("probe unavailable"));

        // The timer path fails open as well
        scheduler.advanceMillis(100);
        assertEquals(HealthLevel.WARNING, pool.monitor().health());
        assertEquals(2, alerts.size());

        detector.clearFailure();
        assertEquals(HealthLevel.HEALTHY, update(20));
    }

    @Test
    void testDetectorAlertsAreForwarded() {
        var alert = new ResourceAlert(ResourceCategory.MEMORY, HealthLevel.CRITICAL,
                                      "memory usage exceeded critical threshold", 95.0, 90.0, 0L);
        detector.emitAlert(alert);
        assertEquals(List.of(alert), alerts);
    }

    @Test
    void testPoolUtilizationDrivesHealth() {
        // minimalConfig has ten slots; eight leases put the pool at its warning threshold
        for (int i = 0; i < 8; i++) {
            pool.allocate(ResourceRequest.of("req-" + i, ResourceType.GENERIC));
        }
        assertEquals(HealthLevel.WARNING, update(10));
    }

    @Test
    void testSustainedRecoveryWithDefaultRecoveryConfig() {
        pool.dispose();
        var config = PoolConfiguration.builder()
                                      .withMinPoolSize(0)
                                      .withMaxPoolSize(10)
                                      .withRecovery(RecoveryConfig.defaultConfig())
                                      .build();
        pool = new ResourcePoolManager(config, detector, scheduler);

        assertEquals(HealthLevel.WARNING, update(85));
        assertEquals(HealthLevel.CRITICAL, update(95));
        assertEquals(HealthLevel.CRITICAL, update(20));
        assertEquals(HealthLevel.CRITICAL, update(20));
        assertEquals(HealthLevel.WARNING, update(20));
        assertTrue(pool.getHealthStateManager().getRejectedTransitionCount() >= 2);
    }
}
