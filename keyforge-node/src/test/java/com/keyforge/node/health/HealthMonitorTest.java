package com.keyforge.node.health;

import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.support.MutableClock;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for HealthMonitor aggregation and failover.
 */
class HealthMonitorTest {

    private EventBus eventBus;
    private List<NodeEvent> events;
    private StubComponent pool;
    private StubComponent cache;
    private StubComponent batch;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribe(NodeEventType.ALL, events::add);
        pool = new StubComponent("worker-pool");
        cache = new StubComponent("multi-tier-cache");
        batch = new StubComponent("batch-service");
    }

    private HealthMonitor monitor(boolean failoverEnabled) {
        return new HealthMonitor(List.of(pool, cache, batch), eventBus, new MutableClock(), failoverEnabled);
    }

    private List<NodeEventType> eventTypes() {
        return events.stream().map(NodeEvent::eventType).toList();
    }

    // ==================== Aggregation Tests ====================

    @Test
    void check_allHealthy() {
        HealthReport report = monitor(true).check();

        assertThat(report.state()).isEqualTo(HealthState.HEALTHY);
        assertThat(report.components()).hasSize(3).allMatch(ComponentHealth::healthy);
        assertThat(eventTypes()).containsExactly(NodeEventType.HEALTH_UPDATED);
    }

    @Test
    void check_oneOfThreeUnhealthyIsDegraded() {
        HealthMonitor monitor = monitor(false);
        cache.healthy = false;

        HealthReport report = monitor.check();

        assertThat(report.state()).isEqualTo(HealthState.DEGRADED);
        assertThat(report.unhealthyCount()).isEqualTo(1);
        assertThat(report.components()).filteredOn(c -> !c.healthy())
                .extracting(ComponentHealth::component).containsExactly("multi-tier-cache");
        assertThat(monitor.lastReport()).isSameAs(report);
    }

    @Test
    void check_twoOfThreeUnhealthyIsCritical() {
        pool.healthy = false;
        batch.healthy = false;

        HealthReport report = monitor(false).check();

        assertThat(report.state()).isEqualTo(HealthState.CRITICAL);
    }

    @Test
    void check_unexpectedPingFailureCountsAsUnhealthy() {
        pool.unexpected = true;

        HealthReport report = monitor(false).check();

        assertThat(report.state()).isEqualTo(HealthState.DEGRADED);
        assertThat(report.components().get(0).detail()).contains("IllegalStateException");
    }

    // ==================== Failover Tests ====================

    @Test
    void check_failoverRecoversUnhealthyComponent() {
        HealthMonitor monitor = monitor(true);
        cache.healthy = false;
        cache.recoverable = true;

        monitor.check();

        assertThat(cache.recoverCalls).isEqualTo(1);
        assertThat(eventTypes()).containsSubsequence(
                NodeEventType.COMPONENT_ERROR, NodeEventType.FAILOVER_TRIGGERED, NodeEventType.HEALTH_UPDATED);

        HealthReport next = monitor.check();

        assertThat(next.state()).isEqualTo(HealthState.HEALTHY);
        assertThat(eventTypes()).contains(NodeEventType.COMPONENT_RECOVERED);
    }

    @Test
    void check_withoutFailoverOnlyReportsError() {
        cache.healthy = false;

        monitor(false).check();

        assertThat(cache.recoverCalls).isZero();
        assertThat(eventTypes()).contains(NodeEventType.COMPONENT_ERROR)
                .doesNotContain(NodeEventType.FAILOVER_TRIGGERED);
    }

    @Test
    void failover_failingRecoveryDoesNotPropagate() {
        cache.recoverFails = true;

        assertThatCode(() -> monitor(true).failover(cache, "batch failed"))
                .doesNotThrowAnyException();
        assertThat(cache.recoverCalls).isEqualTo(1);
    }

    // ==================== HealthState ====================

    @Test
    void aggregate_thresholds() {
        assertThat(HealthState.aggregate(0, 0)).isEqualTo(HealthState.HEALTHY);
        assertThat(HealthState.aggregate(4, 4)).isEqualTo(HealthState.HEALTHY);
        assertThat(HealthState.aggregate(3, 4)).isEqualTo(HealthState.DEGRADED);
        assertThat(HealthState.aggregate(2, 4)).isEqualTo(HealthState.CRITICAL);
        assertThat(HealthState.aggregate(0, 1)).isEqualTo(HealthState.CRITICAL);
        assertThatThrownBy(() -> HealthState.aggregate(5, 4)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Property: More healthy components never make the aggregate worse.
     */
    @Property(tries = 50)
    void aggregateIsMonotonic(@ForAll @IntRange(min = 1, max = 40) int total,
                              @ForAll @IntRange(min = 0, max = 39) int healthy) {
        int h = Math.min(healthy, total - 1);

        assertThat(HealthState.aggregate(h + 1, total).ordinal())
                .isLessThanOrEqualTo(HealthState.aggregate(h, total).ordinal());
    }

    private static final class StubComponent implements ManagedComponent {
        private final String name;
        volatile boolean healthy = true;
        volatile boolean unexpected;
        volatile boolean recoverable;
        volatile boolean recoverFails;
        int recoverCalls;

        StubComponent(String name) {
            this.name = name;
        }

        @Override
        public String componentName() {
            return name;
        }

        @Override
        public void ping() {
            if (unexpected) {
                throw new IllegalStateException("ping handler crashed");
            }
            if (!healthy) {
                throw new ComponentUnavailableException(name, "not serving");
            }
        }

        @Override
        public void recover() {
            recoverCalls++;
            if (recoverFails) {
                throw new IllegalStateException("cannot recover");
            }
            if (recoverable) {
                healthy = true;
            }
        }
    }
}
