package com.keyforge.node.health;

import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pings a fixed set of components and aggregates their health.
 * <p>
 * A failed ping emits {@code COMPONENT_ERROR}; with failover enabled the component's
 * {@link ManagedComponent#recover()} runs right away and {@code FAILOVER_TRIGGERED} is
 * emitted. A component that answers again after a failed ping emits
 * {@code COMPONENT_RECOVERED}.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);
    private static final String SOURCE = "health-monitor";

    private final List<ManagedComponent> components;
    private final EventBus eventBus;
    private final Clock clock;
    private final boolean failoverEnabled;
    private final Map<String, Boolean> lastHealthy = new ConcurrentHashMap<>();
    private volatile HealthReport lastReport;

    public HealthMonitor(List<ManagedComponent> components, EventBus eventBus, Clock clock, boolean failoverEnabled) {
        this.components = List.copyOf(components);
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.failoverEnabled = failoverEnabled;
        this.lastReport = new HealthReport(HealthState.HEALTHY, List.of(), this.clock.instant());
    }

    /**
     * Pings every component once and publishes the aggregate.
     */
    public HealthReport check() {
        Instant now = clock.instant();
        List<ComponentHealth> results = new ArrayList<>(components.size());
        for (ManagedComponent component : components) {
            results.add(ping(component, now));
        }
        HealthReport report = HealthReport.of(results, now);
        HealthState previous = lastReport.state();
        lastReport = report;
        if (report.state() != HealthState.HEALTHY) {
            log.warn("Node health {}: {} of {} components unhealthy", report.state(), report.unhealthyCount(),
                    results.size());
        } else if (previous != HealthState.HEALTHY) {
            log.info("Node health restored");
        }
        eventBus.emit(new NodeEvent(NodeEventType.HEALTH_UPDATED, SOURCE, null, report.state().name(),
                Map.of("state", report.state().name(), "unhealthy", report.unhealthyCount())));
        return report;
    }

    public HealthReport lastReport() {
        return lastReport;
    }

    /**
     * Runs failover for a component that reported an error outside the ping cycle.
     */
    public void failover(ManagedComponent component, String reason) {
        eventBus.emit(new NodeEvent(NodeEventType.COMPONENT_ERROR, SOURCE, component.componentName(), reason));
        if (!failoverEnabled) {
            return;
        }
        log.warn("Failing over {}: {}", component.componentName(), reason);
        eventBus.emit(new NodeEvent(NodeEventType.FAILOVER_TRIGGERED, SOURCE, component.componentName(), reason));
        try {
            component.recover();
        } catch (RuntimeException e) {
            log.error("Recovery of {} failed", component.componentName(), e);
        }
    }

    private ComponentHealth ping(ManagedComponent component, Instant now) {
        String name = component.componentName();
        try {
            component.ping();
            Boolean wasHealthy = lastHealthy.put(name, Boolean.TRUE);
            if (Boolean.FALSE.equals(wasHealthy)) {
                eventBus.emit(new NodeEvent(NodeEventType.COMPONENT_RECOVERED, SOURCE, name));
            }
            return new ComponentHealth(name, true, null, now);
        } catch (ComponentUnavailableException e) {
            lastHealthy.put(name, Boolean.FALSE);
            failover(component, e.getMessage());
            return new ComponentHealth(name, false, e.getMessage(), now);
        } catch (RuntimeException e) {
            lastHealthy.put(name, Boolean.FALSE);
            log.error("Ping of {} failed unexpectedly", name, e);
            failover(component, e.toString());
            return new ComponentHealth(name, false, e.toString(), now);
        }
    }
}
