package com.keyforge.node.health;

import java.time.Instant;
import java.util.List;

/**
 * Node health as of the last check.
 */
public record HealthReport(
        HealthState state,
        List<ComponentHealth> components,
        Instant checkedAt
) {
    public HealthReport {
        components = List.copyOf(components);
    }

    public static HealthReport of(List<ComponentHealth> components, Instant checkedAt) {
        int healthy = (int) components.stream().filter(ComponentHealth::healthy).count();
        return new HealthReport(HealthState.aggregate(healthy, components.size()), components, checkedAt);
    }

    public long unhealthyCount() {
        return components.stream().filter(c -> !c.healthy()).count();
    }
}
