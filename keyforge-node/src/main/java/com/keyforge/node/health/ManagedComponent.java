package com.keyforge.node.health;

/**
 * A component the coordinator monitors and can recover.
 */
public interface ManagedComponent {

    /**
     * Stable name used in health reports and events.
     */
    String componentName();

    /**
     * Checks that the component can serve requests.
     *
     * @throws com.keyforge.core.error.ComponentUnavailableException if it cannot
     */
    void ping();

    /**
     * Restores the component to a serving state after a failed ping or an error event.
     * Must be safe to call on a healthy component.
     */
    void recover();
}
