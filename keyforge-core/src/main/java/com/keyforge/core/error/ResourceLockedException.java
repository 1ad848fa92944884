package com.keyforge.core.error;

/**
 * The resource is locked by an in-flight consensus round or migration.
 */
public class ResourceLockedException extends KeyforgeException {

    private final String resourceId;

    public ResourceLockedException(String resourceId) {
        super("Resource is locked: " + resourceId);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
