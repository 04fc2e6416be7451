package com.di.dataqc.exception;

/**
 * Lookup of a session or result by id found nothing (never stored, deleted, or expired).
 */
public class ResourceNotFoundException extends QcException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
