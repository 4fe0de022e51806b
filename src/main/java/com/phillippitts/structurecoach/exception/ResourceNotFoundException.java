package com.phillippitts.structurecoach.exception;

/**
 * Thrown when a practice session, interview, or report does not exist.
 */
public class ResourceNotFoundException extends StructureCoachException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
