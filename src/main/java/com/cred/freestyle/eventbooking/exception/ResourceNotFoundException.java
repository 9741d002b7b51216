package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when an event, booking or payment record id does not resolve.
 *
 * @author Event Booking Team
 */
public class ResourceNotFoundException extends BookingException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorKind.NOT_FOUND, String.format("%s not found: %s", resourceType, resourceId));
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
