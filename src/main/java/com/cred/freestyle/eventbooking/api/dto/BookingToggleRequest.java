package com.cred.freestyle.eventbooking.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for opening or closing an event for new reservations.
 *
 * @author Event Booking Team
 */
public class BookingToggleRequest {

    @NotNull(message = "enabled is required")
    private Boolean enabled;

    public BookingToggleRequest() {
    }

    public BookingToggleRequest(Boolean enabled) {
        this.enabled = enabled;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }
}
