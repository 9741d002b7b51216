package com.cred.freestyle.eventbooking.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for holding tickets. The user comes from the authenticated caller.
 *
 * @author Event Booking Team
 */
public class ReservationRequest {

    @NotBlank(message = "Event ID is required")
    private String eventId;

    @NotNull(message = "Ticket count is required")
    @Min(value = 1, message = "Ticket count must be at least 1")
    private Integer ticketCount;

    public ReservationRequest() {
    }

    public ReservationRequest(String eventId, Integer ticketCount) {
        this.eventId = eventId;
        this.ticketCount = ticketCount;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public Integer getTicketCount() {
        return ticketCount;
    }

    public void setTicketCount(Integer ticketCount) {
        this.ticketCount = ticketCount;
    }
}
