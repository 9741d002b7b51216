package com.cred.freestyle.eventbooking.api.dto;

import com.cred.freestyle.eventbooking.domain.model.Event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for an event and its capacity state.
 *
 * @author Event Booking Team
 */
public class EventResponse {

    private String eventId;
    private String name;
    private String venueName;
    private String venueAddress;
    private Instant startTime;
    private Instant endTime;
    private Integer totalCapacity;
    private Integer availableCapacity;
    private BigDecimal price;
    private String status;
    private Boolean bookingEnabled;

    public EventResponse() {
    }

    public static EventResponse fromEntity(Event event) {
        EventResponse response = new EventResponse();
        response.setEventId(event.getEventId());
        response.setName(event.getName());
        response.setVenueName(event.getVenueName());
        response.setVenueAddress(event.getVenueAddress());
        response.setStartTime(event.getStartTime());
        response.setEndTime(event.getEndTime());
        response.setTotalCapacity(event.getTotalCapacity());
        response.setAvailableCapacity(event.getAvailableCapacity());
        response.setPrice(event.getPrice());
        response.setStatus(event.getStatus().name());
        response.setBookingEnabled(event.getBookingEnabled());
        return response;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVenueName() {
        return venueName;
    }

    public void setVenueName(String venueName) {
        this.venueName = venueName;
    }

    public String getVenueAddress() {
        return venueAddress;
    }

    public void setVenueAddress(String venueAddress) {
        this.venueAddress = venueAddress;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public Integer getTotalCapacity() {
        return totalCapacity;
    }

    public void setTotalCapacity(Integer totalCapacity) {
        this.totalCapacity = totalCapacity;
    }

    public Integer getAvailableCapacity() {
        return availableCapacity;
    }

    public void setAvailableCapacity(Integer availableCapacity) {
        this.availableCapacity = availableCapacity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Boolean getBookingEnabled() {
        return bookingEnabled;
    }

    public void setBookingEnabled(Boolean bookingEnabled) {
        this.bookingEnabled = bookingEnabled;
    }
}
