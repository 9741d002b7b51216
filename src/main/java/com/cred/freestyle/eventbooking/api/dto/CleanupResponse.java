package com.cred.freestyle.eventbooking.api.dto;

/**
 * Result of an on-demand expiry sweep.
 *
 * @author Event Booking Team
 */
public class CleanupResponse {

    private int reclaimedReservations;

    public CleanupResponse() {
    }

    public CleanupResponse(int reclaimedReservations) {
        this.reclaimedReservations = reclaimedReservations;
    }

    public int getReclaimedReservations() {
        return reclaimedReservations;
    }

    public void setReclaimedReservations(int reclaimedReservations) {
        this.reclaimedReservations = reclaimedReservations;
    }
}
