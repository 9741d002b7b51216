package com.cred.freestyle.eventbooking.domain.model;

import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters, sort and paging for listing a user's bookings.
 *
 * @author Event Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingQuery {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private BookingStatus status;

    /**
     * "upcoming" (event starts now or later) or "past"; null for both.
     */
    private String timeframe;

    /**
     * createdAt, totalPrice, ticketCount or eventDate.
     */
    @Builder.Default
    private String sortBy = "createdAt";

    /**
     * asc or desc.
     */
    @Builder.Default
    private String sortOrder = "desc";

    /**
     * 1-based page number.
     */
    @Builder.Default
    private int page = 1;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;
}
