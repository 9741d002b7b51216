package com.cred.freestyle.eventbooking.api.controller;

import com.cred.freestyle.eventbooking.api.dto.BookingPageResponse;
import com.cred.freestyle.eventbooking.api.dto.BookingResponse;
import com.cred.freestyle.eventbooking.api.dto.CancellationResponse;
import com.cred.freestyle.eventbooking.api.dto.ConfirmBookingRequest;
import com.cred.freestyle.eventbooking.api.dto.ReservationRequest;
import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventbooking.domain.model.BookingQuery;
import com.cred.freestyle.eventbooking.domain.model.CancellationResult;
import com.cred.freestyle.eventbooking.domain.model.PaymentOptions;
import com.cred.freestyle.eventbooking.security.SecurityUtils;
import com.cred.freestyle.eventbooking.service.BookingService;
import com.cred.freestyle.eventbooking.service.PaymentService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * REST controller for the booking lifecycle: hold, confirm, cancel and read.
 * All operations act on behalf of the authenticated caller; ownership is enforced by the services.
 *
 * @author Event Booking Team
 */
@RestController
@RequestMapping("/api/v1/bookings")
public class BookingController {

    private static final Logger logger = LoggerFactory.getLogger(BookingController.class);

    private final BookingService bookingService;
    private final PaymentService paymentService;
    private final Clock clock;

    public BookingController(BookingService bookingService, PaymentService paymentService, Clock clock) {
        this.bookingService = bookingService;
        this.paymentService = paymentService;
        this.clock = clock;
    }

    /**
     * Hold tickets for an event. The hold must be paid before it expires.
     *
     * @param request Event and ticket count
     * @return RESERVED booking with its expiry
     */
    @PostMapping("/reserve")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BookingResponse> createReservation(@Valid @RequestBody ReservationRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();

        Booking reservation = bookingService.createReservation(userId, request.getEventId(), request.getTicketCount());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BookingResponse.fromEntity(reservation, clock.instant()));
    }

    /**
     * Confirm a reservation. The payment intent is verified with the gateway before confirming;
     * the client's word is never taken for it.
     */
    @PostMapping("/confirm")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BookingResponse> confirmReservation(@Valid @RequestBody ConfirmBookingRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();

        Booking confirmed = paymentService.confirmPaymentAndBooking(
                request.getPaymentIntentId(), request.getReservationId(), userId);

        return ResponseEntity.ok(BookingResponse.fromEntity(confirmed, clock.instant()));
    }

    /**
     * Cancel a hold or a confirmed booking. Confirmed bookings are refunded by how far
     * away the event is.
     */
    @PostMapping("/{bookingId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CancellationResponse> cancelBooking(@PathVariable String bookingId) {
        String userId = SecurityUtils.requireCurrentUserId();
        logger.info("Cancel requested for booking {} by user {}", bookingId, userId);

        CancellationResult result = bookingService.cancelBooking(bookingId, userId);

        return ResponseEntity.ok(CancellationResponse.from(result, clock.instant()));
    }

    /**
     * List the caller's bookings.
     *
     * @param status RESERVED, CONFIRMED, CANCELLED or PAYMENT_FAILED (case-insensitive)
     * @param timeframe upcoming or past
     * @param sortBy createdAt, totalPrice, ticketCount or eventDate
     * @param sortOrder asc or desc
     * @param page 1-based page number
     * @param limit Page size, at most 100
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BookingPageResponse> getBookings(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String timeframe,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit
    ) {
        String userId = SecurityUtils.requireCurrentUserId();

        BookingQuery query = BookingQuery.builder()
                .status(parseStatus(status))
                .timeframe(timeframe)
                .sortBy(sortBy)
                .sortOrder(sortOrder)
                .page(page)
                .limit(limit)
                .build();

        Page<Booking> bookings = bookingService.getBookings(userId, query);
        return ResponseEntity.ok(BookingPageResponse.from(bookings, clock.instant()));
    }

    @GetMapping("/{bookingId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable String bookingId) {
        String userId = SecurityUtils.requireCurrentUserId();
        Booking booking = bookingService.getBookingById(bookingId, userId);
        return ResponseEntity.ok(BookingResponse.fromEntity(booking, clock.instant()));
    }

    /**
     * Amount, deadline and accepted payment methods for a held reservation.
     */
    @GetMapping("/{bookingId}/payment-options")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PaymentOptions> getPaymentOptions(@PathVariable String bookingId) {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(bookingService.getPaymentOptions(bookingId, userId));
    }

    private static BookingStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return BookingStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Unsupported booking status: %s", status), e);
        }
    }
}
