package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventbooking.domain.model.Booking.RefundStatus;
import com.cred.freestyle.eventbooking.domain.model.BookingQuery;
import com.cred.freestyle.eventbooking.domain.model.CancellationResult;
import com.cred.freestyle.eventbooking.domain.model.Event;
import com.cred.freestyle.eventbooking.domain.model.Event.EventStatus;
import com.cred.freestyle.eventbooking.domain.model.PaymentOptions;
import com.cred.freestyle.eventbooking.domain.model.Refund;
import com.cred.freestyle.eventbooking.exception.BookingAccessDeniedException;
import com.cred.freestyle.eventbooking.exception.BookingException;
import com.cred.freestyle.eventbooking.exception.CapacityExceededException;
import com.cred.freestyle.eventbooking.exception.InvalidBookingStateException;
import com.cred.freestyle.eventbooking.exception.QuotaExceededException;
import com.cred.freestyle.eventbooking.exception.ReservationExpiredException;
import com.cred.freestyle.eventbooking.exception.ResourceNotFoundException;
import com.cred.freestyle.eventbooking.infrastructure.lock.DistributedLock;
import com.cred.freestyle.eventbooking.infrastructure.messaging.BookingEventPublisher;
import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.eventbooking.infrastructure.tx.TransactionalExecutor;
import com.cred.freestyle.eventbooking.repository.BookingRepository;
import com.cred.freestyle.eventbooking.repository.EventRepository;
import jakarta.persistence.criteria.Join;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reservation lifecycle engine.
 *
 * State machine:
 * <pre>
 * RESERVED  -> CONFIRMED   (payment verified, capacity unchanged)
 * RESERVED  -> CANCELLED   (user cancel or expiry sweep, capacity credited)
 * CONFIRMED -> CANCELLED   (user cancel with refund evaluation, capacity credited)
 * </pre>
 *
 * Concurrency:
 * - Reservation runs under a distributed lock on (user, event) so the per-user quota check
 *   and the insert cannot interleave with another attempt by the same user
 * - The event row is locked FOR UPDATE and capacity is debited by a conditional UPDATE,
 *   which alone rules out oversell
 * - Confirm and cancel lock the booking row, so a booking is released at most once
 * - Every state change runs in TransactionalExecutor (retry on deadlock)
 *
 * @author Event Booking Team
 */
@Service
public class BookingService {

    private static final Logger logger = LoggerFactory.getLogger(BookingService.class);

    private static final Map<String, String> SORTABLE_FIELDS = Map.of(
            "createdAt", "createdAt",
            "totalPrice", "totalPrice",
            "ticketCount", "ticketCount",
            "eventDate", "event.startTime"
    );

    private final BookingRepository bookingRepository;
    private final EventRepository eventRepository;
    private final CapacityStore capacityStore;
    private final RefundPolicy refundPolicy;
    private final PaymentGateway paymentGateway;
    private final DistributedLock distributedLock;
    private final TransactionalExecutor transactionalExecutor;
    private final BookingEventPublisher eventPublisher;
    private final CloudWatchMetricsService metricsService;
    private final Clock clock;

    @Value("${eventbooking.reservation.hold-minutes:15}")
    private int defaultHoldMinutes = 15;

    @Value("${eventbooking.reservation.max-tickets-per-user:4}")
    private int maxTicketsPerUser = 4;

    @Value("${eventbooking.reservation.cleanup.payment-grace-minutes:10}")
    private long paymentGraceMinutes = 10;

    @Value("${eventbooking.reservation.cleanup.batch-size:500}")
    private int cleanupBatchSize = 500;

    public BookingService(
            BookingRepository bookingRepository,
            EventRepository eventRepository,
            CapacityStore capacityStore,
            RefundPolicy refundPolicy,
            PaymentGateway paymentGateway,
            DistributedLock distributedLock,
            TransactionalExecutor transactionalExecutor,
            BookingEventPublisher eventPublisher,
            CloudWatchMetricsService metricsService,
            Clock clock
    ) {
        this.bookingRepository = bookingRepository;
        this.eventRepository = eventRepository;
        this.capacityStore = capacityStore;
        this.refundPolicy = refundPolicy;
        this.paymentGateway = paymentGateway;
        this.distributedLock = distributedLock;
        this.transactionalExecutor = transactionalExecutor;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Create a reservation with the default hold time.
     */
    public Booking createReservation(String userId, String eventId, int ticketCount) {
        return createReservation(userId, eventId, ticketCount, defaultHoldMinutes);
    }

    /**
     * Create a time-boxed hold on event capacity.
     *
     * Steps (one unit of work, under the (user, event) lock):
     * 1. Lock the event row and check it is ACTIVE, booking-enabled and not started
     * 2. Check confirmed + unexpired reserved + requested tickets against the per-user cap
     * 3. Conditionally debit capacity
     * 4. Insert the RESERVED booking with expiry = now + holdMinutes
     *
     * @param userId User ID
     * @param eventId Event ID
     * @param ticketCount Tickets to hold
     * @param holdMinutes Payment window in minutes
     * @return RESERVED booking
     * @throws ResourceNotFoundException if the event does not exist
     * @throws InvalidBookingStateException if the event is not open for booking
     * @throws QuotaExceededException if the per-user cap would be exceeded
     * @throws CapacityExceededException if not enough capacity remains
     */
    public Booking createReservation(String userId, String eventId, int ticketCount, int holdMinutes) {
        if (ticketCount < 1 || ticketCount > maxTicketsPerUser) {
            throw new IllegalArgumentException(
                    String.format("Ticket count must be between 1 and %d", maxTicketsPerUser));
        }
        if (holdMinutes < 1) {
            throw new IllegalArgumentException("Hold time must be at least 1 minute");
        }

        long startTime = System.currentTimeMillis();
        logger.info("Creating reservation for user: {}, event: {}, tickets: {}", userId, eventId, ticketCount);

        try {
            Booking reservation = distributedLock.withLock(
                    DistributedLock.userEventKey(userId, eventId),
                    () -> transactionalExecutor.execute(status ->
                            reserveWithinTransaction(userId, eventId, ticketCount, holdMinutes))
            );

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Reservation created: bookingId={}, user={}, event={}, tickets={}, expiresAt={}, duration={}ms",
                    reservation.getBookingId(), userId, eventId, ticketCount,
                    reservation.getReservationExpiry(), duration);

            metricsService.recordReservationSuccess(eventId, ticketCount);
            metricsService.recordReservationLatency(duration);
            eventPublisher.publishReserved(reservation);
            return reservation;

        } catch (BookingException e) {
            logger.warn("Reservation rejected for user: {}, event: {}: {}", userId, eventId, e.getMessage());
            metricsService.recordReservationFailure(eventId, e.getKind().name());
            throw e;
        }
    }

    private Booking reserveWithinTransaction(String userId, String eventId, int ticketCount, int holdMinutes) {
        Instant now = clock.instant();

        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        if (event.getStatus() != EventStatus.ACTIVE) {
            throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                    String.format("Cannot book tickets for %s event", event.getStatus().name().toLowerCase()));
        }
        if (!Boolean.TRUE.equals(event.getBookingEnabled())) {
            throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                    "Booking is not enabled for this event");
        }
        if (event.hasStarted(now)) {
            throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                    "Cannot book tickets for an event that has already started");
        }

        int confirmedTickets = (int) bookingRepository.sumTicketsByStatus(userId, eventId, BookingStatus.CONFIRMED);
        int reservedTickets = (int) bookingRepository.sumUnexpiredTickets(userId, eventId, BookingStatus.RESERVED, now);
        if (confirmedTickets + reservedTickets + ticketCount > maxTicketsPerUser) {
            throw new QuotaExceededException(userId, eventId, confirmedTickets, reservedTickets, maxTicketsPerUser);
        }

        if (!capacityStore.tryDebit(eventId, ticketCount)) {
            int available = capacityStore.availableCapacity(eventId);
            throw new CapacityExceededException(eventId, ticketCount, available);
        }

        Booking reservation = Booking.builder()
                .userId(userId)
                .eventId(eventId)
                .ticketCount(ticketCount)
                .totalPrice(event.getPrice().multiply(BigDecimal.valueOf(ticketCount)))
                .status(BookingStatus.RESERVED)
                .reservationExpiry(now.plus(Duration.ofMinutes(holdMinutes)))
                .paymentProcessing(false)
                .createdAt(now)
                .build();

        return bookingRepository.save(reservation);
    }

    /**
     * Confirm a held reservation after payment verification.
     * Capacity is untouched: it was committed when the hold was created.
     *
     * @param reservationId Booking ID
     * @param userId Caller, must own the booking
     * @param paymentIntentId Verified payment reference, may be null
     * @return CONFIRMED booking
     * @throws ResourceNotFoundException if the booking does not exist
     * @throws BookingAccessDeniedException if the caller does not own it
     * @throws InvalidBookingStateException if it is not RESERVED or the event has started
     * @throws ReservationExpiredException if the hold lapsed, whether or not the sweep has run
     */
    public Booking confirmReservation(String reservationId, String userId, String paymentIntentId) {
        Booking confirmed = transactionalExecutor.execute(status -> {
            Instant now = clock.instant();

            Booking booking = bookingRepository.findByIdForUpdate(reservationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

            if (!booking.getUserId().equals(userId)) {
                throw new BookingAccessDeniedException(reservationId,
                        "Access denied: You can only confirm your own reservations");
            }
            if (booking.getStatus() != BookingStatus.RESERVED) {
                throw new InvalidBookingStateException(reservationId, booking.getStatus().name(),
                        String.format("Cannot confirm a %s booking", booking.getStatus().label()));
            }
            if (booking.isHoldExpired(now)) {
                throw new ReservationExpiredException(reservationId, booking.getReservationExpiry(),
                        "Reservation has expired");
            }

            Event event = eventRepository.findById(booking.getEventId())
                    .orElseThrow(() -> new ResourceNotFoundException("Event", booking.getEventId()));
            if (event.hasStarted(now)) {
                throw new InvalidBookingStateException(reservationId, booking.getStatus().name(),
                        "Cannot confirm reservation for an event that has already started");
            }

            booking.confirm(paymentIntentId, now);
            return bookingRepository.save(booking);
        });

        logger.info("Reservation confirmed: bookingId={}, user={}, event={}, paymentIntent={}",
                confirmed.getBookingId(), userId, confirmed.getEventId(), paymentIntentId);
        metricsService.recordReservationConfirmation(confirmed.getEventId());
        eventPublisher.publishConfirmed(confirmed);
        return confirmed;
    }

    /**
     * Cancel a hold or a confirmed booking and release its capacity.
     *
     * Refunds apply only to CONFIRMED bookings with a payment reference, banded by
     * {@link RefundPolicy}. A failed refund is recorded as REFUND_FAILED and never blocks the
     * cancellation. Status change, refund bookkeeping and capacity credit commit together.
     *
     * @param bookingId Booking ID
     * @param userId Caller, must own the booking
     * @return Cancelled booking and refund outcome
     */
    public CancellationResult cancelBooking(String bookingId, String userId) {
        CancellationResult result = transactionalExecutor.execute(status -> {
            Instant now = clock.instant();

            Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));

            if (!booking.getUserId().equals(userId)) {
                throw new BookingAccessDeniedException(bookingId,
                        "Access denied: You can only cancel your own bookings");
            }
            if (booking.getStatus() == BookingStatus.CANCELLED) {
                throw new InvalidBookingStateException(bookingId, booking.getStatus().name(),
                        "Booking is already cancelled");
            }

            Event event = eventRepository.findById(booking.getEventId())
                    .orElseThrow(() -> new ResourceNotFoundException("Event", booking.getEventId()));
            if (event.hasStarted(now)) {
                throw new InvalidBookingStateException(bookingId, booking.getStatus().name(),
                        "Cannot cancel booking for an event that has already started");
            }

            CancellationResult.CancellationResultBuilder outcome = CancellationResult.builder()
                    .refundProcessed(false)
                    .refundStatus(RefundStatus.NOT_APPLICABLE);

            if (booking.getStatus() == BookingStatus.CONFIRMED && booking.getPaymentIntentId() != null) {
                applyRefund(booking, event, now, outcome);
            } else {
                booking.setRefundStatus(RefundStatus.NOT_APPLICABLE);
            }

            booking.cancel(now);
            Booking cancelled = bookingRepository.save(booking);
            capacityStore.credit(booking.getEventId(), booking.getTicketCount());

            return outcome.booking(cancelled).build();
        });

        Booking cancelled = result.getBooking();
        logger.info("Booking cancelled: bookingId={}, user={}, event={}, released={} tickets, refund={}",
                bookingId, userId, cancelled.getEventId(), cancelled.getTicketCount(), result.getRefundStatus());
        metricsService.recordBookingCancellation(cancelled.getEventId(), result.getRefundStatus().name());
        eventPublisher.publishCancelled(cancelled);
        return result;
    }

    private void applyRefund(Booking booking, Event event, Instant now,
                             CancellationResult.CancellationResultBuilder outcome) {
        try {
            RefundPolicy.RefundDecision decision = refundPolicy.evaluate(
                    booking.getTotalPrice(), event.getStartTime(), now);

            if (decision.hasAmount()) {
                Refund refund = paymentGateway.processRefund(
                        booking.getPaymentIntentId(),
                        decision.getAmount(),
                        String.format("Refund for booking #%s", booking.getBookingId()));

                booking.setRefundAmount(decision.getAmount());
                booking.setRefundId(refund.getRefundId());
                booking.setRefundedAt(now);
                outcome.refundProcessed(true)
                        .refundAmount(decision.getAmount())
                        .refundId(refund.getRefundId());
            }

            booking.setRefundStatus(decision.getStatus());
            outcome.refundStatus(decision.getStatus());
            metricsService.recordRefund(decision.getStatus().name(), decision.getAmount());

        } catch (RuntimeException e) {
            logger.error("Refund failed for booking {} (payment {}), cancelling anyway",
                    booking.getBookingId(), booking.getPaymentIntentId(), e);
            booking.setRefundStatus(RefundStatus.REFUND_FAILED);
            outcome.refundProcessed(false)
                    .refundAmount(null)
                    .refundId(null)
                    .refundStatus(RefundStatus.REFUND_FAILED);
            metricsService.recordRefund(RefundStatus.REFUND_FAILED.name(), null);
        }
    }

    /**
     * Reclaim capacity from lapsed holds.
     *
     * Selects RESERVED bookings whose expiry has passed and whose payment is either not in
     * progress or was initiated before the grace cutoff. Work is split into batches of
     * {@code cleanup.batch-size}; each batch is its own unit of work, and a full batch is
     * followed by another until a short one comes back. Reclaimed rows leave RESERVED, so every
     * batch makes progress.
     *
     * @return Number of reservations reclaimed (zero is normal)
     */
    public int cleanupExpiredReservations() {
        int total = 0;
        List<Booking> batch;
        do {
            batch = reclaimExpiredBatch();
            if (!batch.isEmpty()) {
                total += batch.size();
                metricsService.recordReservationsReclaimed(batch.size());
                batch.forEach(eventPublisher::publishExpired);
            }
        } while (batch.size() >= cleanupBatchSize);

        if (total > 0) {
            logger.info("Reclaimed {} expired reservations", total);
        }
        return total;
    }

    /**
     * One batch of the sweep: selected rows are locked, moved to CANCELLED in bulk, and each
     * affected event is credited once with its summed tickets. Events are credited in id order.
     */
    private List<Booking> reclaimExpiredBatch() {
        return transactionalExecutor.execute(status -> {
            Instant now = clock.instant();
            Instant paymentCutoff = now.minus(Duration.ofMinutes(paymentGraceMinutes));

            List<Booking> expired = bookingRepository.findReclaimableReservations(
                    BookingStatus.RESERVED, now, paymentCutoff, PageRequest.of(0, cleanupBatchSize));
            if (expired.isEmpty()) {
                return Collections.<Booking>emptyList();
            }

            Map<String, Integer> ticketsByEvent = expired.stream()
                    .collect(Collectors.groupingBy(Booking::getEventId, TreeMap::new,
                            Collectors.summingInt(Booking::getTicketCount)));

            List<String> bookingIds = expired.stream().map(Booking::getBookingId).collect(Collectors.toList());
            int updated = bookingRepository.cancelReservations(
                    bookingIds, BookingStatus.RESERVED, BookingStatus.CANCELLED, now);
            if (updated != bookingIds.size()) {
                throw new IllegalStateException(String.format(
                        "Expected to cancel %d reservations but cancelled %d", bookingIds.size(), updated));
            }

            ticketsByEvent.forEach(capacityStore::credit);

            logger.debug("Released capacity for {} events: {}", ticketsByEvent.size(), ticketsByEvent);
            return expired;
        });
    }

    /**
     * Payment details for a held reservation.
     *
     * @param reservationId Booking ID
     * @param userId Caller, must own the booking
     * @return Amount, expiry, time left and supported payment methods
     */
    @Transactional(readOnly = true)
    public PaymentOptions getPaymentOptions(String reservationId, String userId) {
        Instant now = clock.instant();

        Booking reservation = bookingRepository.findWithEventByBookingId(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

        if (!reservation.getUserId().equals(userId)) {
            throw new BookingAccessDeniedException(reservationId, "You can only access your own reservations");
        }
        if (reservation.getStatus() != BookingStatus.RESERVED) {
            throw new InvalidBookingStateException(reservationId, reservation.getStatus().name(),
                    "This booking is no longer in reserved status");
        }
        if (reservation.isHoldExpired(now)) {
            throw new ReservationExpiredException(reservationId, reservation.getReservationExpiry(),
                    "This reservation has expired");
        }

        long secondsLeft = Math.max(0, Duration.between(now, reservation.getReservationExpiry()).getSeconds());

        return PaymentOptions.builder()
                .reservationId(reservation.getBookingId())
                .eventName(reservation.getEvent().getName())
                .eventDate(reservation.getEvent().getStartTime())
                .amount(reservation.getTotalPrice())
                .expiresAt(reservation.getReservationExpiry())
                .timeLeftSeconds(secondsLeft)
                .paymentMethods(PaymentOptions.SUPPORTED_METHODS)
                .build();
    }

    /**
     * Get a booking owned by the caller.
     */
    @Transactional(readOnly = true)
    public Booking getBookingById(String bookingId, String userId) {
        Booking booking = bookingRepository.findWithEventByBookingId(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));

        if (!booking.getUserId().equals(userId)) {
            throw new BookingAccessDeniedException(bookingId, "Access denied: You can only view your own bookings");
        }
        return booking;
    }

    /**
     * List the caller's bookings with filters, sorting and pagination.
     *
     * @param userId Caller
     * @param query Filters; page is 1-based, limit is capped at 100
     * @return Page of bookings with their events loaded
     */
    @Transactional(readOnly = true)
    public Page<Booking> getBookings(String userId, BookingQuery query) {
        String sortProperty = SORTABLE_FIELDS.get(query.getSortBy() != null ? query.getSortBy() : "createdAt");
        if (sortProperty == null) {
            throw new IllegalArgumentException(String.format("Unsupported sort field: %s", query.getSortBy()));
        }
        Sort.Direction direction = "asc".equalsIgnoreCase(query.getSortOrder())
                ? Sort.Direction.ASC : Sort.Direction.DESC;

        String timeframe = query.getTimeframe();
        if (timeframe != null && !timeframe.isBlank()
                && !"upcoming".equalsIgnoreCase(timeframe) && !"past".equalsIgnoreCase(timeframe)) {
            throw new IllegalArgumentException(String.format("Unsupported timeframe: %s", timeframe));
        }

        int page = Math.max(query.getPage(), 1);
        int limit = Math.min(Math.max(query.getLimit(), 1), BookingQuery.MAX_LIMIT);

        Specification<Booking> spec = ownedBy(userId)
                .and(hasStatus(query.getStatus()))
                .and(inTimeframe(timeframe, clock.instant()));

        return bookingRepository.findAll(spec, PageRequest.of(page - 1, limit, Sort.by(direction, sortProperty)));
    }

    private static Specification<Booking> ownedBy(String userId) {
        return (root, cq, cb) -> cb.equal(root.get("userId"), userId);
    }

    private static Specification<Booking> hasStatus(BookingStatus status) {
        return (root, cq, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    private static Specification<Booking> inTimeframe(String timeframe, Instant now) {
        return (root, cq, cb) -> {
            if (timeframe == null || timeframe.isBlank()) {
                return null;
            }
            Join<Booking, Event> event = root.join("event");
            return "upcoming".equalsIgnoreCase(timeframe)
                    ? cb.greaterThanOrEqualTo(event.get("startTime"), now)
                    : cb.lessThan(event.get("startTime"), now);
        };
    }
}
