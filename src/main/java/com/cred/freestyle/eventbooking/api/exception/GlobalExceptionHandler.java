package com.cred.freestyle.eventbooking.api.exception;

import com.cred.freestyle.eventbooking.api.dto.ErrorResponse;
import com.cred.freestyle.eventbooking.exception.BookingAccessDeniedException;
import com.cred.freestyle.eventbooking.exception.BookingException;
import com.cred.freestyle.eventbooking.exception.CapacityExceededException;
import com.cred.freestyle.eventbooking.exception.ErrorKind;
import com.cred.freestyle.eventbooking.exception.InvalidBookingStateException;
import com.cred.freestyle.eventbooking.exception.LockUnavailableException;
import com.cred.freestyle.eventbooking.exception.PaymentFailedException;
import com.cred.freestyle.eventbooking.exception.QuotaExceededException;
import com.cred.freestyle.eventbooking.exception.RefundFailedException;
import com.cred.freestyle.eventbooking.exception.ReservationExpiredException;
import com.cred.freestyle.eventbooking.exception.ResourceNotFoundException;
import com.cred.freestyle.eventbooking.exception.TransientConflictException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the event booking API.
 * Converts booking failures to HTTP responses by their {@link ErrorKind}; every other
 * exception becomes a 400 (bad input) or a generic 500.
 *
 * @author Event Booking Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final Map<ErrorKind, HttpStatus> STATUS_BY_KIND = new EnumMap<>(ErrorKind.class);

    static {
        STATUS_BY_KIND.put(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND);
        STATUS_BY_KIND.put(ErrorKind.FORBIDDEN, HttpStatus.FORBIDDEN);
        STATUS_BY_KIND.put(ErrorKind.INVALID_STATE, HttpStatus.CONFLICT);
        STATUS_BY_KIND.put(ErrorKind.EXPIRED, HttpStatus.GONE);
        STATUS_BY_KIND.put(ErrorKind.CAPACITY_EXCEEDED, HttpStatus.CONFLICT);
        STATUS_BY_KIND.put(ErrorKind.QUOTA_EXCEEDED, HttpStatus.UNPROCESSABLE_ENTITY);
        STATUS_BY_KIND.put(ErrorKind.TRANSIENT_CONFLICT, HttpStatus.SERVICE_UNAVAILABLE);
        STATUS_BY_KIND.put(ErrorKind.LOCK_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE);
        STATUS_BY_KIND.put(ErrorKind.REFUND_FAILED, HttpStatus.BAD_GATEWAY);
        STATUS_BY_KIND.put(ErrorKind.PAYMENT_FAILED, HttpStatus.PAYMENT_REQUIRED);
    }

    private final boolean exposeDetails;

    public GlobalExceptionHandler(@Value("${eventbooking.errors.expose-details:false}") boolean exposeDetails) {
        this.exposeDetails = exposeDetails;
    }

    /**
     * Handle every booking failure.
     * Retryable kinds are logged at info, the rest at warn.
     */
    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ErrorResponse> handleBookingException(
            BookingException ex,
            HttpServletRequest request
    ) {
        ErrorKind kind = ex.getKind();
        HttpStatus httpStatus = STATUS_BY_KIND.getOrDefault(kind, HttpStatus.INTERNAL_SERVER_ERROR);

        if (kind.isRetryable()) {
            logger.info("Retryable failure on {}: {} - {}", request.getRequestURI(), kind, ex.getMessage());
        } else {
            logger.warn("Request to {} failed: {} - {}", request.getRequestURI(), kind, ex.getMessage());
        }

        ErrorResponse error = ErrorResponse.of(httpStatus, ex.getMessage(), request.getRequestURI())
                .withKind(kind.name())
                .addDetail("retryable", kind.isRetryable());
        addDetails(ex, error);

        return ResponseEntity.status(httpStatus).body(error);
    }

    private void addDetails(BookingException ex, ErrorResponse error) {
        if (ex instanceof ResourceNotFoundException) {
            ResourceNotFoundException notFound = (ResourceNotFoundException) ex;
            error.addDetail("resourceType", notFound.getResourceType());
            error.addDetail("resourceId", notFound.getResourceId());
        } else if (ex instanceof BookingAccessDeniedException) {
            error.addDetail("bookingId", ((BookingAccessDeniedException) ex).getBookingId());
        } else if (ex instanceof InvalidBookingStateException) {
            InvalidBookingStateException invalid = (InvalidBookingStateException) ex;
            error.addDetail("resourceId", invalid.getResourceId());
            error.addDetail("currentStatus", invalid.getCurrentStatus());
        } else if (ex instanceof ReservationExpiredException) {
            ReservationExpiredException expired = (ReservationExpiredException) ex;
            error.addDetail("resourceId", expired.getResourceId());
            error.addDetail("expiredAt", expired.getExpiredAt());
        } else if (ex instanceof CapacityExceededException) {
            CapacityExceededException capacity = (CapacityExceededException) ex;
            error.addDetail("eventId", capacity.getEventId());
            error.addDetail("requestedTickets", capacity.getRequestedTickets());
            error.addDetail("availableTickets", capacity.getAvailableTickets());
        } else if (ex instanceof QuotaExceededException) {
            QuotaExceededException quota = (QuotaExceededException) ex;
            error.addDetail("eventId", quota.getEventId());
            error.addDetail("confirmedTickets", quota.getConfirmedTickets());
            error.addDetail("reservedTickets", quota.getReservedTickets());
            error.addDetail("maxTickets", quota.getMaxTickets());
        } else if (ex instanceof TransientConflictException) {
            error.addDetail("attempts", ((TransientConflictException) ex).getAttempts());
        } else if (ex instanceof LockUnavailableException) {
            error.addDetail("resourceKey", ((LockUnavailableException) ex).getResourceKey());
        } else if (ex instanceof PaymentFailedException) {
            error.addDetail("paymentIntentId", ((PaymentFailedException) ex).getPaymentIntentId());
        } else if (ex instanceof RefundFailedException) {
            error.addDetail("paymentIntentId", ((RefundFailedException) ex).getPaymentIntentId());
        }
    }

    /**
     * Handle Spring Security denials from @PreAuthorize.
     * Returns 403 FORBIDDEN.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied to {}: {}", request.getRequestURI(), ex.getMessage());

        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of(HttpStatus.FORBIDDEN, ex.getMessage(), request.getRequestURI())
                        .withKind(ErrorKind.FORBIDDEN.name()));
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid arguments (ticket counts, sort fields, schedules).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(),
                        request.getRequestURI()));
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed. Please check the field errors.", request.getRequestURI())
                .addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Malformed JSON, missing or mistyped query parameters.
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());

        return ResponseEntity.badRequest()
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST, "Malformed Request",
                        "Request could not be read. Please check the body and parameters.",
                        request.getRequestURI()));
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.", request.getRequestURI());

        if (exposeDetails) {
            error.addDetail("exceptionType", ex.getClass().getSimpleName());
            error.addDetail("exceptionMessage", ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
