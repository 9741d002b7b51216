package com.cred.freestyle.eventbooking.api.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failing API call, from controllers and from the security filter chain.
 *
 * {@code kind} is the booking failure kind (CAPACITY_EXCEEDED, EXPIRED, ...) and is absent for
 * plain input errors. {@code details} holds kind-specific context such as the requested and
 * available ticket counts.
 *
 * @author Event Booking Team
 */
@Getter
@Setter
@NoArgsConstructor
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String kind;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(HttpStatus status, String error, String message, String path) {
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public static ErrorResponse of(HttpStatus status, String message, String path) {
        return new ErrorResponse(status, status.getReasonPhrase(), message, path);
    }

    public ErrorResponse withKind(String kind) {
        this.kind = kind;
        return this;
    }

    /**
     * Adds a detail entry; null values are left out of the body.
     */
    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }
}
