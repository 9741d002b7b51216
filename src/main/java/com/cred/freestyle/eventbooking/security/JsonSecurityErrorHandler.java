package com.cred.freestyle.eventbooking.security;

import com.cred.freestyle.eventbooking.api.dto.ErrorResponse;
import com.cred.freestyle.eventbooking.exception.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;

/**
 * Writes filter-chain rejections (missing identity, role mismatch on admin routes) in the same
 * {@link ErrorResponse} shape the controllers use.
 *
 * @author Event Booking Team
 */
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger logger = LoggerFactory.getLogger(JsonSecurityErrorHandler.class);

    private final ObjectMapper objectMapper;

    public JsonSecurityErrorHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        logger.debug("Unauthenticated request to {}", request.getRequestURI());
        write(response, ErrorResponse.of(HttpStatus.UNAUTHORIZED,
                "Missing " + HeaderAuthenticationFilter.USER_ID_HEADER + " header", request.getRequestURI()));
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        logger.warn("Role check failed for {} on {}", SecurityUtils.getCurrentUserId(), request.getRequestURI());
        write(response, ErrorResponse.of(HttpStatus.FORBIDDEN, "Insufficient role for this operation",
                request.getRequestURI()).withKind(ErrorKind.FORBIDDEN.name()));
    }

    private void write(HttpServletResponse response, ErrorResponse body) throws IOException {
        response.setStatus(body.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
