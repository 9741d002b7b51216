package com.cred.freestyle.eventbooking.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Turns the gateway-resolved caller headers into a Spring Security principal.
 *
 * X-User-Id becomes the principal name; X-User-Role (USER or ADMIN, default USER) becomes a
 * single ROLE_ authority. Requests without X-User-Id stay anonymous and are rejected by the
 * chain on any non-public route.
 *
 * @author Event Booking Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String callerId = trimToNull(request.getHeader(USER_ID_HEADER));
        if (callerId != null) {
            SimpleGrantedAuthority authority = toAuthority(request.getHeader(USER_ROLE_HEADER));
            SecurityContextHolder.getContext().setAuthentication(
                    new UsernamePasswordAuthenticationToken(callerId, null, List.of(authority)));
            logger.debug("Caller {} as {} on {}", callerId, authority.getAuthority(), request.getRequestURI());
        }
        chain.doFilter(request, response);
    }

    static SimpleGrantedAuthority toAuthority(String roleHeader) {
        String role = trimToNull(roleHeader);
        role = role == null ? "USER" : role.toUpperCase(Locale.ROOT);
        return new SimpleGrantedAuthority(role.startsWith("ROLE_") ? role : "ROLE_" + role);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
