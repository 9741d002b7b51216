package com.cred.freestyle.eventbooking.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderAuthenticationFilterTest {

    private final HeaderAuthenticationFilter filter = new HeaderAuthenticationFilter();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Caller id without role header authenticates as USER")
    void defaultsToUserRole() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/bookings");
        request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, " user-7 ");

        // When
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        // Then
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth.getName()).isEqualTo("user-7");
        assertThat(auth.getAuthorities()).extracting("authority").containsExactly("ROLE_USER");
        assertThat(SecurityUtils.requireCurrentUserId()).isEqualTo("user-7");
    }

    @Test
    @DisplayName("Role header is normalised to a ROLE_ authority")
    void normalisesRole() {
        assertThat(HeaderAuthenticationFilter.toAuthority("admin").getAuthority()).isEqualTo("ROLE_ADMIN");
        assertThat(HeaderAuthenticationFilter.toAuthority("ROLE_ADMIN").getAuthority()).isEqualTo("ROLE_ADMIN");
        assertThat(HeaderAuthenticationFilter.toAuthority("  ").getAuthority()).isEqualTo("ROLE_USER");
    }

    @Test
    @DisplayName("Blank caller id leaves the request anonymous")
    void blankIdStaysAnonymous() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/bookings");
        request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, "   ");

        // When
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        // Then
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(SecurityUtils.getCurrentUserId()).isNull();
    }
}
