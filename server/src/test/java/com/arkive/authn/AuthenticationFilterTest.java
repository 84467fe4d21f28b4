package com.arkive.authn;

import com.arkive.spi.ArkiveAuthenticationProvider;
import com.arkive.spi.authn.ArkiveUser;
import com.arkive.spimpl.authn.SimpleArkiveUser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.context.SecurityContextHolder;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AuthenticationFilterTest {

    private final ArkiveAuthenticationProvider authenticationProvider = mock(ArkiveAuthenticationProvider.class);

    private final HttpServletRequest request = mock(HttpServletRequest.class);

    private final HttpServletResponse response = mock(HttpServletResponse.class);

    private final FilterChain filterChain = mock(FilterChain.class);

    private final AuthenticationFilter authenticationFilter = new AuthenticationFilter(authenticationProvider);

    @BeforeEach
    void setUp() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void doFilterInternal_WhenAuthenticationSuccessful_ShouldSetSecurityContext() throws ServletException, IOException {
        // Arrange
        ArkiveUser user = new SimpleArkiveUser("u-1", "alice");
        when(authenticationProvider.authenticate(request)).thenReturn(user);

        // Act
        authenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        verify(filterChain).doFilter(request, response);
        assertEquals(user, SecurityContextHolder.getContext().getAuthentication().getPrincipal());
        assertTrue(SecurityContextHolder.getContext().getAuthentication().isAuthenticated());
    }

    @Test
    void doFilterInternal_WhenAuthenticationReturnsNull_ShouldContinueChain() throws ServletException, IOException {
        // Arrange
        when(authenticationProvider.authenticate(request)).thenReturn(null);

        // Act
        authenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        verify(filterChain).doFilter(request, response);
        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void doFilterInternal_WhenAuthenticationFails_ShouldRespondUnauthorized() throws ServletException, IOException {
        // Arrange
        AuthenticationException authException = new BadCredentialsException("Invalid X-Arkive-User-Id header");
        when(authenticationProvider.authenticate(request)).thenThrow(authException);

        // Act
        authenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        verify(response).sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid X-Arkive-User-Id header");
        verify(filterChain, never()).doFilter(request, response);
        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }
}
