package com.bbthechange.eventhub.config;

import com.bbthechange.eventhub.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JwtAuthenticationFilter
 *
 * Test Coverage:
 * - Valid bearer token sets principal and userId attribute
 * - Invalid token leaves request unauthenticated
 * - Missing or non-bearer authorization header
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JwtAuthenticationFilter Tests")
class JwtAuthenticationFilterTest {

    @Mock
    private JwtService jwtService;

    @Mock
    private HttpServletRequest request;

    @Mock
    private HttpServletResponse response;

    @Mock
    private FilterChain filterChain;

    @Mock
    private SecurityContext securityContext;

    @InjectMocks
    private JwtAuthenticationFilter jwtAuthenticationFilter;

    private String validToken;
    private String testUserId;

    @BeforeEach
    void setUp() {
        validToken = "valid.jwt.token";
        testUserId = "550e8400-e29b-41d4-a716-446655440000";

        // Setup SecurityContextHolder mock
        SecurityContextHolder.setContext(securityContext);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Should authenticate request with valid bearer token")
    void doFilterInternal_ValidToken_SetsAuthenticationAndUserId() throws ServletException, IOException {
        // Arrange
        when(request.getHeader("Authorization")).thenReturn("Bearer " + validToken);
        when(jwtService.isTokenValid(validToken)).thenReturn(true);
        when(jwtService.extractUserId(validToken)).thenReturn(testUserId);

        // Act
        jwtAuthenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        ArgumentCaptor<Authentication> authCaptor = ArgumentCaptor.forClass(Authentication.class);
        verify(securityContext).setAuthentication(authCaptor.capture());
        assertInstanceOf(UsernamePasswordAuthenticationToken.class, authCaptor.getValue());
        assertEquals(testUserId, authCaptor.getValue().getPrincipal());
        verify(request).setAttribute("userId", testUserId);
        verify(filterChain).doFilter(request, response);
    }

    @Test
    @DisplayName("Should continue unauthenticated when token is invalid")
    void doFilterInternal_InvalidToken_LeavesRequestUnauthenticated() throws ServletException, IOException {
        // Arrange
        when(request.getHeader("Authorization")).thenReturn("Bearer expired.token");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/events/x/registration");
        when(jwtService.isTokenValid("expired.token")).thenReturn(false);

        // Act
        jwtAuthenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        verify(jwtService, never()).extractUserId(anyString());
        verify(securityContext, never()).setAuthentication(any());
        verify(request, never()).setAttribute(eq("userId"), any());
        verify(filterChain).doFilter(request, response);
    }

    @Test
    @DisplayName("Should skip token handling without bearer header")
    void doFilterInternal_NoBearerHeader_PassesThrough() throws ServletException, IOException {
        // Arrange
        when(request.getHeader("Authorization")).thenReturn("Basic dXNlcjpwYXNz");

        // Act
        jwtAuthenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        verifyNoInteractions(jwtService);
        verify(filterChain).doFilter(request, response);
    }

    @Test
    @DisplayName("Should skip token handling when header is missing")
    void doFilterInternal_MissingHeader_PassesThrough() throws ServletException, IOException {
        // Arrange
        when(request.getHeader("Authorization")).thenReturn(null);

        // Act
        jwtAuthenticationFilter.doFilterInternal(request, response, filterChain);

        // Assert
        verifyNoInteractions(jwtService);
        verify(filterChain).doFilter(request, response);
    }
}
