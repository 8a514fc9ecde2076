package com.myancamp.backend.global.security;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myancamp.backend.global.error.ProblemResponse;
import com.myancamp.backend.modules.auth.application.AccessTokenCheck;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String UNAUTHENTICATED = "unauthenticated";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        Object failure = request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE);
        String message = failure instanceof AccessTokenCheck.Outcome outcome
                ? messageFor(outcome)
                : "Authentication required";
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, UNAUTHENTICATED, message, request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private static String messageFor(AccessTokenCheck.Outcome outcome) {
        return switch (outcome) {
            case EXPIRED -> "Access token has expired";
            case REVOKED -> "Access token has been revoked";
            case STORE_UNAVAILABLE -> "Access token could not be verified";
            case INVALID, AUTHENTICATED -> "Access token is invalid";
        };
    }
}
