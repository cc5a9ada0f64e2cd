package com.zenith.backend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenith.backend.dto.ApiError;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes the JSON 401 body. A request that carried a bearer token is told its session ended, since the
 * filter only rejects a present token when it is expired or no longer the user's current session.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String MISSING_TOKEN = "Sign in to Zenith: send 'Authorization: Bearer <token>' from /api/auth/login";
    static final String SESSION_ENDED = "Zenith session expired or signed out; log in again";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException, ServletException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        boolean tokenPresented = header != null && header.startsWith("Bearer ");
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(HttpServletResponse.SC_UNAUTHORIZED)
                .error(tokenPresented ? "SESSION_ENDED" : "UNAUTHORIZED")
                .message(tokenPresented ? SESSION_ENDED : MISSING_TOKEN)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .build();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"zenith\"");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
