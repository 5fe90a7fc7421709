package com.machine.signals.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machine.signals.exception.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Counts requests in flight for the shutdown drain and turns new ones away
 * once draining has begun.
 */
@Component
@RequiredArgsConstructor
public class InFlightRequestFilter extends OncePerRequestFilter {

    private final ShutdownCoordinator shutdownCoordinator;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (!shutdownCoordinator.tryEnterRequest()) {
            ErrorResponse body = ErrorResponse.builder()
                    .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                    .error("Service Unavailable")
                    .message("Service is shutting down")
                    .path(request.getRequestURI())
                    .build();
            response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), body);
            return;
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            shutdownCoordinator.exitRequest();
        }
    }
}
