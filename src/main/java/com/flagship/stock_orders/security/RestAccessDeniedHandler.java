package com.flagship.stock_orders.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stock_orders.exception.ApiError;
import com.flagship.stock_orders.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes a JSON 403 when an authenticated caller lacks the role an endpoint requires.
 */
@Component
@Slf4j
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public RestAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("Access denied: {} {} for user={}", request.getMethod(), request.getRequestURI(),
                MDC.get(CorrelationContext.USER_MDC_KEY));
        ApiError error = ApiError.builder()
                .error("forbidden")
                .message("Access denied")
                .path(request.getRequestURI())
                .correlationId(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY))
                .timestamp(Instant.now())
                .build();
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
