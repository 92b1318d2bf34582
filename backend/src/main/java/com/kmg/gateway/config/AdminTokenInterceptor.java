package com.kmg.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Guards {@code /api/admin/**} with the shared {@code X-Admin-Token}. With no token configured
 * the admin API is closed.
 */
@Component
public class AdminTokenInterceptor implements HandlerInterceptor {
    public static final String HEADER = "X-Admin-Token";
    private static final Logger log = LoggerFactory.getLogger(AdminTokenInterceptor.class);

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public AdminTokenInterceptor(GatewayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String expected = properties.getAdmin().getToken();
        if (expected == null || expected.isBlank()) {
            reject(response, HttpStatus.SERVICE_UNAVAILABLE, "Admin API is disabled");
            return false;
        }

        String presented = request.getHeader(HEADER);
        if (presented == null || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected admin request {} {} from {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            reject(response, HttpStatus.UNAUTHORIZED, "Invalid admin token");
            return false;
        }
        return true;
    }

    private void reject(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.name());
        body.put("message", message);
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }
}
