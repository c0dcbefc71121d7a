package com.al.graphsubscriptions.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the externally triggered renewal endpoint with a shared secret sent as {@code Authorization: Bearer}.
 * When no secret is configured the endpoint is open.
 */
@Component
@Slf4j
public class CronSecretInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final String secret;

    public CronSecretInterceptor(@Value("${app.cron.secret:}") String secret) {
        this.secret = secret;
        if (secret == null || secret.isBlank()) {
            log.warn("app.cron.secret is not set; /api/cron endpoints accept unauthenticated calls");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (secret == null || secret.isBlank()) {
            return true;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            byte[] presented = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
            if (MessageDigest.isEqual(presented, secret.getBytes(StandardCharsets.UTF_8))) {
                return true;
            }
        }

        log.warn("Rejected cron call to {} without a valid secret", request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"error\":\"Unauthorized\",\"message\":\"Missing or invalid cron secret\"}");
        return false;
    }
}
