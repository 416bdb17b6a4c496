package com.eventspotter.catalog.infrastructure.web;

import com.eventspotter.catalog.infrastructure.config.RateLimitProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Duration;

/**
 * Fixed-window request budget per client address, one resilience4j limiter per client.
 * The client is the first hop of {@code X-Forwarded-For} when present, the remote address otherwise.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final RateLimiterRegistry registry;

    public RateLimitInterceptor(RateLimitProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(properties.getMaxRequests())
                .limitRefreshPeriod(properties.getWindow())
                .timeoutDuration(Duration.ZERO)
                .build();
        this.registry = RateLimiterRegistry.of(config);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String client = clientKey(request);
        RateLimiter limiter = registry.rateLimiter(client);

        if (!limiter.acquirePermission()) {
            logger.warn("Rate limit exceeded for client {} on {} {}", client, request.getMethod(), request.getRequestURI());
            throw new RateLimitExceededException();
        }
        return true;
    }

    static String clientKey(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
