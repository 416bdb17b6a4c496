package com.eventspotter.catalog.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Per-client request budget for the API: at most {@code maxRequests} per {@code window}.
 */
@ConfigurationProperties(prefix = "eventspotter.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private int maxRequests = 100;
    private Duration window = Duration.ofMinutes(1);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }
}
