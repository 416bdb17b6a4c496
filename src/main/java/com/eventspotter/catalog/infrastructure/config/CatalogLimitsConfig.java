package com.eventspotter.catalog.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Upper bounds on catalog growth. A value of zero or less disables the bound.
 */
@Component
@ConfigurationProperties(prefix = "eventspotter.limits")
public class CatalogLimitsConfig {

    private int maxEvents = 500;
    private int maxSavedEvents = 500;

    public int getMaxEvents() {
        return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
        this.maxEvents = maxEvents;
    }

    public int getMaxSavedEvents() {
        return maxSavedEvents;
    }

    public void setMaxSavedEvents(int maxSavedEvents) {
        this.maxSavedEvents = maxSavedEvents;
    }

    public boolean isEventLimitReached(long currentCount) {
        return maxEvents > 0 && currentCount >= maxEvents;
    }

    public boolean isSavedEventLimitReached(long currentCount) {
        return maxSavedEvents > 0 && currentCount >= maxSavedEvents;
    }
}
