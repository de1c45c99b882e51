package com.onextel.CampaignDialerApplication.resource.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Named fixed-window limiter configurations.
 */
@Getter
@RequiredArgsConstructor
public enum RateLimitPolicy {
    API(Duration.ofMinutes(1), 100, "Too many API requests, please try again later"),
    PAYMENT(Duration.ofMinutes(1), 5, "Too many payment requests, please try again later"),
    STRICT(Duration.ofMinutes(1), 10, "Rate limit exceeded for this sensitive operation");

    private final Duration window;
    private final int maxRequests;
    private final String message;

    public String keyPrefix() {
        return name().toLowerCase();
    }
}
