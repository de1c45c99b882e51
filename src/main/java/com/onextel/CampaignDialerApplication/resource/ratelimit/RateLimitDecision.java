package com.onextel.CampaignDialerApplication.resource.ratelimit;

import lombok.Value;

@Value
public class RateLimitDecision {
    String key;
    boolean allowed;
    int limit;
    int remaining;
    long resetSeconds;
}
