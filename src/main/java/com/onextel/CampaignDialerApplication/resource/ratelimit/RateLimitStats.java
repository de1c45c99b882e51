package com.onextel.CampaignDialerApplication.resource.ratelimit;

import lombok.Value;

import java.util.List;

@Value
public class RateLimitStats {
    long trackedKeys;
    List<KeyUsage> topKeys;

    @Value
    public static class KeyUsage {
        String key;
        int count;
        long windowStartEpochMs;
    }
}
