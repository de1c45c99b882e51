package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.resource.pool.DatabasePoolManager;
import com.onextel.CampaignDialerApplication.resource.pool.PoolHealth;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitStats;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimiter;
import com.onextel.CampaignDialerApplication.resource.session.ConcurrentSessionRegistry;
import com.onextel.CampaignDialerApplication.resource.session.SessionLimits;
import com.onextel.CampaignDialerApplication.resource.session.SessionRegistryStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {
    private final DatabasePoolManager databasePoolManager;
    private final ConcurrentSessionRegistry sessionRegistry;
    private final RateLimiter rateLimiter;

    @GetMapping("/health/db")
    public ResponseEntity<PoolHealth> databaseHealth() {
        PoolHealth health = databasePoolManager.healthCheck();
        return ResponseEntity.status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }

    @GetMapping("/sessions")
    public SessionRegistryStats sessions() {
        return sessionRegistry.getStats();
    }

    @PostMapping("/sessions/refresh-limits")
    public SessionLimits refreshSessionLimits() {
        return sessionRegistry.refreshLimits();
    }

    @GetMapping("/rate-limits")
    public RateLimitStats rateLimits() {
        return rateLimiter.stats();
    }
}
