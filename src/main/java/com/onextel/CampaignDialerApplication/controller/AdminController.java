package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.aop.RequireServiceUp;
import com.onextel.CampaignDialerApplication.dto.OrphanReconciliationReport;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitPolicy;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimited;
import com.onextel.CampaignDialerApplication.service.call.OrphanedCallReconciler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@RequireServiceUp
public class AdminController {
    private final OrphanedCallReconciler orphanedCallReconciler;

    @PostMapping("/calls/reconcile-orphans")
    @RateLimited(RateLimitPolicy.STRICT)
    public OrphanReconciliationReport reconcileOrphanedCalls() {
        return orphanedCallReconciler.reconcile();
    }
}
