package com.onextel.CampaignDialerApplication.service.campaign;

import com.onextel.CampaignDialerApplication.common.shutdown.ServiceLifecycle;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.CampaignStatus;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically projects remote batch progress onto every running campaign.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignReconciliationScheduler {
    private final CampaignRepository campaignRepository;
    private final CampaignExecutor campaignExecutor;
    private final ServiceLifecycle serviceLifecycle;

    @Scheduled(fixedDelayString = "${app.campaign.reconcile-interval-ms:60000}",
            initialDelayString = "${app.campaign.reconcile-interval-ms:60000}")
    public int reconcileRunning() {
        if (serviceLifecycle.isShuttingDown()) {
            return 0;
        }
        List<Campaign> running = campaignRepository.findWithBatchJobByStatus(CampaignStatus.RUNNING);
        int refreshed = 0;
        for (Campaign campaign : running) {
            if (serviceLifecycle.isShuttingDown()) {
                break;
            }
            try {
                campaignExecutor.refreshStatus(campaign.getId());
                refreshed++;
            } catch (RuntimeException e) {
                log.warn("Could not refresh campaign {} (batch job {}): {}",
                        campaign.getId(), campaign.getBatchJobId(), e.getMessage());
            }
        }
        if (!running.isEmpty()) {
            log.debug("Reconciled {}/{} running campaigns", refreshed, running.size());
        }
        return refreshed;
    }
}
