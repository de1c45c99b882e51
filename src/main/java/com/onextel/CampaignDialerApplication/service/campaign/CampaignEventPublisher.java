package com.onextel.CampaignDialerApplication.service.campaign;

import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import com.onextel.CampaignDialerApplication.service.webhook.WebhookManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds campaign lifecycle payloads and hands them to webhook delivery.
 */
@Component
@RequiredArgsConstructor
public class CampaignEventPublisher {
    private final WebhookManager webhookManager;

    public void publish(Campaign campaign, WebhookEventType type) {
        publish(campaign, type, Map.of());
    }

    public void publish(Campaign campaign, WebhookEventType type, Map<String, Object> extra) {
        webhookManager.publish(campaign.getUserId(), type, payload(campaign, extra));
    }

    static Map<String, Object> payload(Campaign campaign, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("campaignId", campaign.getId());
        data.put("name", campaign.getName());
        data.put("type", campaign.getType());
        data.put("status", campaign.getStatus().dbValue());
        data.put("totalContacts", campaign.getTotalContacts());
        data.put("completedCalls", campaign.getCompletedCalls());
        data.put("successfulCalls", campaign.getSuccessfulCalls());
        data.put("failedCalls", campaign.getFailedCalls());
        data.put("batchJobId", campaign.getBatchJobId());
        data.putAll(extra);
        return data;
    }
}
