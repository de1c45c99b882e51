package com.onextel.CampaignDialerApplication.service.webhook;

import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;

import java.time.Instant;

/**
 * Delayed redelivery of events whose immediate retries were exhausted.
 */
public interface WebhookEventQueue {
    void enqueue(WebhookEvent event, WebhookConfig config, Instant executeAt, int attempt);

    /**
     * Schedules attempt number {@code attempt} with exponential backoff. Returns false when the event is dropped.
     */
    boolean scheduleRetry(WebhookEvent event, WebhookConfig config, int attempt);

    int size();

    void shutdown();
}
