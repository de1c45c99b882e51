package com.onextel.CampaignDialerApplication.model.webhook;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class QueuedWebhook {
    private WebhookEvent event;
    private WebhookConfig config;
    private Instant executeAt;
    private int attempt;
}
