package com.onextel.CampaignDialerApplication.model.webhook;

import lombok.Value;

import java.time.Instant;

/**
 * A subscription as held in Redis, with the bookkeeping fields written next to it.
 */
@Value
public class StoredWebhookConfig {
    WebhookConfig config;
    Instant createdAt;
    Instant updatedAt;
    // hash of the serialized config, changes on every re-registration
    String eTag;
}
