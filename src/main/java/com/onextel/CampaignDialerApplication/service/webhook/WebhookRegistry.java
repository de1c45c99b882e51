package com.onextel.CampaignDialerApplication.service.webhook;

import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.StoredWebhookConfig;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface WebhookRegistry {
    CompletableFuture<Void> registerWebhook(String accountId, WebhookConfig config);

    CompletableFuture<Boolean> unregisterWebhook(String accountId, String url);

    CompletableFuture<Optional<StoredWebhookConfig>> getWebhookConfig(String accountId, String url);

    CompletableFuture<List<WebhookConfig>> getConfigsForAccount(String accountId);

    void touch(String accountId, String url);
}
