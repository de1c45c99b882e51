package com.onextel.CampaignDialerApplication.service.webhook;

import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.StoredWebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for subscription management and for publishing lifecycle events.
 * {@link #publish} never blocks or fails the caller.
 */
@Service
@Slf4j
public class WebhookManager {
    private final WebhookRegistry registry;
    private final WebhookRetryEngine retryEngine;
    private final WebhookDeliveryService deliveryService;
    private final ExecutorService webhookExecutor;
    private final Clock clock;

    public WebhookManager(WebhookRegistry registry,
                          WebhookRetryEngine retryEngine,
                          WebhookDeliveryService deliveryService,
                          @Qualifier("webhookExecutor") ExecutorService webhookExecutor,
                          Clock clock) {
        this.registry = registry;
        this.retryEngine = retryEngine;
        this.deliveryService = deliveryService;
        this.webhookExecutor = webhookExecutor;
        this.clock = clock;
    }

    public void shutdown() {
        try {
            webhookExecutor.shutdown();
            if (!webhookExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                webhookExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            webhookExecutor.shutdownNow();
        }
        log.info("WebhookManager shutdown complete");
    }

    // ========== Subscription Management ========== //

    public CompletableFuture<Void> registerWebhook(String accountId, WebhookConfig config) {
        config.setAccountId(accountId);
        return registry.registerWebhook(accountId, config);
    }

    public CompletableFuture<Boolean> unregisterWebhook(String accountId, String url) {
        return registry.unregisterWebhook(accountId, url)
                .whenComplete((removed, ex) -> {
                    if (ex == null && Boolean.TRUE.equals(removed)) {
                        log.info("Unregistered webhook {} for account {}", url, accountId);
                    }
                });
    }

    public CompletableFuture<Optional<StoredWebhookConfig>> getWebhookConfig(String accountId, String url) {
        return registry.getWebhookConfig(accountId, url);
    }

    public CompletableFuture<List<WebhookConfig>> getWebhooksForAccount(String accountId) {
        return registry.getConfigsForAccount(accountId);
    }

    /**
     * Sends a {@code webhook.test} event once, without retries, and reports the outcome.
     */
    public CompletableFuture<Optional<WebhookDeliveryResult>> sendTest(String accountId, String url) {
        return registry.getWebhookConfig(accountId, url)
                .thenApplyAsync(found -> found.map(meta -> deliveryService.deliver(
                        meta.getConfig(),
                        event(accountId, WebhookEventType.TEST, Map.of("message", "Test delivery")),
                        UUID.randomUUID().toString())), webhookExecutor);
    }

    // ========== Event Delivery ========== //

    /**
     * Fans the event out to the account's active subscriptions for this type. Failures are logged only.
     */
    public void publish(String accountId, WebhookEventType type, Map<String, Object> data) {
        if (accountId == null) {
            return;
        }
        WebhookEvent event = event(accountId, type, data);
        try {
            CompletableFuture.runAsync(() -> deliverEvent(event), webhookExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Webhook executor rejected {} for account {}", type.getEventName(), accountId);
        }
    }

    CompletableFuture<Void> deliverEvent(WebhookEvent event) {
        return registry.getConfigsForAccount(event.getAccountId())
                .thenCompose(configs -> {
                    List<CompletableFuture<Void>> deliveries = configs.stream()
                            .filter(config -> shouldDeliver(event, config))
                            .map(config -> deliverWithRetry(event, config))
                            .toList();
                    return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
                })
                .exceptionally(ex -> {
                    log.error("Failed to fan out {} for account {}",
                            event.getType().getEventName(), event.getAccountId(), ex);
                    return null;
                });
    }

    private static boolean shouldDeliver(WebhookEvent event, WebhookConfig config) {
        return config.isActive() && config.getSubscribedEvents().contains(event.getType());
    }

    private CompletableFuture<Void> deliverWithRetry(WebhookEvent event, WebhookConfig config) {
        return retryEngine.executeWithRetry(event, config)
                .thenAccept(result -> {
                    if (result.isSuccess()) {
                        registry.touch(config.getAccountId(), config.getUrl());
                    }
                })
                .exceptionally(ex -> {
                    log.warn("Final delivery failure to {}: {}", config.getUrl(), ex.getMessage());
                    return null;
                });
    }

    private WebhookEvent event(String accountId, WebhookEventType type, Map<String, Object> data) {
        return WebhookEvent.builder()
                .accountId(accountId)
                .type(type)
                .timestamp(clock.instant())
                .payload(data)
                .build();
    }
}
