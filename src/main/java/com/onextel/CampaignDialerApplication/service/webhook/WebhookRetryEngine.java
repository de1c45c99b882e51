package com.onextel.CampaignDialerApplication.service.webhook;

import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.exception.WebhookDeliveryException;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Immediate delivery with a few quick retries; once those are exhausted the event moves
 * to the delayed {@link WebhookEventQueue}.
 */
@Service
@Slf4j
public class WebhookRetryEngine {
    private final WebhookDeliveryService deliveryService;
    private final WebhookEventQueue eventQueue;
    private final RetryTemplate retryTemplate;
    private final RedisWebhookDeliveryLog deliveryLog;
    private final ExecutorService webhookExecutor;
    private final MeterRegistry meterRegistry;

    public WebhookRetryEngine(WebhookDeliveryService deliveryService,
                              WebhookEventQueue eventQueue,
                              @Qualifier("webhookRetryTemplate") RetryTemplate retryTemplate,
                              RedisWebhookDeliveryLog deliveryLog,
                              @Qualifier("webhookExecutor") ExecutorService webhookExecutor,
                              MeterRegistry meterRegistry) {
        this.deliveryService = deliveryService;
        this.eventQueue = eventQueue;
        this.retryTemplate = retryTemplate;
        this.deliveryLog = deliveryLog;
        this.webhookExecutor = webhookExecutor;
        this.meterRegistry = meterRegistry;
    }

    public CompletableFuture<WebhookDeliveryResult> executeWithRetry(WebhookEvent event, WebhookConfig config) {
        String deliveryId = UUID.randomUUID().toString();
        return CompletableFuture.supplyAsync(() -> deliver(event, config, deliveryId), webhookExecutor);
    }

    WebhookDeliveryResult deliver(WebhookEvent event, WebhookConfig config, String deliveryId) {
        return retryTemplate.execute(context -> {
            WebhookDeliveryResult result = deliveryService.deliver(config, event, deliveryId);
            int attempt = context.getRetryCount() + 1;
            if (!result.isSuccess()) {
                deliveryLog.logFailure(event, config, deliveryId, attempt, result.getErrorMessage());
                throw new WebhookDeliveryException("Delivery failed: " + result.getErrorMessage());
            }
            deliveryLog.logSuccess(event, config, deliveryId, attempt, result.getDuration());
            meterRegistry.counter("webhook.delivery", "outcome", "success").increment();
            return result;
        }, context -> {
            meterRegistry.counter("webhook.delivery", "outcome", "requeued").increment();
            // attempts already made in this round count towards the queue's backoff
            boolean queued = eventQueue.scheduleRetry(event, config, context.getRetryCount());
            return WebhookDeliveryResult.failure(queued ? "Queued for retry" : "Dropped after max retries");
        });
    }
}
