package com.onextel.CampaignDialerApplication.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.onextel.CampaignDialerApplication.common.JsonUtil;
import com.onextel.CampaignDialerApplication.exception.RedisOperationException;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import com.onextel.CampaignDialerApplication.service.redis.RedisConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Capped Redis lists of recent delivery outcomes, one list per outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisWebhookDeliveryLog {
    static final String FAILURE_LOG = "webhook:failures";
    static final String SUCCESS_LOG = "webhook:successes";
    private static final int MAX_LOG_ENTRIES = 1000;

    private final RedisConnectionPool connectionPool;
    private final Clock clock;

    public void logSuccess(WebhookEvent event, WebhookConfig config, String deliveryId,
                           int attemptCount, Duration duration) {
        append(SUCCESS_LOG, new DeliveryLogEntry(clock.instant(), deliveryId, config.getUrl(),
                config.getAccountId(), event.getType(), attemptCount, duration.toMillis() + "ms", true));
        log.info("Webhook {} delivered to {} (attempt {}, {}ms)",
                event.getType().getEventName(), config.getUrl(), attemptCount, duration.toMillis());
    }

    public void logFailure(WebhookEvent event, WebhookConfig config, String deliveryId,
                           int attemptCount, String reason) {
        append(FAILURE_LOG, new DeliveryLogEntry(clock.instant(), deliveryId, config.getUrl(),
                config.getAccountId(), event.getType(), attemptCount, reason, false));
        log.warn("Webhook {} to {} failed (attempt {}): {}",
                event.getType().getEventName(), config.getUrl(), attemptCount, reason);
    }

    private void append(String list, DeliveryLogEntry entry) {
        String serialized;
        try {
            serialized = JsonUtil.serialize(entry);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize delivery log entry for {}", entry.url(), e);
            return;
        }
        try {
            connectionPool.executeSync("appendDeliveryLog", commands -> {
                commands.multi();
                commands.rpush(list, serialized);
                commands.ltrim(list, -MAX_LOG_ENTRIES, -1);
                return commands.exec();
            });
        } catch (RedisOperationException e) {
            // the outcome is already in the application log
            log.warn("Delivery log unavailable: {}", e.getMessage());
        }
    }

    private record DeliveryLogEntry(Instant timestamp, String deliveryId, String url, String accountId,
                                    WebhookEventType eventType, int attemptCount, String details,
                                    boolean success) {
    }
}
