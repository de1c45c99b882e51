package com.onextel.CampaignDialerApplication.service.webhook;

import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.model.webhook.QueuedWebhook;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single-process delayed queue ordered by due time. Pending entries are lost on restart.
 */
@Service
@Slf4j
public class InMemoryWebhookEventQueue implements WebhookEventQueue {
    private static final Duration MAX_BACKOFF = Duration.ofMinutes(5);

    private final PriorityBlockingQueue<QueuedWebhook> queue =
            new PriorityBlockingQueue<>(100, Comparator.comparing(QueuedWebhook::getExecuteAt));
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "webhook-retry-queue");
        t.setDaemon(true);
        return t;
    });
    private final WebhookDeliveryService deliveryService;
    private final RedisWebhookDeliveryLog deliveryLog;
    private final Clock clock;
    private final int maxAttempts;

    public InMemoryWebhookEventQueue(WebhookDeliveryService deliveryService,
                                     RedisWebhookDeliveryLog deliveryLog,
                                     Clock clock,
                                     @Value("${app.webhook.max-queued-attempts:8}") int maxAttempts) {
        this.deliveryService = deliveryService;
        this.deliveryLog = deliveryLog;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @PostConstruct
    public void init() {
        scheduler.scheduleWithFixedDelay(this::processDue, 1, 1, TimeUnit.SECONDS);
    }

    @Override
    public void shutdown() {
        try {
            scheduler.shutdown();
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        if (!queue.isEmpty()) {
            log.warn("Webhook queue stopped with {} pending deliveries", queue.size());
        }
        log.info("Webhook retry queue shutdown complete");
    }

    @Override
    public void enqueue(WebhookEvent event, WebhookConfig config, Instant executeAt, int attempt) {
        queue.put(new QueuedWebhook(event, config, executeAt, attempt));
        log.debug("Queued webhook {} for {} at {}", event.getType().getEventName(), config.getUrl(), executeAt);
    }

    @Override
    public boolean scheduleRetry(WebhookEvent event, WebhookConfig config, int attempt) {
        if (attempt >= maxAttempts) {
            log.error("Dropping webhook {} for {} after {} attempts",
                    event.getType().getEventName(), config.getUrl(), attempt);
            return false;
        }
        enqueue(event, config, clock.instant().plus(backoff(attempt)), attempt);
        return true;
    }

    @Override
    public int size() {
        return queue.size();
    }

    static Duration backoff(int attempt) {
        long seconds = 1L << Math.min(attempt, 20);
        Duration delay = Duration.ofSeconds(seconds);
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    /**
     * Delivers every entry that is due. Runs on the queue's own thread, callable directly in tests.
     */
    void processDue() {
        try {
            QueuedWebhook queued = queue.peek();
            while (queued != null && !queued.getExecuteAt().isAfter(clock.instant())) {
                if (queue.remove(queued)) {
                    deliver(queued);
                }
                queued = queue.peek();
            }
        } catch (RuntimeException e) {
            log.error("Webhook queue processing error", e);
        }
    }

    private void deliver(QueuedWebhook queued) {
        WebhookEvent event = queued.getEvent();
        WebhookConfig config = queued.getConfig();
        int attempt = queued.getAttempt() + 1;
        String deliveryId = UUID.randomUUID().toString();

        WebhookDeliveryResult result = deliveryService.deliver(config, event, deliveryId);
        if (result.isSuccess()) {
            deliveryLog.logSuccess(event, config, deliveryId, attempt, result.getDuration());
        } else {
            deliveryLog.logFailure(event, config, deliveryId, attempt, result.getErrorMessage());
            scheduleRetry(event, config, attempt);
        }
    }
}
