package com.onextel.CampaignDialerApplication.service.webhook;

import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InMemoryWebhookEventQueueTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private WebhookDeliveryService deliveryService;
    private RedisWebhookDeliveryLog deliveryLog;
    private Clock clock;
    private InMemoryWebhookEventQueue queue;

    private final WebhookEvent event = WebhookEvent.builder()
            .accountId("user-1").type(WebhookEventType.CALL_COMPLETED).timestamp(NOW).build();
    private final WebhookConfig config = WebhookConfig.builder()
            .accountId("user-1").url("https://hooks.example.com").secret("s").build();

    @BeforeEach
    void setUp() {
        deliveryService = mock(WebhookDeliveryService.class);
        deliveryLog = mock(RedisWebhookDeliveryLog.class);
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        queue = new InMemoryWebhookEventQueue(deliveryService, deliveryLog, clock, 4);
    }

    @Test
    void onlyDueEntriesAreDelivered() {
        when(deliveryService.deliver(any(), any(), anyString()))
                .thenReturn(WebhookDeliveryResult.success(200, "ok", Duration.ofMillis(5)));
        queue.enqueue(event, config, NOW.minusSeconds(1), 1);
        queue.enqueue(event, config, NOW.plusSeconds(30), 1);

        queue.processDue();

        assertEquals(1, queue.size());
        verify(deliveryLog).logSuccess(eq(event), eq(config), anyString(), eq(2), eq(Duration.ofMillis(5)));
    }

    @Test
    void failedDeliveryIsRescheduledWithBackoff() {
        when(deliveryService.deliver(any(), any(), anyString()))
                .thenReturn(WebhookDeliveryResult.failure(503, "HTTP 503", Duration.ZERO));
        queue.enqueue(event, config, NOW, 1);

        queue.processDue();

        assertEquals(1, queue.size());
        verify(deliveryLog).logFailure(eq(event), eq(config), anyString(), eq(2), eq("HTTP 503"));

        when(clock.instant()).thenReturn(NOW.plus(InMemoryWebhookEventQueue.backoff(2)).minusMillis(1));
        queue.processDue();
        verify(deliveryService).deliver(any(), any(), anyString());
    }

    @Test
    void eventIsDroppedAtMaxAttempts() {
        assertFalse(queue.scheduleRetry(event, config, 4));
        assertTrue(queue.scheduleRetry(event, config, 3));

        assertEquals(1, queue.size());
    }

    @Test
    void lastFailureDropsTheEvent() {
        when(deliveryService.deliver(any(), any(), anyString()))
                .thenReturn(WebhookDeliveryResult.failure(null, "timeout", Duration.ZERO));
        queue.enqueue(event, config, NOW, 3);

        queue.processDue();

        assertEquals(0, queue.size());
        verify(deliveryLog, never()).logSuccess(any(), any(), anyString(), anyInt(), any());
    }

    @Test
    void backoffDoublesAndIsCapped() {
        assertEquals(Duration.ofSeconds(2), InMemoryWebhookEventQueue.backoff(1));
        assertEquals(Duration.ofSeconds(16), InMemoryWebhookEventQueue.backoff(4));
        assertEquals(Duration.ofMinutes(5), InMemoryWebhookEventQueue.backoff(12));
    }
}
