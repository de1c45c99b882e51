package com.onextel.CampaignDialerApplication.common.shutdown;

import com.onextel.CampaignDialerApplication.resource.pool.DatabasePoolManager;
import com.onextel.CampaignDialerApplication.resource.session.ConcurrentSessionRegistry;
import com.onextel.CampaignDialerApplication.service.webhook.WebhookEventQueue;
import com.onextel.CampaignDialerApplication.service.webhook.WebhookManager;
import com.onextel.CampaignDialerApplication.stream.LiveCallSessionRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

@Slf4j
@Component
@RequiredArgsConstructor
public class GracefulShutdownHandler {
    static final CloseStatus SERVER_SHUTDOWN = CloseStatus.GOING_AWAY.withReason("Server shutting down");

    private final ServiceLifecycle serviceLifecycle;
    private final ConcurrentSessionRegistry sessionRegistry;
    private final LiveCallSessionRouter liveCallSessionRouter;
    private final WebhookEventQueue webhookEventQueue;
    private final WebhookManager webhookManager;
    private final DatabasePoolManager databasePoolManager;

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        log.info("ContextClosedEvent received - initiating graceful shutdown");
        shutdownInOrder();
    }

    void shutdownInOrder() {
        if (!serviceLifecycle.beginShutdown()) {
            return;
        }
        log.info("Starting shutdown (initiated by {})", Thread.currentThread().getName());
        runStep("live sessions", () -> sessionRegistry.closeAll(SERVER_SHUTDOWN));
        runStep("stream router", liveCallSessionRouter::shutdown);
        runStep("webhook queue", webhookEventQueue::shutdown);
        runStep("webhook executor", webhookManager::shutdown);
        runStep("database pool", databasePoolManager::shutdown);
        log.info("Graceful shutdown completed.");
    }

    // one failing step must not keep the later resources open
    private static void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("Exception while shutting down {}", name, e);
        }
    }
}
