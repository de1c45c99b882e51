package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.aop.RequireServiceUp;
import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.dto.WebhookRegistrationRequest;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitInterceptor;
import com.onextel.CampaignDialerApplication.service.webhook.WebhookManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Lifecycle webhook subscriptions of the calling account.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks/subscriptions")
@RequiredArgsConstructor
@RequireServiceUp
public class WebhookController {
    private final WebhookManager webhookManager;

    @PostMapping
    public CompletableFuture<ResponseEntity<Void>> registerWebhook(
            @RequestHeader(RateLimitInterceptor.USER_HEADER) String accountId,
            @RequestBody WebhookRegistrationRequest registrationRequest) {
        registrationRequest.validate();
        return webhookManager.registerWebhook(accountId, registrationRequest.toWebhookConfig(accountId))
                .thenApply(ignored -> ResponseEntity.accepted().<Void>build());
    }

    @DeleteMapping
    public CompletableFuture<ResponseEntity<Void>> unregisterWebhook(
            @RequestHeader(RateLimitInterceptor.USER_HEADER) String accountId,
            @RequestParam String url) {
        return webhookManager.unregisterWebhook(accountId, url)
                .thenApply(removed -> removed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping
    public CompletableFuture<ResponseEntity<List<WebhookConfig>>> getSubscriptions(
            @RequestHeader(RateLimitInterceptor.USER_HEADER) String accountId,
            @RequestParam(required = false) WebhookEventType eventType) {
        return webhookManager.getWebhooksForAccount(accountId)
                .thenApply(configs -> {
                    List<WebhookConfig> result = configs.stream()
                            .filter(c -> eventType == null || c.getSubscribedEvents().contains(eventType))
                            .collect(Collectors.toList());
                    return ResponseEntity.ok()
                            .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS))
                            .header("X-Total-Count", String.valueOf(result.size()))
                            .body(result);
                });
    }

    @PostMapping("/test")
    public CompletableFuture<ResponseEntity<WebhookDeliveryResult>> sendTest(
            @RequestHeader(RateLimitInterceptor.USER_HEADER) String accountId,
            @RequestParam String url) {
        return webhookManager.sendTest(accountId, url)
                .thenApply(result -> result
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
