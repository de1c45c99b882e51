package com.onextel.CampaignDialerApplication.dto;

import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import lombok.Getter;
import lombok.Setter;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Getter
@Setter
public class WebhookRegistrationRequest {
    private String url;
    private String secret;
    private Set<WebhookEventType> subscribedEvents = EnumSet.noneOf(WebhookEventType.class);
    private Map<String, String> headers = new LinkedHashMap<>();

    public void validate() {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("URL is required");
        }
        if (!url.startsWith("https://") && !url.startsWith("http://")) {
            throw new IllegalArgumentException("URL must be http(s)");
        }
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret is required");
        }
        if (subscribedEvents == null || subscribedEvents.isEmpty()) {
            throw new IllegalArgumentException("at least one event is required");
        }
    }

    public WebhookConfig toWebhookConfig(String accountId) {
        return WebhookConfig.builder()
                .accountId(accountId)
                .url(url)
                .secret(secret)
                .subscribedEvents(EnumSet.copyOf(subscribedEvents))
                .headers(headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers))
                .build();
    }
}
