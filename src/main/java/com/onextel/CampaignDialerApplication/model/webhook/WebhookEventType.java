package com.onextel.CampaignDialerApplication.model.webhook;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum WebhookEventType {
    CAMPAIGN_STARTED("campaign.started"),
    CAMPAIGN_PAUSED("campaign.paused"),
    CAMPAIGN_RESUMED("campaign.resumed"),
    CAMPAIGN_COMPLETED("campaign.completed"),
    CAMPAIGN_FAILED("campaign.failed"),
    CAMPAIGN_CANCELLED("campaign.cancelled"),
    CALL_COMPLETED("call.completed"),
    CALL_FAILED("call.failed"),
    TEST("webhook.test");

    private final String eventName;

    WebhookEventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }

    @JsonCreator
    public static WebhookEventType fromString(String value) {
        return Arrays.stream(values())
                .filter(t -> t.eventName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown webhook event: " + value));
    }
}
