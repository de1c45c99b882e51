package com.onextel.CampaignDialerApplication.model.webhook;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Delivered body is {@code {"event": ..., "timestamp": ..., "data": {...}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {
    @JsonIgnore
    private String accountId;

    @JsonProperty("event")
    private WebhookEventType type;

    private Instant timestamp;

    @JsonProperty("data")
    private Map<String, Object> payload;
}
