package com.onextel.CampaignDialerApplication.model.webhook;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookConfig {

    @NotBlank
    private String accountId;

    @NotBlank
    private String url;

    @NotBlank
    private String secret;

    @Builder.Default
    private Set<WebhookEventType> subscribedEvents = EnumSet.noneOf(WebhookEventType.class);

    // Sent verbatim with every delivery, e.g. an Authorization header
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Builder.Default
    private boolean active = true;

}
