package com.onextel.CampaignDialerApplication.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.exception.WebhookSerializationException;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Performs a single signed HTTP delivery. Retrying is left to {@link WebhookRetryEngine}.
 */
@Service
@Slf4j
public class WebhookDeliveryService {
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String DELIVERY_HEADER = "X-Webhook-Delivery";
    static final String USER_AGENT = "CampaignDialer-Webhook/1.0";
    static final int MAX_RESPONSE_BODY_CHARS = 10_000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookDeliveryService(@Qualifier("webhookRestTemplate") RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public WebhookDeliveryResult deliver(WebhookConfig config, WebhookEvent event, String deliveryId) {
        String payload = serialize(event);
        Instant start = clock.instant();

        HttpHeaders headers = new HttpHeaders();
        if (config.getHeaders() != null) {
            config.getHeaders().forEach(headers::set);
        }
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(SIGNATURE_HEADER, sign(payload, config.getSecret()));
        headers.set(EVENT_HEADER, event.getType().getEventName());
        headers.set(DELIVERY_HEADER, deliveryId);
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    config.getUrl(), HttpMethod.POST, new HttpEntity<>(payload, headers), String.class);
            return WebhookDeliveryResult.success(
                    response.getStatusCode().value(),
                    truncate(response.getBody()),
                    Duration.between(start, clock.instant()));
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            return WebhookDeliveryResult.failure(status,
                    "HTTP " + status + ": " + truncate(e.getResponseBodyAsString()),
                    Duration.between(start, clock.instant()));
        } catch (RestClientException e) {
            log.debug("Webhook delivery {} to {} failed: {}", deliveryId, config.getUrl(), e.getMessage());
            return WebhookDeliveryResult.failure(null, e.getMessage(), Duration.between(start, clock.instant()));
        }
    }

    /**
     * {@code sha256=} followed by the lowercase hex HMAC-SHA256 of the body.
     */
    public static String sign(String payload, String secret) {
        return "sha256=" + Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
                .hashString(payload, StandardCharsets.UTF_8);
    }

    public static boolean verifySignature(String payload, String signature, String secret) {
        if (signature == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sign(payload, secret).getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }

    static String truncate(String body) {
        if (body == null || body.length() <= MAX_RESPONSE_BODY_CHARS) {
            return body;
        }
        return body.substring(0, MAX_RESPONSE_BODY_CHARS);
    }

    private String serialize(WebhookEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new WebhookSerializationException("Failed to serialize webhook event " + event.getType(), e);
        }
    }
}
