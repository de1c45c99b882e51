package com.onextel.CampaignDialerApplication.service.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.onextel.CampaignDialerApplication.dto.WebhookDeliveryResult;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEvent;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookDeliveryServiceTest {
    private static final String URL = "https://hooks.example.com/dialer";

    private MockRestServiceServer server;
    private WebhookDeliveryService deliveryService;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        deliveryService = new WebhookDeliveryService(restTemplate, objectMapper,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private static WebhookConfig config() {
        return WebhookConfig.builder()
                .accountId("user-1")
                .url(URL)
                .secret("s3cret")
                .headers(Map.of("Authorization", "Bearer abc"))
                .build();
    }

    private static WebhookEvent event() {
        return WebhookEvent.builder()
                .accountId("user-1")
                .type(WebhookEventType.CAMPAIGN_COMPLETED)
                .timestamp(Instant.parse("2024-05-01T09:59:00Z"))
                .payload(Map.of("campaignId", "c1"))
                .build();
    }

    @Test
    void deliversSignedEnvelopeWithCustomHeaders() {
        server.expect(once(), requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer abc"))
                .andExpect(header(WebhookDeliveryService.EVENT_HEADER, "campaign.completed"))
                .andExpect(header(WebhookDeliveryService.DELIVERY_HEADER, "d-1"))
                .andExpect(jsonPath("$.event").value("campaign.completed"))
                .andExpect(jsonPath("$.data.campaignId").value("c1"))
                .andExpect(jsonPath("$.accountId").doesNotExist())
                .andExpect(request -> {
                    String body = ((MockClientHttpRequest) request).getBodyAsString();
                    String signature = request.getHeaders().getFirst(WebhookDeliveryService.SIGNATURE_HEADER);
                    assertTrue(WebhookDeliveryService.verifySignature(body, signature, "s3cret"));
                })
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        WebhookDeliveryResult result = deliveryService.deliver(config(), event(), "d-1");

        server.verify();
        assertTrue(result.isSuccess());
        assertEquals(200, result.getStatusCode());
        assertEquals("ok", result.getResponseBody());
    }

    @Test
    void httpErrorIsReportedNotThrown() {
        server.expect(requestTo(URL)).andRespond(withServerError().body("nope"));

        WebhookDeliveryResult result = deliveryService.deliver(config(), event(), "d-2");

        assertFalse(result.isSuccess());
        assertEquals(500, result.getStatusCode());
        assertEquals("HTTP 500: nope", result.getErrorMessage());
        assertNull(result.getResponseBody());
    }

    @Test
    void signatureIsHexHmacOfBody() {
        String signature = WebhookDeliveryService.sign("{}", "key");

        assertTrue(signature.startsWith("sha256="));
        assertEquals(64, signature.length() - "sha256=".length());
        assertTrue(WebhookDeliveryService.verifySignature("{}", signature, "key"));
        assertFalse(WebhookDeliveryService.verifySignature("{ }", signature, "key"));
        assertFalse(WebhookDeliveryService.verifySignature("{}", null, "key"));
    }

    @Test
    void longResponseBodiesAreTruncated() {
        String body = "x".repeat(WebhookDeliveryService.MAX_RESPONSE_BODY_CHARS + 50);

        assertEquals(WebhookDeliveryService.MAX_RESPONSE_BODY_CHARS, WebhookDeliveryService.truncate(body).length());
        assertNull(WebhookDeliveryService.truncate(null));
    }
}
