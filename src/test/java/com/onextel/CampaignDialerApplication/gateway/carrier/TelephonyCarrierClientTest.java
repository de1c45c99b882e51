package com.onextel.CampaignDialerApplication.gateway.carrier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.exception.RemoteGatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TelephonyCarrierClientTest {
    private static final String BASE = "https://carrier.test/2010-04-01";
    private static final String ACCOUNT = BASE + "/Accounts/AC123";

    private MockRestServiceServer server;
    private TelephonyCarrierClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new TelephonyCarrierClient(restTemplate, new ObjectMapper(), BASE, "AC123", "token",
                "https://dialer.example.com");
    }

    @Test
    void searchUsesBasicAuthAndFilters() {
        String auth = "Basic " + Base64.getEncoder().encodeToString("AC123:token".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(ACCOUNT + "/AvailablePhoneNumbers/GB/Local.json?PageSize=5&VoiceEnabled=true&AreaCode=415"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, auth))
                .andRespond(withSuccess("{\"available_phone_numbers\":[{\"phone_number\":\"+441234\","
                        + "\"friendly_name\":\"(123) 4\",\"iso_country\":\"GB\",\"capabilities\":{\"voice\":true,\"SMS\":false}}]}",
                        MediaType.APPLICATION_JSON));

        List<AvailableNumber> numbers = client.searchAvailableNumbers("gb", "415", null, 5);

        server.verify();
        assertEquals(1, numbers.size());
        assertEquals("+441234", numbers.get(0).getPhoneNumber());
        assertTrue(numbers.get(0).isVoiceCapable());
    }

    @Test
    void configureInboundWebhookPointsAtPublicDomain() {
        server.expect(requestTo(ACCOUNT + "/IncomingPhoneNumbers/PN1.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "VoiceUrl", "https://dialer.example.com" + TelephonyCarrierClient.INCOMING_WEBHOOK_PATH,
                        "StatusCallback", "https://dialer.example.com" + TelephonyCarrierClient.STATUS_WEBHOOK_PATH,
                        "VoiceMethod", "POST")))
                .andRespond(withSuccess("{\"sid\":\"PN1\",\"phone_number\":\"+15550001\","
                        + "\"voice_url\":\"https://dialer.example.com/api/webhooks/carrier/incoming\"}", MediaType.APPLICATION_JSON));

        OwnedNumber number = client.configureInboundWebhook("PN1");

        server.verify();
        assertEquals("PN1", number.getSid());
        assertEquals("https://dialer.example.com/api/webhooks/carrier/incoming", number.getVoiceUrl());
    }

    @Test
    void purchaseSendsFormAndMapsOwnedNumber() {
        server.expect(requestTo(ACCOUNT + "/IncomingPhoneNumbers.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of("PhoneNumber", "+15550001", "FriendlyName", "Sales")))
                .andRespond(withStatus(HttpStatus.CREATED).contentType(MediaType.APPLICATION_JSON)
                        .body("{\"sid\":\"PN9\",\"phone_number\":\"+15550001\",\"friendly_name\":\"Sales\"}"));

        OwnedNumber number = client.purchaseNumber("+15550001", "Sales");

        assertEquals("PN9", number.getSid());
        assertEquals("Sales", number.getFriendlyName());
    }

    @Test
    void callDetailsParseNumericStringDuration() {
        server.expect(requestTo(ACCOUNT + "/Calls/CA1.json"))
                .andRespond(withSuccess("{\"sid\":\"CA1\",\"from\":\"+1\",\"to\":\"+2\",\"status\":\"completed\","
                        + "\"duration\":\"42\",\"start_time\":\"Tue, 01 May 2024 10:00:00 +0000\"}", MediaType.APPLICATION_JSON));

        CallDetails details = client.getCallDetails("CA1");

        assertEquals(42, details.getDurationSeconds());
        assertEquals("completed", details.getStatus());
        assertNull(details.getEndTime());
    }

    @Test
    void recordingsResolveMediaUrlOnCarrierHost() {
        server.expect(requestTo(ACCOUNT + "/Calls/CA1/Recordings.json"))
                .andRespond(withSuccess("{\"recordings\":[{\"sid\":\"RE1\",\"duration\":\"12\","
                        + "\"uri\":\"/2010-04-01/Accounts/AC123/Recordings/RE1.json\"}]}", MediaType.APPLICATION_JSON));

        List<CallRecording> recordings = client.getCallRecordings("CA1");

        assertEquals(1, recordings.size());
        assertEquals("https://carrier.test/2010-04-01/Accounts/AC123/Recordings/RE1.mp3", recordings.get(0).getMediaUrl());
        assertEquals(12, recordings.get(0).getDurationSeconds());
    }

    @Test
    void carrierErrorsBecomeGatewayExceptions() {
        server.expect(requestTo(ACCOUNT + "/IncomingPhoneNumbers/PN1.json"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":20404,\"message\":\"The requested resource was not found\"}"));

        RemoteGatewayException ex = assertThrows(RemoteGatewayException.class, () -> client.releaseNumber("PN1"));

        assertEquals(404, ex.getStatusCode());
        assertEquals("releaseNumber", ex.getOperation());
        assertTrue(ex.getMessage().contains("The requested resource was not found"));
    }
}
