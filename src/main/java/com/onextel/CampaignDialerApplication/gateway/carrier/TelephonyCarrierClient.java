package com.onextel.CampaignDialerApplication.gateway.carrier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.exception.RemoteGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Carrier REST client: number inventory, inbound webhook wiring and call/recording metadata.
 * Requests are form-encoded and authenticated with the account SID and auth token.
 */
@Component
@Slf4j
public class TelephonyCarrierClient {
    public static final String INCOMING_WEBHOOK_PATH = "/api/webhooks/carrier/incoming";
    public static final String STATUS_WEBHOOK_PATH = "/api/webhooks/carrier/status";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;
    private final String accountSid;
    private final String authToken;
    private final String publicDomain;

    public TelephonyCarrierClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  @Value("${app.carrier.base-url:https://api.twilio.com/2010-04-01}") String apiBaseUrl,
                                  @Value("${app.carrier.account-sid:}") String accountSid,
                                  @Value("${app.carrier.auth-token:}") String authToken,
                                  @Value("${app.public-domain:http://localhost:8080}") String publicDomain) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = apiBaseUrl;
        this.accountSid = accountSid;
        this.authToken = authToken;
        this.publicDomain = publicDomain;
    }

    // ========== Number Inventory ========== //

    public List<AvailableNumber> searchAvailableNumbers(String country, String areaCode, String contains, int limit) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(accountUrl("/AvailablePhoneNumbers/"
                        + (country == null || country.isBlank() ? "US" : country.toUpperCase()) + "/Local.json"))
                .queryParam("PageSize", limit)
                .queryParam("VoiceEnabled", true);
        if (areaCode != null && !areaCode.isBlank()) {
            uri.queryParam("AreaCode", areaCode);
        }
        if (contains != null && !contains.isBlank()) {
            uri.queryParam("Contains", contains);
        }
        JsonNode response = exchange("searchAvailableNumbers", HttpMethod.GET, uri.encode().build().toUri(), null);

        List<AvailableNumber> numbers = new ArrayList<>();
        for (JsonNode n : response.path("available_phone_numbers")) {
            numbers.add(AvailableNumber.builder()
                    .phoneNumber(n.path("phone_number").asText())
                    .friendlyName(n.path("friendly_name").asText(""))
                    .locality(n.path("locality").asText(""))
                    .region(n.path("region").asText(""))
                    .isoCountry(n.path("iso_country").asText(""))
                    .voiceCapable(n.path("capabilities").path("voice").asBoolean(false))
                    .smsCapable(n.path("capabilities").path("SMS").asBoolean(false))
                    .build());
        }
        return numbers;
    }

    public OwnedNumber purchaseNumber(String phoneNumber, String friendlyName) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("PhoneNumber", phoneNumber);
        if (friendlyName != null && !friendlyName.isBlank()) {
            form.add("FriendlyName", friendlyName);
        }
        log.info("Purchasing phone number {}", phoneNumber);
        return toOwnedNumber(exchange("purchaseNumber", HttpMethod.POST,
                URI.create(accountUrl("/IncomingPhoneNumbers.json")), form));
    }

    public List<OwnedNumber> listOwnedNumbers() {
        JsonNode response = exchange("listOwnedNumbers", HttpMethod.GET,
                URI.create(accountUrl("/IncomingPhoneNumbers.json")), null);
        List<OwnedNumber> numbers = new ArrayList<>();
        for (JsonNode n : response.path("incoming_phone_numbers")) {
            numbers.add(toOwnedNumber(n));
        }
        return numbers;
    }

    public void releaseNumber(String numberSid) {
        log.info("Releasing phone number {}", numberSid);
        exchange("releaseNumber", HttpMethod.DELETE,
                URI.create(accountUrl("/IncomingPhoneNumbers/" + numberSid + ".json")), null);
    }

    // ========== Inbound Webhooks ========== //

    public OwnedNumber configureInboundWebhook(String numberSid) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("VoiceUrl", publicDomain + INCOMING_WEBHOOK_PATH);
        form.add("VoiceMethod", "POST");
        form.add("StatusCallback", publicDomain + STATUS_WEBHOOK_PATH);
        form.add("StatusCallbackMethod", "POST");
        log.info("Configuring inbound webhook for number {}", numberSid);
        return toOwnedNumber(exchange("configureInboundWebhook", HttpMethod.POST,
                URI.create(accountUrl("/IncomingPhoneNumbers/" + numberSid + ".json")), form));
    }

    public OwnedNumber clearInboundWebhook(String numberSid) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("VoiceUrl", "");
        form.add("StatusCallback", "");
        return toOwnedNumber(exchange("clearInboundWebhook", HttpMethod.POST,
                URI.create(accountUrl("/IncomingPhoneNumbers/" + numberSid + ".json")), form));
    }

    // ========== Call Metadata ========== //

    public CallDetails getCallDetails(String callSid) {
        JsonNode n = exchange("getCallDetails", HttpMethod.GET,
                URI.create(accountUrl("/Calls/" + callSid + ".json")), null);
        return CallDetails.builder()
                .sid(n.path("sid").asText(callSid))
                .from(n.path("from").asText(""))
                .to(n.path("to").asText(""))
                .status(n.path("status").asText(""))
                .direction(n.path("direction").asText(""))
                .durationSeconds(n.path("duration").asInt(0))   // carrier sends a numeric string
                .startTime(n.path("start_time").asText(null))
                .endTime(n.path("end_time").asText(null))
                .build();
    }

    public List<CallRecording> getCallRecordings(String callSid) {
        JsonNode response = exchange("getCallRecordings", HttpMethod.GET,
                URI.create(accountUrl("/Calls/" + callSid + "/Recordings.json")), null);
        List<CallRecording> recordings = new ArrayList<>();
        for (JsonNode r : response.path("recordings")) {
            String uri = r.path("uri").asText("");
            recordings.add(CallRecording.builder()
                    .sid(r.path("sid").asText())
                    .durationSeconds(r.path("duration").asInt(0))
                    .mediaUrl(uri.isEmpty() ? null : mediaHost() + uri.replace(".json", ".mp3"))
                    .build());
        }
        return recordings;
    }

    // ========== HTTP Plumbing ========== //

    private JsonNode exchange(String operation, HttpMethod method, URI url, MultiValueMap<String, String> form) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(accountSid, authToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (form != null) {
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        }

        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, new HttpEntity<>(form, headers), String.class);
            String body = response.getBody();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (HttpStatusCodeException e) {
            log.error("Carrier API error on {}: {} - {}", operation, e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new RemoteGatewayException(operation, e.getStatusCode().value(),
                    "Carrier API error: " + e.getStatusCode().value() + " - " + carrierMessage(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            log.error("Carrier API unreachable on {}: {}", operation, e.getMessage());
            throw new RemoteGatewayException(operation, null, "Carrier API unreachable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new RemoteGatewayException(operation, null, "Malformed carrier payload", e);
        }
    }

    private String carrierMessage(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            return json.path("message").asText(body);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private OwnedNumber toOwnedNumber(JsonNode n) {
        return OwnedNumber.builder()
                .sid(n.path("sid").asText())
                .phoneNumber(n.path("phone_number").asText(""))
                .friendlyName(n.path("friendly_name").asText(""))
                .voiceUrl(n.path("voice_url").asText(""))
                .statusCallback(n.path("status_callback").asText(""))
                .build();
    }

    private String accountUrl(String path) {
        return apiBaseUrl + "/Accounts/" + accountSid + path;
    }

    private String mediaHost() {
        URI base = URI.create(apiBaseUrl);
        return base.getScheme() + "://" + base.getAuthority();
    }
}
