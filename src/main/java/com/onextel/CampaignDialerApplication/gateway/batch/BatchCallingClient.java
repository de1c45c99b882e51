package com.onextel.CampaignDialerApplication.gateway.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.exception.RemoteGatewayException;
import com.onextel.CampaignDialerApplication.model.Contact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Typed client for the conversational-voice provider's batch calling API.
 * <p>
 * Every response is normalized into {@link BatchJob}; every transport, HTTP or
 * parse failure surfaces as {@link RemoteGatewayException}.
 */
@Component
@Slf4j
public class BatchCallingClient {
    static final String API_KEY_HEADER = "xi-api-key";
    private static final String BASE_PATH = "/convai/batch-calling";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public BatchCallingClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              @Value("${app.batch-calling.base-url:https://api.elevenlabs.io/v1}") String baseUrl,
                              @Value("${app.batch-calling.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    // ========== Remote Operations ========== //

    public BatchJob submit(SubmitBatchRequest request) {
        String operation = BASE_PATH + "/submit";
        if (request.getAgentPhoneNumberId() == null || request.getAgentPhoneNumberId().isBlank()) {
            throw new RemoteGatewayException(operation, null, "agent_phone_number_id is required for batch calling");
        }
        log.info("Submitting batch job '{}' with {} recipients (agent {})",
                request.getCallName(), request.getRecipients().size(), request.getAgentId());

        JsonNode response = exchange(operation, HttpMethod.POST, url(operation), request);

        String batchId = firstText(response, "id", "batch_call_id");
        if (batchId.isEmpty()) {
            // Accepted but unusable: refuse rather than let the caller persist a job-less campaign
            log.error("Batch calling API returned no job id for '{}': {}", request.getCallName(), response);
            throw new RemoteGatewayException(operation, null,
                    "Batch calling API returned no batch id, the job may not have been created");
        }

        BatchJob job = toJob(response, batchId, BatchJobStatus.PENDING).toBuilder()
                .name(text(response, "name", request.getCallName()))
                .agentId(text(response, "agent_id", request.getAgentId()))
                .totalCallsScheduled(response.path("total_calls_scheduled").asInt(0) > 0
                        ? response.path("total_calls_scheduled").asInt()
                        : request.getRecipients().size())
                .phoneNumberId(text(response, "phone_number_id", request.getAgentPhoneNumberId()))
                .build();
        log.info("Created batch job {} (status: {})", job.getId(), job.getStatus().value());
        return job;
    }

    public BatchJobPage list(int limit, String cursor) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + BASE_PATH)
                .queryParam("limit", limit);
        if (cursor != null && !cursor.isBlank()) {
            uri.queryParam("last_doc", cursor);
        }
        JsonNode response = exchange(BASE_PATH, HttpMethod.GET, uri.encode().build().toUri(), null);

        List<BatchJob> jobs = new ArrayList<>();
        for (JsonNode node : response.path("batch_calls")) {
            String id = text(node, "batch_call_id", "");
            if (id.isEmpty()) {
                log.warn("Skipping batch entry with missing id");
                continue;
            }
            jobs.add(toJob(node, id, BatchJobStatus.PENDING));
        }
        String nextCursor = response.hasNonNull("last_doc") ? response.get("last_doc").asText() : null;
        return new BatchJobPage(jobs, nextCursor, response.path("has_more").asBoolean(false));
    }

    public BatchJob get(String batchId) {
        String operation = BASE_PATH + "/" + batchId;
        JsonNode response = exchange(operation, HttpMethod.GET, url(operation), null);

        List<BatchRecipientResult> recipients = new ArrayList<>();
        for (JsonNode r : response.path("recipients")) {
            recipients.add(BatchRecipientResult.builder()
                    .recipientId(text(r, "recipient_id", ""))
                    .phoneNumber(text(r, "phone_number", ""))
                    .name(nullableText(r, "name"))
                    .email(nullableText(r, "email"))
                    .dynamicData(stringMap(r.path("dynamic_data")))
                    .status(RecipientStatus.fromRemote(nullableText(r, "status")))
                    .conversationId(nullableText(r, "conversation_id"))
                    .callDurationSecs(r.hasNonNull("call_duration_secs") ? r.get("call_duration_secs").asInt() : null)
                    .errorMessage(nullableText(r, "error_message"))
                    .build());
        }
        return toJob(response, text(response, "batch_call_id", batchId), BatchJobStatus.PENDING).toBuilder()
                .recipients(recipients)
                .build();
    }

    public BatchJob cancel(String batchId) {
        String operation = BASE_PATH + "/" + batchId + "/cancel";
        log.info("Cancelling batch job {}", batchId);
        JsonNode response = exchange(operation, HttpMethod.POST, url(operation), null);
        return toJob(response, text(response, "batch_call_id", batchId), BatchJobStatus.CANCELLED);
    }

    public BatchJob retry(String batchId) {
        String operation = BASE_PATH + "/" + batchId + "/retry";
        log.info("Retrying batch job {}", batchId);
        JsonNode response = exchange(operation, HttpMethod.POST, url(operation), null);
        return toJob(response, text(response, "batch_call_id", batchId), BatchJobStatus.PENDING);
    }

    // ========== Static Helpers ========== //

    /**
     * Converts campaign contacts to the recipient payload. Personalization values are
     * stringified and nulls dropped, since the remote API only accepts string values.
     */
    public static List<BatchRecipient> toRecipients(List<Contact> contacts) {
        return contacts.stream()
                .map(contact -> {
                    String name = (Objects.toString(contact.getFirstName(), "") + " "
                            + Objects.toString(contact.getLastName(), "")).trim();
                    Map<String, String> dynamicData = new LinkedHashMap<>();
                    if (contact.getCustomFields() != null) {
                        contact.getCustomFields().forEach((key, value) -> {
                            if (value != null) {
                                dynamicData.put(key, String.valueOf(value));
                            }
                        });
                    }
                    return BatchRecipient.builder()
                            .phoneNumber(contact.getPhoneNumber())
                            .name(name.isEmpty() ? null : name)
                            .email(contact.getEmail() == null || contact.getEmail().isBlank() ? null : contact.getEmail())
                            .dynamicData(dynamicData.isEmpty() ? null : dynamicData)
                            .build();
                })
                .collect(Collectors.toList());
    }

    public static BatchJobStats stats(BatchJob job) {
        return BatchJobStats.of(job.getRecipients());
    }

    // ========== HTTP Plumbing ========== //

    private JsonNode exchange(String operation, HttpMethod method, URI url, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            String payload = body == null ? null : objectMapper.writeValueAsString(body);
            log.debug("Batch calling API request: {} {}", method, operation);
            ResponseEntity<String> response = restTemplate.exchange(
                    url, method, new HttpEntity<>(payload, headers), String.class);
            String responseBody = response.getBody();
            return responseBody == null || responseBody.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(responseBody);
        } catch (HttpStatusCodeException e) {
            String detail = errorDetail(e.getResponseBodyAsString());
            log.error("Batch calling API error on {}: {} - {}", operation, e.getStatusCode().value(), detail);
            throw new RemoteGatewayException(operation, e.getStatusCode().value(),
                    "Batch calling API error: " + e.getStatusCode().value() + " - " + detail, e);
        } catch (RestClientException e) {
            log.error("Batch calling API unreachable on {}: {}", operation, e.getMessage());
            throw new RemoteGatewayException(operation, null, "Batch calling API unreachable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            log.error("Malformed batch calling payload on {}", operation, e);
            throw new RemoteGatewayException(operation, null, "Malformed batch calling payload", e);
        }
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            JsonNode detail = json.path("detail");
            if (detail.hasNonNull("message")) {
                return detail.get("message").asText();
            }
            if (detail.isTextual()) {
                return detail.asText();
            }
            return json.hasNonNull("message") ? json.get("message").asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private BatchJob toJob(JsonNode node, String id, BatchJobStatus defaultStatus) {
        return BatchJob.builder()
                .id(id)
                .name(text(node, "name", ""))
                .agentId(text(node, "agent_id", ""))
                .agentName(text(node, "agent_name", ""))
                .status(BatchJobStatus.fromRemote(nullableText(node, "status"), defaultStatus))
                .totalCallsScheduled(node.path("total_calls_scheduled").asInt(0))
                .totalCallsDispatched(node.path("total_calls_dispatched").asInt(0))
                .createdAtUnix(node.path("created_at_unix").asLong(0))
                .scheduledTimeUnix(node.path("scheduled_time_unix").asLong(0))
                .lastUpdatedAtUnix(node.path("last_updated_at_unix").asLong(0))
                .phoneNumberId(nullableText(node, "phone_number_id"))
                .phoneProvider(nullableText(node, "phone_provider"))
                .build();
    }

    private URI url(String path) {
        return URI.create(baseUrl + path);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field, "");
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isEmpty() ? fallback : value.asText();
    }

    private static String nullableText(JsonNode node, String field) {
        return text(node, field, null);
    }

    private static Map<String, String> stringMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, String> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            map.put(entry.getKey(), entry.getValue().asText());
        }
        return map;
    }
}
