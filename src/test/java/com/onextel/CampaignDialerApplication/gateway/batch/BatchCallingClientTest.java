package com.onextel.CampaignDialerApplication.gateway.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.exception.RemoteGatewayException;
import com.onextel.CampaignDialerApplication.model.Contact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BatchCallingClientTest {
    private static final String BASE = "https://voice.test/v1";

    private MockRestServiceServer server;
    private BatchCallingClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new BatchCallingClient(restTemplate, new ObjectMapper(), BASE, "secret-key");
    }

    private static SubmitBatchRequest request(String phoneNumberId) {
        return SubmitBatchRequest.builder()
                .callName("Spring promo")
                .agentId("agent-ext-1")
                .agentPhoneNumberId(phoneNumberId)
                .recipients(List.of(
                        BatchRecipient.builder().phoneNumber("+15550001").name("Ada").build(),
                        BatchRecipient.builder().phoneNumber("+15550002").build()))
                .build();
    }

    @Test
    void submitSendsSnakeCasePayloadAndNormalizesResponse() {
        server.expect(requestTo(BASE + "/convai/batch-calling/submit"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(BatchCallingClient.API_KEY_HEADER, "secret-key"))
                .andExpect(jsonPath("$.call_name").value("Spring promo"))
                .andExpect(jsonPath("$.agent_phone_number_id").value("pn-ext-1"))
                .andExpect(jsonPath("$.recipients[0].phone_number").value("+15550001"))
                .andExpect(jsonPath("$.recipients[1].name").doesNotExist())
                .andRespond(withSuccess("{\"id\":\"batch-1\",\"status\":\"pending\"}", MediaType.APPLICATION_JSON));

        BatchJob job = client.submit(request("pn-ext-1"));

        server.verify();
        assertEquals("batch-1", job.getId());
        assertEquals(BatchJobStatus.PENDING, job.getStatus());
        assertEquals("Spring promo", job.getName());
        assertEquals(2, job.getTotalCallsScheduled());
        assertEquals("pn-ext-1", job.getPhoneNumberId());
    }

    @Test
    void submitRequiresPhoneNumberBeforeCallingRemote() {
        RemoteGatewayException ex = assertThrows(RemoteGatewayException.class, () -> client.submit(request(" ")));

        assertNull(ex.getStatusCode());
        server.verify();
    }

    @Test
    void submitWithoutReturnedIdIsAnError() {
        server.expect(requestTo(BASE + "/convai/batch-calling/submit"))
                .andRespond(withSuccess("{\"status\":\"pending\"}", MediaType.APPLICATION_JSON));

        assertThrows(RemoteGatewayException.class, () -> client.submit(request("pn-ext-1")));
    }

    @Test
    void getParsesRecipientsWithLenientStatuses() {
        String body = "{\"batch_call_id\":\"batch-1\",\"status\":\"in_progress\",\"total_calls_scheduled\":4,"
                + "\"recipients\":["
                + "{\"recipient_id\":\"r1\",\"phone_number\":\"+1\",\"status\":\"completed\",\"call_duration_secs\":31},"
                + "{\"recipient_id\":\"r2\",\"phone_number\":\"+2\",\"status\":\"no_response\"},"
                + "{\"recipient_id\":\"r3\",\"phone_number\":\"+3\",\"status\":\"voicemail\"},"
                + "{\"recipient_id\":\"r4\",\"phone_number\":\"+4\",\"status\":\"failed\",\"error_message\":\"busy\"}]}";
        server.expect(requestTo(BASE + "/convai/batch-calling/batch-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        BatchJob job = client.get("batch-1");
        BatchJobStats stats = BatchCallingClient.stats(job);

        assertEquals(BatchJobStatus.IN_PROGRESS, job.getStatus());
        assertEquals(4, job.getRecipients().size());
        assertEquals(31, job.getRecipients().get(0).getCallDurationSecs());
        assertEquals(RecipientStatus.PENDING, job.getRecipients().get(2).getStatus());
        assertEquals(4, stats.getTotal());
        assertEquals(1, stats.getCompleted());
        assertEquals(2, stats.getFailedTotal());
        assertEquals(1, stats.getPending());
    }

    @Test
    void listPassesCursorAndReadsNextPage() {
        String body = "{\"batch_calls\":[{\"batch_call_id\":\"b1\",\"status\":\"completed\"},{\"status\":\"pending\"}],"
                + "\"last_doc\":\"cursor-2\",\"has_more\":true}";
        server.expect(requestTo(BASE + "/convai/batch-calling?limit=10&last_doc=cursor-1"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        BatchJobPage page = client.list(10, "cursor-1");

        assertEquals(1, page.getJobs().size());
        assertEquals(BatchJobStatus.COMPLETED, page.getJobs().get(0).getStatus());
        assertEquals("cursor-2", page.getNextCursor());
        assertTrue(page.isHasMore());
    }

    @Test
    void remoteErrorDetailIsSurfaced() {
        server.expect(requestTo(BASE + "/convai/batch-calling/missing/cancel"))
                .andRespond(withResourceNotFound()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":{\"message\":\"Batch not found\"}}"));

        RemoteGatewayException ex = assertThrows(RemoteGatewayException.class, () -> client.cancel("missing"));

        assertEquals(404, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("Batch not found"));
        assertEquals("/convai/batch-calling/missing/cancel", ex.getOperation());
    }

    @Test
    void cancelDefaultsToCancelledStatus() {
        server.expect(requestTo(BASE + "/convai/batch-calling/batch-1/cancel"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.OK));

        BatchJob job = client.cancel("batch-1");

        assertEquals("batch-1", job.getId());
        assertEquals(BatchJobStatus.CANCELLED, job.getStatus());
    }

    @Test
    void serverErrorWithPlainBodyKeepsBody() {
        server.expect(requestTo(BASE + "/convai/batch-calling/batch-1/retry"))
                .andRespond(withServerError().body("upstream exploded"));

        RemoteGatewayException ex = assertThrows(RemoteGatewayException.class, () -> client.retry("batch-1"));

        assertEquals(500, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("upstream exploded"));
    }

    @Test
    void contactsBecomeStringOnlyRecipients() {
        Map<String, Object> custom = new LinkedHashMap<>();
        custom.put("plan", "gold");
        custom.put("visits", 3);
        custom.put("notes", null);
        Contact contact = Contact.builder()
                .phoneNumber("+15550001")
                .firstName("Ada")
                .lastName(null)
                .email(" ")
                .customFields(custom)
                .build();

        BatchRecipient recipient = BatchCallingClient.toRecipients(List.of(contact)).get(0);

        assertEquals("Ada", recipient.getName());
        assertNull(recipient.getEmail());
        assertEquals(Map.of("plan", "gold", "visits", "3"), recipient.getDynamicData());
        assertFalse(recipient.getDynamicData().containsKey("notes"));
    }
}
