package com.onextel.CampaignDialerApplication.service.call;

import com.onextel.CampaignDialerApplication.model.Agent;
import com.onextel.CampaignDialerApplication.model.AgentType;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.model.CallDirection;
import com.onextel.CampaignDialerApplication.model.CallStatus;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import com.onextel.CampaignDialerApplication.repository.AgentRepository;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import com.onextel.CampaignDialerApplication.repository.PhoneNumberRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InboundCallServiceTest {
    private PhoneNumberRepository phoneNumberRepository;
    private IncomingConnectionRepository incomingConnectionRepository;
    private AgentRepository agentRepository;
    private CallRepository callRepository;
    private InboundCallService service;

    @BeforeEach
    void setUp() {
        phoneNumberRepository = mock(PhoneNumberRepository.class);
        incomingConnectionRepository = mock(IncomingConnectionRepository.class);
        agentRepository = mock(AgentRepository.class);
        callRepository = mock(CallRepository.class);
        service = new InboundCallService(phoneNumberRepository, incomingConnectionRepository, agentRepository,
                callRepository, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC),
                "https://dialer.example.com");
    }

    @Test
    void connectedNumberOpensStreamAndStoresCall() {
        when(phoneNumberRepository.findByPhoneNumber("+15550002222"))
                .thenReturn(Optional.of(PhoneNumber.builder().id("pn-1").phoneNumber("+15550002222").build()));
        when(incomingConnectionRepository.findActiveByPhoneNumber("pn-1")).thenReturn(Optional.of(
                IncomingConnection.builder().id("ic-1").userId("user-1").agentId("agent-1").phoneNumberId("pn-1").build()));
        when(agentRepository.findById("agent-1")).thenReturn(Optional.of(
                Agent.builder().id("agent-1").type(AgentType.FLOW).flowId("flow-3").build()));

        String xml = service.handleIncoming("CA1", "+15550001111", "+15550002222");

        ArgumentCaptor<Call> call = ArgumentCaptor.forClass(Call.class);
        verify(callRepository).insert(call.capture());
        assertEquals("user-1", call.getValue().getUserId());
        assertEquals("ic-1", call.getValue().getIncomingConnectionId());
        assertEquals("CA1", call.getValue().getCarrierCallSid());
        assertEquals(CallDirection.INBOUND, call.getValue().getDirection());
        assertEquals(CallStatus.INITIATED, call.getValue().getStatus());

        assertTrue(xml.contains("<Stream url=\"wss://dialer.example.com/api/webhooks/carrier/stream\">"));
        assertTrue(xml.contains("<Parameter name=\"callId\" value=\"" + call.getValue().getId() + "\"/>"));
        assertTrue(xml.contains("<Parameter name=\"agentId\" value=\"agent-1\"/>"));
        assertTrue(xml.contains("<Parameter name=\"flowId\" value=\"flow-3\"/>"));
    }

    @Test
    void unknownNumberHangsUp() {
        when(phoneNumberRepository.findByPhoneNumber(any())).thenReturn(Optional.empty());

        assertEquals(InboundCallService.UNAVAILABLE_RESPONSE, service.handleIncoming("CA2", "+1555", "+1666"));
        verify(callRepository, never()).insert(any());
    }

    @Test
    void parameterValuesAreEscaped() {
        String xml = service.streamResponse(Map.of("contactName", "Tom & \"Jerry\""));

        assertTrue(xml.contains("value=\"Tom &amp; &quot;Jerry&quot;\""));
    }
}
