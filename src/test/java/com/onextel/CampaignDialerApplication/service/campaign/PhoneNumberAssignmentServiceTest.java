package com.onextel.CampaignDialerApplication.service.campaign;

import com.onextel.CampaignDialerApplication.exception.InvalidCampaignStateException;
import com.onextel.CampaignDialerApplication.exception.PhoneNumberConflictException;
import com.onextel.CampaignDialerApplication.model.Agent;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.CampaignStatus;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import com.onextel.CampaignDialerApplication.repository.AgentRepository;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import com.onextel.CampaignDialerApplication.repository.PhoneNumberRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PhoneNumberAssignmentServiceTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private PhoneNumberRepository phoneNumberRepository;
    private CampaignRepository campaignRepository;
    private IncomingConnectionRepository incomingConnectionRepository;
    private AgentRepository agentRepository;
    private PhoneNumberAssignmentService service;

    @BeforeEach
    void setUp() {
        phoneNumberRepository = mock(PhoneNumberRepository.class);
        campaignRepository = mock(CampaignRepository.class);
        incomingConnectionRepository = mock(IncomingConnectionRepository.class);
        agentRepository = mock(AgentRepository.class);
        service = new PhoneNumberAssignmentService(phoneNumberRepository, campaignRepository,
                incomingConnectionRepository, agentRepository, Clock.fixed(NOW, ZoneOffset.UTC));

        when(phoneNumberRepository.lockById("pn-1")).thenReturn(Optional.of(PhoneNumber.builder()
                .id("pn-1").userId("user-1").phoneNumber("+15550000").build()));
    }

    private static Campaign campaign(String id, CampaignStatus status) {
        return Campaign.builder().id(id).userId("user-1").name("Campaign " + id).status(status).phoneNumberId("pn-1").build();
    }

    @Test
    void assignsFreeNumberToInactiveCampaign() {
        when(campaignRepository.findById("c1")).thenReturn(Optional.of(campaign("c1", CampaignStatus.DRAFT)));

        Campaign result = service.assignToCampaign("c1", "pn-1");

        assertEquals("pn-1", result.getPhoneNumberId());
        verify(campaignRepository).assignPhoneNumber("c1", "pn-1");
    }

    @Test
    void numberBoundToIncomingConnectionCannotBeAssigned() {
        when(campaignRepository.findById("c1")).thenReturn(Optional.of(campaign("c1", CampaignStatus.DRAFT)));
        when(incomingConnectionRepository.findActiveByPhoneNumber("pn-1"))
                .thenReturn(Optional.of(IncomingConnection.builder().id("ic-1").build()));

        PhoneNumberConflictException ex = assertThrows(PhoneNumberConflictException.class,
                () -> service.assignToCampaign("c1", "pn-1"));

        assertEquals(PhoneNumberConflictException.INCOMING_CONNECTION, ex.getConflictType());
        assertEquals("ic-1", ex.getConflictingId());
        verify(campaignRepository, never()).assignPhoneNumber(anyString(), anyString());
    }

    @Test
    void numberUsedByAnotherActiveCampaignCannotBeAssigned() {
        when(campaignRepository.findById("c1")).thenReturn(Optional.of(campaign("c1", CampaignStatus.DRAFT)));
        when(campaignRepository.findActiveByPhoneNumber("pn-1", "c1"))
                .thenReturn(Optional.of(campaign("c2", CampaignStatus.RUNNING)));

        PhoneNumberConflictException ex = assertThrows(PhoneNumberConflictException.class,
                () -> service.assignToCampaign("c1", "pn-1"));

        assertEquals(PhoneNumberConflictException.ACTIVE_CAMPAIGN, ex.getConflictType());
        assertEquals("Campaign c2", ex.getConflictingName());
    }

    @Test
    void activeCampaignKeepsItsNumber() {
        when(campaignRepository.findById("c1")).thenReturn(Optional.of(campaign("c1", CampaignStatus.RUNNING)));

        assertThrows(InvalidCampaignStateException.class, () -> service.assignToCampaign("c1", "pn-1"));
        verify(phoneNumberRepository, never()).lockById(anyString());
    }

    @Test
    void anotherUsersNumberIsNotFound() {
        when(campaignRepository.findById("c1")).thenReturn(Optional.of(
                campaign("c1", CampaignStatus.DRAFT).toBuilder().userId("user-2").build()));

        assertThrows(IllegalArgumentException.class, () -> service.assignToCampaign("c1", "pn-1"));
    }

    @Test
    void createsIncomingConnectionForOwnedAgentAndNumber() {
        when(agentRepository.findById("agent-1")).thenReturn(Optional.of(
                Agent.builder().id("agent-1").userId("user-1").name("Reception").build()));

        IncomingConnection connection = service.createIncomingConnection("user-1", "agent-1", "pn-1");

        ArgumentCaptor<IncomingConnection> stored = ArgumentCaptor.forClass(IncomingConnection.class);
        verify(incomingConnectionRepository).insert(stored.capture());
        assertEquals(connection.getId(), stored.getValue().getId());
        assertTrue(stored.getValue().isActive());
        assertEquals(NOW, stored.getValue().getCreatedAt());
    }

    @Test
    void incomingConnectionRejectedWhileCampaignRunsOnNumber() {
        when(agentRepository.findById("agent-1")).thenReturn(Optional.of(
                Agent.builder().id("agent-1").userId("user-1").name("Reception").build()));
        when(campaignRepository.findActiveByPhoneNumber("pn-1", null))
                .thenReturn(Optional.of(campaign("c2", CampaignStatus.PAUSED)));

        assertThrows(PhoneNumberConflictException.class,
                () -> service.createIncomingConnection("user-1", "agent-1", "pn-1"));
        verify(incomingConnectionRepository, never()).insert(any());
    }

    @Test
    void claimReportsCurrentStatusWhenAnotherRequestWon() {
        Campaign draft = campaign("c1", CampaignStatus.DRAFT);
        when(campaignRepository.claimForExecution(eq("c1"), eq(CampaignStatus.DRAFT), any())).thenReturn(false);
        when(campaignRepository.findById("c1")).thenReturn(Optional.of(campaign("c1", CampaignStatus.RUNNING)));

        InvalidCampaignStateException ex = assertThrows(InvalidCampaignStateException.class,
                () -> service.claimForExecution(draft));

        assertEquals(CampaignStatus.RUNNING, ex.getCurrentStatus());
    }

    @Test
    void claimReturnsPreviousStatus() {
        when(campaignRepository.claimForExecution("c1", CampaignStatus.PENDING, NOW)).thenReturn(true);

        assertEquals(CampaignStatus.PENDING, service.claimForExecution(campaign("c1", CampaignStatus.PENDING)));
    }
}
