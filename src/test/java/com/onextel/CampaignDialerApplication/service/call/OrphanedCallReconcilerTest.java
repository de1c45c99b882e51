package com.onextel.CampaignDialerApplication.service.call;

import com.onextel.CampaignDialerApplication.dto.OrphanReconciliationReport;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrphanedCallReconcilerTest {

    private CallRepository callRepository;
    private CampaignRepository campaignRepository;
    private IncomingConnectionRepository incomingConnectionRepository;

    @BeforeEach
    void setUp() {
        callRepository = mock(CallRepository.class);
        campaignRepository = mock(CampaignRepository.class);
        incomingConnectionRepository = mock(IncomingConnectionRepository.class);
    }

    private OrphanedCallReconciler reconciler(int batchSize, int maxWithoutProgress) {
        return new OrphanedCallReconciler(callRepository, campaignRepository, incomingConnectionRepository,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC), batchSize, maxWithoutProgress);
    }

    @Test
    void resolvesOwnersThroughCampaignThenIncomingConnection() {
        Call viaCampaign = Call.builder().id("a").campaignId("c1").build();
        Call viaDeletedCampaignFallback = Call.builder().id("b").campaignId("gone").incomingConnectionId("ic-1").build();
        Call unresolvable = Call.builder().id("c").build();
        when(callRepository.findWithoutUser(isNull(), eq(10))).thenReturn(List.of(viaCampaign, viaDeletedCampaignFallback, unresolvable));
        when(callRepository.findWithoutUser("c", 10)).thenReturn(List.of());
        when(campaignRepository.findByIdIncludingDeleted("c1"))
                .thenReturn(Optional.of(Campaign.builder().id("c1").userId("owner-1").build()));
        when(incomingConnectionRepository.findById("ic-1"))
                .thenReturn(Optional.of(IncomingConnection.builder().id("ic-1").userId("owner-2").build()));
        when(callRepository.assignUser(anyString(), anyString())).thenReturn(true);
        when(callRepository.replaceMetadata(eq("c"), anyMap())).thenReturn(true);

        OrphanReconciliationReport report = reconciler(10, 100).reconcile();

        verify(callRepository).assignUser("a", "owner-1");
        verify(callRepository).assignUser("b", "owner-2");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(callRepository).replaceMetadata(eq("c"), metadata.capture());
        assertEquals(true, metadata.getValue().get("orphaned"));
        assertEquals("no_owner_reference", metadata.getValue().get("reason"));
        assertEquals("2024-05-01T10:00:00Z", metadata.getValue().get("taggedAt"));

        assertEquals(3, report.getScanned());
        assertEquals(2, report.getMigrated());
        assertEquals(1, report.getOrphaned());
        assertFalse(report.isStoppedWithoutProgress());
    }

    @Test
    void missingCampaignIsTaggedWithReason() {
        Call call = Call.builder().id("a").campaignId("gone").build();
        when(callRepository.findWithoutUser(isNull(), eq(10))).thenReturn(List.of(call));
        when(callRepository.findWithoutUser("a", 10)).thenReturn(List.of());
        when(callRepository.replaceMetadata(eq("a"), anyMap())).thenReturn(true);

        reconciler(10, 100).reconcile();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(callRepository).replaceMetadata(eq("a"), metadata.capture());
        assertEquals("campaign_not_found", metadata.getValue().get("reason"));
    }

    @Test
    void stopsAfterTooManyAlreadyTaggedRows() {
        Call tagged1 = Call.builder().id("a").metadata(Map.of("orphaned", true)).build();
        Call tagged2 = Call.builder().id("b").metadata(Map.of("orphaned", true)).build();
        Call tagged3 = Call.builder().id("c").metadata(Map.of("orphaned", true)).build();
        when(callRepository.findWithoutUser(isNull(), eq(2))).thenReturn(List.of(tagged1, tagged2));
        when(callRepository.findWithoutUser("b", 2)).thenReturn(List.of(tagged3));

        OrphanReconciliationReport report = reconciler(2, 3).reconcile();

        assertTrue(report.isStoppedWithoutProgress());
        assertEquals(3, report.getScanned());
        assertEquals(0, report.getMigrated());
        verify(callRepository, never()).replaceMetadata(anyString(), anyMap());
    }
}
