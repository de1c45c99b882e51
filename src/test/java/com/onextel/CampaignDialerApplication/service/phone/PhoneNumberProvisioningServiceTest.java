package com.onextel.CampaignDialerApplication.service.phone;

import com.onextel.CampaignDialerApplication.exception.PhoneNumberConflictException;
import com.onextel.CampaignDialerApplication.gateway.carrier.OwnedNumber;
import com.onextel.CampaignDialerApplication.gateway.carrier.TelephonyCarrierClient;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import com.onextel.CampaignDialerApplication.repository.PhoneNumberRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PhoneNumberProvisioningServiceTest {
    private TelephonyCarrierClient carrierClient;
    private PhoneNumberRepository phoneNumberRepository;
    private CampaignRepository campaignRepository;
    private IncomingConnectionRepository incomingConnectionRepository;
    private PhoneNumberProvisioningService service;

    private final PhoneNumber owned = PhoneNumber.builder()
            .id("pn-1").userId("user-1").phoneNumber("+15550002222").carrierSid("PN1").build();

    @BeforeEach
    void setUp() {
        carrierClient = mock(TelephonyCarrierClient.class);
        phoneNumberRepository = mock(PhoneNumberRepository.class);
        campaignRepository = mock(CampaignRepository.class);
        incomingConnectionRepository = mock(IncomingConnectionRepository.class);
        service = new PhoneNumberProvisioningService(carrierClient, phoneNumberRepository,
                campaignRepository, incomingConnectionRepository);
        when(phoneNumberRepository.findByCarrierSid("PN1")).thenReturn(Optional.of(owned));
    }

    @Test
    void purchaseStoresRowBeforeConfiguringWebhook() {
        when(carrierClient.purchaseNumber("+15550002222", "Sales"))
                .thenReturn(OwnedNumber.builder().sid("PN1").phoneNumber("+15550002222").build());

        PhoneNumber number = service.purchase("user-1", "+15550002222", "Sales");

        assertEquals("PN1", number.getCarrierSid());
        assertEquals("user-1", number.getUserId());
        InOrder order = inOrder(phoneNumberRepository, carrierClient);
        order.verify(phoneNumberRepository).insert(any());
        order.verify(carrierClient).configureInboundWebhook("PN1");
    }

    @Test
    void releaseIsRejectedWhileCampaignUsesNumber() {
        when(campaignRepository.findActiveByPhoneNumber("pn-1", null))
                .thenReturn(Optional.of(Campaign.builder().id("c1").name("Spring promo").build()));

        PhoneNumberConflictException e = assertThrows(PhoneNumberConflictException.class,
                () -> service.release("user-1", "PN1"));

        assertEquals(PhoneNumberConflictException.ACTIVE_CAMPAIGN, e.getConflictType());
        assertEquals("c1", e.getConflictingId());
        verify(carrierClient, never()).releaseNumber(anyString());
    }

    @Test
    void releaseIsRejectedWhileIncomingConnectionUsesNumber() {
        when(campaignRepository.findActiveByPhoneNumber("pn-1", null)).thenReturn(Optional.empty());
        when(incomingConnectionRepository.findActiveByPhoneNumber("pn-1"))
                .thenReturn(Optional.of(IncomingConnection.builder().id("ic-1").build()));

        PhoneNumberConflictException e = assertThrows(PhoneNumberConflictException.class,
                () -> service.release("user-1", "PN1"));

        assertEquals(PhoneNumberConflictException.INCOMING_CONNECTION, e.getConflictType());
        verify(phoneNumberRepository, never()).deleteByCarrierSid(anyString());
    }

    @Test
    void unusedNumberIsReleased() {
        when(campaignRepository.findActiveByPhoneNumber("pn-1", null)).thenReturn(Optional.empty());
        when(incomingConnectionRepository.findActiveByPhoneNumber("pn-1")).thenReturn(Optional.empty());

        service.release("user-1", "PN1");

        verify(carrierClient).releaseNumber("PN1");
        verify(phoneNumberRepository).deleteByCarrierSid("PN1");
    }

    @Test
    void anotherUsersNumberIsNotFound() {
        assertThrows(IllegalArgumentException.class, () -> service.clearWebhook("user-2", "PN1"));
        verify(carrierClient, never()).clearInboundWebhook(anyString());
    }

    @Test
    void ownedListingOnlyShowsUsersNumbers() {
        when(phoneNumberRepository.findByUserId("user-1")).thenReturn(List.of(owned));
        when(carrierClient.listOwnedNumbers()).thenReturn(List.of(
                OwnedNumber.builder().sid("PN1").phoneNumber("+15550002222").build(),
                OwnedNumber.builder().sid("PN9").phoneNumber("+15550009999").build()));

        List<OwnedNumber> numbers = service.listOwned("user-1");

        assertEquals(1, numbers.size());
        assertEquals("PN1", numbers.get(0).getSid());
    }

    @Test
    void searchLimitIsBounded() {
        service.search(null, "415", null, 500);

        ArgumentCaptor<Integer> limit = ArgumentCaptor.forClass(Integer.class);
        verify(carrierClient).searchAvailableNumbers(eq("US"), eq("415"), isNull(), limit.capture());
        assertTrue(limit.getValue() <= 50);
    }
}
