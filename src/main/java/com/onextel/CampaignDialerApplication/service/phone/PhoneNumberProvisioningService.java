package com.onextel.CampaignDialerApplication.service.phone;

import com.onextel.CampaignDialerApplication.exception.PhoneNumberConflictException;
import com.onextel.CampaignDialerApplication.gateway.carrier.AvailableNumber;
import com.onextel.CampaignDialerApplication.gateway.carrier.OwnedNumber;
import com.onextel.CampaignDialerApplication.gateway.carrier.TelephonyCarrierClient;
import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import com.onextel.CampaignDialerApplication.repository.PhoneNumberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Buys, wires and releases carrier numbers, keeping the local {@code phone_numbers} rows in step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PhoneNumberProvisioningService {
    private static final int MAX_SEARCH_RESULTS = 50;

    private final TelephonyCarrierClient carrierClient;
    private final PhoneNumberRepository phoneNumberRepository;
    private final CampaignRepository campaignRepository;
    private final IncomingConnectionRepository incomingConnectionRepository;

    public List<AvailableNumber> search(String country, String areaCode, String contains, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_SEARCH_RESULTS));
        return carrierClient.searchAvailableNumbers(country == null ? "US" : country, areaCode, contains, bounded);
    }

    /**
     * Purchases the number, stores it for the user and points its voice webhooks at this service.
     * The row is stored before the webhook call so a failed configuration can be retried by sid.
     */
    public PhoneNumber purchase(String userId, String phoneNumber, String friendlyName) {
        OwnedNumber owned = carrierClient.purchaseNumber(phoneNumber, friendlyName);
        PhoneNumber number = PhoneNumber.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .phoneNumber(owned.getPhoneNumber() == null || owned.getPhoneNumber().isBlank()
                        ? phoneNumber : owned.getPhoneNumber())
                .carrierSid(owned.getSid())
                .build();
        phoneNumberRepository.insert(number);
        log.info("User {} purchased {} ({})", userId, number.getPhoneNumber(), owned.getSid());

        carrierClient.configureInboundWebhook(owned.getSid());
        return number;
    }

    /**
     * Carrier-side view of the user's numbers. Numbers on the carrier account that no local row
     * attributes to the user are left out.
     */
    public List<OwnedNumber> listOwned(String userId) {
        Set<String> sids = phoneNumberRepository.findByUserId(userId).stream()
                .map(PhoneNumber::getCarrierSid)
                .collect(Collectors.toSet());
        if (sids.isEmpty()) {
            return List.of();
        }
        return carrierClient.listOwnedNumbers().stream()
                .filter(n -> sids.contains(n.getSid()))
                .collect(Collectors.toList());
    }

    public OwnedNumber clearWebhook(String userId, String carrierSid) {
        requireOwned(userId, carrierSid);
        log.info("User {} detached inbound webhook from {}", userId, carrierSid);
        return carrierClient.clearInboundWebhook(carrierSid);
    }

    public OwnedNumber configureWebhook(String userId, String carrierSid) {
        requireOwned(userId, carrierSid);
        return carrierClient.configureInboundWebhook(carrierSid);
    }

    /**
     * Releases a number that no running campaign or incoming connection is using.
     */
    public void release(String userId, String carrierSid) {
        PhoneNumber number = requireOwned(userId, carrierSid);
        campaignRepository.findActiveByPhoneNumber(number.getId(), null).ifPresent(campaign -> {
            throw new PhoneNumberConflictException(
                    "Phone number is in use by active campaign '" + campaign.getName() + "'",
                    PhoneNumberConflictException.ACTIVE_CAMPAIGN, campaign.getId(), campaign.getName());
        });
        incomingConnectionRepository.findActiveByPhoneNumber(number.getId()).ifPresent(connection -> {
            throw new PhoneNumberConflictException(
                    "Phone number is assigned to an incoming connection",
                    PhoneNumberConflictException.INCOMING_CONNECTION, connection.getId(), null);
        });
        carrierClient.releaseNumber(carrierSid);
        phoneNumberRepository.deleteByCarrierSid(carrierSid);
        log.info("User {} released {} ({})", userId, number.getPhoneNumber(), carrierSid);
    }

    private PhoneNumber requireOwned(String userId, String carrierSid) {
        return phoneNumberRepository.findByCarrierSid(carrierSid)
                .filter(n -> userId.equals(n.getUserId()))
                .orElseThrow(() -> new IllegalArgumentException("Phone number not found: " + carrierSid));
    }
}
