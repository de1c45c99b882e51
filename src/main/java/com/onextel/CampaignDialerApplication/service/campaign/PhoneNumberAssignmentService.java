package com.onextel.CampaignDialerApplication.service.campaign;

import com.onextel.CampaignDialerApplication.exception.CampaignNotFoundException;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Keeps a phone number bound to at most one active campaign and at most one incoming connection.
 * <p>
 * Every operation starts by locking the phone-number row, so concurrent assignments of the same
 * number are serialized and the conflict checks cannot interleave.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PhoneNumberAssignmentService {
    private final PhoneNumberRepository phoneNumberRepository;
    private final CampaignRepository campaignRepository;
    private final IncomingConnectionRepository incomingConnectionRepository;
    private final AgentRepository agentRepository;
    private final Clock clock;

    @Transactional
    public Campaign assignToCampaign(String campaignId, String phoneNumberId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException("Campaign not found: " + campaignId));
        if (campaign.getStatus().isActive()) {
            throw new InvalidCampaignStateException(
                    "Phone number cannot be changed while the campaign is " + campaign.getStatus().dbValue(),
                    campaign.getStatus());
        }
        PhoneNumber number = lockOwnedNumber(phoneNumberId, campaign.getUserId());

        checkNoIncomingConnection(number);
        checkNoOtherActiveCampaign(number, campaignId);

        campaignRepository.assignPhoneNumber(campaignId, phoneNumberId);
        log.info("Assigned phone number {} to campaign {}", number.getPhoneNumber(), campaignId);
        return campaign.toBuilder().phoneNumberId(phoneNumberId).build();
    }

    @Transactional
    public IncomingConnection createIncomingConnection(String userId, String agentId, String phoneNumberId) {
        Agent agent = agentRepository.findById(agentId)
                .filter(a -> userId.equals(a.getUserId()))
                .orElseThrow(() -> new IllegalArgumentException("Agent not found: " + agentId));
        PhoneNumber number = lockOwnedNumber(phoneNumberId, userId);

        campaignRepository.findActiveByPhoneNumber(phoneNumberId, null).ifPresent(active -> {
            throw new PhoneNumberConflictException(
                    "Phone number is in use by active campaign '" + active.getName() + "'",
                    PhoneNumberConflictException.ACTIVE_CAMPAIGN, active.getId(), active.getName());
        });
        checkNoIncomingConnection(number);

        IncomingConnection connection = IncomingConnection.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .agentId(agent.getId())
                .phoneNumberId(phoneNumberId)
                .active(true)
                .createdAt(clock.instant())
                .build();
        incomingConnectionRepository.insert(connection);
        log.info("Created incoming connection {} on {} for agent {}", connection.getId(), number.getPhoneNumber(), agentId);
        return connection;
    }

    /**
     * Re-runs the conflict checks under the row lock and moves the campaign to running.
     * Returns the status the campaign had before, for compensation.
     */
    @Transactional
    public CampaignStatus claimForExecution(Campaign campaign) {
        if (campaign.getPhoneNumberId() == null) {
            throw new IllegalArgumentException("Campaign has no phone number assigned");
        }
        PhoneNumber number = phoneNumberRepository.lockById(campaign.getPhoneNumberId())
                .orElseThrow(() -> new IllegalArgumentException("Phone number not found: " + campaign.getPhoneNumberId()));

        checkNoIncomingConnection(number);
        checkNoOtherActiveCampaign(number, campaign.getId());

        CampaignStatus previous = campaign.getStatus();
        if (!campaignRepository.claimForExecution(campaign.getId(), previous, clock.instant())) {
            CampaignStatus current = campaignRepository.findById(campaign.getId())
                    .map(Campaign::getStatus)
                    .orElseThrow(() -> new CampaignNotFoundException("Campaign not found: " + campaign.getId()));
            throw new InvalidCampaignStateException(
                    "Campaign can no longer be executed, it is " + current.dbValue(), current);
        }
        return previous;
    }

    private PhoneNumber lockOwnedNumber(String phoneNumberId, String userId) {
        return phoneNumberRepository.lockById(phoneNumberId)
                .filter(n -> n.getUserId() == null || n.getUserId().equals(userId))
                .orElseThrow(() -> new IllegalArgumentException("Phone number not found: " + phoneNumberId));
    }

    private void checkNoIncomingConnection(PhoneNumber number) {
        incomingConnectionRepository.findActiveByPhoneNumber(number.getId()).ifPresent(connection -> {
            throw new PhoneNumberConflictException(
                    "Phone number " + number.getPhoneNumber() + " is assigned to an incoming connection",
                    PhoneNumberConflictException.INCOMING_CONNECTION, connection.getId(), null);
        });
    }

    private void checkNoOtherActiveCampaign(PhoneNumber number, String campaignId) {
        campaignRepository.findActiveByPhoneNumber(number.getId(), campaignId).ifPresent(other -> {
            throw new PhoneNumberConflictException(
                    "Phone number " + number.getPhoneNumber() + " is in use by campaign '" + other.getName() + "'",
                    PhoneNumberConflictException.ACTIVE_CAMPAIGN, other.getId(), other.getName());
        });
    }
}
