package com.onextel.CampaignDialerApplication.service.campaign;

import com.onextel.CampaignDialerApplication.dto.BatchStatusResponse;
import com.onextel.CampaignDialerApplication.dto.CampaignExecutionResponse;
import com.onextel.CampaignDialerApplication.dto.CampaignValidationResult;
import com.onextel.CampaignDialerApplication.dto.PauseCampaignRequest;
import com.onextel.CampaignDialerApplication.exception.CampaignNotFoundException;
import com.onextel.CampaignDialerApplication.exception.CampaignValidationException;
import com.onextel.CampaignDialerApplication.exception.InsufficientBalanceException;
import com.onextel.CampaignDialerApplication.exception.InvalidCampaignStateException;
import com.onextel.CampaignDialerApplication.gateway.batch.BatchCallingClient;
import com.onextel.CampaignDialerApplication.gateway.batch.BatchJob;
import com.onextel.CampaignDialerApplication.gateway.batch.BatchJobStats;
import com.onextel.CampaignDialerApplication.gateway.batch.BatchJobStatus;
import com.onextel.CampaignDialerApplication.gateway.batch.SubmitBatchRequest;
import com.onextel.CampaignDialerApplication.model.Agent;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.CampaignStatus;
import com.onextel.CampaignDialerApplication.model.Contact;
import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import com.onextel.CampaignDialerApplication.repository.AgentRepository;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import com.onextel.CampaignDialerApplication.repository.ContactRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import com.onextel.CampaignDialerApplication.repository.PhoneNumberRepository;
import com.onextel.CampaignDialerApplication.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Campaign state machine on top of the remote batch calling job.
 * <p>
 * The remote job is authoritative for call outcomes; the campaign row mirrors it through
 * {@link #refreshStatus}. Every status change is a conditional update, so concurrent triggers
 * (user actions, the reconciliation poller) cannot both win the same transition.
 */
@Service
@Slf4j
public class CampaignExecutor {
    private static final double BALANCE_WARNING_RATIO = 0.8;

    private final CampaignRepository campaignRepository;
    private final ContactRepository contactRepository;
    private final AgentRepository agentRepository;
    private final PhoneNumberRepository phoneNumberRepository;
    private final IncomingConnectionRepository incomingConnectionRepository;
    private final UserAccountRepository userAccountRepository;
    private final PhoneNumberAssignmentService assignmentService;
    private final BatchCallingClient batchCallingClient;
    private final CampaignEventPublisher eventPublisher;
    private final Clock clock;
    private final int minutesPerCall;

    public CampaignExecutor(CampaignRepository campaignRepository,
                            ContactRepository contactRepository,
                            AgentRepository agentRepository,
                            PhoneNumberRepository phoneNumberRepository,
                            IncomingConnectionRepository incomingConnectionRepository,
                            UserAccountRepository userAccountRepository,
                            PhoneNumberAssignmentService assignmentService,
                            BatchCallingClient batchCallingClient,
                            CampaignEventPublisher eventPublisher,
                            Clock clock,
                            @Value("${app.campaign.minutes-per-call:2}") int minutesPerCall) {
        this.campaignRepository = campaignRepository;
        this.contactRepository = contactRepository;
        this.agentRepository = agentRepository;
        this.phoneNumberRepository = phoneNumberRepository;
        this.incomingConnectionRepository = incomingConnectionRepository;
        this.userAccountRepository = userAccountRepository;
        this.assignmentService = assignmentService;
        this.batchCallingClient = batchCallingClient;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.minutesPerCall = minutesPerCall;
    }

    // ========== Lookup ========== //

    public Campaign getCampaign(String campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException("Campaign not found: " + campaignId));
    }

    /**
     * Same as {@link #getCampaign} but treats another user's campaign as missing.
     */
    public Campaign getOwnedCampaign(String campaignId, String userId) {
        Campaign campaign = getCampaign(campaignId);
        if (userId != null && !userId.equals(campaign.getUserId())) {
            throw new CampaignNotFoundException("Campaign not found: " + campaignId);
        }
        return campaign;
    }

    // ========== Validation ========== //

    public CampaignValidationResult validate(String campaignId) {
        return inspect(getCampaign(campaignId)).result;
    }

    private Inspection inspect(Campaign campaign) {
        CampaignValidationResult result = new CampaignValidationResult();

        if (!CampaignStatus.EXECUTABLE.contains(campaign.getStatus())) {
            result.error("Campaign cannot be executed from status " + campaign.getStatus().dbValue());
        }

        Agent agent = null;
        if (campaign.getAgentId() == null) {
            result.error("No agent assigned to campaign");
        } else {
            agent = agentRepository.findById(campaign.getAgentId()).orElse(null);
            if (agent == null) {
                result.error("Agent not found: " + campaign.getAgentId());
            } else if (!agent.isSynced()) {
                result.error("Agent '" + agent.getName() + "' is not synchronized with the voice provider");
            }
        }

        PhoneNumber number = null;
        if (campaign.getPhoneNumberId() == null) {
            result.error("No phone number assigned to campaign");
        } else {
            number = phoneNumberRepository.findById(campaign.getPhoneNumberId()).orElse(null);
            if (number == null) {
                result.error("Phone number not found: " + campaign.getPhoneNumberId());
            } else {
                if (number.getExternalNumberId() == null || number.getExternalNumberId().isBlank()) {
                    result.error("Phone number " + number.getPhoneNumber() + " is not registered with the voice provider");
                }
                PhoneNumber checked = number;
                incomingConnectionRepository.findActiveByPhoneNumber(number.getId()).ifPresent(connection ->
                        result.error("Phone number " + checked.getPhoneNumber() + " is assigned to an incoming connection"));
                campaignRepository.findActiveByPhoneNumber(number.getId(), campaign.getId()).ifPresent(other ->
                        result.error("Phone number " + checked.getPhoneNumber() + " is in use by campaign '"
                                + other.getName() + "'"));
            }
        }

        int contactCount = contactRepository.countByCampaignId(campaign.getId());
        if (contactCount == 0) {
            result.error("Campaign has no contacts");
        }

        long estimated = estimateCredits(contactCount);
        long available = userAccountRepository.findCredits(campaign.getUserId());
        if (estimated > available) {
            result.warning("Estimated cost of " + estimated + " credits exceeds the available " + available);
        } else if (estimated > available * BALANCE_WARNING_RATIO) {
            result.warning("Estimated cost of " + estimated + " credits uses more than 80% of the available balance");
        }
        if (campaign.getScheduledFor() != null && campaign.getScheduledFor().isAfter(clock.instant())) {
            result.warning("Campaign is scheduled for " + campaign.getScheduledFor() + " but will start now");
        }
        return new Inspection(result, agent, number);
    }

    long estimateCredits(int contactCount) {
        return (long) contactCount * minutesPerCall;
    }

    // ========== Execution ========== //

    public CampaignExecutionResponse execute(String campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (!CampaignStatus.EXECUTABLE.contains(campaign.getStatus())) {
            throw new InvalidCampaignStateException(
                    "Campaign cannot be executed from status " + campaign.getStatus().dbValue(), campaign.getStatus());
        }
        Inspection inspection = inspect(campaign);
        if (!inspection.result.isValid()) {
            throw new CampaignValidationException(inspection.result);
        }
        List<Contact> contacts = contactRepository.findByCampaignId(campaignId);

        CampaignStatus previousStatus = assignmentService.claimForExecution(campaign);

        long estimated = estimateCredits(contacts.size());
        long available;
        BatchJob job;
        try {
            available = userAccountRepository.findCredits(campaign.getUserId());
            if (available < estimated) {
                throw new InsufficientBalanceException(estimated, available);
            }
            job = batchCallingClient.submit(SubmitBatchRequest.builder()
                    .callName(campaign.getName())
                    .agentId(inspection.agent.getExternalAgentId())
                    .agentPhoneNumberId(inspection.number.getExternalNumberId())
                    .recipients(BatchCallingClient.toRecipients(contacts))
                    .build());
        } catch (RuntimeException e) {
            releaseClaim(campaignId, previousStatus, e);
            throw e;
        }

        try {
            if (!campaignRepository.recordBatchJob(campaignId, job.getId(), job.getStatus().value(), contacts.size())) {
                log.error("Inconsistency: batch job {} was created for campaign {} but the campaign row was not updated",
                        job.getId(), campaignId);
            }
        } catch (DataAccessException e) {
            log.error("Inconsistency: batch job {} was created for campaign {} but could not be recorded",
                    job.getId(), campaignId, e);
            throw e;
        }
        log.info("Campaign {} is running with batch job {} ({} calls)", campaignId, job.getId(), contacts.size());

        eventPublisher.publish(getCampaign(campaignId), WebhookEventType.CAMPAIGN_STARTED);

        return CampaignExecutionResponse.builder()
                .campaignId(campaignId)
                .batchJobId(job.getId())
                .batchJobStatus(job.getStatus().value())
                .totalCallsScheduled(job.getTotalCallsScheduled())
                .estimatedCredits(estimated)
                .availableCredits(available)
                .build();
    }

    private void releaseClaim(String campaignId, CampaignStatus previousStatus, RuntimeException cause) {
        String reason = cause instanceof InsufficientBalanceException ? null : cause.getMessage();
        try {
            if (!campaignRepository.releaseClaim(campaignId, previousStatus, reason)) {
                log.error("Could not restore campaign {} to {} after failed execution", campaignId, previousStatus.dbValue());
            }
        } catch (DataAccessException e) {
            log.error("Could not restore campaign {} to {} after failed execution", campaignId, previousStatus.dbValue(), e);
            cause.addSuppressed(e);
        }
    }

    // ========== Lifecycle Operations ========== //

    /**
     * The batch API has no pause primitive: pending recipients are cancelled remotely and
     * the campaign is held as paused so that {@link #resume} can re-dispatch them.
     */
    public Campaign pause(String campaignId, PauseCampaignRequest.Reason reason) {
        Campaign campaign = getCampaign(campaignId);
        if (campaign.getStatus() != CampaignStatus.RUNNING) {
            throw new InvalidCampaignStateException(
                    "Only running campaigns can be paused, campaign is " + campaign.getStatus().dbValue(),
                    campaign.getStatus());
        }
        BatchJob job = campaign.hasBatchJob() ? batchCallingClient.cancel(campaign.getBatchJobId()) : null;

        if (!campaignRepository.pause(campaignId, reason.value())) {
            Campaign current = getCampaign(campaignId);
            if (current.getStatus() == CampaignStatus.PAUSED) {
                return current;
            }
            throw new InvalidCampaignStateException("Campaign changed state while pausing", current.getStatus());
        }
        if (job != null) {
            campaignRepository.updateBatchJobStatus(campaignId, job.getStatus().value());
        }
        log.info("Campaign {} paused ({})", campaignId, reason.value());

        Campaign paused = getCampaign(campaignId);
        eventPublisher.publish(paused, WebhookEventType.CAMPAIGN_PAUSED, Map.of("reason", reason.value()));
        return paused;
    }

    public Campaign resume(String campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (!CampaignStatus.RESUMABLE.contains(campaign.getStatus())) {
            throw new InvalidCampaignStateException(
                    "Campaign cannot be resumed from status " + campaign.getStatus().dbValue(), campaign.getStatus());
        }
        BatchJob job = campaign.hasBatchJob() ? batchCallingClient.retry(campaign.getBatchJobId()) : null;

        if (!campaignRepository.resume(campaignId)) {
            Campaign current = getCampaign(campaignId);
            throw new InvalidCampaignStateException("Campaign changed state while resuming", current.getStatus());
        }
        if (job != null) {
            campaignRepository.updateBatchJobStatus(campaignId, job.getStatus().value());
        }
        log.info("Campaign {} resumed from {}", campaignId, campaign.getStatus().dbValue());

        Campaign resumed = getCampaign(campaignId);
        eventPublisher.publish(resumed, WebhookEventType.CAMPAIGN_RESUMED);
        return resumed;
    }

    /**
     * Cancelling an already cancelled campaign returns it unchanged without calling the remote API.
     */
    public Campaign cancel(String campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (campaign.getStatus() == CampaignStatus.CANCELLED) {
            return campaign;
        }
        if (!campaign.hasBatchJob()) {
            throw new InvalidCampaignStateException("Campaign has no batch job to cancel", campaign.getStatus());
        }
        if (!campaign.getStatus().isActive()) {
            throw new InvalidCampaignStateException(
                    "Campaign cannot be cancelled from status " + campaign.getStatus().dbValue(), campaign.getStatus());
        }

        BatchJob job = batchCallingClient.cancel(campaign.getBatchJobId());
        if (!campaignRepository.cancel(campaignId, clock.instant())) {
            Campaign current = getCampaign(campaignId);
            if (current.getStatus() == CampaignStatus.CANCELLED) {
                return current;
            }
            throw new InvalidCampaignStateException("Campaign changed state while cancelling", current.getStatus());
        }
        campaignRepository.updateBatchJobStatus(campaignId, job.getStatus().value());
        log.info("Campaign {} cancelled", campaignId);

        Campaign cancelled = getCampaign(campaignId);
        eventPublisher.publish(cancelled, WebhookEventType.CAMPAIGN_CANCELLED);
        return cancelled;
    }

    /**
     * Re-dispatches failed and unanswered recipients of the existing job.
     */
    public Campaign retry(String campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (!campaign.hasBatchJob()) {
            throw new InvalidCampaignStateException("Campaign has no batch job to retry", campaign.getStatus());
        }
        if (campaign.getStatus() == CampaignStatus.CANCELLED) {
            throw new InvalidCampaignStateException("Cancelled campaigns cannot be retried", campaign.getStatus());
        }

        BatchJob job = batchCallingClient.retry(campaign.getBatchJobId());
        boolean reopened = campaign.getStatus() != CampaignStatus.RUNNING && campaignRepository.resume(campaignId);
        campaignRepository.updateBatchJobStatus(campaignId, job.getStatus().value());
        log.info("Campaign {} retry requested for batch job {}", campaignId, campaign.getBatchJobId());

        Campaign retried = getCampaign(campaignId);
        if (reopened) {
            eventPublisher.publish(retried, WebhookEventType.CAMPAIGN_RESUMED, Map.of("reason", "retry"));
        }
        return retried;
    }

    // ========== Reconciliation ========== //

    /**
     * Pulls the remote job and projects it onto the campaign row. Safe to run concurrently with itself:
     * counters only move forward and only the caller that wins the terminal transition emits the event.
     */
    public BatchStatusResponse refreshStatus(String campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (!campaign.hasBatchJob()) {
            throw new InvalidCampaignStateException("Campaign has no batch job", campaign.getStatus());
        }
        BatchJob job = batchCallingClient.get(campaign.getBatchJobId());
        BatchJobStats stats = BatchCallingClient.stats(job);

        campaignRepository.applyCounters(campaignId,
                stats.getFinished(), stats.getSuccessful(), stats.getFailedTotal(), job.getStatus().value());

        if (job.getStatus().isTerminal() && campaign.getStatus().isActive() && !isPausedByCancel(campaign, job)) {
            finish(campaign, job);
        }
        return new BatchStatusResponse(getCampaign(campaignId), job, stats);
    }

    // a paused campaign's job reports cancelled, that is not the end of the campaign
    private static boolean isPausedByCancel(Campaign campaign, BatchJob job) {
        return campaign.getStatus() == CampaignStatus.PAUSED && job.getStatus() == BatchJobStatus.CANCELLED;
    }

    private void finish(Campaign campaign, BatchJob job) {
        CampaignStatus terminal;
        WebhookEventType event;
        String error = null;
        switch (job.getStatus()) {
            case COMPLETED -> {
                terminal = CampaignStatus.COMPLETED;
                event = WebhookEventType.CAMPAIGN_COMPLETED;
            }
            case FAILED -> {
                terminal = CampaignStatus.FAILED;
                event = WebhookEventType.CAMPAIGN_FAILED;
                error = "Batch job " + job.getId() + " failed";
            }
            default -> {
                terminal = CampaignStatus.CANCELLED;
                event = WebhookEventType.CAMPAIGN_CANCELLED;
            }
        }
        if (!campaignRepository.finish(campaign.getId(), terminal, clock.instant(), error)) {
            log.debug("Campaign {} was already finished by another refresher", campaign.getId());
            return;
        }
        log.info("Campaign {} finished as {} (batch job {})", campaign.getId(), terminal.dbValue(), job.getId());
        Campaign finished = getCampaign(campaign.getId());
        eventPublisher.publish(finished, event, error == null ? Map.of() : Map.of("error", error));
    }

    // ========== Soft Delete ========== //

    public void delete(String campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (campaign.getStatus().isActive()) {
            throw new InvalidCampaignStateException(
                    "Campaign must be cancelled or finished before deletion", campaign.getStatus());
        }
        if (!campaignRepository.softDelete(campaignId, clock.instant())) {
            Campaign current = campaignRepository.findByIdIncludingDeleted(campaignId)
                    .orElseThrow(() -> new CampaignNotFoundException("Campaign not found: " + campaignId));
            if (!current.isDeleted()) {
                throw new InvalidCampaignStateException("Campaign changed state while deleting", current.getStatus());
            }
        }
        log.info("Campaign {} deleted", campaignId);
    }

    public Campaign restore(String campaignId, String userId) {
        Campaign campaign = campaignRepository.findByIdIncludingDeleted(campaignId)
                .filter(c -> userId == null || userId.equals(c.getUserId()))
                .orElseThrow(() -> new CampaignNotFoundException("Campaign not found: " + campaignId));
        if (campaign.isDeleted() && campaignRepository.restore(campaignId)) {
            log.info("Campaign {} restored", campaignId);
        }
        return getCampaign(campaignId);
    }

    private static final class Inspection {
        final CampaignValidationResult result;
        final Agent agent;
        final PhoneNumber number;

        Inspection(CampaignValidationResult result, Agent agent, PhoneNumber number) {
            this.result = result;
            this.agent = agent;
            this.number = number;
        }
    }
}
