package com.onextel.CampaignDialerApplication.service.call;

import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.model.CallStatus;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookEventType;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import com.onextel.CampaignDialerApplication.service.webhook.WebhookManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies call lifecycle updates coming from the carrier status callback and from live stream sessions.
 * Campaign counters are not touched here, they follow the remote batch job only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallStatusService {
    private final CallRepository callRepository;
    private final WebhookManager webhookManager;
    private final Clock clock;

    /**
     * @return true when the call row was updated
     */
    public boolean applyCarrierStatus(String callSid, String carrierStatus, Integer durationSeconds, String recordingUrl) {
        CallStatus status = CallStatus.fromCarrierStatus(carrierStatus);
        if (status == null) {
            log.debug("Ignoring carrier status '{}' for {}", carrierStatus, callSid);
            return false;
        }
        Call call = callRepository.findByCarrierCallSid(callSid).orElse(null);
        if (call == null) {
            log.warn("Status callback for unknown carrier call {}", callSid);
            return false;
        }
        Instant now = clock.instant();
        boolean updated = callRepository.updateStatus(call.getId(), status, durationSeconds, recordingUrl,
                status == CallStatus.ANSWERED ? now : null,
                status.isTerminal() ? now : null);
        if (!updated) {
            log.debug("Call {} already final or further along, status '{}' ignored", call.getId(), carrierStatus);
            return false;
        }
        log.info("Call {} is now {}", call.getId(), status.dbValue());
        if (status.isTerminal()) {
            publishOutcome(call.getId());
        }
        return true;
    }

    public boolean markAnswered(String callId) {
        return callRepository.updateStatus(callId, CallStatus.ANSWERED, null, null, clock.instant(), null);
    }

    /**
     * Final update from a live stream. Losing to a carrier callback that already finished the call is fine.
     */
    public boolean markCompleted(String callId, int durationSeconds) {
        boolean updated = callRepository.updateStatus(callId, CallStatus.COMPLETED, durationSeconds, null,
                null, clock.instant());
        if (updated) {
            log.info("Call {} completed after {}s of streaming", callId, durationSeconds);
            publishOutcome(callId);
        }
        return updated;
    }

    private void publishOutcome(String callId) {
        callRepository.findById(callId).ifPresent(call -> webhookManager.publish(
                call.getUserId(),
                call.getStatus().isFailure() ? WebhookEventType.CALL_FAILED : WebhookEventType.CALL_COMPLETED,
                payload(call)));
    }

    static Map<String, Object> payload(Call call) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("callId", call.getId());
        data.put("campaignId", call.getCampaignId());
        data.put("contactId", call.getContactId());
        data.put("carrierCallSid", call.getCarrierCallSid());
        data.put("phoneNumber", call.getPhoneNumber());
        data.put("status", call.getStatus().dbValue());
        data.put("durationSeconds", call.getDurationSeconds());
        data.put("recordingUrl", call.getRecordingUrl());
        return data;
    }
}
