package com.onextel.CampaignDialerApplication.gateway.batch;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-recipient outcome as reported by the remote batch job.
 */
@Value
@Builder
public class BatchRecipientResult {
    String recipientId;
    String phoneNumber;
    String name;
    String email;
    Map<String, String> dynamicData;
    RecipientStatus status;
    String conversationId;
    Integer callDurationSecs;
    String errorMessage;
}
