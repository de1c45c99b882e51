package com.onextel.CampaignDialerApplication.gateway.batch;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized view of a remote batch job. Optional remote fields are defaulted
 * (zero counts, empty strings, pending status) so callers never branch on them.
 */
@Value
@Builder(toBuilder = true)
public class BatchJob {
    String id;
    String name;
    String agentId;
    String agentName;
    BatchJobStatus status;
    int totalCallsScheduled;
    int totalCallsDispatched;
    long createdAtUnix;
    long scheduledTimeUnix;
    long lastUpdatedAtUnix;
    String phoneNumberId;
    String phoneProvider;

    // Only populated by get(id)
    @Builder.Default
    List<BatchRecipientResult> recipients = List.of();
}
