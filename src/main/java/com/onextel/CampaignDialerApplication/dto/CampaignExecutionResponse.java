package com.onextel.CampaignDialerApplication.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CampaignExecutionResponse {
    String campaignId;
    String batchJobId;
    String batchJobStatus;
    int totalCallsScheduled;
    long estimatedCredits;
    long availableCredits;
}
