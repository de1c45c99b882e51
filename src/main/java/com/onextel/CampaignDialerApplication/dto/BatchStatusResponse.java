package com.onextel.CampaignDialerApplication.dto;

import com.onextel.CampaignDialerApplication.gateway.batch.BatchJob;
import com.onextel.CampaignDialerApplication.gateway.batch.BatchJobStats;
import com.onextel.CampaignDialerApplication.model.Campaign;
import lombok.Value;

@Value
public class BatchStatusResponse {
    Campaign campaign;
    BatchJob batchJob;
    BatchJobStats stats;
}
