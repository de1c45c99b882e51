package com.onextel.CampaignDialerApplication.gateway.batch;

import lombok.Value;

import java.util.List;

@Value
public class BatchJobPage {
    List<BatchJob> jobs;
    String nextCursor;
    boolean hasMore;
}
