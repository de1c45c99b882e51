package com.onextel.CampaignDialerApplication.dto;

import lombok.Value;

@Value
public class OrphanReconciliationReport {
    int scanned;
    int migrated;
    int orphaned;
    boolean stoppedWithoutProgress;
}
