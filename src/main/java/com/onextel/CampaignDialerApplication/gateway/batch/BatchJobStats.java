package com.onextel.CampaignDialerApplication.gateway.batch;

import lombok.Value;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

@Value
public class BatchJobStats {
    int total;
    int pending;
    int inProgress;
    int completed;
    int failed;
    int noResponse;
    int cancelled;

    /**
     * Aggregates recipients into per-status counts. Pure, the six buckets always sum to {@code total}.
     */
    public static BatchJobStats of(Collection<BatchRecipientResult> recipients) {
        Map<RecipientStatus, Integer> counts = new EnumMap<>(RecipientStatus.class);
        int total = 0;
        if (recipients != null) {
            for (BatchRecipientResult recipient : recipients) {
                RecipientStatus status = recipient.getStatus() == null ? RecipientStatus.PENDING : recipient.getStatus();
                counts.merge(status, 1, Integer::sum);
                total++;
            }
        }
        return new BatchJobStats(
                total,
                counts.getOrDefault(RecipientStatus.PENDING, 0),
                counts.getOrDefault(RecipientStatus.IN_PROGRESS, 0),
                counts.getOrDefault(RecipientStatus.COMPLETED, 0),
                counts.getOrDefault(RecipientStatus.FAILED, 0),
                counts.getOrDefault(RecipientStatus.NO_RESPONSE, 0),
                counts.getOrDefault(RecipientStatus.CANCELLED, 0));
    }

    public int getSuccessful() {
        return completed;
    }

    // no_response counts as a failed call
    public int getFailedTotal() {
        return failed + noResponse;
    }

    public int getFinished() {
        return getSuccessful() + getFailedTotal();
    }
}
