package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Campaign {
    private String id;
    private String userId;
    private String name;
    private String type;

    private String agentId;
    private String phoneNumberId;

    @Builder.Default
    private CampaignStatus status = CampaignStatus.DRAFT;

    // Remote batch job mirror
    private String batchJobId;
    private String batchJobStatus;

    // Counters never decrease, see CampaignRepository.applyCounters
    private int totalContacts;
    private int completedCalls;
    private int successfulCalls;
    private int failedCalls;

    private String pauseReason;
    private String errorMessage;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant scheduledFor;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant completedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant deletedAt;

    public boolean hasBatchJob() {
        return batchJobId != null && !batchJobId.isBlank();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
