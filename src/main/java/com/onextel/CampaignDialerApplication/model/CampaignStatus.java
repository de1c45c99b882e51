package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum CampaignStatus {
    DRAFT,                          // Created, not yet configured
    PENDING,                        // Ready to execute
    SCHEDULED,                      // Waiting for scheduledFor
    RUNNING,                        // Batch job submitted
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    private Set<CampaignStatus> allowedTransitions;

    static {
        DRAFT.allowedTransitions     = Set.of(PENDING, SCHEDULED, RUNNING);
        PENDING.allowedTransitions   = Set.of(SCHEDULED, RUNNING);
        SCHEDULED.allowedTransitions = Set.of(PENDING, RUNNING);
        RUNNING.allowedTransitions   = Set.of(PAUSED, COMPLETED, FAILED, CANCELLED);
        PAUSED.allowedTransitions    = Set.of(RUNNING, COMPLETED, FAILED, CANCELLED);
        COMPLETED.allowedTransitions = Set.of(RUNNING);
        FAILED.allowedTransitions    = Set.of(RUNNING);
        CANCELLED.allowedTransitions = Set.of();
    }

    public static final Set<CampaignStatus> EXECUTABLE = EnumSet.of(DRAFT, PENDING, SCHEDULED);
    public static final Set<CampaignStatus> RESUMABLE = EnumSet.of(PAUSED, COMPLETED, FAILED);
    public static final Set<CampaignStatus> ACTIVE = EnumSet.of(RUNNING, PAUSED);

    public boolean canTransitionTo(CampaignStatus newStatus) {
        return allowedTransitions.contains(newStatus);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static CampaignStatus fromString(String status) {
        try {
            return CampaignStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unexpected campaign status: " + status, e);
        }
    }
}
