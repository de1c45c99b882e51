package com.onextel.CampaignDialerApplication.gateway.batch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchJobStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Lenient parse of a remote status; blank or unknown values fall back to {@code defaultStatus}.
     */
    public static BatchJobStatus fromRemote(String value, BatchJobStatus defaultStatus) {
        if (value == null || value.isBlank()) {
            return defaultStatus;
        }
        try {
            return BatchJobStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return defaultStatus;
        }
    }
}
