package com.onextel.CampaignDialerApplication.gateway.batch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecipientStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    NO_RESPONSE,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    // Unknown values count as pending so aggregated buckets always add up to the total
    public static RecipientStatus fromRemote(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return RecipientStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
