package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum CallStatus {
    INITIATED("initiated"),
    RINGING("ringing"),
    ANSWERED("answered"),
    COMPLETED("completed"),
    FAILED("failed"),
    NO_ANSWER("no-answer"),
    BUSY("busy");

    private final String value;

    CallStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String dbValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == NO_ANSWER || this == BUSY;
    }

    /**
     * Position in the forward-only lifecycle. All terminal statuses share the highest rank.
     */
    public int rank() {
        return switch (this) {
            case INITIATED -> 0;
            case RINGING -> 1;
            case ANSWERED -> 2;
            default -> 3;
        };
    }

    public boolean isFailure() {
        return this == FAILED || this == NO_ANSWER || this == BUSY;
    }

    @JsonCreator
    public static CallStatus fromString(String status) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(status) || s.name().equalsIgnoreCase(status))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unexpected call status: " + status));
    }

    /**
     * Maps a carrier status callback value onto the local call lifecycle.
     * Unknown values return {@code null} so callers can ignore them.
     */
    public static CallStatus fromCarrierStatus(String carrierStatus) {
        if (carrierStatus == null) {
            return null;
        }
        return switch (carrierStatus.toLowerCase()) {
            case "queued", "initiated" -> INITIATED;
            case "ringing" -> RINGING;
            case "in-progress" -> ANSWERED;
            case "completed" -> COMPLETED;
            case "busy" -> BUSY;
            case "no-answer" -> NO_ANSWER;
            case "failed", "canceled" -> FAILED;
            default -> null;
        };
    }
}
