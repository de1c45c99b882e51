package com.onextel.CampaignDialerApplication.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PauseCampaignRequest {
    private Reason reason = Reason.MANUAL;

    public enum Reason {
        MANUAL,
        SCHEDULED;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Reason fromString(String value) {
            if (value == null || value.isBlank()) {
                return MANUAL;
            }
            try {
                return Reason.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("reason must be 'manual' or 'scheduled'", e);
            }
        }
    }
}
