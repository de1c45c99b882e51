package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CallDirection {
    INBOUND,
    OUTBOUND;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static CallDirection fromString(String direction) {
        if (direction == null) {
            return null;
        }
        // carrier reports outbound-api / outbound-dial
        return direction.toLowerCase().startsWith("outbound") ? OUTBOUND : INBOUND;
    }
}
