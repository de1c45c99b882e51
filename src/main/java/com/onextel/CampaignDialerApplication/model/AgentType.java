package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentType {
    NATURAL,    // free-form conversational agent
    FLOW,       // scripted flow, needs flow/execution ids on the stream
    INCOMING;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AgentType fromString(String type) {
        if (type == null || type.isBlank()) {
            return NATURAL;
        }
        try {
            return AgentType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unexpected agent type: " + type, e);
        }
    }
}
