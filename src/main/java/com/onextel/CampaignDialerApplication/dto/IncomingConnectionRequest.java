package com.onextel.CampaignDialerApplication.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class IncomingConnectionRequest {
    private String agentId;
    private String phoneNumberId;

    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (phoneNumberId == null || phoneNumberId.isBlank()) {
            throw new IllegalArgumentException("phoneNumberId is required");
        }
    }
}
