package com.onextel.CampaignDialerApplication.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PhoneNumberAssignmentRequest {
    private String phoneNumberId;

    public void validate() {
        if (phoneNumberId == null || phoneNumberId.isBlank()) {
            throw new IllegalArgumentException("phoneNumberId is required");
        }
    }
}
