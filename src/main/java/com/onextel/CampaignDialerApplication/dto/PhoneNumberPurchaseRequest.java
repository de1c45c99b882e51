package com.onextel.CampaignDialerApplication.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PhoneNumberPurchaseRequest {
    private String phoneNumber;
    private String friendlyName;

    public void validate() {
        if (phoneNumber == null || !phoneNumber.matches("^\\+[1-9]\\d{6,14}$")) {
            throw new IllegalArgumentException("phoneNumber must be in E.164 format");
        }
    }
}
