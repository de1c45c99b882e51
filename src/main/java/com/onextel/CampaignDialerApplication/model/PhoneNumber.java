package com.onextel.CampaignDialerApplication.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhoneNumber {
    private String id;
    private String userId;
    private String phoneNumber;
    private String carrierSid;

    // Dialer number id registered with the voice provider
    private String externalNumberId;
}
