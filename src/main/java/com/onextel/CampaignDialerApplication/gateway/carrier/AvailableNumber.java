package com.onextel.CampaignDialerApplication.gateway.carrier;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AvailableNumber {
    String phoneNumber;
    String friendlyName;
    String locality;
    String region;
    String isoCountry;
    boolean voiceCapable;
    boolean smsCapable;
}
