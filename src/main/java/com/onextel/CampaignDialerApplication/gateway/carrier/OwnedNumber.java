package com.onextel.CampaignDialerApplication.gateway.carrier;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OwnedNumber {
    String sid;
    String phoneNumber;
    String friendlyName;
    String voiceUrl;
    String statusCallback;
}
