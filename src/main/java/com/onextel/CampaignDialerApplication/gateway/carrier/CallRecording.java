package com.onextel.CampaignDialerApplication.gateway.carrier;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CallRecording {
    String sid;
    int durationSeconds;
    String mediaUrl;
}
