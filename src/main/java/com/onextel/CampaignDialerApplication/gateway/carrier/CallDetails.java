package com.onextel.CampaignDialerApplication.gateway.carrier;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CallDetails {
    String sid;
    String from;
    String to;
    String status;
    String direction;
    int durationSeconds;
    String startTime;
    String endTime;
}
