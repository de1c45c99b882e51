package com.onextel.CampaignDialerApplication.resource.session;

import lombok.Value;

@Value
public class SessionRegistryStats {
    int totalConnections;
    int uniqueUsers;
    int uniqueAddresses;
    SessionLimits limits;
    double utilizationPercent;
}
