package com.onextel.CampaignDialerApplication.resource.session;

import lombok.Value;

@Value
public class SessionLimits {
    public static final String MAX_PER_PROCESS_KEY = "max_ws_connections_per_process";
    public static final String MAX_PER_USER_KEY = "max_ws_connections_per_user";
    public static final String MAX_PER_ADDRESS_KEY = "max_ws_connections_per_ip";

    public static final SessionLimits DEFAULTS = new SessionLimits(1000, 5, 10);

    int maxPerProcess;
    int maxPerUser;
    int maxPerAddress;
}
