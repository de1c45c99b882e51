package com.onextel.CampaignDialerApplication.stream;

public enum SessionState {
    AWAITING_HANDSHAKE,     // buffering until the start event
    ROUTING,                // start received, agent and call lookups running
    ROUTED,                 // handed to the downstream handler
    CLOSED
}
