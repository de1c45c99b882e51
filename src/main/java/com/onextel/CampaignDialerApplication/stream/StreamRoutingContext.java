package com.onextel.CampaignDialerApplication.stream;

import com.onextel.CampaignDialerApplication.model.AgentType;
import lombok.Builder;
import lombok.Value;

/**
 * Routing parameters taken from the stream start event, resolved against stored agents and calls.
 */
@Value
@Builder
public class StreamRoutingContext {
    String callId;
    String agentId;
    String externalAgentId;
    AgentType agentType;
    String streamSid;

    // Only meaningful for flow agents
    String flowId;
    String executionId;

    String fromPhone;
    String contactName;
}
