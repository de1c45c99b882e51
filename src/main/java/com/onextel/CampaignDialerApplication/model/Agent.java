package com.onextel.CampaignDialerApplication.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {
    private String id;
    private String userId;
    private String name;
    private AgentType type;

    // Identity on the conversational voice provider, null until synced
    private String externalAgentId;
    private String flowId;

    public boolean isSynced() {
        return externalAgentId != null && !externalAgentId.isBlank();
    }
}
