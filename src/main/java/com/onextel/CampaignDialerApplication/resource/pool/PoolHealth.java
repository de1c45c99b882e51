package com.onextel.CampaignDialerApplication.resource.pool;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoolHealth {
    boolean healthy;
    int total;
    int idle;
    int active;
    int waiting;
    String error;

    public static PoolHealth unavailable(String error) {
        return new PoolHealth(false, 0, 0, 0, 0, error);
    }
}
