package com.onextel.CampaignDialerApplication.gateway.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmitBatchRequest {
    @JsonProperty("call_name")
    String callName;

    @JsonProperty("agent_id")
    String agentId;

    @JsonProperty("agent_phone_number_id")
    String agentPhoneNumberId;

    @JsonProperty("recipients")
    List<BatchRecipient> recipients;

    @JsonProperty("scheduled_time_unix")
    Long scheduledTimeUnix;
}
