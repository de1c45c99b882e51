package com.onextel.CampaignDialerApplication.gateway.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One recipient in a submit request.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BatchRecipient {
    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("dynamic_data")
    Map<String, String> dynamicData;
}
