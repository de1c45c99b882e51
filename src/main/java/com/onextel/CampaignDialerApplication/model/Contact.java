package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Contact {
    private String id;
    private String campaignId;
    private String firstName;
    private String lastName;
    private String phoneNumber;
    private String email;

    // Forwarded verbatim as dynamic_data to the batch calling payload
    @Builder.Default
    private Map<String, Object> customFields = new LinkedHashMap<>();
}
