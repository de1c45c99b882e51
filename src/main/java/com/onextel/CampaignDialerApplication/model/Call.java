package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)  // Avoid storing null values
@JsonIgnoreProperties(ignoreUnknown = true)
public class Call {
    private String id;
    private String userId;

    // Outbound calls reference a campaign and contact, inbound calls an incoming connection
    private String campaignId;
    private String contactId;
    private String incomingConnectionId;

    private String carrierCallSid;
    private String conversationId;
    private String phoneNumber;
    private CallDirection direction;

    @Builder.Default
    private CallStatus status = CallStatus.INITIATED;

    private Integer durationSeconds;
    private String transcript;
    private String recordingUrl;

    // Reconciliation facts, e.g. {"orphaned": true}
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant endedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    public boolean isOrphaned() {
        return metadata != null && Boolean.TRUE.equals(metadata.get("orphaned"));
    }
}
