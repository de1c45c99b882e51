package com.onextel.CampaignDialerApplication.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomingConnection {
    private String id;
    private String userId;
    private String agentId;
    private String phoneNumberId;

    @Builder.Default
    private boolean active = true;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;
}
