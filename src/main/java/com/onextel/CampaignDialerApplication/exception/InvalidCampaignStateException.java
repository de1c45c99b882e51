package com.onextel.CampaignDialerApplication.exception;

import com.onextel.CampaignDialerApplication.model.CampaignStatus;
import lombok.Getter;

@Getter
public class InvalidCampaignStateException extends RuntimeException {
    private final CampaignStatus currentStatus;

    public InvalidCampaignStateException(String message, CampaignStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }
}
