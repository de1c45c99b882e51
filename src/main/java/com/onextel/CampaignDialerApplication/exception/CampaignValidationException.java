package com.onextel.CampaignDialerApplication.exception;

import com.onextel.CampaignDialerApplication.dto.CampaignValidationResult;
import lombok.Getter;

@Getter
public class CampaignValidationException extends RuntimeException {
    private final CampaignValidationResult result;

    public CampaignValidationException(CampaignValidationResult result) {
        super(String.join("; ", result.getErrors()));
        this.result = result;
    }
}
