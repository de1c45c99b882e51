package com.onextel.CampaignDialerApplication.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String error;
    String message;
    Map<String, Object> details;

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }
}
