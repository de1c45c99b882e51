package com.onextel.CampaignDialerApplication.exception;

import lombok.Getter;

/**
 * The batch calling API or the carrier returned an error or an unusable response.
 * {@code statusCode} is null when no HTTP response was received.
 */
@Getter
public class RemoteGatewayException extends RuntimeException {
    private final String operation;
    private final Integer statusCode;

    public RemoteGatewayException(String operation, Integer statusCode, String message) {
        super(message);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public RemoteGatewayException(String operation, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }
}
