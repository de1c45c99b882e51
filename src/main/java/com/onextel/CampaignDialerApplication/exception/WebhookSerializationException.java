package com.onextel.CampaignDialerApplication.exception;

public class WebhookSerializationException extends RuntimeException {

    public WebhookSerializationException(String message) {
        super(message);
    }

    public WebhookSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
