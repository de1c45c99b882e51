package com.onextel.CampaignDialerApplication.exception;

import lombok.Getter;

@Getter
public class InsufficientBalanceException extends RuntimeException {
    private final long required;
    private final long available;

    public InsufficientBalanceException(long required, long available) {
        super(String.format("Insufficient credits: %d required, %d available", required, available));
        this.required = required;
        this.available = available;
    }
}
