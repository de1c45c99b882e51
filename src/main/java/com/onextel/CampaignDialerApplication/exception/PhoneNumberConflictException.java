package com.onextel.CampaignDialerApplication.exception;

import lombok.Getter;

/**
 * A phone number is already bound to an active campaign or to an incoming connection.
 */
@Getter
public class PhoneNumberConflictException extends RuntimeException {
    public static final String INCOMING_CONNECTION = "incoming_connection";
    public static final String ACTIVE_CAMPAIGN = "active_campaign";

    private final String conflictType;
    private final String conflictingId;
    private final String conflictingName;

    public PhoneNumberConflictException(String message, String conflictType,
                                        String conflictingId, String conflictingName) {
        super(message);
        this.conflictType = conflictType;
        this.conflictingId = conflictingId;
        this.conflictingName = conflictingName;
    }
}
