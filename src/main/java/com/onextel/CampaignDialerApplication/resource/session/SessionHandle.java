package com.onextel.CampaignDialerApplication.resource.session;

import lombok.Value;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * In-memory record of a live session and the identities it is counted against.
 */
@Value
public class SessionHandle {
    String sessionId;
    String userId;
    String remoteAddress;
    WebSocketSession session;
    Instant connectedAt;
}
