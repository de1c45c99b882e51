package com.onextel.CampaignDialerApplication.stream;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

/**
 * Downstream owner of a routed real-time audio session.
 * <p>
 * {@link #attach} is called exactly once, before any {@link #onMessage}. Messages arrive in receipt order.
 */
public interface RealtimeSessionHandler {

    void attach(WebSocketSession session, StreamRoutingContext context);

    void onMessage(WebSocketSession session, String payload);

    void onClose(WebSocketSession session, CloseStatus status);
}
