package com.onextel.CampaignDialerApplication.stream;

import lombok.Getter;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-connection routing state. Guarded by its own monitor; the router holds it for every transition.
 */
@Getter
class LiveSession {
    private final WebSocketSession session;
    private final List<String> buffer = new ArrayList<>();
    private SessionState state = SessionState.AWAITING_HANDSHAKE;
    private ScheduledFuture<?> handshakeTimer;
    private StreamRoutingContext context;
    private boolean handedOff;
    private boolean replayed;

    LiveSession(WebSocketSession session) {
        this.session = session;
    }

    String getId() {
        return session.getId();
    }

    void append(String payload) {
        buffer.add(payload);
    }

    List<String> drain() {
        List<String> drained = new ArrayList<>(buffer);
        buffer.clear();
        replayed = true;
        return drained;
    }

    void setHandshakeTimer(ScheduledFuture<?> handshakeTimer) {
        this.handshakeTimer = handshakeTimer;
    }

    void cancelHandshakeTimer() {
        if (handshakeTimer != null) {
            handshakeTimer.cancel(false);
            handshakeTimer = null;
        }
    }

    void startRouting() {
        cancelHandshakeTimer();
        state = SessionState.ROUTING;
    }

    void markRouted(StreamRoutingContext context) {
        this.context = context;
        this.state = SessionState.ROUTED;
        this.handedOff = true;
    }

    /**
     * @return false if the session was already closed
     */
    boolean close() {
        if (state == SessionState.CLOSED) {
            return false;
        }
        state = SessionState.CLOSED;
        cancelHandshakeTimer();
        buffer.clear();
        return true;
    }
}
