package com.onextel.CampaignDialerApplication.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.model.Agent;
import com.onextel.CampaignDialerApplication.repository.AgentRepository;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import com.onextel.CampaignDialerApplication.resource.session.ConcurrentSessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Accepts carrier media-stream connections whose destination is only known once the {@code start}
 * event arrives.
 * <p>
 * Until then every message is buffered. On {@code start} the agent and the call are resolved off the
 * socket thread, the session is attached to the {@link RealtimeSessionHandler}, and after a short
 * delay the buffered messages are replayed in receipt order. The {@code connected} and {@code start}
 * events are consumed here; the handler receives their content through {@link StreamRoutingContext}.
 */
@Slf4j
@Component
public class LiveCallSessionRouter extends TextWebSocketHandler {
    static final String EVENT_CONNECTED = "connected";
    static final String EVENT_START = "start";

    static final CloseStatus MISSING_PARAMETERS = CloseStatus.POLICY_VIOLATION.withReason("Missing required parameters");
    static final CloseStatus AGENT_NOT_FOUND = CloseStatus.POLICY_VIOLATION.withReason("Agent not found");
    static final CloseStatus CALL_NOT_FOUND = CloseStatus.POLICY_VIOLATION.withReason("Call not found");
    static final CloseStatus HANDSHAKE_TIMEOUT = CloseStatus.POLICY_VIOLATION.withReason("Start event timeout");
    static final CloseStatus ROUTING_ERROR = CloseStatus.SERVER_ERROR.withReason("Internal server error during routing");
    static final CloseStatus TOO_MANY_SESSIONS = CloseStatus.SERVICE_OVERLOAD.withReason("Too many connections");

    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();

    private final AgentRepository agentRepository;
    private final CallRepository callRepository;
    private final ConcurrentSessionRegistry sessionRegistry;
    private final RealtimeSessionHandler sessionHandler;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final long handshakeTimeoutMs;
    private final long replayDelayMs;

    public LiveCallSessionRouter(AgentRepository agentRepository,
                                 CallRepository callRepository,
                                 ConcurrentSessionRegistry sessionRegistry,
                                 RealtimeSessionHandler sessionHandler,
                                 @Qualifier("streamRouterScheduler") ScheduledExecutorService scheduler,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry,
                                 @Value("${app.stream.handshake-timeout-ms:10000}") long handshakeTimeoutMs,
                                 @Value("${app.stream.replay-delay-ms:100}") long replayDelayMs) {
        this.agentRepository = agentRepository;
        this.callRepository = callRepository;
        this.sessionRegistry = sessionRegistry;
        this.sessionHandler = sessionHandler;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
        this.replayDelayMs = replayDelayMs;
    }

    // ========== WebSocket Callbacks ========== //

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String address = remoteAddress(session);
        if (!sessionRegistry.addConnection(session, null, address)) {
            reject(session, TOO_MANY_SESSIONS, "session_limit");
            return;
        }
        LiveSession live = new LiveSession(session);
        sessions.put(session.getId(), live);
        synchronized (live) {
            live.setHandshakeTimer(scheduler.schedule(
                    () -> onHandshakeTimeout(live), handshakeTimeoutMs, TimeUnit.MILLISECONDS));
        }
        log.info("Stream {} accepted from {}, waiting for start event", session.getId(), address);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        LiveSession live = sessions.get(session.getId());
        if (live == null) {
            return;
        }
        String payload = message.getPayload();
        synchronized (live) {
            switch (live.getState()) {
                case CLOSED -> {
                    // late frame after close, dropped
                }
                case ROUTED -> {
                    if (live.isReplayed()) {
                        sessionHandler.onMessage(session, payload);
                    } else {
                        live.append(payload);
                    }
                }
                case ROUTING -> live.append(payload);
                case AWAITING_HANDSHAKE -> onHandshakeMessage(live, payload);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionRegistry.removeConnection(session.getId());
        LiveSession live = sessions.remove(session.getId());
        if (live == null) {
            return;
        }
        boolean handedOff;
        synchronized (live) {
            live.close();
            handedOff = live.isHandedOff();
        }
        if (handedOff) {
            sessionHandler.onClose(session, status);
        }
        log.info("Stream {} closed ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on stream {}: {}", session.getId(), exception.getMessage());
    }

    // ========== Handshake ========== //

    private void onHandshakeMessage(LiveSession live, String payload) {
        JsonNode root = parse(payload);
        String event = root.path("event").asText("");
        if (!EVENT_START.equals(event)) {
            if (!EVENT_CONNECTED.equals(event)) {
                live.append(payload);
            }
            log.debug("Stream {} buffered '{}' while awaiting start", live.getId(), event);
            return;
        }
        live.startRouting();

        JsonNode start = root.path("start");
        JsonNode params = start.path("customParameters");
        String callId = textOrNull(params, "callId");
        String agentId = textOrNull(params, "agentId");
        if (callId == null || agentId == null) {
            log.warn("Stream {} start event without callId/agentId", live.getId());
            closeSession(live, MISSING_PARAMETERS, "missing_parameters");
            return;
        }
        StreamRoutingContext.StreamRoutingContextBuilder context = StreamRoutingContext.builder()
                .callId(callId)
                .streamSid(textOrNull(start, "streamSid"))
                .flowId(textOrNull(params, "flowId"))
                .executionId(textOrNull(params, "executionId"))
                .fromPhone(params.hasNonNull("fromPhone") ? textOrNull(params, "fromPhone") : textOrNull(params, "from"))
                .contactName(textOrNull(params, "contactName"));
        try {
            scheduler.execute(() -> route(live, agentId, context));
        } catch (RejectedExecutionException e) {
            log.error("Stream {} could not be routed, executor rejected the task", live.getId());
            closeSession(live, ROUTING_ERROR, "routing_error");
        }
    }

    private void route(LiveSession live, String agentId, StreamRoutingContext.StreamRoutingContextBuilder builder) {
        WebSocketSession session = live.getSession();
        try {
            // the handshake may carry either our id or the voice provider's id
            Agent agent = agentRepository.findById(agentId)
                    .or(() -> agentRepository.findByExternalAgentId(agentId))
                    .orElse(null);
            if (agent == null) {
                log.warn("Stream {} references unknown agent {}", live.getId(), agentId);
                closeSession(live, AGENT_NOT_FOUND, "agent_not_found");
                return;
            }
            StreamRoutingContext context = builder
                    .agentId(agent.getId())
                    .externalAgentId(agent.getExternalAgentId())
                    .agentType(agent.getType())
                    .build();
            if (!callRepository.existsById(context.getCallId())) {
                log.warn("Stream {} references unknown call {}, possible spoofing attempt from {}",
                        live.getId(), context.getCallId(), remoteAddress(session));
                closeSession(live, CALL_NOT_FOUND, "call_not_found");
                return;
            }

            synchronized (live) {
                if (live.getState() != SessionState.ROUTING) {
                    return;
                }
                live.markRouted(context);
            }
            sessionHandler.attach(session, context);
            meterRegistry.counter("stream.routed", "agentType", agent.getType().dbValue()).increment();
            log.info("Stream {} routed to call {} (agent {}, type {})",
                    live.getId(), context.getCallId(), agent.getId(), agent.getType().dbValue());

            scheduler.schedule(() -> replay(live), replayDelayMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.error("Routing failed for stream {}", live.getId(), e);
            closeSession(live, ROUTING_ERROR, "routing_error");
        }
    }

    /**
     * Delivers the buffered messages, then switches the session to direct forwarding.
     * Runs under the session monitor so frames arriving meanwhile queue behind the replay.
     */
    private void replay(LiveSession live) {
        synchronized (live) {
            if (live.getState() != SessionState.ROUTED) {
                return;
            }
            List<String> buffered = live.drain();
            log.debug("Replaying {} buffered messages on stream {}", buffered.size(), live.getId());
            for (String payload : buffered) {
                sessionHandler.onMessage(live.getSession(), payload);
            }
        }
    }

    private void onHandshakeTimeout(LiveSession live) {
        synchronized (live) {
            if (live.getState() != SessionState.AWAITING_HANDSHAKE) {
                return;
            }
        }
        log.warn("Stream {} sent no start event within {} ms", live.getId(), handshakeTimeoutMs);
        closeSession(live, HANDSHAKE_TIMEOUT, "handshake_timeout");
    }

    // ========== Lifecycle ========== //

    /**
     * Cancels every pending handshake timer. Open sockets are closed by the session registry.
     */
    public void shutdown() {
        sessions.values().forEach(live -> {
            synchronized (live) {
                live.cancelHandshakeTimer();
            }
        });
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Stream router shutdown complete");
    }

    public int activeSessions() {
        return sessions.size();
    }

    // ========== Helpers ========== //

    private void closeSession(LiveSession live, CloseStatus status, String reason) {
        synchronized (live) {
            if (!live.close()) {
                return;
            }
        }
        reject(live.getSession(), status, reason);
    }

    private void reject(WebSocketSession session, CloseStatus status, String reason) {
        meterRegistry.counter("stream.rejected", "reason", reason).increment();
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Closing stream {} failed: {}", session.getId(), e.getMessage());
        }
    }

    private JsonNode parse(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON frame on stream: {}", e.getOriginalMessage());
            return objectMapper.missingNode();
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }

    static String remoteAddress(WebSocketSession session) {
        HttpHeaders headers = session.getHandshakeHeaders();
        String forwarded = headers == null ? null : headers.getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress address = session.getRemoteAddress();
        if (address == null) {
            return null;
        }
        return address.getAddress() == null ? address.getHostString() : address.getAddress().getHostAddress();
    }
}
