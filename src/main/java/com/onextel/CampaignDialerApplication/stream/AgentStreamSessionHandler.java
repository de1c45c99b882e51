package com.onextel.CampaignDialerApplication.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.model.AgentType;
import com.onextel.CampaignDialerApplication.service.call.CallStatusService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single downstream handler for every agent type. Tracks the call for the lifetime of the stream:
 * answered on attach, completed with the streamed duration on {@code stop} or on close.
 */
@Slf4j
@Component
public class AgentStreamSessionHandler implements RealtimeSessionHandler {
    private final Map<String, ActiveStream> streams = new ConcurrentHashMap<>();

    private final CallStatusService callStatusService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AgentStreamSessionHandler(CallStatusService callStatusService, ObjectMapper objectMapper, Clock clock) {
        this.callStatusService = callStatusService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    static class ActiveStream {
        final StreamRoutingContext context;
        final Instant attachedAt;
        int mediaFrames;
        boolean finished;

        ActiveStream(StreamRoutingContext context, Instant attachedAt) {
            this.context = context;
            this.attachedAt = attachedAt;
        }
    }

    @Override
    public void attach(WebSocketSession session, StreamRoutingContext context) {
        streams.put(session.getId(), new ActiveStream(context, clock.instant()));
        callStatusService.markAnswered(context.getCallId());
        if (context.getAgentType() == AgentType.FLOW) {
            log.info("Call {} streaming to flow agent {} (flow {}, execution {})",
                    context.getCallId(), context.getAgentId(), context.getFlowId(), context.getExecutionId());
        } else {
            log.info("Call {} streaming to agent {}", context.getCallId(), context.getAgentId());
        }
    }

    @Override
    public void onMessage(WebSocketSession session, String payload) {
        ActiveStream stream = streams.get(session.getId());
        if (stream == null) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed frame on call {}: {}", stream.context.getCallId(), e.getOriginalMessage());
            return;
        }
        switch (root.path("event").asText("")) {
            case "media" -> stream.mediaFrames++;
            case "mark" -> log.debug("Mark '{}' on call {}", root.path("mark").path("name").asText(), stream.context.getCallId());
            case "stop" -> finish(session.getId(), stream);
            default -> log.debug("Unhandled stream event on call {}", stream.context.getCallId());
        }
    }

    @Override
    public void onClose(WebSocketSession session, CloseStatus status) {
        ActiveStream stream = streams.remove(session.getId());
        if (stream != null) {
            finish(session.getId(), stream);
        }
    }

    private void finish(String sessionId, ActiveStream stream) {
        synchronized (stream) {
            if (stream.finished) {
                return;
            }
            stream.finished = true;
        }
        int seconds = (int) Duration.between(stream.attachedAt, clock.instant()).getSeconds();
        log.info("Stream {} for call {} finished after {}s, {} media frames",
                sessionId, stream.context.getCallId(), seconds, stream.mediaFrames);
        callStatusService.markCompleted(stream.context.getCallId(), seconds);
    }

    int mediaFrames(String sessionId) {
        ActiveStream stream = streams.get(sessionId);
        return stream == null ? 0 : stream.mediaFrames;
    }

    public int activeStreams() {
        return streams.size();
    }
}
