package com.onextel.CampaignDialerApplication.service.call;

import com.onextel.CampaignDialerApplication.config.WebSocketConfig;
import com.onextel.CampaignDialerApplication.model.Agent;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.model.CallDirection;
import com.onextel.CampaignDialerApplication.model.CallStatus;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.repository.AgentRepository;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import com.onextel.CampaignDialerApplication.repository.PhoneNumberRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Answers the carrier's incoming-call webhook. When the dialed number has an active incoming
 * connection, a Call row is stored and the carrier is told to open a media stream carrying the
 * routing parameters that {@code LiveCallSessionRouter} expects in its start event.
 */
@Slf4j
@Service
public class InboundCallService {
    static final String UNAVAILABLE_RESPONSE =
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response><Say>This number is not available.</Say><Hangup/></Response>";

    private final PhoneNumberRepository phoneNumberRepository;
    private final IncomingConnectionRepository incomingConnectionRepository;
    private final AgentRepository agentRepository;
    private final CallRepository callRepository;
    private final Clock clock;
    private final String streamUrl;

    public InboundCallService(PhoneNumberRepository phoneNumberRepository,
                              IncomingConnectionRepository incomingConnectionRepository,
                              AgentRepository agentRepository,
                              CallRepository callRepository,
                              Clock clock,
                              @Value("${app.public-domain:http://localhost:8080}") String publicDomain) {
        this.phoneNumberRepository = phoneNumberRepository;
        this.incomingConnectionRepository = incomingConnectionRepository;
        this.agentRepository = agentRepository;
        this.callRepository = callRepository;
        this.clock = clock;
        this.streamUrl = publicDomain.replaceFirst("^http", "ws") + WebSocketConfig.STREAM_PATH;
    }

    /**
     * @return the carrier instruction document for this call
     */
    public String handleIncoming(String callSid, String from, String to) {
        Optional<IncomingConnection> connection = phoneNumberRepository.findByPhoneNumber(to)
                .flatMap(number -> incomingConnectionRepository.findActiveByPhoneNumber(number.getId()));
        if (connection.isEmpty()) {
            log.warn("Incoming call {} to {} has no active incoming connection", callSid, to);
            return UNAVAILABLE_RESPONSE;
        }
        Agent agent = agentRepository.findById(connection.get().getAgentId()).orElse(null);
        if (agent == null) {
            log.error("Incoming connection {} references missing agent {}",
                    connection.get().getId(), connection.get().getAgentId());
            return UNAVAILABLE_RESPONSE;
        }

        Call call = Call.builder()
                .id(UUID.randomUUID().toString())
                .userId(connection.get().getUserId())
                .incomingConnectionId(connection.get().getId())
                .carrierCallSid(callSid)
                .phoneNumber(from)
                .direction(CallDirection.INBOUND)
                .status(CallStatus.INITIATED)
                .createdAt(clock.instant())
                .build();
        callRepository.insert(call);
        log.info("Incoming call {} from {} routed to agent {} as call {}", callSid, from, agent.getId(), call.getId());

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("callId", call.getId());
        parameters.put("agentId", agent.getId());
        parameters.put("fromPhone", from);
        if (agent.getFlowId() != null) {
            parameters.put("flowId", agent.getFlowId());
        }
        return streamResponse(parameters);
    }

    String streamResponse(Map<String, String> parameters) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response><Connect>")
                .append("<Stream url=\"").append(HtmlUtils.htmlEscape(streamUrl)).append("\">");
        parameters.forEach((name, value) -> {
            if (value != null) {
                xml.append("<Parameter name=\"").append(HtmlUtils.htmlEscape(name))
                        .append("\" value=\"").append(HtmlUtils.htmlEscape(value)).append("\"/>");
            }
        });
        return xml.append("</Stream></Connect></Response>").toString();
    }
}
