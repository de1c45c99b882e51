package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.service.call.CallStatusService;
import com.onextel.CampaignDialerApplication.service.call.InboundCallService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Form-encoded callbacks from the telephony carrier. Always acknowledged with 2xx so the carrier does not retry.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks/carrier")
@RequiredArgsConstructor
public class CarrierWebhookController {
    private final CallStatusService callStatusService;
    private final InboundCallService inboundCallService;

    @PostMapping(value = "/incoming", produces = MediaType.APPLICATION_XML_VALUE)
    public String incoming(@RequestParam("CallSid") String callSid,
                           @RequestParam("From") String from,
                           @RequestParam("To") String to) {
        return inboundCallService.handleIncoming(callSid, from, to);
    }

    @PostMapping("/status")
    public ResponseEntity<Void> status(@RequestParam("CallSid") String callSid,
                                       @RequestParam("CallStatus") String callStatus,
                                       @RequestParam(value = "CallDuration", required = false) Integer callDuration,
                                       @RequestParam(value = "RecordingUrl", required = false) String recordingUrl) {
        callStatusService.applyCarrierStatus(callSid, callStatus, callDuration, recordingUrl);
        return ResponseEntity.noContent().build();
    }
}
