package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.aop.RequireServiceUp;
import com.onextel.CampaignDialerApplication.dto.IncomingConnectionRequest;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitInterceptor;
import com.onextel.CampaignDialerApplication.service.campaign.PhoneNumberAssignmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/incoming-connections")
@RequiredArgsConstructor
@RequireServiceUp
public class IncomingConnectionController {
    private final PhoneNumberAssignmentService assignmentService;

    @PostMapping
    public ResponseEntity<IncomingConnection> create(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                                     @RequestBody IncomingConnectionRequest request) {
        request.validate();
        IncomingConnection connection = assignmentService.createIncomingConnection(
                userId, request.getAgentId(), request.getPhoneNumberId());
        return ResponseEntity.status(HttpStatus.CREATED).body(connection);
    }
}
