package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.aop.RequireServiceUp;
import com.onextel.CampaignDialerApplication.gateway.carrier.CallDetails;
import com.onextel.CampaignDialerApplication.gateway.carrier.CallRecording;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitInterceptor;
import com.onextel.CampaignDialerApplication.service.call.CallLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/calls")
@RequiredArgsConstructor
@RequireServiceUp
public class CallController {
    private final CallLookupService callLookupService;

    @GetMapping("/{id}")
    public Call getCall(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                        @PathVariable String id) {
        return callLookupService.getOwnedCall(id, userId);
    }

    @GetMapping("/{id}/carrier-details")
    public CallDetails getCarrierDetails(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                         @PathVariable String id) {
        return callLookupService.getCarrierDetails(id, userId);
    }

    @GetMapping("/{id}/recordings")
    public List<CallRecording> getRecordings(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                             @PathVariable String id) {
        return callLookupService.getRecordings(id, userId);
    }
}
