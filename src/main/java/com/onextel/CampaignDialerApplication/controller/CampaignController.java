package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.aop.RequireServiceUp;
import com.onextel.CampaignDialerApplication.dto.BatchStatusResponse;
import com.onextel.CampaignDialerApplication.dto.CampaignExecutionResponse;
import com.onextel.CampaignDialerApplication.dto.CampaignValidationResult;
import com.onextel.CampaignDialerApplication.dto.PauseCampaignRequest;
import com.onextel.CampaignDialerApplication.dto.PhoneNumberAssignmentRequest;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitInterceptor;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitPolicy;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimited;
import com.onextel.CampaignDialerApplication.service.campaign.CampaignExecutor;
import com.onextel.CampaignDialerApplication.service.campaign.PhoneNumberAssignmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
@RequireServiceUp
public class CampaignController {
    private final CampaignExecutor campaignExecutor;
    private final PhoneNumberAssignmentService assignmentService;

    @GetMapping("/{id}")
    public Campaign getCampaign(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                @PathVariable String id) {
        return campaignExecutor.getOwnedCampaign(id, userId);
    }

    @GetMapping("/{id}/validate")
    public CampaignValidationResult validate(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                             @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        return campaignExecutor.validate(id);
    }

    @PostMapping("/{id}/execute")
    @RateLimited(RateLimitPolicy.STRICT)
    public CampaignExecutionResponse execute(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                             @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        return campaignExecutor.execute(id);
    }

    @PostMapping("/{id}/pause")
    public Campaign pause(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                          @PathVariable String id,
                          @RequestBody(required = false) PauseCampaignRequest request) {
        campaignExecutor.getOwnedCampaign(id, userId);
        PauseCampaignRequest.Reason reason = request == null || request.getReason() == null
                ? PauseCampaignRequest.Reason.MANUAL : request.getReason();
        return campaignExecutor.pause(id, reason);
    }

    @PostMapping("/{id}/resume")
    public Campaign resume(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                           @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        return campaignExecutor.resume(id);
    }

    @PostMapping("/{id}/cancel")
    public Campaign cancel(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                           @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        return campaignExecutor.cancel(id);
    }

    @PostMapping("/{id}/retry")
    @RateLimited(RateLimitPolicy.STRICT)
    public Campaign retry(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                          @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        return campaignExecutor.retry(id);
    }

    @GetMapping("/{id}/batch-status")
    public BatchStatusResponse batchStatus(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                           @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        return campaignExecutor.refreshStatus(id);
    }

    @PutMapping("/{id}/phone-number")
    public Campaign assignPhoneNumber(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                      @PathVariable String id,
                                      @RequestBody PhoneNumberAssignmentRequest request) {
        request.validate();
        campaignExecutor.getOwnedCampaign(id, userId);
        return assignmentService.assignToCampaign(id, request.getPhoneNumberId());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                       @PathVariable String id) {
        campaignExecutor.getOwnedCampaign(id, userId);
        campaignExecutor.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/restore")
    public Campaign restore(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                            @PathVariable String id) {
        return campaignExecutor.restore(id, userId);
    }
}
