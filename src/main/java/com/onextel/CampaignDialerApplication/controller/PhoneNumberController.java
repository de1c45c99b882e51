package com.onextel.CampaignDialerApplication.controller;

import com.onextel.CampaignDialerApplication.aop.RequireServiceUp;
import com.onextel.CampaignDialerApplication.dto.PhoneNumberPurchaseRequest;
import com.onextel.CampaignDialerApplication.gateway.carrier.AvailableNumber;
import com.onextel.CampaignDialerApplication.gateway.carrier.OwnedNumber;
import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitInterceptor;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimitPolicy;
import com.onextel.CampaignDialerApplication.resource.ratelimit.RateLimited;
import com.onextel.CampaignDialerApplication.service.phone.PhoneNumberProvisioningService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/phone-numbers")
@RequiredArgsConstructor
@RequireServiceUp
public class PhoneNumberController {
    private final PhoneNumberProvisioningService provisioningService;

    @GetMapping
    public List<OwnedNumber> listOwned(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId) {
        return provisioningService.listOwned(userId);
    }

    @GetMapping("/available")
    public List<AvailableNumber> searchAvailable(@RequestParam(defaultValue = "US") String country,
                                                 @RequestParam(required = false) String areaCode,
                                                 @RequestParam(required = false) String contains,
                                                 @RequestParam(defaultValue = "20") int limit) {
        return provisioningService.search(country, areaCode, contains, limit);
    }

    @PostMapping("/purchase")
    @RateLimited(RateLimitPolicy.PAYMENT)
    public ResponseEntity<PhoneNumber> purchase(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                                @RequestBody PhoneNumberPurchaseRequest request) {
        request.validate();
        PhoneNumber number = provisioningService.purchase(userId, request.getPhoneNumber(), request.getFriendlyName());
        return ResponseEntity.status(HttpStatus.CREATED).body(number);
    }

    @PostMapping("/{sid}/webhook")
    public OwnedNumber configureWebhook(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                        @PathVariable String sid) {
        return provisioningService.configureWebhook(userId, sid);
    }

    @DeleteMapping("/{sid}/webhook")
    public OwnedNumber clearWebhook(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                    @PathVariable String sid) {
        return provisioningService.clearWebhook(userId, sid);
    }

    @DeleteMapping("/{sid}")
    public ResponseEntity<Void> release(@RequestHeader(RateLimitInterceptor.USER_HEADER) String userId,
                                        @PathVariable String sid) {
        provisioningService.release(userId, sid);
        return ResponseEntity.noContent().build();
    }
}
