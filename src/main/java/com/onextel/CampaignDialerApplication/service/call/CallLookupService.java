package com.onextel.CampaignDialerApplication.service.call;

import com.onextel.CampaignDialerApplication.exception.CallNotFoundException;
import com.onextel.CampaignDialerApplication.gateway.carrier.CallDetails;
import com.onextel.CampaignDialerApplication.gateway.carrier.CallRecording;
import com.onextel.CampaignDialerApplication.gateway.carrier.TelephonyCarrierClient;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to stored calls and to what the carrier knows about them.
 */
@Service
@RequiredArgsConstructor
public class CallLookupService {
    private final CallRepository callRepository;
    private final TelephonyCarrierClient carrierClient;

    public Call getOwnedCall(String callId, String userId) {
        return callRepository.findById(callId)
                .filter(call -> userId.equals(call.getUserId()))
                .orElseThrow(() -> new CallNotFoundException("Call not found: " + callId));
    }

    public CallDetails getCarrierDetails(String callId, String userId) {
        return carrierClient.getCallDetails(carrierSid(getOwnedCall(callId, userId)));
    }

    public List<CallRecording> getRecordings(String callId, String userId) {
        return carrierClient.getCallRecordings(carrierSid(getOwnedCall(callId, userId)));
    }

    private static String carrierSid(Call call) {
        if (call.getCarrierCallSid() == null) {
            throw new CallNotFoundException("Call " + call.getId() + " was never placed with the carrier");
        }
        return call.getCarrierCallSid();
    }
}
