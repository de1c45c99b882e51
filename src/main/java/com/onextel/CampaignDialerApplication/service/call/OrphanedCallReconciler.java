package com.onextel.CampaignDialerApplication.service.call;

import com.onextel.CampaignDialerApplication.dto.OrphanReconciliationReport;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import com.onextel.CampaignDialerApplication.repository.CallRepository;
import com.onextel.CampaignDialerApplication.repository.CampaignRepository;
import com.onextel.CampaignDialerApplication.repository.IncomingConnectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns an owner to calls stored without one, resolving it through the campaign first and the
 * incoming connection second. Calls that cannot be resolved are tagged in their metadata and left
 * for manual review; tagged calls are skipped by later runs.
 */
@Slf4j
@Service
public class OrphanedCallReconciler {
    static final String ORPHANED = "orphaned";

    private final CallRepository callRepository;
    private final CampaignRepository campaignRepository;
    private final IncomingConnectionRepository incomingConnectionRepository;
    private final Clock clock;
    private final int batchSize;
    private final int maxScannedWithoutProgress;

    public OrphanedCallReconciler(CallRepository callRepository,
                                  CampaignRepository campaignRepository,
                                  IncomingConnectionRepository incomingConnectionRepository,
                                  Clock clock,
                                  @Value("${app.calls.orphan-batch-size:500}") int batchSize,
                                  @Value("${app.calls.orphan-max-scan-without-progress:10000}") int maxScannedWithoutProgress) {
        this.callRepository = callRepository;
        this.campaignRepository = campaignRepository;
        this.incomingConnectionRepository = incomingConnectionRepository;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxScannedWithoutProgress = maxScannedWithoutProgress;
    }

    public OrphanReconciliationReport reconcile() {
        int scanned = 0;
        int migrated = 0;
        int orphaned = 0;
        int sinceProgress = 0;
        String lastId = null;

        while (true) {
            List<Call> page = callRepository.findWithoutUser(lastId, batchSize);
            if (page.isEmpty()) {
                break;
            }
            for (Call call : page) {
                scanned++;
                lastId = call.getId();
                if (call.isOrphaned()) {
                    sinceProgress++;
                } else {
                    Optional<String> owner = resolveOwner(call);
                    if (owner.isPresent()) {
                        if (callRepository.assignUser(call.getId(), owner.get())) {
                            migrated++;
                        }
                    } else if (callRepository.replaceMetadata(call.getId(), tagged(call))) {
                        orphaned++;
                    }
                    sinceProgress = 0;
                }
                if (sinceProgress >= maxScannedWithoutProgress) {
                    log.warn("Stopping orphan reconciliation after {} rows without progress", sinceProgress);
                    return report(scanned, migrated, orphaned, true);
                }
            }
        }
        return report(scanned, migrated, orphaned, false);
    }

    private OrphanReconciliationReport report(int scanned, int migrated, int orphaned, boolean stopped) {
        log.info("Orphan reconciliation: scanned={}, migrated={}, orphaned={}", scanned, migrated, orphaned);
        return new OrphanReconciliationReport(scanned, migrated, orphaned, stopped);
    }

    private Optional<String> resolveOwner(Call call) {
        if (call.getCampaignId() != null) {
            Optional<String> owner = campaignRepository.findByIdIncludingDeleted(call.getCampaignId())
                    .map(Campaign::getUserId);
            if (owner.isPresent()) {
                return owner;
            }
        }
        if (call.getIncomingConnectionId() != null) {
            return incomingConnectionRepository.findById(call.getIncomingConnectionId())
                    .map(IncomingConnection::getUserId);
        }
        return Optional.empty();
    }

    private Map<String, Object> tagged(Call call) {
        Map<String, Object> metadata = call.getMetadata() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(call.getMetadata());
        metadata.put(ORPHANED, true);
        metadata.put("reason", reason(call));
        metadata.put("taggedAt", clock.instant().toString());
        return metadata;
    }

    private static String reason(Call call) {
        if (call.getCampaignId() != null) {
            return "campaign_not_found";
        }
        if (call.getIncomingConnectionId() != null) {
            return "incoming_connection_not_found";
        }
        return "no_owner_reference";
    }
}
