package com.onextel.CampaignDialerApplication.common.shutdown;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide shutting-down flag. Once set it is never cleared.
 */
@Slf4j
@Component
public class ServiceLifecycle {
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * @return true for the caller that flipped the flag
     */
    public boolean beginShutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            log.info("Service marked as shutting down, new work is rejected");
            return true;
        }
        return false;
    }
}
