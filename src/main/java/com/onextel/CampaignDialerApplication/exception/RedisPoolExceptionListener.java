package com.onextel.CampaignDialerApplication.exception;

import io.lettuce.core.RedisException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.SwallowedExceptionListener;

@Slf4j
public class RedisPoolExceptionListener implements SwallowedExceptionListener {

    @Override
    public void onSwallowException(Exception e) {
        if (e instanceof RedisException) {
            log.error("Redis pool maintenance failed: {}", e.getMessage());
        } else if (e instanceof InterruptedException) {
            log.warn("Redis pool maintenance interrupted");
            Thread.currentThread().interrupt();
        } else {
            log.error("Unexpected exception in Redis pool", e);
        }
    }
}
