package com.onextel.CampaignDialerApplication.config;

import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.EvictionConfig;
import org.apache.commons.pool2.impl.EvictionPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * Evicts pooled connections that have been idle too long or have outlived their maximum lifetime.
 */
public class IdleConnectionEvictionPolicy<T> implements EvictionPolicy<T> {
    private final Duration maxIdle;
    private final Duration maxLifetime;

    public IdleConnectionEvictionPolicy(Duration maxIdle, Duration maxLifetime) {
        this.maxIdle = maxIdle;
        this.maxLifetime = maxLifetime;
    }

    @Override
    public boolean evict(EvictionConfig config, PooledObject<T> underTest, int idleCount) {
        Instant now = Instant.now();
        if (Duration.between(underTest.getCreateInstant(), now).compareTo(maxLifetime) > 0) {
            return true;
        }
        Instant lastReturn = underTest.getLastReturnInstant();
        return lastReturn != null && Duration.between(lastReturn, now).compareTo(maxIdle) > 0;
    }
}
