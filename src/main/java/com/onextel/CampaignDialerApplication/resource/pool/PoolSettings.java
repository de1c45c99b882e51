package com.onextel.CampaignDialerApplication.resource.pool;

import lombok.Value;

@Value
public class PoolSettings {
    public static final String MIN_CONNECTIONS_KEY = "db_pool_min_connections";
    public static final String MAX_CONNECTIONS_KEY = "db_pool_max_connections";
    public static final String IDLE_TIMEOUT_KEY = "db_pool_idle_timeout_ms";

    public static final PoolSettings DEFAULTS = new PoolSettings(2, 20, 30_000L, false);

    int minConnections;
    int maxConnections;
    long idleTimeoutMs;
    boolean loadedFromSettings;
}
