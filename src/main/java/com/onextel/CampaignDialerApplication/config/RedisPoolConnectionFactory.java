package com.onextel.CampaignDialerApplication.config;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;

@Slf4j
public class RedisPoolConnectionFactory extends BasePooledObjectFactory<StatefulRedisConnection<String, String>> {
    private final RedisClient redisClient;

    RedisPoolConnectionFactory(RedisClient redisClient) {
        this.redisClient = redisClient;
    }

    @Override
    public StatefulRedisConnection<String, String> create() {
        return redisClient.connect();
    }

    @Override
    public PooledObject<StatefulRedisConnection<String, String>> wrap(StatefulRedisConnection<String, String> conn) {
        return new DefaultPooledObject<>(conn);
    }

    @Override
    public void destroyObject(PooledObject<StatefulRedisConnection<String, String>> p) {
        StatefulRedisConnection<String, String> conn = p.getObject();
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (RedisException e) {
            log.warn("Error closing pooled Redis connection: {}", e.getMessage());
        }
    }

    /**
     * A connection inside MULTI is never handed out again; otherwise it must answer PING.
     */
    @Override
    public boolean validateObject(PooledObject<StatefulRedisConnection<String, String>> p) {
        StatefulRedisConnection<String, String> conn = p.getObject();
        if (conn == null || !conn.isOpen() || conn.isMulti()) {
            return false;
        }
        try {
            return "PONG".equals(conn.sync().ping());
        } catch (RedisException e) {
            log.debug("Pooled Redis connection failed validation: {}", e.getMessage());
            return false;
        }
    }
}
