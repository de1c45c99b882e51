package com.onextel.CampaignDialerApplication.config;

import com.onextel.CampaignDialerApplication.exception.RedisPoolExceptionListener;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Lettuce client and the commons-pool2 connection pool backing the webhook registry and delivery log.
 * Host, credentials and pool bounds come from the standard {@code spring.data.redis.*} properties.
 */
@Configuration
public class RedisConfig {
    private static final Duration BORROW_WAIT = Duration.ofSeconds(3);
    // must outlast a pool borrow so a slow borrow is reported as such, not as a command timeout
    private static final Duration COMMAND_TIMEOUT = BORROW_WAIT.plusSeconds(1);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration EVICTION_INTERVAL = Duration.ofMinutes(1);

    @Bean(destroyMethod = "shutdown")
    public RedisClient redisLettuceClient(RedisProperties properties) {
        RedisURI.Builder target = RedisURI.builder()
                .withHost(properties.getHost())
                .withPort(properties.getPort())
                .withTimeout(COMMAND_TIMEOUT);
        if (StringUtils.hasText(properties.getPassword())) {
            target.withPassword(properties.getPassword().toCharArray());
        }

        ClientOptions options = ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .keepAlive(true)
                        .tcpNoDelay(true)
                        .build())
                .timeoutOptions(TimeoutOptions.enabled(COMMAND_TIMEOUT))
                .build();

        RedisClient redisClient = RedisClient.create(target.build());
        redisClient.setOptions(options);
        return redisClient;
    }

    @Bean(destroyMethod = "close")
    public GenericObjectPool<StatefulRedisConnection<String, String>> redisLettuceConnectionPool(
            RedisClient redisLettuceClient, RedisProperties properties) {
        RedisProperties.Pool bounds = properties.getLettuce().getPool();

        GenericObjectPoolConfig<StatefulRedisConnection<String, String>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(bounds.getMaxActive());
        poolConfig.setMaxIdle(bounds.getMaxIdle());
        poolConfig.setMinIdle(bounds.getMinIdle());
        poolConfig.setMaxWait(BORROW_WAIT);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setTimeBetweenEvictionRuns(EVICTION_INTERVAL);
        // probe about a fifth of the idle connections per run
        poolConfig.setNumTestsPerEvictionRun(Math.max(1, bounds.getMaxIdle() / 5));
        poolConfig.setEvictionPolicy(new IdleConnectionEvictionPolicy<>(Duration.ofMinutes(5), Duration.ofHours(1)));

        GenericObjectPool<StatefulRedisConnection<String, String>> connectionPool =
                new GenericObjectPool<>(new RedisPoolConnectionFactory(redisLettuceClient), poolConfig);
        connectionPool.setSwallowedExceptionListener(new RedisPoolExceptionListener());
        return connectionPool;
    }
}
