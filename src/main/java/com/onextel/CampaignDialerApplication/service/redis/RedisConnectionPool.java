package com.onextel.CampaignDialerApplication.service.redis;

import com.onextel.CampaignDialerApplication.exception.RedisOperationException;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Borrows a pooled Lettuce connection for the duration of one operation and always returns it.
 */
@Component
@Slf4j
public class RedisConnectionPool {
    private final GenericObjectPool<StatefulRedisConnection<String, String>> redisLettucePool;

    public RedisConnectionPool(
            @Qualifier("redisLettuceConnectionPool") GenericObjectPool<StatefulRedisConnection<String, String>> redisLettucePool) {
        this.redisLettucePool = redisLettucePool;
    }

    public <T> T executeSync(String operationName, RedisOperation<T> operation) {
        StatefulRedisConnection<String, String> connection = null;
        try {
            connection = redisLettucePool.borrowObject();
            return operation.execute(connection.sync());
        } catch (Exception e) {
            log.error("Redis operation {} failed: {}", operationName, e.getMessage());
            throw toRedisException(operationName, e);
        } finally {
            returnConnectionToPool(connection);
        }
    }

    /**
     * The connection goes back to the pool once the returned stage completes, not when this method returns.
     */
    public <T> CompletableFuture<T> executeAsync(
            String operationName,
            Function<RedisAsyncCommands<String, String>, CompletionStage<T>> operation) {
        StatefulRedisConnection<String, String> connection = null;
        try {
            connection = redisLettucePool.borrowObject();
            CompletableFuture<T> completable = operation.apply(connection.async()).toCompletableFuture();
            StatefulRedisConnection<String, String> finalConnection = connection;
            completable.whenComplete((r, e) -> returnConnectionToPool(finalConnection));
            return completable;
        } catch (Exception e) {
            log.error("Redis async operation {} failed: {}", operationName, e.getMessage());
            returnConnectionToPool(connection);
            return CompletableFuture.failedFuture(toRedisException(operationName, e));
        }
    }

    public int getNumActive() {
        return redisLettucePool.getNumActive();
    }

    private void returnConnectionToPool(StatefulRedisConnection<String, String> conn) {
        if (conn != null) {
            try {
                redisLettucePool.returnObject(conn);
            } catch (IllegalStateException e) {
                log.warn("Error returning connection to pool: {}", e.getMessage());
            }
        }
    }

    private RuntimeException toRedisException(String operationName, Exception e) {
        if (e instanceof RedisOperationException roe) {
            return roe;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String kind = e instanceof RedisException ? "Redis error" : "Redis operation failed";
        return new RedisOperationException(kind + " in " + operationName, e);
    }
}
