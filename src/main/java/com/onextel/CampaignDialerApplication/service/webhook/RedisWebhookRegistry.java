package com.onextel.CampaignDialerApplication.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.hash.Hashing;
import com.onextel.CampaignDialerApplication.model.webhook.WebhookConfig;
import com.onextel.CampaignDialerApplication.model.webhook.StoredWebhookConfig;
import com.onextel.CampaignDialerApplication.service.redis.RedisConnectionPool;
import io.lettuce.core.RedisFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Webhook subscriptions stored per account.
 *
 * <pre>
 * {wh}:config:{accountId}:{urlHash}  Hash  config, createdAt, updatedAt, eTag
 * {wh}:idx:account:{accountId}       Set   subscribed URLs
 * </pre>
 *
 * Both keys expire after {@link #DEFAULT_TTL} unless refreshed by a delivery ({@link #touch}).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RedisWebhookRegistry implements WebhookRegistry {
    private static final String KEY_PREFIX = "{wh}";
    private static final Duration DEFAULT_TTL = Duration.ofDays(30);

    private final RedisConnectionPool connectionPool;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Cache<String, StoredWebhookConfig> localCache = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(5, TimeUnit.MINUTES)
            .build();

    @Override
    public CompletableFuture<Void> registerWebhook(String accountId, WebhookConfig config) {
        String configKey = configKey(accountId, config.getUrl());
        localCache.invalidate(configKey);
        String serialized = serializeConfig(config);
        String now = clock.instant().toString();

        return connectionPool.executeAsync("registerWebhook", commands -> {
            RedisFuture<Long> stored = commands.hset(configKey, Map.of(
                    "config", serialized,
                    "createdAt", now,
                    "updatedAt", now,
                    "eTag", generateETag(serialized)));
            RedisFuture<Boolean> configTtl = commands.expire(configKey, DEFAULT_TTL);
            RedisFuture<Long> indexed = commands.sadd(accountIndexKey(accountId), config.getUrl());
            RedisFuture<Boolean> indexTtl = commands.expire(accountIndexKey(accountId), DEFAULT_TTL);
            return CompletableFuture.allOf(
                    stored.toCompletableFuture(),
                    configTtl.toCompletableFuture(),
                    indexed.toCompletableFuture(),
                    indexTtl.toCompletableFuture());
        }).thenRun(() -> log.info("Registered webhook {} for account {}", config.getUrl(), accountId));
    }

    @Override
    public CompletableFuture<Boolean> unregisterWebhook(String accountId, String url) {
        String configKey = configKey(accountId, url);
        localCache.invalidate(configKey);
        return connectionPool.executeAsync("unregisterWebhook", commands -> {
            CompletableFuture<Long> deleted = commands.del(configKey).toCompletableFuture();
            CompletableFuture<Long> removed = commands.srem(accountIndexKey(accountId), url).toCompletableFuture();
            return deleted.thenCombine(removed, (d, r) -> d > 0 || r > 0);
        });
    }

    @Override
    public CompletableFuture<Optional<StoredWebhookConfig>> getWebhookConfig(String accountId, String url) {
        String configKey = configKey(accountId, url);
        StoredWebhookConfig cached = localCache.getIfPresent(configKey);
        if (cached != null) {
            return CompletableFuture.completedFuture(Optional.of(cached));
        }

        return connectionPool.executeAsync("getWebhookConfig", commands -> commands.hgetall(configKey))
                .thenApply(map -> {
                    if (map == null || map.isEmpty()) {
                        return Optional.<StoredWebhookConfig>empty();
                    }
                    Optional<StoredWebhookConfig> parsed = parse(map);
                    parsed.ifPresent(value -> localCache.put(configKey, value));
                    return parsed;
                });
    }

    @Override
    public CompletableFuture<List<WebhookConfig>> getConfigsForAccount(String accountId) {
        return connectionPool.executeAsync("getConfigsForAccount",
                        commands -> commands.smembers(accountIndexKey(accountId)))
                .thenCompose((Set<String> urls) -> {
                    List<CompletableFuture<Optional<StoredWebhookConfig>>> lookups = urls.stream()
                            .map(url -> getWebhookConfig(accountId, url))
                            .toList();
                    return CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
                            .thenApply(v -> lookups.stream()
                                    .map(CompletableFuture::join)
                                    .flatMap(Optional::stream)
                                    .map(StoredWebhookConfig::getConfig)
                                    .toList());
                });
    }

    @Override
    public void touch(String accountId, String url) {
        connectionPool.executeAsync("touchWebhook",
                        commands -> commands.expire(configKey(accountId, url), DEFAULT_TTL))
                .exceptionally(ex -> {
                    log.warn("Failed to refresh TTL of webhook {} for {}: {}", url, accountId, ex.getMessage());
                    return false;
                });
    }

    private Optional<StoredWebhookConfig> parse(Map<String, String> map) {
        try {
            WebhookConfig config = objectMapper.readValue(map.get("config"), WebhookConfig.class);
            Instant createdAt = Instant.parse(map.get("createdAt"));
            Instant updatedAt = Instant.parse(map.getOrDefault("updatedAt", map.get("createdAt")));
            return Optional.of(new StoredWebhookConfig(config, createdAt, updatedAt, map.get("eTag")));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Stored webhook config is unreadable, ignoring it: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String generateETag(String serializedConfig) {
        return "\"" + Hashing.murmur3_128().hashString(serializedConfig, StandardCharsets.UTF_8) + "\"";
    }

    private static String configKey(String accountId, String url) {
        String urlHash = Hashing.murmur3_32_fixed().hashString(url, StandardCharsets.UTF_8).toString();
        return String.format("%s:config:%s:%s", KEY_PREFIX, accountId, urlHash);
    }

    private static String accountIndexKey(String accountId) {
        return String.format("%s:idx:account:%s", KEY_PREFIX, accountId);
    }

    private String serializeConfig(WebhookConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid webhook config", e);
        }
    }
}
