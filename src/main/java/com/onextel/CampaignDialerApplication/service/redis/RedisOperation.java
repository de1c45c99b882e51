package com.onextel.CampaignDialerApplication.service.redis;

import io.lettuce.core.api.sync.RedisCommands;

@FunctionalInterface
public interface RedisOperation<T> {
    T execute(RedisCommands<String, String> commands) throws Exception;
}
