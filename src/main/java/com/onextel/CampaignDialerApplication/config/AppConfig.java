package com.onextel.CampaignDialerApplication.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Configuration
public class AppConfig {

    private static final int STREAM_ROUTER_THREADS = 4;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        // Register the JavaTimeModule to handle Instant and friends
        objectMapper.registerModule(new JavaTimeModule());
        // ISO-8601 strings instead of epoch numbers
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder,   // for BatchCallingClient, TelephonyCarrierClient
                                            @Value("${app.gateway.connect-timeout-ms:5000}") long connectTimeoutMs,
                                            @Value("${app.gateway.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    // Timers, routing lookups and replays for LiveCallSessionRouter, which shuts it down
    @Bean(destroyMethod = "")
    public ScheduledExecutorService streamRouterScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(STREAM_ROUTER_THREADS,
                new ThreadFactoryBuilder().setNameFormat("stream-router-%d").setDaemon(true).build());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
