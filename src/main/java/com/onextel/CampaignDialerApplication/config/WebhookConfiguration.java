package com.onextel.CampaignDialerApplication.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebhookConfiguration {

    private static final int WEBHOOK_CORE_POOL_THREADS = 4;
    private static final int WEBHOOK_MAX_THREADS = 16;
    private static final int KEEP_ALIVE_TIME_SECONDS = 30;
    private static final int WEBHOOK_QUEUE_MAX_EVENTS = 2000;

    // Lifecycle is owned by GracefulShutdownHandler through WebhookManager.shutdown()
    @Bean(destroyMethod = "")
    public ExecutorService webhookExecutor() {
        return new ThreadPoolExecutor(
                WEBHOOK_CORE_POOL_THREADS,
                WEBHOOK_MAX_THREADS,
                KEEP_ALIVE_TIME_SECONDS, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(WEBHOOK_QUEUE_MAX_EVENTS),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public RetryTemplate webhookRetryTemplate(
            @Value("${app.webhook.max-attempts:3}") int maxAttempts,
            @Value("${app.webhook.initial-backoff-ms:1000}") long initialBackoffMs) {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(initialBackoffMs);
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(30_000);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxAttempts));
        return retryTemplate;
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder,
                                            @Value("${app.webhook.timeout-ms:30000}") long timeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }
}
